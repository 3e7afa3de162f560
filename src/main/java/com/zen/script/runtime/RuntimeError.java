package com.zen.script.runtime;

import com.zen.script.parser.SourceLocation;

/**
 * Fatal evaluation failure. The interpreter wraps every lower-level error in one of these at the
 * node where it surfaced; the original error stays available as the cause.
 */
public class RuntimeError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final SourceLocation location;

    public RuntimeError(String message) {
        this(message, null, null);
    }

    public RuntimeError(String message, SourceLocation location) {
        this(message, location, null);
    }

    public RuntimeError(String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public RuntimeError withLocation(SourceLocation where) {
        if (location != null || where == null) return this;
        RuntimeError located = new RuntimeError(getMessage(), where, getCause());
        located.setStackTrace(getStackTrace());
        return located;
    }

    /** Message plus position, source line and caret when a location is known. */
    public String format() {
        return location == null ? getMessage() : location.annotate(getMessage());
    }
}
