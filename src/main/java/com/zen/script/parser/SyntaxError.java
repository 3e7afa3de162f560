package com.zen.script.parser;

/** A lexical or grammatical problem found before execution. Collected, never thrown. */
public final class SyntaxError {
    private final String message;
    private final SourceLocation location;

    public SyntaxError(String message, SourceLocation location) {
        this.message = message;
        this.location = location;
    }

    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    public String format() {
        return location == null ? message : location.annotate(message);
    }

    @Override
    public String toString() {
        return location == null ? message : message + " at " + location;
    }
}
