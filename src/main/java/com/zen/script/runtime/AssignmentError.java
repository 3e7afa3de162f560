package com.zen.script.runtime;

/** Writing to a constant, or null into a non-nullable binding. */
public class AssignmentError extends EnvironmentError {
    private static final long serialVersionUID = 1L;

    public AssignmentError(String message) {
        super("Assignment error: " + message);
    }
}
