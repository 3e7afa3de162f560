package com.zen.script.runtime;

public class ScopeError extends EnvironmentError {
    private static final long serialVersionUID = 1L;

    public ScopeError(String message) {
        super("Scope error: " + message);
    }
}
