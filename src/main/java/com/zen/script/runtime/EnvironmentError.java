package com.zen.script.runtime;

/** Base class for name-binding failures raised by {@link Environment}. */
public class EnvironmentError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public EnvironmentError(String message) {
        super(message);
    }
}
