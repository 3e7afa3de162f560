package com.zen.script.runtime;

/** A value has the wrong type for an operation, coercion or conversion. */
public class TypeError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String detail;

    public TypeError(String detail) {
        super("Type error: " + detail);
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
