package com.zen.script.runtime;

public class RedefinitionError extends EnvironmentError {
    private static final long serialVersionUID = 1L;

    private final String name;

    public RedefinitionError(String name) {
        super("Cannot redefine variable: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
