package com.zen.script.runtime;

public class UndefinedVariableError extends EnvironmentError {
    private static final long serialVersionUID = 1L;

    private final String name;

    public UndefinedVariableError(String name) {
        super("Undefined variable: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
