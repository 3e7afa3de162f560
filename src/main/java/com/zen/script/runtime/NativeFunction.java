package com.zen.script.runtime;

import java.util.List;

/** A {@link BuiltinFunction} bound to the name it is registered under. */
public final class NativeFunction implements Callable {
    private final String name;
    private final BuiltinFunction fn;

    public NativeFunction(String name, BuiltinFunction fn) {
        this.name = name;
        this.fn = fn;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        Value result = fn.call(interpreter.getEnvironment(), args);
        return result == null ? Value.voidValue() : result;
    }

    @Override
    public String describe() {
        return "<builtin " + name + ">";
    }
}
