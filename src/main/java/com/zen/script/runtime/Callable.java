package com.zen.script.runtime;

import java.util.List;

/** Anything that can stand as the callee of a call expression. */
public interface Callable {

    String getName();

    Value call(Interpreter interpreter, List<Value> args);

    /** Rendering used by {@link Value#toString()}. */
    String describe();
}
