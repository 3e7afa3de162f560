package com.zen.script.runtime;

import java.util.List;

/**
 * Host-side function callable from scripts. Receives the calling environment and the evaluated
 * positional arguments; a {@code null} result is treated as Void.
 */
@FunctionalInterface
public interface BuiltinFunction {
    Value call(Environment env, List<Value> args);
}
