package com.zen.script.plugins;

import java.util.List;

import com.zen.script.runtime.Interpreter;
import com.zen.script.runtime.Value;

/**
 * CorePlugin
 *
 * Built-ins every interpreter starts with. Registered into the global scope by the
 * {@link Interpreter} constructor, before any user code runs.
 *
 * In scripts:
 *   print("total:", 3 + 4)   // writes "total: 7"
 */
public final class CorePlugin {

    private CorePlugin() {}

    public static void register(Interpreter interpreter) {

        // Arguments rendered and joined by single spaces, then a newline. Always returns true.
        interpreter.registerFunction("print", (env, args) -> {
            interpreter.getOutput().println(join(args));
            return Value.bool(true);
        });
    }

    static String join(List<Value> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(args.get(i));
        }
        return sb.toString();
    }
}
