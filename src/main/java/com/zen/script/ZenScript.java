package com.zen.script;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.zen.debug.Debug;
import com.zen.script.parser.InlineSourceCode;
import com.zen.script.parser.Lexer;
import com.zen.script.parser.Parser;
import com.zen.script.parser.Program;
import com.zen.script.parser.SourceCode;
import com.zen.script.parser.Token;
import com.zen.script.runtime.BuiltinFunction;
import com.zen.script.runtime.Interpreter;
import com.zen.script.runtime.RuntimeError;
import com.zen.script.runtime.Value;

/**
 * Engine facade: source text in, final global variables out.
 *
 * <pre>
 *   ZenScript zen = new ZenScript();
 *   zen.registerFunction("now", (env, args) -&gt; Value.int64(System.currentTimeMillis()));
 *   Map&lt;String, Value&gt; globals = zen.run("var x = 2 + 3 * 4");
 * </pre>
 *
 * Each run gets a fresh {@link Interpreter}; settings and registered functions carry over.
 */
public class ZenScript {
    private static final String TAG = "ZenScript";

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private int maxCallDepth = Interpreter.DEFAULT_MAX_CALL_DEPTH;
    private boolean stopAtFirstError = false;
    private PrintStream output = System.out;

    public void setMaxCallDepth(int depth) { this.maxCallDepth = depth; }

    public int getMaxCallDepth() { return maxCallDepth; }

    /** true: the parser stops at the first syntax error instead of collecting them all. */
    public void setStopAtFirstError(boolean stop) { this.stopAtFirstError = stop; }

    public boolean isStopAtFirstError() { return stopAtFirstError; }

    /** Target of the {@code print} built-in. */
    public void setOutput(PrintStream output) { this.output = (output == null) ? System.out : output; }

    public void registerFunction(String name, BuiltinFunction fn) {
        functions.put(name, fn);
        Debug.get().d(TAG, "registered host function " + name);
    }

    /**
     * @throws ZenSyntaxException on any lexical error
     */
    public List<Token> tokenize(SourceCode source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.scan();
        if (lexer.hasErrors()) throw new ZenSyntaxException(new ArrayList<>(lexer.getErrors()));
        return tokens;
    }

    /**
     * @throws ZenSyntaxException on any lexical or grammatical error
     */
    public Program parse(SourceCode source) {
        Parser parser = new Parser(tokenize(source), stopAtFirstError);
        Program program = parser.parse();
        if (parser.hasErrors()) throw new ZenSyntaxException(new ArrayList<>(parser.getErrors()));
        return program;
    }

    /** Interpreter with this engine's settings and host functions applied. */
    public Interpreter newInterpreter() {
        Interpreter interpreter = new Interpreter(output);
        interpreter.setMaxCallDepth(maxCallDepth);
        for (Map.Entry<String, BuiltinFunction> e : functions.entrySet()) {
            interpreter.registerFunction(e.getKey(), e.getValue());
        }
        return interpreter;
    }

    public Map<String, Value> run(String source) {
        return run(new InlineSourceCode(source), null);
    }

    public Map<String, Value> run(String source, Map<String, Value> initialEnv) {
        return run(new InlineSourceCode(source), initialEnv);
    }

    /**
     * Parses and executes {@code source}, with {@code initialEnv} predefined as globals.
     *
     * @return global variables after execution, built-ins excluded
     * @throws ZenSyntaxException when the source does not parse
     * @throws RuntimeError when execution fails
     */
    public Map<String, Value> run(SourceCode source, Map<String, Value> initialEnv) {
        Program program = parse(source);
        Interpreter interpreter = newInterpreter();
        if (initialEnv != null) {
            for (Map.Entry<String, Value> e : initialEnv.entrySet()) {
                interpreter.getEnvironment().defineGlobal(e.getKey(), e.getValue());
            }
        }
        interpreter.execute(program);
        return interpreter.getGlobals();
    }
}
