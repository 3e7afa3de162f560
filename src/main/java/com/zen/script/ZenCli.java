package com.zen.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.zen.debug.Debug;
import com.zen.debug.DebugLevel;
import com.zen.script.parser.AstPrinter;
import com.zen.script.parser.FileSourceCode;
import com.zen.script.parser.InlineSourceCode;
import com.zen.script.parser.Lexer;
import com.zen.script.parser.Parser;
import com.zen.script.parser.Program;
import com.zen.script.parser.SourceCode;
import com.zen.script.parser.SyntaxError;
import com.zen.script.parser.Token;
import com.zen.script.runtime.Interpreter;
import com.zen.script.runtime.RuntimeError;
import com.zen.script.runtime.TypeError;
import com.zen.script.runtime.Value;
import com.zen.script.util.ValueJson;

/**
 * Command line entry point.
 *
 * <pre>
 *   zen [options] [script.zen]
 *
 *   -i, --interactive   start the REPL
 *   --tokens            dump the token stream
 *   --ast               dump the parse tree
 *   -v, --verbose       both of the above
 *   --fail-fast         stop at the first syntax error
 *   --debug             trace lexer/parser/interpreter to stderr
 *   --globals-json      print final globals as JSON
 *   --input FILE        predefine globals from a JSON object
 * </pre>
 *
 * Without a script file the source is read from stdin, or the REPL starts when stdin is a terminal.
 * Exit codes: 0 ok, 1 syntax or runtime error, 2 usage, 3 I/O.
 */
public final class ZenCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_SCRIPT_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO = 3;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    private boolean interactive;
    private boolean dumpTokens;
    private boolean dumpAst;
    private boolean failFast;
    private boolean debug;
    private boolean globalsJson;
    private Path inputJson;
    private Path script;

    public ZenCli(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        ZenCli cli = new ZenCli(System.in, System.out, System.err);
        int code = cli.run(args, System.console() != null);
        if (code != EXIT_OK) System.exit(code);
    }

    public int run(String[] args, boolean stdinIsTerminal) {
        if (!parseArgs(args)) {
            usage();
            return EXIT_USAGE;
        }
        if (debug) Debug.get().setSink(Debug.printSink(err, DebugLevel.TRACE));

        ZenScript engine = new ZenScript();
        engine.setStopAtFirstError(failFast);
        engine.setOutput(out);

        Interpreter interpreter = engine.newInterpreter();
        if (inputJson != null) {
            int code = loadInputs(interpreter);
            if (code != EXIT_OK) return code;
        }

        if (interactive || (script == null && stdinIsTerminal)) {
            return repl(interpreter);
        }

        SourceCode source;
        try {
            source = (script != null) ? FileSourceCode.read(script) : new InlineSourceCode(readAll(in));
        } catch (IOException e) {
            err.println("Failed to read script: " + (script != null ? script : "<stdin>"));
            e.printStackTrace(err);
            return EXIT_IO;
        }

        int code = runSource(interpreter, source);
        if (code != EXIT_OK) return code;

        if (globalsJson) {
            try {
                out.println(ValueJson.mapper().writerWithDefaultPrettyPrinter()
                        .writeValueAsString(ValueJson.globalsToJson(interpreter.getGlobals())));
            } catch (IOException e) {
                err.println("Failed to write globals: " + e.getMessage());
                return EXIT_IO;
            }
        }
        return EXIT_OK;
    }

    private boolean parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-i":
                case "--interactive": interactive = true; break;
                case "--tokens": dumpTokens = true; break;
                case "--ast": dumpAst = true; break;
                case "-v":
                case "--verbose": dumpTokens = true; dumpAst = true; break;
                case "--fail-fast": failFast = true; break;
                case "--debug": debug = true; break;
                case "--globals-json": globalsJson = true; break;
                case "--input":
                    if (i + 1 >= args.length) return false;
                    inputJson = Path.of(args[++i]);
                    break;
                default:
                    if (a.startsWith("-") || script != null) return false;
                    script = Path.of(a);
            }
        }
        return true;
    }

    private void usage() {
        err.println("Usage: zen [-i|--interactive] [--tokens] [--ast] [-v|--verbose] [--fail-fast] [--debug]");
        err.println("           [--globals-json] [--input FILE.json] [script.zen]");
    }

    private int loadInputs(Interpreter interpreter) {
        try {
            JsonNode root = ValueJson.mapper().readTree(inputJson.toFile());
            for (Map.Entry<String, Value> e : ValueJson.fromJsonObject(root).entrySet()) {
                interpreter.getEnvironment().defineGlobal(e.getKey(), e.getValue());
            }
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Failed to read input file: " + inputJson + " (" + e.getMessage() + ")");
            return EXIT_IO;
        } catch (TypeError e) {
            err.println("Invalid input file " + inputJson + ": " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    /** Lex, parse and execute one unit against a long-lived interpreter. */
    private int runSource(Interpreter interpreter, SourceCode source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.scan();
        if (lexer.hasErrors()) {
            printSyntaxErrors(lexer.getErrors());
            return EXIT_SCRIPT_ERROR;
        }
        if (dumpTokens) {
            for (Token t : tokens) out.println(t);
        }

        Parser parser = new Parser(tokens, failFast);
        Program program = parser.parse();
        if (parser.hasErrors()) {
            printSyntaxErrors(parser.getErrors());
            return EXIT_SCRIPT_ERROR;
        }
        if (dumpAst) out.print(new AstPrinter().print(program));

        try {
            interpreter.execute(program);
        } catch (RuntimeError e) {
            err.println("Runtime Error:");
            err.println(e.format());
            return EXIT_SCRIPT_ERROR;
        }
        return EXIT_OK;
    }

    private void printSyntaxErrors(List<SyntaxError> errors) {
        err.println("Syntax Error(s):");
        for (SyntaxError e : errors) err.println(e.format());
    }

    private int repl(Interpreter interpreter) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        out.println("Zen REPL. Type 'exit' to quit.");
        StringBuilder pending = new StringBuilder();
        try {
            while (true) {
                out.print(pending.length() == 0 ? "zen> " : "...> ");
                out.flush();
                String line = reader.readLine();
                if (line == null) break;
                if (pending.length() == 0) {
                    String trimmed = line.trim();
                    if (trimmed.equals("exit") || trimmed.equals("quit")) break;
                    if (trimmed.isEmpty()) continue;
                }
                pending.append(line).append('\n');
                // keep reading while a block is still open
                if (braceBalance(pending) > 0) continue;

                runSource(interpreter, new InlineSourceCode(pending.toString()));
                pending.setLength(0);
            }
        } catch (IOException e) {
            err.println("Failed to read input: " + e.getMessage());
            return EXIT_IO;
        }
        return EXIT_OK;
    }

    /** Open minus closed braces outside string literals and comments. */
    public static int braceBalance(CharSequence text) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') i++;
                else if (c == '"' || c == '\n') inString = false;
                continue;
            }
            if (c == '"') inString = true;
            else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                while (i < text.length() && text.charAt(i) != '\n') i++;
            }
            else if (c == '{') depth++;
            else if (c == '}') depth--;
        }
        return depth;
    }

    private static String readAll(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
