import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.zen.script.ZenCli;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ZenCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, boolean terminal, String... args) {
        ZenCli cli = new ZenCli(
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true),
                new PrintStream(err, true));
        return cli.run(args, terminal);
    }

    private Path script(String name, String content) throws Exception {
        Path p = dir.resolve(name);
        Files.write(p, content.getBytes(StandardCharsets.UTF_8));
        return p;
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void runsScriptFile_andDumpsGlobals() throws Exception {
        Path p = script("sum.zen", "var x = 2 + 3\nprint(x)\n");

        int code = run("", false, p.toString(), "--globals-json");

        assertEquals(ZenCli.EXIT_OK, code, err());
        assertTrue(out().startsWith("5" + System.lineSeparator()), out());
        assertTrue(out().contains("\"x\" : 5"), out());
    }

    @Test
    void syntaxErrors_exitWithScriptError() throws Exception {
        Path p = script("bad.zen", "var = 1\n");

        assertEquals(ZenCli.EXIT_SCRIPT_ERROR, run("", false, p.toString()));
        assertTrue(err().startsWith("Syntax Error(s):"), err());
        assertTrue(err().contains("Expected variable name at Line 1, Column 4"), err());
    }

    @Test
    void runtimeErrors_exitWithScriptError() throws Exception {
        Path p = script("div.zen", "var z = 1 / 0\n");

        assertEquals(ZenCli.EXIT_SCRIPT_ERROR, run("", false, p.toString()));
        assertTrue(err().startsWith("Runtime Error:"), err());
        assertTrue(err().contains("division by zero"), err());
    }

    @Test
    void usageAndIoErrors() {
        assertEquals(ZenCli.EXIT_USAGE, run("", false, "--bogus"));
        assertTrue(err().contains("Usage: zen"), err());

        assertEquals(ZenCli.EXIT_USAGE, run("", false, "--input"));
        assertEquals(ZenCli.EXIT_IO, run("", false, dir.resolve("missing.zen").toString()));
    }

    @Test
    void readsScriptFromStdin() {
        assertEquals(ZenCli.EXIT_OK, run("print(\"hi\")\n", false));
        assertEquals("hi" + System.lineSeparator(), out());
    }

    @Test
    void inputFile_predefinesGlobals() throws Exception {
        Path input = script("in.json", "{\"n\": 20}");
        Path p = script("double.zen", "var m = n * 2\n");

        int code = run("", false, "--input", input.toString(), "--globals-json", p.toString());

        assertEquals(ZenCli.EXIT_OK, code, err());
        assertTrue(out().contains("\"m\" : 40"), out());
        assertTrue(out().contains("\"n\" : 20"), out());
    }

    @Test
    void tokensAndAstDumps() throws Exception {
        Path p = script("dump.zen", "var a = 1\n");

        assertEquals(ZenCli.EXIT_OK, run("", false, "-v", p.toString()));
        assertTrue(out().contains("Keyword(var)"), out());
        assertTrue(out().contains("VarDeclaration a"), out());
    }

    @Test
    void repl_keepsStateAndWaitsForOpenBlocks() {
        String session =
                "var x = 1\n" +
                "if x == 1 {\n" +
                "print(\"one\")\n" +
                "}\n" +
                "print(x + 1)\n" +
                "exit\n";

        assertEquals(ZenCli.EXIT_OK, run(session, true));
        String text = out();
        assertTrue(text.contains("zen> "), text);
        assertTrue(text.contains("...> "), text);
        assertTrue(text.contains("one"), text);
        assertTrue(text.contains("2" + System.lineSeparator()), text);
    }

    @Test
    void repl_reportsErrorsAndContinues() {
        assertEquals(ZenCli.EXIT_OK, run("var = 1\nprint(\"still here\")\n", false, "-i"));
        assertTrue(err().contains("Syntax Error(s):"), err());
        assertTrue(out().contains("still here"), out());
    }

    @Test
    void braceBalance_ignoresStringsAndComments() {
        assertEquals(1, ZenCli.braceBalance("func f() {\n"));
        assertEquals(0, ZenCli.braceBalance("var s = \"{\"\n"));
        assertEquals(0, ZenCli.braceBalance("var a = 1 // {\n"));
        assertEquals(0, ZenCli.braceBalance("if a {\n}\n"));
    }
}
