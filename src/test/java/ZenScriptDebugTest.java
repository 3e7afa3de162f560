import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.zen.debug.Debug;
import com.zen.debug.DebugLevel;
import com.zen.script.ZenScript;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ZenScriptDebugTest {

    @AfterEach
    void resetSink() {
        Debug.get().setSink(null);
    }

    @Test
    void sinkReceivesEngineEvents() {
        List<String> events = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> events.add(level + " " + tag + " " + message));

        new ZenScript().run(
                "func f(n: int64): int64 {\n" +
                "    return n\n" +
                "}\n" +
                "var x = f(1)\n");

        assertTrue(events.stream().anyMatch(e -> e.startsWith("DEBUG Lexer")), events.toString());
        assertTrue(events.stream().anyMatch(e -> e.equals("TRACE Interpreter enter f(), depth 1")), events.toString());
    }

    @Test
    void printSink_filtersByLevel() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        Debug.get().setSink(Debug.printSink(new PrintStream(buf, true), DebugLevel.INFO));

        Debug.get().d("Test", "hidden");
        Debug.get().w("Test", "shown");

        assertEquals("[WARN] Test: shown" + System.lineSeparator(), buf.toString(StandardCharsets.UTF_8));
    }
}
