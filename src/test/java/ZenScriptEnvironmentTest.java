import org.junit.jupiter.api.Test;

import com.zen.script.runtime.AssignmentError;
import com.zen.script.runtime.DeclaredType;
import com.zen.script.runtime.Environment;
import com.zen.script.runtime.Interpreter;
import com.zen.script.runtime.RedefinitionError;
import com.zen.script.runtime.Scope;
import com.zen.script.runtime.ScopeError;
import com.zen.script.runtime.TypeError;
import com.zen.script.runtime.UndefinedVariableError;
import com.zen.script.runtime.Value;
import com.zen.script.parser.InlineSourceCode;
import com.zen.script.parser.Lexer;
import com.zen.script.parser.Parser;
import com.zen.script.parser.Program;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ZenScriptEnvironmentTest {

    @Test
    void defineAndGet() {
        Environment env = new Environment();
        env.define("x", Value.int64(1));

        assertEquals(Value.int64(1), env.get("x"));
        assertTrue(env.isDefined("x"));
        assertFalse(env.isDefined("y"));

        UndefinedVariableError e = assertThrows(UndefinedVariableError.class, () -> env.get("y"));
        assertEquals("Undefined variable: y", e.getMessage());
    }

    @Test
    void redefinition_onlyInSameScope() {
        Environment env = new Environment();
        env.define("x", Value.int64(1));

        RedefinitionError e = assertThrows(RedefinitionError.class, () -> env.define("x", Value.int64(2)));
        assertEquals("Cannot redefine variable: x", e.getMessage());

        env.beginScope();
        env.define("x", Value.int64(2));
        assertEquals(Value.int64(2), env.get("x"));
        env.endScope();
        assertEquals(Value.int64(1), env.get("x"));
    }

    @Test
    void assign_updatesNearestBinding() {
        Environment env = new Environment();
        env.define("total", Value.int64(0));

        env.beginScope();
        env.beginScope();
        assertEquals(2, env.depth());
        env.assign("total", Value.int64(5));
        env.endScope();
        env.endScope();

        assertEquals(Value.int64(5), env.get("total"));
        assertThrows(UndefinedVariableError.class, () -> env.assign("missing", Value.int64(1)));
    }

    @Test
    void innerBindings_disappearWithTheirScope() {
        Environment env = new Environment();
        env.beginScope();
        env.define("tmp", Value.string("t"));
        env.endScope();

        assertFalse(env.isDefined("tmp"));
        assertEquals(0, env.depth());
    }

    @Test
    void globalScope_cannotBeEnded() {
        Environment env = new Environment();
        ScopeError e = assertThrows(ScopeError.class, env::endScope);
        assertEquals("Scope error: Cannot end global scope", e.getMessage());
    }

    @Test
    void constants_andNullability() {
        Environment env = new Environment();
        env.defineConst("PI", Value.float64(3.14));

        AssignmentError constant = assertThrows(AssignmentError.class, () -> env.assign("PI", Value.float64(3)));
        assertEquals("Assignment error: Cannot assign to constant", constant.getMessage());

        AssignmentError nullConst = assertThrows(AssignmentError.class, () -> env.defineConst("N", Value.nil()));
        assertEquals("Assignment error: Cannot define constant with null value", nullConst.getMessage());

        assertThrows(AssignmentError.class, () -> env.define("strict", Value.nil()));

        env.defineNullable("loose", Value.nil());
        assertEquals(Value.nil(), env.get("loose"));
        env.assign("loose", Value.int64(1));
        env.assign("loose", Value.nil());
        assertEquals(Value.nil(), env.get("loose"));
    }

    @Test
    void typedBindings_convertOnEveryWrite() {
        Environment env = new Environment();
        env.define("n", Value.int64(3), false, false, DeclaredType.named("int"));
        assertEquals(Value.int32(3), env.get("n"));

        env.assign("n", Value.float64(9.0));
        assertEquals(Value.int32(9), env.get("n"));

        assertThrows(TypeError.class, () -> env.assign("n", Value.string("nine")));
    }

    @Test
    void globals_ignoreTheCurrentCursor() {
        Environment env = new Environment();
        env.defineGlobal("seed", Value.int64(1));
        env.beginScope();
        env.define("seed", Value.int64(99));

        assertEquals(Value.int64(99), env.get("seed"));
        assertEquals(Value.int64(1), env.getGlobal("seed"));
        env.assignGlobal("seed", Value.int64(2));
        env.endScope();

        assertEquals(Value.int64(2), env.get("seed"));
        assertEquals(1, env.globals().size());
    }

    @Test
    void callFrames_hangOffTheDeclaringScope() {
        Environment env = new Environment();
        env.define("outer", Value.int64(1));
        Scope declaring = env.getCurrentScope();

        env.beginScope();
        env.define("callerOnly", Value.int64(2));

        Scope saved = env.enterScope(declaring);
        assertTrue(env.isDefined("outer"));
        assertFalse(env.isDefined("callerOnly"));
        env.restoreScope(saved);

        assertTrue(env.isDefined("callerOnly"));
    }

    @Test
    void interpreter_blockScopesAndShadowing() {
        String src =
                "var x = 1\n" +
                "var seen = 0\n" +
                "if true {\n" +
                "    var x = 2\n" +
                "    var inner = 5\n" +
                "    seen = x\n" +
                "}\n";
        Lexer lexer = new Lexer(new InlineSourceCode(src));
        Parser parser = new Parser(lexer.scan());
        Program program = parser.parse();
        assertFalse(parser.hasErrors(), () -> parser.getErrors().toString());

        Interpreter interpreter = new Interpreter(new PrintStream(new ByteArrayOutputStream()));
        interpreter.execute(program);

        assertEquals(Value.int64(1), interpreter.getValue("x"));
        assertEquals(Value.int64(2), interpreter.getValue("seen"));
        assertThrows(UndefinedVariableError.class, () -> interpreter.getValue("inner"));
        assertEquals(0, interpreter.getEnvironment().depth());
    }

    @Test
    void interpreter_hostFunctionsSeeArguments() {
        List<Value> received = new ArrayList<>();
        Interpreter interpreter = new Interpreter(new PrintStream(new ByteArrayOutputStream()));
        interpreter.registerFunction("record", (env, args) -> {
            received.addAll(args);
            return null;
        });

        Lexer lexer = new Lexer(new InlineSourceCode("record(1, \"two\", [3])"));
        interpreter.execute(new Parser(lexer.scan()).parse());

        assertEquals(3, received.size());
        assertEquals(Value.string("two"), received.get(1));
        assertEquals(Value.Type.ARRAY, received.get(2).type);
    }
}
