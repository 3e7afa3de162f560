import org.junit.jupiter.api.Test;

import com.zen.script.parser.AstPrinter;
import com.zen.script.parser.Expr.Binary;
import com.zen.script.parser.Expr.Identifier;
import com.zen.script.parser.Expr.Literal;
import com.zen.script.parser.Expr.MapAccess;
import com.zen.script.parser.Expr.MapLiteral;
import com.zen.script.parser.Expr.ParametricType;
import com.zen.script.parser.InlineSourceCode;
import com.zen.script.parser.Lexer;
import com.zen.script.parser.Parser;
import com.zen.script.parser.Program;
import com.zen.script.parser.Statement.ExprStmt;
import com.zen.script.parser.Statement.ForIn;
import com.zen.script.parser.Statement.FunctionStmt;
import com.zen.script.parser.Statement.If;
import com.zen.script.parser.Statement.ReturnStmt;
import com.zen.script.parser.Statement.VarStmt;
import com.zen.script.parser.SyntaxError;
import com.zen.script.parser.Token;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ZenScriptParserTest {

    private static Parser parser(String src, boolean stopAtFirstError) {
        Lexer lexer = new Lexer(new InlineSourceCode(src));
        List<Token> tokens = lexer.scan();
        assertFalse(lexer.hasErrors(), () -> "Unexpected lexer errors: " + lexer.getErrors());
        return new Parser(tokens, stopAtFirstError);
    }

    private static Program parseOk(String src) {
        Parser p = parser(src, false);
        Program program = p.parse();
        assertFalse(p.hasErrors(), () -> "Unexpected syntax errors: " + p.getErrors());
        return program;
    }

    private static List<SyntaxError> errorsOf(String src) {
        Parser p = parser(src, false);
        p.parse();
        return p.getErrors();
    }

    private static String firstError(String src) {
        List<SyntaxError> errors = errorsOf(src);
        assertFalse(errors.isEmpty(), "Expected a syntax error for: " + src);
        return errors.get(0).getMessage();
    }

    private static final String THREE_BAD_STATEMENTS =
            "var = 1\n" +
            "var y = 2\n" +
            "const z\n" +
            "var w = )\n" +
            "var ok = 3\n";

    @Test
    void errors_accumulateAcrossStatements() {
        Parser p = parser(THREE_BAD_STATEMENTS, false);
        Program program = p.parse();

        List<SyntaxError> errors = p.getErrors();
        assertEquals(3, errors.size(), errors.toString());
        assertEquals("Expected variable name", errors.get(0).getMessage());
        assertEquals("Constant 'z' must be initialized. Did you mean 'var z' ?", errors.get(1).getMessage());
        assertEquals("Expected expression", errors.get(2).getMessage());
        assertEquals(4, errors.get(2).getLocation().getLine());

        // the good statements survive recovery
        assertEquals(2, program.getStatements().size());
        assertEquals("y", ((VarStmt) program.getStatements().get(0)).name.literal);
        assertEquals("ok", ((VarStmt) program.getStatements().get(1)).name.literal);
    }

    @Test
    void failFast_stopsAtFirstError() {
        Parser p = parser(THREE_BAD_STATEMENTS, true);
        p.parse();
        assertEquals(1, p.getErrors().size());
    }

    @Test
    void mapAccessInCondition_isNotMistakenForBlock() {
        Program program = parseOk("var m = {\"a\": 1}\nif m{\"a\"} == 1 { print(\"yes\") }");

        If stmt = (If) program.getStatements().get(1);
        Binary condition = (Binary) stmt.thenBranch.condition;
        assertEquals("==", condition.op());
        assertTrue(condition.left instanceof MapAccess);
        assertEquals("a", ((MapAccess) condition.left).key);
        assertEquals(1, stmt.thenBranch.body.size());
    }

    @Test
    void braceAfterCondition_opensBlock() {
        Program program = parseOk("if x {y}");

        If stmt = (If) program.getStatements().get(0);
        assertTrue(stmt.thenBranch.condition instanceof Identifier);
        ExprStmt body = (ExprStmt) stmt.thenBranch.body.get(0);
        assertEquals("y", ((Identifier) body.expression).getName());
    }

    @Test
    void forIn_withKeyAndValue() {
        Program program = parseOk("for i, v in items { }");

        ForIn stmt = (ForIn) program.getStatements().get(0);
        assertEquals("i", stmt.key.literal);
        assertEquals("v", stmt.value.literal);
        assertEquals("items", ((Identifier) stmt.container).getName());
        assertTrue(stmt.body.isEmpty());

        ForIn valueOnly = (ForIn) parseOk("for v in [1, 2] { }").getStatements().get(0);
        assertNull(valueOnly.key);
    }

    @Test
    void mapLiteralAsLoopContainer() {
        ForIn stmt = (ForIn) parseOk("for k, v in {\"a\": 1, \"b\": 2} {\n  print(k)\n}").getStatements().get(0);

        assertTrue(stmt.container instanceof MapLiteral);
        assertEquals(2, ((MapLiteral) stmt.container).entries.size());
        assertEquals(1, stmt.body.size());
    }

    @Test
    void ifElifElse_chain() {
        If stmt = (If) parseOk("if a { } elif b { } elif c { } else { x = 1 }").getStatements().get(0);

        assertEquals(2, stmt.elifBranches.size());
        assertNotNull(stmt.elseBranch);
        assertEquals(1, stmt.elseBranch.size());

        If nested = (If) parseOk("if a { } else if b { }").getStatements().get(0);
        assertTrue(nested.elseBranch.get(0) instanceof If);
    }

    @Test
    void compoundAssignment_desugars() {
        ExprStmt stmt = (ExprStmt) parseOk("x += 2").getStatements().get(0);

        Binary assign = (Binary) stmt.expression;
        assertTrue(assign.isAssignment());
        Binary add = (Binary) assign.right;
        assertEquals("+", add.op());
        assertEquals(2L, ((Literal) add.right).value);

        Binary inc = (Binary) ((ExprStmt) parseOk("x++").getStatements().get(0)).expression;
        assertTrue(inc.isAssignment());
        assertEquals(1L, ((Literal) ((Binary) inc.right).right).value);
    }

    @Test
    void precedence_multiplicationBindsTighter() {
        VarStmt stmt = (VarStmt) parseOk("var a = 2 + 3 * 4").getStatements().get(0);

        Binary add = (Binary) stmt.initializer;
        assertEquals("+", add.op());
        assertEquals("*", ((Binary) add.right).op());
    }

    @Test
    void functionDeclaration_paramsAndReturnType() {
        FunctionStmt fn = (FunctionStmt) parseOk(
                "async func scale(x: float64, by: float64? = 2.0): float64 {\n" +
                "    return x * by\n" +
                "}").getStatements().get(0);

        assertTrue(fn.isAsync);
        assertEquals("scale", fn.name.literal);
        assertEquals(2, fn.params.size());
        assertTrue(fn.params.get(1).nullable);
        assertNotNull(fn.params.get(1).defaultValue);
        assertEquals("float64", fn.returnType.getName());

        FunctionStmt plain = (FunctionStmt) parseOk("func noop() { }").getStatements().get(0);
        assertEquals("void", plain.returnType.getName());
    }

    @Test
    void returnValue_mustStartOnSameLine() {
        FunctionStmt fn = (FunctionStmt) parseOk(
                "func f() {\n" +
                "    return\n" +
                "    5\n" +
                "}").getStatements().get(0);

        assertEquals(2, fn.body.size());
        assertNull(((ReturnStmt) fn.body.get(0)).value);
    }

    @Test
    void parametricTypes() {
        VarStmt stmt = (VarStmt) parseOk("var grid: Map<string, Array<int, 3>> = {}").getStatements().get(0);

        ParametricType type = (ParametricType) stmt.type;
        assertEquals("Map", type.getName());
        assertEquals(2, type.parameters.size());
        ParametricType inner = (ParametricType) type.parameters.get(1).type;
        assertEquals(Long.valueOf(3), inner.parameters.get(1).size);
        assertEquals("Map<string, Array<int, 3>>", type.toString());
    }

    @Test
    void typeGrammarErrors() {
        assertEquals("Expected at least one type parameter", firstError("var a: Array<> = 1"));
        assertEquals("Unexpected trailing comma", firstError("var a: Array<int,> = 1"));
        assertEquals("Expected '>' after type parameters", firstError("var a: Map<int = 1"));
        assertEquals("Expected type name", firstError("var a: = 1"));
    }

    @Test
    void controlFlowOutsideItsContext() {
        assertEquals("'break' used outside of a loop", firstError("break"));
        assertEquals("'continue' used outside of a loop", firstError("if true { continue }"));
        assertEquals("'return' used outside of a function", firstError("return 1"));

        // a function body resets the loop context
        assertEquals("'break' used outside of a loop",
                firstError("while true {\n func f() {\n break\n }\n}"));
    }

    @Test
    void operatorErrors() {
        assertEquals("Expected expression before operator", firstError("var a = * 2"));
        assertEquals("Expected expression after operator", firstError("var a = 1 +"));
        assertEquals("Invalid assignment target", firstError("1 = 2"));
    }

    @Test
    void duplicates_areRejected() {
        assertEquals("Duplicate map key 'a'", firstError("var m = {\"a\": 1, \"a\": 2}"));
        assertEquals("Duplicate parameter name 'a'", firstError("func f(a: int, a: int) { }"));
    }

    @Test
    void trailingCommas_inLiterals() {
        VarStmt arr = (VarStmt) parseOk("var a = [1, 2,]").getStatements().get(0);
        assertNotNull(arr.initializer);

        VarStmt map = (VarStmt) parseOk("var m = {a: 1, b: 2,}").getStatements().get(0);
        assertEquals(2, ((MapLiteral) map.initializer).entries.size());
    }

    @Test
    void astPrinter_indentsTree() {
        String dump = new AstPrinter().print(parseOk("var a = 1 + 2"));

        assertTrue(dump.startsWith("Program\n  VarDeclaration a\n    Binary +\n"), dump);
    }
}
