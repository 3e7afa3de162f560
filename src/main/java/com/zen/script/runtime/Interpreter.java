package com.zen.script.runtime;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.zen.debug.Debug;
import com.zen.script.parser.Expr.ArrayAccess;
import com.zen.script.parser.Expr.ArrayLiteral;
import com.zen.script.parser.Expr.Await;
import com.zen.script.parser.Expr.Binary;
import com.zen.script.parser.Expr.Call;
import com.zen.script.parser.Expr.ExprInterface;
import com.zen.script.parser.Expr.ExprVisitor;
import com.zen.script.parser.Expr.Identifier;
import com.zen.script.parser.Expr.Literal;
import com.zen.script.parser.Expr.MapAccess;
import com.zen.script.parser.Expr.MapLiteral;
import com.zen.script.parser.Expr.Member;
import com.zen.script.parser.Expr.Unary;
import com.zen.script.parser.Program;
import com.zen.script.parser.Statement.Branch;
import com.zen.script.parser.Statement.BreakStmt;
import com.zen.script.parser.Statement.ContinueStmt;
import com.zen.script.parser.Statement.ExprStmt;
import com.zen.script.parser.Statement.For;
import com.zen.script.parser.Statement.ForIn;
import com.zen.script.parser.Statement.FunctionStmt;
import com.zen.script.parser.Statement.If;
import com.zen.script.parser.Statement.ReturnStmt;
import com.zen.script.parser.Statement.Stmt;
import com.zen.script.parser.Statement.StmtVisitor;
import com.zen.script.parser.Statement.VarStmt;
import com.zen.script.parser.Statement.While;
import com.zen.script.plugins.CorePlugin;

/**
 * Tree-walking evaluator. Owns one {@link Environment}; not safe to share between threads.
 *
 * Any failure below a node is rethrown as a {@link RuntimeError} located at that node, and ends
 * the current {@link #execute(Program)}.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "Interpreter";

    public static final int DEFAULT_MAX_CALL_DEPTH = 64;

    private final Environment environment;
    private final PrintStream output;
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private int callDepth = 0;

    public Interpreter() {
        this(System.out);
    }

    /** Creates an interpreter whose global scope already holds the core built-ins. */
    public Interpreter(PrintStream output) {
        this.environment = new Environment();
        this.output = output;
        CorePlugin.register(this);
    }

    public Environment getEnvironment() {
        return environment;
    }

    public PrintStream getOutput() {
        return output;
    }

    public void setMaxCallDepth(int maxCallDepth) {
        if (maxCallDepth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1");
        this.maxCallDepth = maxCallDepth;
    }

    public void registerFunction(String name, BuiltinFunction fn) {
        environment.defineGlobal(name, Value.builtin(new NativeFunction(name, fn)));
        Debug.get().d(TAG, "registered builtin " + name);
    }

    // -------------------------
    // Entry points
    // -------------------------

    public void execute(Program program) {
        try {
            for (Stmt stmt : program.getStatements()) {
                executeStatement(stmt);
            }
        } catch (RuntimeError e) {
            Debug.get().w(TAG, "execution aborted", e);
            throw e;
        }
    }

    public void executeStatement(Stmt stmt) {
        try {
            stmt.accept(this);
        } catch (ControlSignal signal) {
            throw signal;
        } catch (RuntimeError e) {
            throw e.withLocation(stmt.getLocation());
        } catch (RuntimeException e) {
            throw new RuntimeError(e.getMessage(), stmt.getLocation(), e);
        }
    }

    public Value evaluateExpression(ExprInterface expr) {
        try {
            return expr.accept(this);
        } catch (ControlSignal signal) {
            throw signal;
        } catch (RuntimeError e) {
            throw e.withLocation(expr.getLocation());
        } catch (RuntimeException e) {
            throw new RuntimeError(e.getMessage(), expr.getLocation(), e);
        }
    }

    /** Value bound to {@code name} as seen from the current scope. */
    public Value getValue(String name) {
        return environment.get(name);
    }

    /** Global variables in definition order, without built-ins. */
    public Map<String, Value> getGlobals() {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : environment.globals().entrySet()) {
            if (e.getValue().type != Value.Type.BUILTIN_FUNCTION) out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    // -------------------------
    // Calls
    // -------------------------

    void enterCall(String name) {
        if (callDepth >= maxCallDepth) {
            throw new RuntimeError("Max call depth exceeded (" + maxCallDepth + ") calling " + name + "()");
        }
        callDepth++;
        if (Debug.get().isEnabled()) Debug.get().t(TAG, "enter " + name + "(), depth " + callDepth);
    }

    void exitCall() {
        callDepth--;
    }

    /** Runs a function body in the already prepared call scope; Void when no return is hit. */
    Value executeFunctionBody(List<Stmt> body) {
        try {
            for (Stmt stmt : body) executeStatement(stmt);
        } catch (ReturnSignal r) {
            return r.value;
        }
        return Value.voidValue();
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitVarStmt(VarStmt stmt) {
        String name = stmt.name.literal;
        Value value = null;
        if (stmt.initializer != null) {
            value = requireValue(evaluateExpression(stmt.initializer));
        }
        if (value == null) {
            if (stmt.isConst()) {
                throw new RuntimeError("Constant '" + name + "' must be initialized. Did you mean 'var " + name + "' ?",
                        stmt.name.location);
            }
            if (!stmt.nullable) {
                throw new RuntimeError("Variable '" + name + "' must either be initialized or declared as nullable.",
                        stmt.name.location);
            }
            value = Value.nil();
        }

        DeclaredType type = stmt.type == null ? null : DeclaredType.named(stmt.type.getName());
        if (type != null) {
            environment.define(name, value, stmt.isConst(), stmt.nullable, type);
        } else if (stmt.isConst()) {
            environment.defineConst(name, value);
        } else if (stmt.nullable) {
            environment.defineNullable(name, value);
        } else {
            environment.define(name, value);
        }
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) {
        evaluateExpression(stmt.expression);
    }

    @Override
    public void visitIfStmt(If stmt) {
        if (condition(stmt.thenBranch.condition, "If")) {
            executeBlock(stmt.thenBranch.body);
            return;
        }
        for (Branch elif : stmt.elifBranches) {
            if (condition(elif.condition, "Elif")) {
                executeBlock(elif.body);
                return;
            }
        }
        if (stmt.elseBranch != null) executeBlock(stmt.elseBranch);
    }

    @Override
    public void visitWhileStmt(While stmt) {
        while (condition(stmt.condition, "While")) {
            if (!runLoopBody(stmt.body)) break;
        }
    }

    @Override
    public void visitForStmt(For stmt) {
        environment.beginScope();
        try {
            if (stmt.initializer != null) executeStatement(stmt.initializer);
            while (stmt.condition == null || condition(stmt.condition, "For")) {
                if (!runLoopBody(stmt.body)) break;
                if (stmt.update != null) evaluateExpression(stmt.update);
            }
        } finally {
            environment.endScope();
        }
    }

    @Override
    public void visitForInStmt(ForIn stmt) {
        Value container = evaluateExpression(stmt.container);
        switch (container.type) {
            case ARRAY: {
                List<Value> items = new ArrayList<>(container.asArray());
                for (int i = 0; i < items.size(); i++) {
                    if (!iterate(stmt, Value.int64(i), items.get(i))) break;
                }
                break;
            }
            case MAP: {
                List<Map.Entry<String, Value>> entries = new ArrayList<>(container.asMap().entrySet());
                for (Map.Entry<String, Value> e : entries) {
                    if (!iterate(stmt, Value.string(e.getKey()), e.getValue())) break;
                }
                break;
            }
            default:
                throw new RuntimeError("Cannot iterate over value of type " + container.type,
                        stmt.container.getLocation());
        }
    }

    /** One for-in pass in its own scope. False when the body broke out of the loop. */
    private boolean iterate(ForIn stmt, Value key, Value value) {
        environment.beginScope();
        try {
            if (stmt.key != null) environment.define(stmt.key.literal, key);
            environment.defineNullable(stmt.value.literal, value);
            for (Stmt s : stmt.body) executeStatement(s);
            return true;
        } catch (BreakSignal b) {
            return false;
        } catch (ContinueSignal c) {
            return true;
        } finally {
            environment.endScope();
        }
    }

    @Override
    public void visitBreakStmt(BreakStmt stmt) {
        throw new BreakSignal();
    }

    @Override
    public void visitContinueStmt(ContinueStmt stmt) {
        throw new ContinueSignal();
    }

    @Override
    public void visitReturnStmt(ReturnStmt stmt) {
        Value value = stmt.value == null ? Value.voidValue() : evaluateExpression(stmt.value);
        throw new ReturnSignal(value);
    }

    @Override
    public void visitFunctionStmt(FunctionStmt stmt) {
        UserFunction fn = new UserFunction(stmt, environment.getCurrentScope());
        environment.define(stmt.name.literal, Value.function(fn));
    }

    private boolean condition(ExprInterface expr, String label) {
        Value v = evaluateExpression(expr);
        if (v.type != Value.Type.BOOL) {
            throw new RuntimeError(label + " condition must be a boolean, got " + v.type, expr.getLocation());
        }
        return v.asBool();
    }

    private void executeBlock(List<Stmt> statements) {
        environment.beginScope();
        try {
            for (Stmt stmt : statements) executeStatement(stmt);
        } finally {
            environment.endScope();
        }
    }

    /** False when the body executed {@code break}. */
    private boolean runLoopBody(List<Stmt> body) {
        try {
            executeBlock(body);
            return true;
        } catch (BreakSignal b) {
            return false;
        } catch (ContinueSignal c) {
            return true;
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v == null) return Value.nil();
        if (v instanceof Long) return Value.int64((Long) v);
        if (v instanceof Double) return Value.float64((Double) v);
        if (v instanceof String) return Value.string((String) v);
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        throw new RuntimeError("Unsupported literal " + v, expr.getLocation());
    }

    @Override
    public Value visitIdentifierExpr(Identifier expr) {
        return environment.get(expr.getName());
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value operand = evaluateExpression(expr.right);
        String op = expr.operator.literal;
        if ("-".equals(op) && !operand.isNumeric()) {
            throw new TypeError("unary '-' requires a numeric operand, got " + operand.type);
        }
        if ("not".equals(op) && operand.type != Value.Type.BOOL) {
            throw new TypeError("'not' requires a boolean operand, got " + operand.type);
        }
        return Operations.unary(op, operand);
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        String op = expr.op();
        if (expr.isAssignment()) {
            Value value = requireValue(evaluateExpression(expr.right));
            return assign(expr.left, value);
        }

        if ("and".equals(op) || "or".equals(op)) {
            Value left = evaluateExpression(expr.left);
            if (left.type != Value.Type.BOOL) {
                throw new TypeError("Left operand of " + op + " must be boolean, got " + left.type);
            }
            if ("and".equals(op) && !left.asBool()) return Value.bool(false);
            if ("or".equals(op) && left.asBool()) return Value.bool(true);

            Value right = evaluateExpression(expr.right);
            if (right.type != Value.Type.BOOL) {
                throw new TypeError("Right operand of " + op + " must be boolean, got " + right.type);
            }
            return Value.bool(right.asBool());
        }

        Value left = evaluateExpression(expr.left);
        Value right = evaluateExpression(expr.right);
        Value[] operands = Coercion.coerceForOperation(left, right, op);
        return Operations.binary(op, operands[0], operands[1]);
    }

    private Value assign(ExprInterface target, Value value) {
        if (target instanceof Identifier) {
            return environment.assign(((Identifier) target).getName(), value);
        }
        if (target instanceof ArrayAccess) {
            ArrayAccess access = (ArrayAccess) target;
            List<Value> items = requireArray(evaluateExpression(access.array));
            int i = index(evaluateExpression(access.index), items.size());
            items.set(i, value);
            return value;
        }
        if (target instanceof MapAccess) {
            MapAccess access = (MapAccess) target;
            requireMap(evaluateExpression(access.map), access.key).put(access.key, value);
            return value;
        }
        if (target instanceof Member) {
            Member member = (Member) target;
            requireMap(evaluateExpression(member.object), member.name.literal).put(member.name.literal, value);
            return value;
        }
        throw new RuntimeError("Invalid assignment target", target.getLocation());
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Callable fn = evaluateExpression(expr.callee).asCallable();
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface arg : expr.arguments) {
            args.add(evaluateExpression(arg));
        }
        return fn.call(this, args);
    }

    @Override
    public Value visitMemberExpr(Member expr) {
        Value object = evaluateExpression(expr.object);
        return lookupKey(requireMap(object, expr.name.literal), expr.name.literal);
    }

    @Override
    public Value visitArrayLiteralExpr(ArrayLiteral expr) {
        List<Value> items = new ArrayList<>(expr.elements.size());
        for (ExprInterface e : expr.elements) items.add(requireValue(evaluateExpression(e)));
        return Value.array(items);
    }

    @Override
    public Value visitArrayAccessExpr(ArrayAccess expr) {
        List<Value> items = requireArray(evaluateExpression(expr.array));
        return items.get(index(evaluateExpression(expr.index), items.size()));
    }

    @Override
    public Value visitMapLiteralExpr(MapLiteral expr) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, ExprInterface> e : expr.entries.entrySet()) {
            out.put(e.getKey(), requireValue(evaluateExpression(e.getValue())));
        }
        return Value.map(out);
    }

    @Override
    public Value visitMapAccessExpr(MapAccess expr) {
        Value map = evaluateExpression(expr.map);
        return lookupKey(requireMap(map, expr.key), expr.key);
    }

    /** No suspension model: the operand is evaluated in place. */
    @Override
    public Value visitAwaitExpr(Await expr) {
        return evaluateExpression(expr.expression);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static Value requireValue(Value v) {
        if (v.type == Value.Type.VOID) throw new TypeError("void value used as a value");
        return v;
    }

    private static List<Value> requireArray(Value v) {
        if (v.type != Value.Type.ARRAY) throw new TypeError("Cannot index value of type " + v.type);
        return v.asArray();
    }

    private static Map<String, Value> requireMap(Value v, String key) {
        if (v.type != Value.Type.MAP) {
            throw new TypeError("Cannot access key '" + key + "' on value of type " + v.type);
        }
        return v.asMap();
    }

    private static Value lookupKey(Map<String, Value> map, String key) {
        Value v = map.get(key);
        if (v == null) throw new RuntimeError("Key '" + key + "' not found in map");
        return v;
    }

    private static int index(Value idx, int size) {
        if (idx.type != Value.Type.INT32 && idx.type != Value.Type.INT64) {
            throw new TypeError("Array index must be an integer, got " + idx.type);
        }
        long i = idx.toLong();
        if (i < 0 || i >= size) {
            throw new RuntimeError("Array index " + i + " out of bounds for length " + size);
        }
        return (int) i;
    }

    // -------------------------
    // Control flow signals
    // -------------------------

    private abstract static class ControlSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;

        ControlSignal() { super(null, null, false, false); }
    }

    private static final class BreakSignal extends ControlSignal {
        private static final long serialVersionUID = 1L;
    }

    private static final class ContinueSignal extends ControlSignal {
        private static final long serialVersionUID = 1L;
    }

    private static final class ReturnSignal extends ControlSignal {
        private static final long serialVersionUID = 1L;

        final Value value;

        ReturnSignal(Value value) { this.value = value; }
    }
}
