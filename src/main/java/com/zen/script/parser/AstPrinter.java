package com.zen.script.parser;

import java.util.List;
import java.util.Map;

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
import com.zen.script.parser.Expr.Parameter;
import com.zen.script.parser.Expr.Unary;
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

/** Indented tree dump of a parsed program, two spaces per level. */
public class AstPrinter implements ExprVisitor<Void>, StmtVisitor {
    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    public String print(Program program) {
        out.setLength(0);
        depth = 0;
        line("Program");
        depth++;
        for (Stmt stmt : program.getStatements()) stmt.accept(this);
        depth--;
        return out.toString();
    }

    public String print(Stmt stmt) {
        out.setLength(0);
        depth = 0;
        stmt.accept(this);
        return out.toString();
    }

    public String print(ExprInterface expr) {
        out.setLength(0);
        depth = 0;
        expr.accept(this);
        return out.toString();
    }

    private void line(String text) {
        for (int i = 0; i < depth; i++) out.append("  ");
        out.append(text).append('\n');
    }

    private void child(ExprInterface expr) {
        depth++;
        expr.accept(this);
        depth--;
    }

    private void labelled(String label, ExprInterface expr) {
        depth++;
        line(label);
        child(expr);
        depth--;
    }

    private void body(String label, List<Stmt> statements) {
        depth++;
        line(label);
        depth++;
        for (Stmt s : statements) s.accept(this);
        depth -= 2;
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitVarStmt(VarStmt stmt) {
        StringBuilder head = new StringBuilder(stmt.isConst() ? "ConstDeclaration " : "VarDeclaration ");
        head.append(stmt.name.literal);
        if (stmt.type != null) head.append(" : ").append(stmt.type);
        if (stmt.nullable) head.append('?');
        line(head.toString());
        if (stmt.initializer != null) child(stmt.initializer);
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) {
        line("ExpressionStatement");
        child(stmt.expression);
    }

    @Override
    public void visitIfStmt(If stmt) {
        line("If");
        branch("Condition", stmt.thenBranch);
        for (Branch elif : stmt.elifBranches) branch("Elif", elif);
        if (stmt.elseBranch != null) body("Else", stmt.elseBranch);
    }

    private void branch(String label, Branch b) {
        labelled(label, b.condition);
        body("Then", b.body);
    }

    @Override
    public void visitWhileStmt(While stmt) {
        line("While");
        labelled("Condition", stmt.condition);
        body("Body", stmt.body);
    }

    @Override
    public void visitForStmt(For stmt) {
        line("For");
        if (stmt.initializer != null) {
            depth++;
            line("Init");
            depth++;
            stmt.initializer.accept(this);
            depth -= 2;
        }
        if (stmt.condition != null) labelled("Condition", stmt.condition);
        if (stmt.update != null) labelled("Update", stmt.update);
        body("Body", stmt.body);
    }

    @Override
    public void visitForInStmt(ForIn stmt) {
        String vars = stmt.key == null ? stmt.value.literal : stmt.key.literal + ", " + stmt.value.literal;
        line("ForIn " + vars);
        labelled("Container", stmt.container);
        body("Body", stmt.body);
    }

    @Override
    public void visitBreakStmt(BreakStmt stmt) {
        line("Break");
    }

    @Override
    public void visitContinueStmt(ContinueStmt stmt) {
        line("Continue");
    }

    @Override
    public void visitReturnStmt(ReturnStmt stmt) {
        line("Return");
        if (stmt.value != null) child(stmt.value);
    }

    @Override
    public void visitFunctionStmt(FunctionStmt stmt) {
        line((stmt.isAsync ? "AsyncFunction " : "Function ") + stmt.name.literal + " : " + stmt.returnType);
        depth++;
        for (Parameter p : stmt.params) {
            line("Parameter " + p.getName() + " : " + p.type + (p.nullable ? "?" : ""));
            if (p.defaultValue != null) labelled("Default", p.defaultValue);
        }
        depth--;
        body("Body", stmt.body);
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Void visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v == null) line("Literal null");
        else if (v instanceof String) line("Literal \"" + v + "\"");
        else line("Literal " + v);
        return null;
    }

    @Override
    public Void visitIdentifierExpr(Identifier expr) {
        line("Identifier " + expr.getName());
        return null;
    }

    @Override
    public Void visitUnaryExpr(Unary expr) {
        line("Unary " + expr.operator.literal);
        child(expr.right);
        return null;
    }

    @Override
    public Void visitBinaryExpr(Binary expr) {
        line(expr.isAssignment() ? "Assign" : "Binary " + expr.op());
        child(expr.left);
        child(expr.right);
        return null;
    }

    @Override
    public Void visitCallExpr(Call expr) {
        line("Call");
        child(expr.callee);
        if (!expr.arguments.isEmpty()) {
            depth++;
            line("Arguments");
            for (ExprInterface arg : expr.arguments) child(arg);
            depth--;
        }
        return null;
    }

    @Override
    public Void visitMemberExpr(Member expr) {
        line("Member ." + expr.name.literal);
        child(expr.object);
        return null;
    }

    @Override
    public Void visitArrayLiteralExpr(ArrayLiteral expr) {
        line("ArrayLiteral");
        for (ExprInterface e : expr.elements) child(e);
        return null;
    }

    @Override
    public Void visitArrayAccessExpr(ArrayAccess expr) {
        line("ArrayAccess");
        child(expr.array);
        labelled("Index", expr.index);
        return null;
    }

    @Override
    public Void visitMapLiteralExpr(MapLiteral expr) {
        line("MapLiteral");
        for (Map.Entry<String, ExprInterface> e : expr.entries.entrySet()) {
            labelled("Key \"" + e.getKey() + "\"", e.getValue());
        }
        return null;
    }

    @Override
    public Void visitMapAccessExpr(MapAccess expr) {
        line("MapAccess {\"" + expr.key + "\"}");
        child(expr.map);
        return null;
    }

    @Override
    public Void visitAwaitExpr(Await expr) {
        line("Await");
        child(expr.expression);
        return null;
    }
}
