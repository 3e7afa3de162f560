package com.zen.script.parser;

import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
        SourceLocation getLocation();
    }

    public interface StmtVisitor {
        void visitVarStmt(VarStmt stmt);
        void visitExprStmt(ExprStmt stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitForStmt(For stmt);
        void visitForInStmt(ForIn stmt);
        void visitBreakStmt(BreakStmt stmt);
        void visitContinueStmt(ContinueStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitFunctionStmt(FunctionStmt stmt);
    }

    /** {@code var}/{@code const} declaration. */
    public static final class VarStmt implements Stmt {
        public final Token keyword;
        public final Token name;
        public final Expr.TypeExpr type;        // nullable
        public final boolean nullable;
        public final Expr.ExprInterface initializer; // nullable

        public VarStmt(Token keyword, Token name, Expr.TypeExpr type, boolean nullable, Expr.ExprInterface initializer) {
            this.keyword = keyword;
            this.name = name;
            this.type = type;
            this.nullable = nullable;
            this.initializer = initializer;
        }

        public boolean isConst() { return keyword.isKeyword("const"); }

        public SourceLocation getLocation() { return keyword.location; }
        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;

        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }

        public SourceLocation getLocation() { return expression.getLocation(); }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    /** One {@code if} or {@code elif} arm. */
    public static final class Branch {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;

        public Branch(Token keyword, Expr.ExprInterface condition, List<Stmt> body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = Collections.unmodifiableList(body);
        }
    }

    public static final class If implements Stmt {
        public final Branch thenBranch;
        public final List<Branch> elifBranches;
        public final List<Stmt> elseBranch; // null when there is no else

        public If(Branch thenBranch, List<Branch> elifBranches, List<Stmt> elseBranch) {
            this.thenBranch = thenBranch;
            this.elifBranches = Collections.unmodifiableList(elifBranches);
            this.elseBranch = elseBranch == null ? null : Collections.unmodifiableList(elseBranch);
        }

        public SourceLocation getLocation() { return thenBranch.keyword.location; }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;

        public While(Token keyword, Expr.ExprInterface condition, List<Stmt> body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = Collections.unmodifiableList(body);
        }

        public SourceLocation getLocation() { return keyword.location; }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    /** C-style three clause loop; every clause may be absent. */
    public static final class For implements Stmt {
        public final Token keyword;
        public final Stmt initializer;
        public final Expr.ExprInterface condition;
        public final Expr.ExprInterface update;
        public final List<Stmt> body;

        public For(Token keyword, Stmt initializer, Expr.ExprInterface condition, Expr.ExprInterface update, List<Stmt> body) {
            this.keyword = keyword;
            this.initializer = initializer;
            this.condition = condition;
            this.update = update;
            this.body = Collections.unmodifiableList(body);
        }

        public SourceLocation getLocation() { return keyword.location; }
        public void accept(StmtVisitor visitor) { visitor.visitForStmt(this); }
    }

    /** {@code for [key,] value in container { ... }} */
    public static final class ForIn implements Stmt {
        public final Token keyword;
        public final Token key;   // nullable
        public final Token value;
        public final Expr.ExprInterface container;
        public final List<Stmt> body;

        public ForIn(Token keyword, Token key, Token value, Expr.ExprInterface container, List<Stmt> body) {
            this.keyword = keyword;
            this.key = key;
            this.value = value;
            this.container = container;
            this.body = Collections.unmodifiableList(body);
        }

        public SourceLocation getLocation() { return keyword.location; }
        public void accept(StmtVisitor visitor) { visitor.visitForInStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;

        public BreakStmt(Token keyword) { this.keyword = keyword; }

        public SourceLocation getLocation() { return keyword.location; }
        public void accept(StmtVisitor visitor) { visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        public final Token keyword;

        public ContinueStmt(Token keyword) { this.keyword = keyword; }

        public SourceLocation getLocation() { return keyword.location; }
        public void accept(StmtVisitor visitor) { visitor.visitContinueStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // nullable

        public ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public SourceLocation getLocation() { return keyword.location; }
        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Expr.Parameter> params;
        public final Expr.TypeExpr returnType;
        public final List<Stmt> body;
        public final boolean isAsync;

        public FunctionStmt(Token name, List<Expr.Parameter> params, Expr.TypeExpr returnType, List<Stmt> body, boolean isAsync) {
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.returnType = returnType;
            this.body = Collections.unmodifiableList(body);
            this.isAsync = isAsync;
        }

        public SourceLocation getLocation() { return name.location; }
        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
    }
}
