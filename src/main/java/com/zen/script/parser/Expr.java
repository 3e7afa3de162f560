package com.zen.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
        SourceLocation getLocation();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitIdentifierExpr(Identifier expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitCallExpr(Call expr);
        R visitMemberExpr(Member expr);
        R visitArrayLiteralExpr(ArrayLiteral expr);
        R visitArrayAccessExpr(ArrayAccess expr);
        R visitMapLiteralExpr(MapLiteral expr);
        R visitMapAccessExpr(MapAccess expr);
        R visitAwaitExpr(Await expr);
    }

    // -------------------------
    // Expression nodes
    // -------------------------

    /** A constant: Long, Double, String, Boolean or null. */
    public static final class Literal implements ExprInterface {
        public final Object value;
        private final SourceLocation location;

        public Literal(Object value, SourceLocation location) {
            this.value = value;
            this.location = location;
        }

        @Override
        public SourceLocation getLocation() { return location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Identifier implements ExprInterface {
        public final Token name;

        public Identifier(Token name) {
            this.name = name;
        }

        public String getName() { return name.literal; }

        @Override
        public SourceLocation getLocation() { return name.location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }
    }

    /** {@code -x}, {@code not x}. */
    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public SourceLocation getLocation() { return operator.location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /**
     * Arithmetic, comparison, logical ({@code and}/{@code or}) and assignment.
     * Compound assignment and {@code ++}/{@code --} arrive here already rewritten to plain {@code =}.
     */
    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        public String op() { return operator.literal; }

        public boolean isAssignment() { return operator.type == TokenType.ASSIGN; }

        @Override
        public SourceLocation getLocation() { return operator.location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        @Override
        public SourceLocation getLocation() { return paren.location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** {@code object.name} */
    public static final class Member implements ExprInterface {
        public final ExprInterface object;
        public final Token name;

        public Member(ExprInterface object, Token name) {
            this.object = object;
            this.name = name;
        }

        @Override
        public SourceLocation getLocation() { return name.location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMemberExpr(this);
        }
    }

    public static final class ArrayLiteral implements ExprInterface {
        public final List<ExprInterface> elements;
        private final SourceLocation location;

        public ArrayLiteral(List<ExprInterface> elements, SourceLocation location) {
            this.elements = Collections.unmodifiableList(elements);
            this.location = location;
        }

        @Override
        public SourceLocation getLocation() { return location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteralExpr(this);
        }
    }

    /** {@code array[index]} */
    public static final class ArrayAccess implements ExprInterface {
        public final ExprInterface array;
        public final ExprInterface index;
        private final SourceLocation location;

        public ArrayAccess(ExprInterface array, ExprInterface index, SourceLocation location) {
            this.array = array;
            this.index = index;
            this.location = location;
        }

        @Override
        public SourceLocation getLocation() { return location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayAccessExpr(this);
        }
    }

    public static final class MapLiteral implements ExprInterface {
        public final LinkedHashMap<String, ExprInterface> entries; // source order
        private final SourceLocation location;

        public MapLiteral(LinkedHashMap<String, ExprInterface> entries, SourceLocation location) {
            this.entries = entries;
            this.location = location;
        }

        @Override
        public SourceLocation getLocation() { return location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMapLiteralExpr(this);
        }
    }

    /** {@code map{key}} where key is a string literal or a bare identifier. */
    public static final class MapAccess implements ExprInterface {
        public final ExprInterface map;
        public final String key;
        private final SourceLocation location;

        public MapAccess(ExprInterface map, String key, SourceLocation location) {
            this.map = map;
            this.key = key;
            this.location = location;
        }

        @Override
        public SourceLocation getLocation() { return location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMapAccessExpr(this);
        }
    }

    public static final class Await implements ExprInterface {
        public final Token keyword;
        public final ExprInterface expression;

        public Await(Token keyword, ExprInterface expression) {
            this.keyword = keyword;
            this.expression = expression;
        }

        @Override
        public SourceLocation getLocation() { return keyword.location; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAwaitExpr(this);
        }
    }

    // -------------------------
    // Declarations (not evaluated)
    // -------------------------

    public abstract static class TypeExpr {
        public final Token name;

        TypeExpr(Token name) {
            this.name = name;
        }

        public String getName() { return name.literal; }

        public SourceLocation getLocation() { return name.location; }
    }

    /** {@code int}, {@code string}, {@code Point} */
    public static final class BasicType extends TypeExpr {
        public BasicType(Token name) {
            super(name);
        }

        @Override
        public String toString() { return getName(); }
    }

    /** {@code Array<int, 5>}, {@code Map<string, Array<float>>} */
    public static final class ParametricType extends TypeExpr {
        public final List<TypeParameter> parameters;

        public ParametricType(Token name, List<TypeParameter> parameters) {
            super(name);
            this.parameters = Collections.unmodifiableList(parameters);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(getName()).append('<');
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(parameters.get(i));
            }
            return sb.append('>').toString();
        }
    }

    /** Either a nested type or an integer size. */
    public static final class TypeParameter {
        public final TypeExpr type;
        public final Long size;

        private TypeParameter(TypeExpr type, Long size) {
            this.type = type;
            this.size = size;
        }

        public static TypeParameter ofType(TypeExpr type) { return new TypeParameter(type, null); }
        public static TypeParameter ofSize(long size) { return new TypeParameter(null, size); }

        @Override
        public String toString() {
            return type != null ? type.toString() : String.valueOf(size);
        }
    }

    /** {@code name : Type [?] [= default]} */
    public static final class Parameter {
        public final Token name;
        public final TypeExpr type;
        public final boolean nullable;
        public final ExprInterface defaultValue;

        public Parameter(Token name, TypeExpr type, boolean nullable, ExprInterface defaultValue) {
            this.name = name;
            this.type = type;
            this.nullable = nullable;
            this.defaultValue = defaultValue;
        }

        public String getName() { return name.literal; }

        public SourceLocation getLocation() { return name.location; }
    }
}
