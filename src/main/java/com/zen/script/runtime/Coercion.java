package com.zen.script.runtime;

/**
 * Brings the two operands of a binary operator to compatible types before
 * {@link Operations} applies it.
 */
public final class Coercion {

    private Coercion() {}

    /** Widening rank: Float64 > Int64 > Float32 > Int32. Zero for non-numeric types. */
    static int rank(Value.Type type) {
        switch (type) {
            case INT32: return 1;
            case FLOAT32: return 2;
            case INT64: return 3;
            case FLOAT64: return 4;
            default: return 0;
        }
    }

    public static Value.Type highestNumericType(Value a, Value b) {
        if (!a.isNumeric() || !b.isNumeric()) {
            throw new TypeError("expected numeric operands, got " + a.type + " and " + b.type);
        }
        return rank(a.type) >= rank(b.type) ? a.type : b.type;
    }

    /**
     * Returns {@code {left, right}} converted for {@code op}.
     *
     * @throws TypeError when the operand types cannot meet
     */
    public static Value[] coerceForOperation(Value left, Value right, String op) {
        switch (op) {
            case "+":
                if (left.type == Value.Type.STRING || right.type == Value.Type.STRING) {
                    if (left.type != Value.Type.STRING || right.type != Value.Type.STRING) {
                        throw new TypeError("cannot concatenate " + left.type + " and " + right.type);
                    }
                    return pair(left, right);
                }
                return numeric(left, right, op);

            case "-":
            case "*":
            case "/":
                return numeric(left, right, op);

            case "and":
            case "or":
                if (left.type != Value.Type.BOOL || right.type != Value.Type.BOOL) {
                    throw new TypeError("logical operators require boolean operands, got "
                            + left.type + " and " + right.type);
                }
                return pair(left, right);

            case "==":
            case "!=":
                if (left.isNull() || right.isNull() || left.type == right.type) return pair(left, right);
                return toSameType(left, right);

            case "<":
            case "<=":
            case ">":
            case ">=":
                if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) return pair(left, right);
                if (left.isNumeric() && right.isNumeric()) return widen(left, right);
                throw new TypeError("cannot compare " + left.type + " and " + right.type);

            default:
                throw new TypeError("invalid operation: " + left.type + " " + op + " " + right.type);
        }
    }

    /** Numeric pairs widen, a String on either side wins; any other mix cannot meet. */
    static Value.Type preferredType(Value.Type a, Value.Type b) {
        if (a.isNumeric() && b.isNumeric()) return rank(a) >= rank(b) ? a : b;
        if (a == Value.Type.STRING || b == Value.Type.STRING) return Value.Type.STRING;
        return null;
    }

    private static Value[] toSameType(Value left, Value right) {
        Value.Type target = preferredType(left.type, right.type);
        if (target == null) {
            throw new TypeError("cannot coerce " + left.type + " and " + right.type + " to same type");
        }
        return pair(Conversion.convert(left, target), Conversion.convert(right, target));
    }

    private static Value[] numeric(Value left, Value right, String op) {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new TypeError("invalid operation: " + left.type + " " + op + " " + right.type);
        }
        return widen(left, right);
    }

    private static Value[] widen(Value left, Value right) {
        Value.Type target = highestNumericType(left, right);
        return pair(Conversion.convert(left, target), Conversion.convert(right, target));
    }

    private static Value[] pair(Value left, Value right) {
        return new Value[] { left, right };
    }
}
