package com.zen.script.runtime;

import java.util.List;
import java.util.Map;

/**
 * Applies binary and unary operators to already-coerced operands. Binary operands must share a
 * type; see {@link Coercion#coerceForOperation}.
 */
public final class Operations {

    private Operations() {}

    public static Value binary(String op, Value left, Value right) {
        switch (op) {
            case "+":
                if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                return arithmetic(op, left, right);
            case "-":
            case "*":
                return arithmetic(op, left, right);
            case "/":
                if (!right.isTruthy()) throw new RuntimeError("division by zero");
                return arithmetic(op, left, right);
            case "<":
            case "<=":
            case ">":
            case ">=":
                return Value.bool(compare(op, left, right));
            case "==":
                return Value.bool(equal(left, right));
            case "!=":
                return Value.bool(!equal(left, right));
            case "and":
                return Value.bool(left.asBool() && right.asBool());
            case "or":
                return Value.bool(left.asBool() || right.asBool());
            default:
                throw invalid(op, left, right);
        }
    }

    public static Value unary(String op, Value operand) {
        switch (op) {
            case "-":
                switch (operand.type) {
                    case INT32: return Value.int32(-operand.asInt32());
                    case FLOAT32: return Value.float32(-operand.asFloat32());
                    case INT64: return Value.int64(-operand.asInt64());
                    case FLOAT64: return Value.float64(-operand.asFloat64());
                    default: throw new TypeError("invalid operation: -" + operand.type);
                }
            case "not":
                if (operand.type != Value.Type.BOOL) {
                    throw new TypeError("invalid operation: not " + operand.type);
                }
                return Value.bool(!operand.asBool());
            default:
                throw new TypeError("invalid operation: " + op + operand.type);
        }
    }

    private static Value arithmetic(String op, Value left, Value right) {
        if (left.type != right.type) throw invalid(op, left, right);
        switch (left.type) {
            case INT32: {
                int a = left.asInt32();
                int b = right.asInt32();
                switch (op) {
                    case "+": return Value.int32(a + b);
                    case "-": return Value.int32(a - b);
                    case "*": return Value.int32(a * b);
                    default: return Value.int32(a / b);
                }
            }
            case INT64: {
                long a = left.asInt64();
                long b = right.asInt64();
                switch (op) {
                    case "+": return Value.int64(a + b);
                    case "-": return Value.int64(a - b);
                    case "*": return Value.int64(a * b);
                    default: return Value.int64(a / b);
                }
            }
            case FLOAT32: {
                float a = left.asFloat32();
                float b = right.asFloat32();
                switch (op) {
                    case "+": return Value.float32(a + b);
                    case "-": return Value.float32(a - b);
                    case "*": return Value.float32(a * b);
                    default: return Value.float32(a / b);
                }
            }
            case FLOAT64: {
                double a = left.asFloat64();
                double b = right.asFloat64();
                switch (op) {
                    case "+": return Value.float64(a + b);
                    case "-": return Value.float64(a - b);
                    case "*": return Value.float64(a * b);
                    default: return Value.float64(a / b);
                }
            }
            default:
                throw invalid(op, left, right);
        }
    }

    private static boolean compare(String op, Value left, Value right) {
        int c;
        if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
            c = left.asString().compareTo(right.asString());
        } else if ((left.type == Value.Type.INT32 || left.type == Value.Type.INT64) && left.type == right.type) {
            c = Long.compare(left.toLong(), right.toLong());
        } else if (left.isNumeric() && left.type == right.type) {
            double a = left.toDouble();
            double b = right.toDouble();
            switch (op) {
                case "<": return a < b;
                case "<=": return a <= b;
                case ">": return a > b;
                default: return a >= b;
            }
        } else {
            throw new TypeError("cannot compare " + left.type + " and " + right.type);
        }
        switch (op) {
            case "<": return c < 0;
            case "<=": return c <= 0;
            case ">": return c > 0;
            default: return c >= 0;
        }
    }

    /** Like {@link Value#equals} but floats compare as primitives: 0.0 equals -0.0, NaN equals nothing. */
    static boolean equal(Value left, Value right) {
        if (left.type != right.type) return false;
        switch (left.type) {
            case FLOAT32:
                return left.asFloat32() == right.asFloat32();
            case FLOAT64:
                return left.asFloat64() == right.asFloat64();
            case ARRAY: {
                List<Value> a = left.asArray();
                List<Value> b = right.asArray();
                if (a.size() != b.size()) return false;
                for (int i = 0; i < a.size(); i++) {
                    if (!equal(a.get(i), b.get(i))) return false;
                }
                return true;
            }
            case MAP: {
                Map<String, Value> a = left.asMap();
                Map<String, Value> b = right.asMap();
                if (!a.keySet().equals(b.keySet())) return false;
                for (Map.Entry<String, Value> e : a.entrySet()) {
                    if (!equal(e.getValue(), b.get(e.getKey()))) return false;
                }
                return true;
            }
            default:
                return left.equals(right);
        }
    }

    private static TypeError invalid(String op, Value left, Value right) {
        return new TypeError("invalid operation: " + left.type + " " + op + " " + right.type);
    }
}
