package com.zen.script.runtime;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged runtime value. Scalars are immutable; Array and Map payloads are mutable containers
 * updated in place by element assignment.
 */
public final class Value {

    public enum Type {
        INT32("int"),
        FLOAT32("float"),
        INT64("int64"),
        FLOAT64("float64"),
        STRING("string"),
        BOOL("bool"),
        NULL("null"),
        VOID("void"),
        FUNCTION("function"),
        BUILTIN_FUNCTION("builtin"),
        // reserved for lambdas and class instances; nothing produces these yet
        LAMBDA("lambda"),
        CLASS("class"),
        OBJECT("object"),
        ARRAY("array"),
        MAP("map");

        private final String typeName;

        Type(String typeName) {
            this.typeName = typeName;
        }

        public String getTypeName() {
            return typeName;
        }

        public boolean isNumeric() {
            return this == INT32 || this == FLOAT32 || this == INT64 || this == FLOAT64;
        }

        public boolean isCallable() {
            return this == FUNCTION || this == BUILTIN_FUNCTION || this == LAMBDA;
        }

        @Override
        public String toString() {
            return typeName;
        }
    }

    private static final Value NULL = new Value(Type.NULL, null);
    private static final Value VOID = new Value(Type.VOID, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value int32(int i) { return new Value(Type.INT32, i); }
    public static Value float32(float f) { return new Value(Type.FLOAT32, f); }
    public static Value int64(long l) { return new Value(Type.INT64, l); }
    public static Value float64(double d) { return new Value(Type.FLOAT64, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value nil() { return NULL; }
    public static Value voidValue() { return VOID; }

    public static Value string(String s) {
        if (s == null) throw new IllegalArgumentException("string value is null");
        return new Value(Type.STRING, s);
    }

    public static Value array(List<Value> items) {
        return new Value(Type.ARRAY, items == null ? new ArrayList<Value>() : items);
    }

    public static Value map(Map<String, Value> entries) {
        return new Value(Type.MAP, entries == null ? new LinkedHashMap<String, Value>() : entries);
    }

    public static Value function(UserFunction fn) { return new Value(Type.FUNCTION, fn); }
    public static Value builtin(NativeFunction fn) { return new Value(Type.BUILTIN_FUNCTION, fn); }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }

    public boolean isNumeric() { return type.isNumeric(); }

    // -------------------------
    // Typed accessors
    // -------------------------

    public int asInt32() {
        expect(Type.INT32);
        return (Integer) value;
    }

    public float asFloat32() {
        expect(Type.FLOAT32);
        return (Float) value;
    }

    public long asInt64() {
        expect(Type.INT64);
        return (Long) value;
    }

    public double asFloat64() {
        expect(Type.FLOAT64);
        return (Double) value;
    }

    public String asString() {
        expect(Type.STRING);
        return (String) value;
    }

    public boolean asBool() {
        expect(Type.BOOL);
        return (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        expect(Type.ARRAY);
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asMap() {
        expect(Type.MAP);
        return (Map<String, Value>) value;
    }

    public Callable asCallable() {
        if (!type.isCallable()) throw new TypeError("Cannot call value of type " + type);
        return (Callable) value;
    }

    /** Any numeric payload widened to double. */
    public double toDouble() {
        if (!isNumeric()) throw new TypeError("expected a numeric value, got " + type);
        return ((Number) value).doubleValue();
    }

    /** Integral payload (int or int64) widened to long. */
    public long toLong() {
        if (type != Type.INT32 && type != Type.INT64) throw new TypeError("expected an integer value, got " + type);
        return ((Number) value).longValue();
    }

    private void expect(Type expected) {
        if (type != expected) throw new TypeError("expected " + expected + ", got " + type);
    }

    // -------------------------
    // Semantics
    // -------------------------

    /** Numbers are truthy when non-zero, strings when non-empty, containers when non-empty. */
    public boolean isTruthy() {
        switch (type) {
            case BOOL: return (Boolean) value;
            case INT32:
            case INT64: return ((Number) value).longValue() != 0L;
            case FLOAT32:
            case FLOAT64: return ((Number) value).doubleValue() != 0.0;
            case STRING: return !((String) value).isEmpty();
            case NULL:
            case VOID: return false;
            case ARRAY: return !asArray().isEmpty();
            case MAP: return !asMap().isEmpty();
            default: return true;
        }
    }

    /** Deep for containers; scalars and callables are shared. */
    public Value copy() {
        switch (type) {
            case ARRAY: {
                List<Value> out = new ArrayList<>(asArray().size());
                for (Value v : asArray()) out.add(v.copy());
                return Value.array(out);
            }
            case MAP: {
                Map<String, Value> out = new LinkedHashMap<>();
                for (Map.Entry<String, Value> e : asMap().entrySet()) out.put(e.getKey(), e.getValue().copy());
                return Value.map(out);
            }
            default:
                return this;
        }
    }

    /** Structural equality: same tag and equal payload. Null equals only Null. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return render(false);
    }

    private String render(boolean nested) {
        switch (type) {
            case INT32:
            case INT64:
                return value.toString();
            case FLOAT32:
                return formatFloat(new BigDecimal(Float.toString((Float) value)), (Float) value);
            case FLOAT64:
                return formatFloat(new BigDecimal(Double.toString((Double) value)), (Double) value);
            case STRING:
                return nested ? '"' + (String) value + '"' : (String) value;
            case BOOL:
                return value.toString();
            case NULL:
                return "null";
            case VOID:
                return "void";
            case FUNCTION:
            case BUILTIN_FUNCTION:
            case LAMBDA:
                return ((Callable) value).describe();
            case ARRAY: {
                StringBuilder sb = new StringBuilder("[");
                Iterator<Value> it = asArray().iterator();
                while (it.hasNext()) {
                    sb.append(it.next().render(true));
                    if (it.hasNext()) sb.append(", ");
                }
                return sb.append(']').toString();
            }
            case MAP: {
                StringBuilder sb = new StringBuilder("{");
                Iterator<Map.Entry<String, Value>> it = asMap().entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, Value> e = it.next();
                    sb.append(e.getKey()).append(": ").append(e.getValue().render(true));
                    if (it.hasNext()) sb.append(", ");
                }
                return sb.append('}').toString();
            }
            default:
                return "<" + type + ">";
        }
    }

    /** Shortest form without a trailing ".0": 1, 0.5, 3.14, 1.0E21. */
    private static String formatFloat(BigDecimal exact, double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "+Inf" : "-Inf";
        double abs = Math.abs(d);
        if (abs != 0.0 && (abs < 1e-4 || abs >= 1e21)) {
            return Double.toString(d);
        }
        if (abs == 0.0) return "0";
        return exact.stripTrailingZeros().toPlainString();
    }
}
