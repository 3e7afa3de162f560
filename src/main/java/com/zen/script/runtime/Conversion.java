package com.zen.script.runtime;

/** Explicit conversion of a value to another type, with range checks on narrowing. */
public final class Conversion {

    private Conversion() {}

    public static Value convert(Value value, Value.Type target) {
        if (value.type == target) return value;

        if (value.isNull()) return zeroOf(target);

        switch (target) {
            case INT32: return toInt32(value);
            case FLOAT32: return toFloat32(value);
            case INT64: return toInt64(value);
            case FLOAT64: return toFloat64(value);
            case BOOL: return toBool(value);
            case STRING:
                if (value.type == Value.Type.VOID || value.type.isCallable()) break;
                return Value.string(value.toString());
            default:
                break;
        }
        throw new TypeError("cannot convert " + value.type + " to " + target);
    }

    private static Value zeroOf(Value.Type target) {
        switch (target) {
            case INT32: return Value.int32(0);
            case FLOAT32: return Value.float32(0f);
            case INT64: return Value.int64(0L);
            case FLOAT64: return Value.float64(0.0);
            case BOOL: return Value.bool(false);
            case STRING: return Value.string("null");
            default: throw new TypeError("cannot convert null to " + target);
        }
    }

    private static Value toInt32(Value v) {
        switch (v.type) {
            case INT64: {
                long l = v.asInt64();
                if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                    throw new TypeError("int64 value " + l + " out of range for int32");
                }
                return Value.int32((int) l);
            }
            case FLOAT32:
            case FLOAT64: {
                double d = v.toDouble();
                if (Double.isNaN(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                    throw new TypeError(v.type + " value " + v + " out of range for int32");
                }
                return Value.int32((int) d);
            }
            case BOOL:
                return Value.int32(v.asBool() ? 1 : 0);
            case STRING:
                return toInt32(parseNumber(v.asString(), Value.Type.INT32));
            default:
                throw new TypeError("cannot convert " + v.type + " to int32");
        }
    }

    private static Value toInt64(Value v) {
        switch (v.type) {
            case INT32:
                return Value.int64(v.asInt32());
            case FLOAT32:
            case FLOAT64: {
                double d = v.toDouble();
                if (Double.isNaN(d) || d < Long.MIN_VALUE || d >= 9.223372036854775807E18) {
                    throw new TypeError(v.type + " value " + v + " out of range for int64");
                }
                return Value.int64((long) d);
            }
            case BOOL:
                return Value.int64(v.asBool() ? 1L : 0L);
            case STRING:
                return toInt64(parseNumber(v.asString(), Value.Type.INT64));
            default:
                throw new TypeError("cannot convert " + v.type + " to int64");
        }
    }

    private static Value toFloat32(Value v) {
        switch (v.type) {
            case INT32:
            case INT64:
                return Value.float32((float) v.toLong());
            case FLOAT64: {
                double d = v.asFloat64();
                if (!Double.isInfinite(d) && !Double.isNaN(d) && Math.abs(d) > Float.MAX_VALUE) {
                    throw new TypeError("float64 value " + v + " out of range for float32");
                }
                return Value.float32((float) d);
            }
            case BOOL:
                return Value.float32(v.asBool() ? 1f : 0f);
            case STRING:
                return toFloat32(parseNumber(v.asString(), Value.Type.FLOAT32));
            default:
                throw new TypeError("cannot convert " + v.type + " to float32");
        }
    }

    private static Value toFloat64(Value v) {
        switch (v.type) {
            case INT32:
            case INT64:
                return Value.float64((double) v.toLong());
            case FLOAT32:
                // through the decimal form so 0.1f becomes 0.1, not 0.10000000149011612
                return Value.float64(Double.parseDouble(Float.toString(v.asFloat32())));
            case BOOL:
                return Value.float64(v.asBool() ? 1.0 : 0.0);
            case STRING:
                return toFloat64(parseNumber(v.asString(), Value.Type.FLOAT64));
            default:
                throw new TypeError("cannot convert " + v.type + " to float64");
        }
    }

    private static Value toBool(Value v) {
        if (v.isNumeric()) return Value.bool(v.isTruthy());
        if (v.type == Value.Type.STRING) {
            String s = v.asString();
            if (s.equals("true") || s.equals("1")) return Value.bool(true);
            if (s.equals("false") || s.equals("0") || s.isEmpty()) return Value.bool(false);
            throw new TypeError("cannot convert string '" + s + "' to bool");
        }
        throw new TypeError("cannot convert " + v.type + " to bool");
    }

    /** Parses decimal text as int64 when integral, float64 otherwise. */
    private static Value parseNumber(String text, Value.Type target) {
        String s = text.trim();
        try {
            if (s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0) {
                return Value.int64(Long.parseLong(s));
            }
            return Value.float64(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            throw new TypeError("cannot convert string '" + text + "' to " + target);
        }
    }
}
