package com.zen.script.runtime;

/**
 * Runtime view of a type annotation. Primitive and container names are enforced; any other name
 * (user types, {@code any}, {@code void}) accepts every value.
 */
public final class DeclaredType {
    private final String name;
    private final Value.Type required; // null when unchecked

    private DeclaredType(String name, Value.Type required) {
        this.name = name;
        this.required = required;
    }

    public static DeclaredType named(String name) {
        return new DeclaredType(name, lookup(name));
    }

    private static Value.Type lookup(String name) {
        switch (name) {
            case "int":
            case "int32": return Value.Type.INT32;
            case "float":
            case "float32": return Value.Type.FLOAT32;
            case "int64": return Value.Type.INT64;
            case "float64": return Value.Type.FLOAT64;
            case "string": return Value.Type.STRING;
            case "bool": return Value.Type.BOOL;
            case "Array":
            case "array": return Value.Type.ARRAY;
            case "Map":
            case "map": return Value.Type.MAP;
            case "function": return Value.Type.FUNCTION;
            default: return null;
        }
    }

    public String getName() {
        return name;
    }

    public boolean isChecked() {
        return required != null;
    }

    /**
     * Returns {@code value} fitted to this type: numerics convert (range-checked), matching values
     * pass, null passes (nullability is the binding's concern).
     *
     * @throws TypeError when the value cannot take this type
     */
    public Value coerce(Value value) {
        if (required == null || value.isNull() || value.type == required) return value;
        if (required.isNumeric() && value.isNumeric()) return Conversion.convert(value, required);
        if (required == Value.Type.FUNCTION && value.type.isCallable()) return value;
        throw new TypeError("cannot use " + value.type + " value as " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
