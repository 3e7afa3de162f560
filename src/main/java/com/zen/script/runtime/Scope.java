package com.zen.script.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One level of lexical bindings, linked to its enclosing scope. */
public final class Scope {

    /** A binding slot. The value is replaced in place by assignment. */
    public static final class VarInfo {
        Value value;
        final boolean isConstant;
        final boolean isNullable;
        final DeclaredType declaredType; // nullable

        VarInfo(Value value, boolean isConstant, boolean isNullable, DeclaredType declaredType) {
            this.value = value;
            this.isConstant = isConstant;
            this.isNullable = isNullable;
            this.declaredType = declaredType;
        }

        public Value getValue() { return value; }
        public boolean isConstant() { return isConstant; }
        public boolean isNullable() { return isNullable; }
        public DeclaredType getDeclaredType() { return declaredType; }
    }

    private final Scope parent;
    private final Map<String, VarInfo> bindings = new LinkedHashMap<>();

    Scope(Scope parent) {
        this.parent = parent;
    }

    public Scope getParent() {
        return parent;
    }

    public boolean isGlobal() {
        return parent == null;
    }

    public boolean has(String name) {
        return bindings.containsKey(name);
    }

    /** Binding owned by this scope only, or null. */
    VarInfo local(String name) {
        return bindings.get(name);
    }

    /** Nearest binding walking outward, or null. */
    VarInfo resolve(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            VarInfo info = s.bindings.get(name);
            if (info != null) return info;
        }
        return null;
    }

    void put(String name, VarInfo info) {
        if (bindings.containsKey(name)) throw new RedefinitionError(name);
        bindings.put(name, info);
    }

    public Map<String, VarInfo> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    int depth() {
        int d = 0;
        for (Scope s = parent; s != null; s = s.parent) d++;
        return d;
    }
}
