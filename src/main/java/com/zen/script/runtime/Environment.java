package com.zen.script.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import com.zen.debug.Debug;

/**
 * Scope chain of one interpreter: a fixed global anchor and a movable current cursor.
 *
 * Definitions always land in the current scope; lookup and assignment walk outward to the
 * global scope. The *Global variants touch only the anchor.
 */
public class Environment {
    private static final String TAG = "Environment";

    private final Scope global;
    private Scope current;

    public Environment() {
        this.global = new Scope(null);
        this.current = global;
    }

    public Scope getGlobalScope() {
        return global;
    }

    public Scope getCurrentScope() {
        return current;
    }

    /** Nesting depth of the current scope, 0 at global. */
    public int depth() {
        return current.depth();
    }

    // -------------------------
    // Block scoping
    // -------------------------

    public void beginScope() {
        current = new Scope(current);
        if (Debug.get().isEnabled()) Debug.get().t(TAG, "begin scope, depth " + current.depth());
    }

    public void endScope() {
        if (current == global) throw new ScopeError("Cannot end global scope");
        if (Debug.get().isEnabled()) Debug.get().t(TAG, "end scope, depth " + current.depth());
        current = current.getParent();
    }

    /**
     * Makes a fresh scope under {@code parent} current (a function call frame) and returns the
     * previous cursor for {@link #restoreScope}.
     */
    public Scope enterScope(Scope parent) {
        Scope previous = current;
        current = new Scope(parent);
        return previous;
    }

    public void restoreScope(Scope saved) {
        current = saved;
    }

    // -------------------------
    // Definitions
    // -------------------------

    public void define(String name, Value value) {
        declare(current, name, value, false, false, null);
    }

    public void defineConst(String name, Value value) {
        declare(current, name, value, true, false, null);
    }

    public void defineNullable(String name, Value value) {
        declare(current, name, value, false, true, null);
    }

    /** Typed definition in the current scope; the value is fitted to {@code type} first. */
    public void define(String name, Value value, boolean isConstant, boolean isNullable, DeclaredType type) {
        declare(current, name, value, isConstant, isNullable, type);
    }

    public void defineGlobal(String name, Value value) {
        declare(global, name, value, false, true, null);
    }

    private static void declare(Scope scope, String name, Value value, boolean isConstant, boolean isNullable,
                                DeclaredType type) {
        if (scope.has(name)) throw new RedefinitionError(name);
        if (value == null) value = Value.nil();
        if (value.isNull()) {
            if (isConstant) throw new AssignmentError("Cannot define constant with null value");
            if (!isNullable) throw new AssignmentError("Cannot assign null to non-nullable variable");
        }
        if (type != null) value = type.coerce(value);
        scope.put(name, new Scope.VarInfo(value, isConstant, isNullable, type));
    }

    // -------------------------
    // Lookup and assignment
    // -------------------------

    public Value get(String name) {
        Scope.VarInfo info = current.resolve(name);
        if (info == null) throw new UndefinedVariableError(name);
        return info.value;
    }

    public boolean isDefined(String name) {
        return current.resolve(name) != null;
    }

    /** Updates the nearest binding and returns the stored (possibly converted) value. */
    public Value assign(String name, Value value) {
        Scope.VarInfo info = current.resolve(name);
        if (info == null) throw new UndefinedVariableError(name);
        return write(info, value);
    }

    public Value getGlobal(String name) {
        Scope.VarInfo info = global.local(name);
        if (info == null) throw new UndefinedVariableError(name);
        return info.value;
    }

    public Value assignGlobal(String name, Value value) {
        Scope.VarInfo info = global.local(name);
        if (info == null) throw new UndefinedVariableError(name);
        return write(info, value);
    }

    private static Value write(Scope.VarInfo info, Value value) {
        if (info.isConstant) throw new AssignmentError("Cannot assign to constant");
        if (value == null) value = Value.nil();
        if (value.isNull() && !info.isNullable) {
            throw new AssignmentError("Cannot assign null to non-nullable variable");
        }
        if (info.declaredType != null) value = info.declaredType.coerce(value);
        info.value = value;
        return value;
    }

    /** Snapshot of the global bindings in definition order. */
    public Map<String, Value> globals() {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Scope.VarInfo> e : global.getBindings().entrySet()) {
            out.put(e.getKey(), e.getValue().value);
        }
        return out;
    }
}
