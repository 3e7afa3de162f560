package com.zen.script.runtime;

import java.util.ArrayList;
import java.util.List;

import com.zen.script.parser.Expr.Parameter;
import com.zen.script.parser.Statement.FunctionStmt;

/** A script {@code func} bound to the scope it was declared in. */
public final class UserFunction implements Callable {
    private final FunctionStmt declaration;
    private final Scope closure;
    private final List<DeclaredType> paramTypes = new ArrayList<>();
    private final DeclaredType returnType;
    private final int requiredCount;

    UserFunction(FunctionStmt declaration, Scope closure) {
        this.declaration = declaration;
        this.closure = closure;
        int required = 0;
        for (Parameter p : declaration.params) {
            paramTypes.add(DeclaredType.named(p.type.getName()));
            if (p.defaultValue == null) required++;
        }
        this.requiredCount = required;
        this.returnType = DeclaredType.named(declaration.returnType.getName());
    }

    @Override
    public String getName() {
        return declaration.name.literal;
    }

    public FunctionStmt getDeclaration() {
        return declaration;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        List<Parameter> params = declaration.params;
        if (args.size() < requiredCount || args.size() > params.size()) {
            throw new RuntimeError(getName() + "() expects " + arity() + " arguments, got " + args.size());
        }

        interpreter.enterCall(getName());
        Environment env = interpreter.getEnvironment();
        // call frame is a child of the declaring scope, not of the caller's
        Scope previous = env.enterScope(closure);
        try {
            for (int i = 0; i < params.size(); i++) {
                Parameter p = params.get(i);
                Value v = i < args.size() ? args.get(i) : interpreter.evaluateExpression(p.defaultValue);
                try {
                    env.define(p.getName(), v, false, p.nullable, paramTypes.get(i));
                } catch (EnvironmentError | TypeError e) {
                    throw new RuntimeError("Invalid argument '" + p.getName() + "' for " + getName() + "(): "
                            + e.getMessage(), p.getLocation(), e);
                }
            }

            Value result = interpreter.executeFunctionBody(declaration.body);
            if (result.type == Value.Type.VOID) return result;
            try {
                return returnType.coerce(result);
            } catch (TypeError e) {
                throw new RuntimeError("Invalid return value from " + getName() + "(): " + e.getMessage(),
                        declaration.getLocation(), e);
            }
        } finally {
            env.restoreScope(previous);
            interpreter.exitCall();
        }
    }

    private String arity() {
        int max = declaration.params.size();
        return requiredCount == max ? String.valueOf(max) : requiredCount + " to " + max;
    }

    @Override
    public String describe() {
        return (declaration.isAsync ? "<async func " : "<func ") + getName() + ">";
    }
}
