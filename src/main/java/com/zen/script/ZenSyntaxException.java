package com.zen.script;

import java.util.Collections;
import java.util.List;

import com.zen.script.parser.SyntaxError;

/** Thrown by {@link ZenScript} when lexing or parsing reported errors. Carries all of them. */
public class ZenSyntaxException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final List<SyntaxError> errors;

    public ZenSyntaxException(List<SyntaxError> errors) {
        super(render(errors));
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<SyntaxError> getErrors() {
        return errors;
    }

    private static String render(List<SyntaxError> errors) {
        StringBuilder sb = new StringBuilder("Syntax Error(s):");
        for (SyntaxError e : errors) sb.append('\n').append(e.format());
        return sb.toString();
    }
}
