package com.zen.script.parser;

/** Source text typed at the REPL or passed as a string. */
public final class InlineSourceCode extends AbstractSourceCode {

    public InlineSourceCode(String text) {
        super(text);
    }

    @Override
    public String getName() {
        return "<inline>";
    }
}
