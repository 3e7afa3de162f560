package com.zen.script.parser;

import java.util.Arrays;
import java.util.List;

public abstract class AbstractSourceCode implements SourceCode {
    private final String text;
    private List<String> lines; // split lazily on first getLine

    protected AbstractSourceCode(String text) {
        if (text == null) throw new IllegalArgumentException("source text is null");
        this.text = text;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public int getLength() {
        return text.length();
    }

    @Override
    public char getChar(int index) {
        if (index < 0 || index >= text.length()) return '\0';
        return text.charAt(index);
    }

    @Override
    public String getLine(int lineNumber) {
        if (lines == null) {
            lines = Arrays.asList(text.split("\r?\n", -1));
        }
        if (lineNumber < 1 || lineNumber > lines.size()) return "";
        return lines.get(lineNumber - 1);
    }

    @Override
    public SourceLocation getLocation(int line, int column) {
        return new SourceLocation(this, line, column);
    }

    @Override
    public String toString() {
        return getName();
    }
}
