package com.zen.script.parser;

public final class SourceLocation {
    private final SourceCode source;
    private final int line;
    private final int column;

    public SourceLocation(SourceCode source, int line, int column) {
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public SourceCode getSource() { return source; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    /**
     * Renders {@code message} followed by this position, the source line and a caret under the column.
     */
    public String annotate(String message) {
        StringBuilder sb = new StringBuilder();
        sb.append(message).append(" at Line ").append(line).append(", Column ").append(column);
        if (source != null) {
            sb.append('\n').append(source.getLine(line)).append('\n');
            for (int i = 0; i < column; i++) sb.append(' ');
            sb.append('^');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Line " + line + ", Column " + column;
    }
}
