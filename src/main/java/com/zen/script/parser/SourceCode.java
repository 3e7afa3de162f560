package com.zen.script.parser;

/**
 * Read-only view of one compilation unit's text.
 *
 * Lines are 1-based, columns 0-based.
 */
public interface SourceCode {

    String getText();

    int getLength();

    char getChar(int index);

    /** Text of the given 1-based line without its terminator, or "" when out of range. */
    String getLine(int lineNumber);

    SourceLocation getLocation(int line, int column);

    /** Display name used in diagnostics: the file path, or "&lt;inline&gt;". */
    String getName();
}
