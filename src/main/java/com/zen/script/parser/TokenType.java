package com.zen.script.parser;

public enum TokenType {
    EOF("EOF"),

    IDENTIFIER("Identifier"),
    KEYWORD("Keyword"),
    INT("Int"),
    FLOAT("Float"),
    STRING("String"),

    DOT("Dot"),
    COMMA("Comma"),
    COLON("Colon"),
    SEMICOLON("Semicolon"),
    QMARK("QuestionMark"),
    LEFT_PAREN("LeftParen"),
    RIGHT_PAREN("RightParen"),
    LEFT_BRACE("LeftBrace"),
    RIGHT_BRACE("RightBrace"),
    LEFT_BRACKET("LeftBracket"),
    RIGHT_BRACKET("RightBracket"),

    LESS("Less"),
    GREATER("Greater"),
    PLUS("Plus"),
    MINUS("Minus"),
    MULTIPLY("Multiply"),
    DIVIDE("Divide"),
    EQUALS("Equals"),
    NOT_EQUALS("NotEquals"),
    GREATER_EQUALS("GreaterEquals"),
    LESS_EQUALS("LessEquals"),
    INCREMENT("Increment"),
    DECREMENT("Decrement"),

    ASSIGN("Assign"),
    PLUS_ASSIGN("PlusAssign"),
    MINUS_ASSIGN("MinusAssign"),
    MULTIPLY_ASSIGN("MultiplyAssign"),
    DIVIDE_ASSIGN("DivideAssign");

    private final String displayName;

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
