package com.zen.script.parser;

public final class Token {
    public final TokenType type;
    /** Source text of the token; for strings the unescaped contents. */
    public final String literal;
    public final SourceLocation location;

    public Token(TokenType type, String literal, SourceLocation location) {
        this.type = type;
        this.literal = literal;
        this.location = location;
    }

    public boolean isKeyword(String word) {
        return type == TokenType.KEYWORD && literal.equals(word);
    }

    /** Synthetic token at the same position, used when the parser desugars operators. */
    Token derive(TokenType newType, String newLiteral) {
        return new Token(newType, newLiteral, location);
    }

    @Override
    public String toString() {
        return type.getDisplayName() + "(" + literal + ")";
    }
}
