package com.zen.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.zen.debug.Debug;

public class Lexer {
    private static final String TAG = "Lexer";

    private static final Set<String> keywords;
    static {
        Set<String> set = new HashSet<>();
        Collections.addAll(set,
                "import", "package", "var", "const", "if", "else", "elif", "for", "in", "while",
                "when", "where", "break", "continue", "return", "func", "class", "interface",
                "implements", "extends", "new", "this", "super", "pub", "true", "false", "null",
                "and", "or", "not", "await", "async");
        keywords = Collections.unmodifiableSet(set);
    }

    private final SourceCode source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<SyntaxError> errors = new ArrayList<>();

    private int index = 0;
    private int line = 1;
    private int column = 0;

    // position of the first character of the token being scanned
    private int startLine;
    private int startColumn;

    public Lexer(SourceCode source) {
        this.source = source;
    }

    public static boolean isKeyword(String word) {
        return keywords.contains(word);
    }

    /**
     * Scans the whole source. Always returns the token list, terminated by exactly one EOF token;
     * check {@link #hasErrors()} for lexical problems.
     */
    public List<Token> scan() {
        int length = source.getLength();
        while (index <= length) {
            startLine = line;
            startColumn = column;
            if (index == length) {
                addToken(TokenType.EOF, "");
                index++;
                break;
            }
            scanToken();
        }
        Debug.get().d(TAG, source.getName() + ": " + tokens.size() + " tokens, " + errors.size() + " errors");
        return tokens;
    }

    public List<SyntaxError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                line++;
                column = 0;
                break;
            case '(': addToken(TokenType.LEFT_PAREN, "("); break;
            case ')': addToken(TokenType.RIGHT_PAREN, ")"); break;
            case '{': addToken(TokenType.LEFT_BRACE, "{"); break;
            case '}': addToken(TokenType.RIGHT_BRACE, "}"); break;
            case '[': addToken(TokenType.LEFT_BRACKET, "["); break;
            case ']': addToken(TokenType.RIGHT_BRACKET, "]"); break;
            case '.': addToken(TokenType.DOT, "."); break;
            case ',': addToken(TokenType.COMMA, ","); break;
            case ':': addToken(TokenType.COLON, ":"); break;
            case ';': addToken(TokenType.SEMICOLON, ";"); break;
            case '?': addToken(TokenType.QMARK, "?"); break;
            case '+':
                if (match('+')) addToken(TokenType.INCREMENT, "++");
                else if (match('=')) addToken(TokenType.PLUS_ASSIGN, "+=");
                else addToken(TokenType.PLUS, "+");
                break;
            case '-':
                if (match('-')) addToken(TokenType.DECREMENT, "--");
                else if (match('=')) addToken(TokenType.MINUS_ASSIGN, "-=");
                else addToken(TokenType.MINUS, "-");
                break;
            case '*':
                if (match('=')) addToken(TokenType.MULTIPLY_ASSIGN, "*=");
                else addToken(TokenType.MULTIPLY, "*");
                break;
            case '/':
                if (match('/')) {
                    while (index < source.getLength() && peek() != '\n') advance();
                } else if (match('=')) {
                    addToken(TokenType.DIVIDE_ASSIGN, "/=");
                } else {
                    addToken(TokenType.DIVIDE, "/");
                }
                break;
            case '=':
                if (match('=')) addToken(TokenType.EQUALS, "==");
                else addToken(TokenType.ASSIGN, "=");
                break;
            case '!':
                if (match('=')) addToken(TokenType.NOT_EQUALS, "!=");
                else error("Unexpected character '!'");
                break;
            case '<':
                if (match('=')) addToken(TokenType.LESS_EQUALS, "<=");
                else addToken(TokenType.LESS, "<");
                break;
            case '>':
                if (match('=')) addToken(TokenType.GREATER_EQUALS, ">=");
                else addToken(TokenType.GREATER, ">");
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number(c);
                else if (isAlpha(c)) identifier(c);
                else error("Unexpected character '" + c + "'");
        }
    }

    private void string() {
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (index >= source.getLength()) {
                error("Unterminated string literal");
                return;
            }
            char c = peek();
            if (c == '"') {
                advance();
                break;
            }
            if (c == '\n') {
                // the newline itself is left for scanToken so line counting stays right
                error("Unexpected newline in string literal");
                return;
            }
            advance();
            if (c == '\\') {
                if (index >= source.getLength()) {
                    error("Unterminated string literal");
                    return;
                }
                if (peek() == '\n') {
                    error("Unexpected newline in string literal");
                    return;
                }
                char esc = advance();
                switch (esc) {
                    case '"': sb.append('"'); break;
                    case '\\': sb.append('\\'); break;
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    default:
                        errorAt("Invalid escape sequence: \\" + esc, line, column - 2);
                }
            } else {
                sb.append(c);
            }
        }
        addToken(TokenType.STRING, sb.toString());
    }

    private void number(char first) {
        StringBuilder sb = new StringBuilder().append(first);
        boolean seenDot = false;
        while (true) {
            char c = peek();
            if (isDigit(c)) {
                sb.append(advance());
            } else if (c == '.' && !seenDot) {
                seenDot = true;
                sb.append(advance());
            } else {
                break;
            }
        }
        addToken(seenDot ? TokenType.FLOAT : TokenType.INT, sb.toString());
    }

    private void identifier(char first) {
        StringBuilder sb = new StringBuilder().append(first);
        while (isAlphaNumeric(peek())) sb.append(advance());
        String text = sb.toString();
        addToken(keywords.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER, text);
    }

    private char advance() {
        char c = source.getChar(index++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (index >= source.getLength() || source.getChar(index) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        return source.getChar(index);
    }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(char c) { return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'); }
    private static boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c) || c == '_'; }

    private void addToken(TokenType type, String literal) {
        tokens.add(new Token(type, literal, source.getLocation(startLine, startColumn)));
    }

    private void error(String message) {
        errorAt(message, startLine, startColumn);
    }

    private void errorAt(String message, int atLine, int atColumn) {
        errors.add(new SyntaxError(message, source.getLocation(atLine, atColumn)));
    }
}
