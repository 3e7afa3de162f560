package com.zen.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import com.zen.debug.Debug;
import com.zen.script.parser.Expr.ArrayAccess;
import com.zen.script.parser.Expr.ArrayLiteral;
import com.zen.script.parser.Expr.Await;
import com.zen.script.parser.Expr.BasicType;
import com.zen.script.parser.Expr.Binary;
import com.zen.script.parser.Expr.Call;
import com.zen.script.parser.Expr.ExprInterface;
import com.zen.script.parser.Expr.Identifier;
import com.zen.script.parser.Expr.Literal;
import com.zen.script.parser.Expr.MapAccess;
import com.zen.script.parser.Expr.MapLiteral;
import com.zen.script.parser.Expr.Member;
import com.zen.script.parser.Expr.Parameter;
import com.zen.script.parser.Expr.ParametricType;
import com.zen.script.parser.Expr.TypeExpr;
import com.zen.script.parser.Expr.TypeParameter;
import com.zen.script.parser.Expr.Unary;
import com.zen.script.parser.Statement.Branch;
import com.zen.script.parser.Statement.BreakStmt;
import com.zen.script.parser.Statement.ContinueStmt;
import com.zen.script.parser.Statement.ExprStmt;
import com.zen.script.parser.Statement.For;
import com.zen.script.parser.Statement.ForIn;
import com.zen.script.parser.Statement.FunctionStmt;
import com.zen.script.parser.Statement.If;
import com.zen.script.parser.Statement.ReturnStmt;
import com.zen.script.parser.Statement.Stmt;
import com.zen.script.parser.Statement.VarStmt;
import com.zen.script.parser.Statement.While;

/**
 * Recursive-descent parser producing a {@link Program} from lexer tokens.
 *
 * Every rule returns {@code null} after recording a {@link SyntaxError}; callers pass the
 * {@code null} upward. At the top level the parser then either stops (fail-fast) or skips to
 * the next statement keyword and keeps going, so one pass reports every independent problem.
 */
public class Parser {
    private static final String TAG = "Parser";

    private static final Set<String> SYNC_KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "var", "const", "func", "class", "if", "for", "while", "return", "when")));

    private final List<Token> tokens;
    private final SourceCode source;
    private final boolean stopAtFirstError;
    private final List<SyntaxError> errors = new ArrayList<>();

    private int current = 0;
    private int loopDepth = 0;
    private int functionDepth = 0;
    // false while parsing a condition that is directly followed by a statement block
    private boolean allowMaps = true;
    // true during the first, map-enabled attempt at such a condition
    private boolean speculative = false;

    public Parser(List<Token> tokens) {
        this(tokens, false);
    }

    public Parser(List<Token> tokens, boolean stopAtFirstError) {
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || copy.get(copy.size() - 1).type != TokenType.EOF) {
            SourceLocation loc = copy.isEmpty() ? null : copy.get(copy.size() - 1).location;
            copy.add(new Token(TokenType.EOF, "", loc));
        }
        this.tokens = copy;
        SourceLocation first = copy.get(0).location;
        this.source = first == null ? null : first.getSource();
        this.stopAtFirstError = stopAtFirstError;
    }

    public Program parse() {
        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.SEMICOLON)) continue;

            int start = current;
            Stmt stmt = declaration();
            if (stmt != null) {
                statements.add(stmt);
                continue;
            }
            if (stopAtFirstError) break;
            synchronize(start);
        }
        return new Program(source, statements);
    }

    public List<SyntaxError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt declaration() {
        Token t = peek();
        if (t.type == TokenType.KEYWORD) {
            switch (t.literal) {
                case "var":
                case "const":
                    return varDeclaration(advance());
                case "async":
                    advance();
                    if (!matchKeyword("func")) return error(peek(), "Expected 'func' after 'async'");
                    return functionDeclaration(true);
                case "func":
                    advance();
                    return functionDeclaration(false);
                case "if":
                    return ifStatement(advance());
                case "while":
                    return whileStatement(advance());
                case "for":
                    return forStatement(advance());
                case "break":
                    advance();
                    if (loopDepth == 0) return error(previous(), "'break' used outside of a loop");
                    return new BreakStmt(previous());
                case "continue":
                    advance();
                    if (loopDepth == 0) return error(previous(), "'continue' used outside of a loop");
                    return new ContinueStmt(previous());
                case "return":
                    return returnStatement(advance());
                default:
                    break;
            }
        }
        return expressionStatement();
    }

    private Stmt varDeclaration(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        if (name == null) return null;

        TypeExpr type = null;
        if (match(TokenType.COLON)) {
            type = typeAnnotation();
            if (type == null) return null;
        }
        boolean nullable = match(TokenType.QMARK);

        ExprInterface initializer = null;
        if (match(TokenType.ASSIGN)) {
            initializer = expression();
            if (initializer == null) return null;
        }

        if (keyword.isKeyword("const") && initializer == null) {
            return error(name, "Constant '" + name.literal + "' must be initialized. Did you mean 'var "
                    + name.literal + "' ?");
        }
        return new VarStmt(keyword, name, type, nullable, initializer);
    }

    private Stmt functionDeclaration(boolean isAsync) {
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");
        if (name == null) return null;
        if (consume(TokenType.LEFT_PAREN, "Expected '(' after function name") == null) return null;

        List<Parameter> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            while (true) {
                Token pname = consume(TokenType.IDENTIFIER, "Expected parameter name");
                if (pname == null) return null;
                if (!seen.add(pname.literal)) return error(pname, "Duplicate parameter name '" + pname.literal + "'");
                if (consume(TokenType.COLON, "Expected ':' after parameter name") == null) return null;
                TypeExpr type = typeAnnotation();
                if (type == null) return null;
                boolean nullable = match(TokenType.QMARK);

                ExprInterface defaultValue = null;
                if (match(TokenType.ASSIGN)) {
                    defaultValue = expression();
                    if (defaultValue == null) return null;
                }
                params.add(new Parameter(pname, type, nullable, defaultValue));

                if (match(TokenType.COMMA)) continue;
                if (check(TokenType.RIGHT_PAREN)) break;
                return error(peek(), "Expected ',' or ')' after function parameter");
            }
        }
        if (consume(TokenType.RIGHT_PAREN, "Expected ')' after function parameters") == null) return null;

        TypeExpr returnType;
        if (match(TokenType.COLON)) {
            returnType = typeAnnotation();
            if (returnType == null) return null;
        } else {
            returnType = new BasicType(name.derive(TokenType.IDENTIFIER, "void"));
        }

        if (consume(TokenType.LEFT_BRACE, "Expected '{' after function declaration") == null) return null;

        List<Stmt> body;
        int savedLoopDepth = loopDepth;
        loopDepth = 0;
        functionDepth++;
        try {
            body = block("Expected '}' after function body");
        } finally {
            functionDepth--;
            loopDepth = savedLoopDepth;
        }
        if (body == null) return null;
        return new FunctionStmt(name, params, returnType, body, isAsync);
    }

    private Stmt ifStatement(Token keyword) {
        Branch first = branch(keyword);
        if (first == null) return null;

        List<Branch> elifs = new ArrayList<>();
        List<Stmt> elseBody = null;
        while (checkKeyword("elif")) {
            Branch b = branch(advance());
            if (b == null) return null;
            elifs.add(b);
        }
        if (matchKeyword("else")) {
            if (checkKeyword("if")) {
                Stmt nested = ifStatement(advance());
                if (nested == null) return null;
                elseBody = new ArrayList<>();
                elseBody.add(nested);
            } else {
                if (consume(TokenType.LEFT_BRACE, "Expected '{' after 'else'") == null) return null;
                elseBody = block("Expected '}' after else body");
                if (elseBody == null) return null;
            }
        }
        return new If(first, elifs, elseBody);
    }

    /** {@code cond { body }} after an {@code if} or {@code elif} keyword. */
    private Branch branch(Token keyword) {
        String word = keyword.literal;
        if (check(TokenType.LEFT_BRACE) || isAtEnd()) {
            return error(peek(), "Expected condition after '" + word + "'");
        }
        ExprInterface condition = clauseBefore(TokenType.LEFT_BRACE);
        if (condition == null) return null;
        if (consume(TokenType.LEFT_BRACE, "Expected '{' after '" + word + "' condition") == null) return null;
        List<Stmt> body = block("Expected '}' after " + word + " body");
        if (body == null) return null;
        return new Branch(keyword, condition, body);
    }

    private Stmt whileStatement(Token keyword) {
        if (check(TokenType.LEFT_BRACE) || isAtEnd()) {
            return error(peek(), "Expected condition after 'while'");
        }
        ExprInterface condition = clauseBefore(TokenType.LEFT_BRACE);
        if (condition == null) return null;
        if (consume(TokenType.LEFT_BRACE, "Expected '{' before while loop body") == null) return null;
        List<Stmt> body = loopBody("Expected '}' after while loop body");
        if (body == null) return null;
        return new While(keyword, condition, body);
    }

    private Stmt forStatement(Token keyword) {
        if (check(TokenType.IDENTIFIER) && (checkNext(TokenType.COMMA) || checkNextKeyword("in"))) {
            return forInStatement(keyword);
        }

        Stmt initializer = null;
        if (!check(TokenType.SEMICOLON)) {
            if (checkKeyword("var") || checkKeyword("const")) {
                initializer = varDeclaration(advance());
            } else {
                initializer = expressionStatement();
            }
            if (initializer == null) return null;
        }
        if (consume(TokenType.SEMICOLON, "Expected ';' after for loop initialization") == null) return null;

        ExprInterface condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = clauseBefore(TokenType.SEMICOLON);
            if (condition == null) return null;
        }
        if (consume(TokenType.SEMICOLON, "Expected ';' after for loop condition") == null) return null;

        ExprInterface update = null;
        if (!check(TokenType.LEFT_BRACE)) {
            update = clauseBefore(TokenType.LEFT_BRACE);
            if (update == null) return null;
        }
        if (consume(TokenType.LEFT_BRACE, "Expected '{' before for loop body") == null) return null;

        List<Stmt> body = loopBody("Expected '}' after for loop body");
        if (body == null) return null;
        return new For(keyword, initializer, condition, update, body);
    }

    private Stmt forInStatement(Token keyword) {
        Token first = advance();
        Token key = null;
        Token value = first;
        if (match(TokenType.COMMA)) {
            key = first;
            value = consume(TokenType.IDENTIFIER, "Expected variable name after ','");
            if (value == null) return null;
        }
        if (!matchKeyword("in")) return error(peek(), "Expected 'in' after for loop variables");
        if (check(TokenType.LEFT_BRACE) || isAtEnd()) {
            return error(peek(), "Expected expression after 'in'");
        }

        ExprInterface container = clauseBefore(TokenType.LEFT_BRACE);
        if (container == null) return null;
        if (consume(TokenType.LEFT_BRACE, "Expected '{' before for loop body") == null) return null;

        List<Stmt> body = loopBody("Expected '}' after for loop body");
        if (body == null) return null;
        return new ForIn(keyword, key, value, container, body);
    }

    private Stmt returnStatement(Token keyword) {
        if (functionDepth == 0) return error(keyword, "'return' used outside of a function");

        ExprInterface value = null;
        boolean hasValue = !check(TokenType.RIGHT_BRACE)
                && !check(TokenType.SEMICOLON)
                && !isAtEnd()
                && peek().location.getLine() == keyword.location.getLine();
        if (hasValue) {
            value = expression();
            if (value == null) return null;
        }
        return new ReturnStmt(keyword, value);
    }

    private Stmt expressionStatement() {
        ExprInterface expr = expression();
        if (expr == null) return null;
        return new ExprStmt(expr);
    }

    /** Statements up to and including the closing brace; the opening brace is already consumed. */
    private List<Stmt> block(String closeMessage) {
        List<Stmt> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            if (match(TokenType.SEMICOLON)) continue;
            Stmt stmt = declaration();
            if (stmt == null) return null;
            statements.add(stmt);
        }
        if (consume(TokenType.RIGHT_BRACE, closeMessage) == null) return null;
        return statements;
    }

    private List<Stmt> loopBody(String closeMessage) {
        loopDepth++;
        try {
            return block(closeMessage);
        } finally {
            loopDepth--;
        }
    }

    // -------------------------
    // Types
    // -------------------------

    private TypeExpr typeAnnotation() {
        if (!check(TokenType.IDENTIFIER) && !check(TokenType.KEYWORD)) {
            return error(peek(), "Expected type name");
        }
        Token name = advance();
        if (!match(TokenType.LESS)) return new BasicType(name);

        if (check(TokenType.GREATER)) return error(peek(), "Expected at least one type parameter");

        List<TypeParameter> params = new ArrayList<>();
        while (true) {
            if (check(TokenType.INT)) {
                Token size = advance();
                Long n = parseLong(size);
                if (n == null) return null;
                params.add(TypeParameter.ofSize(n));
            } else if (check(TokenType.IDENTIFIER) || check(TokenType.KEYWORD)) {
                TypeExpr nested = typeAnnotation();
                if (nested == null) return null;
                params.add(TypeParameter.ofType(nested));
            } else {
                return error(peek(), "Expected type name or integer");
            }

            if (match(TokenType.COMMA)) {
                if (check(TokenType.GREATER)) return error(peek(), "Unexpected trailing comma");
                continue;
            }
            break;
        }
        if (consume(TokenType.GREATER, "Expected '>' after type parameters") == null) return null;
        return new ParametricType(name, params);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() {
        return assignment();
    }

    private ExprInterface assignment() {
        ExprInterface expr = or();
        if (expr == null) return null;

        if (match(TokenType.ASSIGN)) {
            Token op = previous();
            if (!isAssignable(expr)) return error(op, "Invalid assignment target");
            if (atExpressionEnd()) return error(peek(), "Expected expression after operator");
            ExprInterface value = assignment();
            if (value == null) return null;
            return new Binary(expr, op, value);
        }

        if (match(TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.MULTIPLY_ASSIGN, TokenType.DIVIDE_ASSIGN)) {
            Token op = previous();
            if (!isAssignable(expr)) return error(op, "Invalid assignment target");
            if (atExpressionEnd()) return error(peek(), "Expected expression after operator");
            ExprInterface value = assignment();
            if (value == null) return null;

            Token arith;
            switch (op.type) {
                case PLUS_ASSIGN: arith = op.derive(TokenType.PLUS, "+"); break;
                case MINUS_ASSIGN: arith = op.derive(TokenType.MINUS, "-"); break;
                case MULTIPLY_ASSIGN: arith = op.derive(TokenType.MULTIPLY, "*"); break;
                default: arith = op.derive(TokenType.DIVIDE, "/"); break;
            }
            return new Binary(expr, op.derive(TokenType.ASSIGN, "="), new Binary(expr, arith, value));
        }
        return expr;
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        if (expr == null) return null;
        while (matchKeyword("or")) {
            Token op = previous();
            if (atExpressionEnd()) return error(peek(), "Expected expression after operator");
            ExprInterface right = and();
            if (right == null) return null;
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = equality();
        if (expr == null) return null;
        while (matchKeyword("and")) {
            Token op = previous();
            if (atExpressionEnd()) return error(peek(), "Expected expression after operator");
            ExprInterface right = equality();
            if (right == null) return null;
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface equality() {
        ExprInterface expr = relational();
        if (expr == null) return null;
        while (match(TokenType.EQUALS, TokenType.NOT_EQUALS)) {
            Token op = previous();
            if (atExpressionEnd()) return error(peek(), "Expected expression after operator");
            ExprInterface right = relational();
            if (right == null) return null;
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface relational() {
        ExprInterface expr = additive();
        if (expr == null) return null;
        while (match(TokenType.LESS, TokenType.LESS_EQUALS, TokenType.GREATER, TokenType.GREATER_EQUALS)) {
            Token op = previous();
            if (atExpressionEnd()) return error(peek(), "Expected expression after operator");
            ExprInterface right = additive();
            if (right == null) return null;
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        if (expr == null) return null;
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            if (atExpressionEnd()) return error(peek(), "Expected expression after operator");
            ExprInterface right = multiplicative();
            if (right == null) return null;
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        if (expr == null) return null;
        while (match(TokenType.MULTIPLY, TokenType.DIVIDE)) {
            Token op = previous();
            if (atExpressionEnd()) return error(peek(), "Expected expression after operator");
            ExprInterface right = unary();
            if (right == null) return null;
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.MINUS) || matchKeyword("not")) {
            Token op = previous();
            if (atExpressionEnd()) return error(peek(), "Expected expression after operator");
            ExprInterface right = unary();
            if (right == null) return null;
            return new Unary(op, right);
        }
        if (matchKeyword("await")) {
            Token keyword = previous();
            if (atExpressionEnd()) return error(peek(), "Expected expression after 'await'");
            ExprInterface inner = unary();
            if (inner == null) return null;
            return new Await(keyword, inner);
        }
        return postfix();
    }

    private ExprInterface postfix() {
        ExprInterface expr = call();
        if (expr == null) return null;

        if (match(TokenType.INCREMENT, TokenType.DECREMENT)) {
            Token op = previous();
            if (!isAssignable(expr)) return error(op, "Invalid assignment target");
            Token arith = op.type == TokenType.INCREMENT
                    ? op.derive(TokenType.PLUS, "+")
                    : op.derive(TokenType.MINUS, "-");
            ExprInterface step = new Binary(expr, arith, new Literal(1L, op.location));
            return new Binary(expr, op.derive(TokenType.ASSIGN, "="), step);
        }
        return expr;
    }

    private ExprInterface call() {
        ExprInterface expr = primary();
        if (expr == null) return null;

        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr, previous());
            } else if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expected property name after '.'");
                if (name == null) return null;
                expr = new Member(expr, name);
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                ExprInterface index = withMaps();
                if (index == null) return null;
                if (consume(TokenType.RIGHT_BRACKET, "Expected ']' after index") == null) return null;
                expr = new ArrayAccess(expr, index, bracket.location);
            } else if (allowMaps && check(TokenType.LEFT_BRACE)) {
                if (speculative) {
                    // inside a clause a '{' that does not close as {key} starts the block
                    Checkpoint checkpoint = mark();
                    ExprInterface access = mapAccess(expr);
                    if (access == null) {
                        reset(checkpoint);
                        break;
                    }
                    expr = access;
                } else {
                    expr = mapAccess(expr);
                }
            } else {
                break;
            }
            if (expr == null) return null;
        }
        return expr;
    }

    private ExprInterface mapAccess(ExprInterface map) {
        Token brace = advance();
        Token key = peek();
        if (key.type != TokenType.STRING && key.type != TokenType.IDENTIFIER) {
            return error(key, "Expected string or identifier for map key");
        }
        advance();
        if (consume(TokenType.RIGHT_BRACE, "Expected '}' after map key") == null) return null;
        return new MapAccess(map, key.literal, brace.location);
    }

    private ExprInterface finishCall(ExprInterface callee, Token paren) {
        List<ExprInterface> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                ExprInterface arg = withMaps();
                if (arg == null) return null;
                args.add(arg);
            } while (match(TokenType.COMMA));
        }
        if (consume(TokenType.RIGHT_PAREN, "Expected ')' after function arguments") == null) return null;
        return new Call(callee, paren, args);
    }

    private ExprInterface primary() {
        Token t = peek();
        switch (t.type) {
            case STRING:
                advance();
                return new Literal(t.literal, t.location);
            case INT: {
                advance();
                Long n = parseLong(t);
                if (n == null) return null;
                return new Literal(n, t.location);
            }
            case FLOAT:
                advance();
                return new Literal(Double.parseDouble(t.literal), t.location);
            case IDENTIFIER:
                advance();
                return new Identifier(t);
            case KEYWORD:
                if (t.isKeyword("true") || t.isKeyword("false")) {
                    advance();
                    return new Literal(Boolean.valueOf(t.literal), t.location);
                }
                if (t.isKeyword("null")) {
                    advance();
                    return new Literal(null, t.location);
                }
                break;
            case LEFT_PAREN: {
                advance();
                ExprInterface inner = withMaps();
                if (inner == null) return null;
                if (consume(TokenType.RIGHT_PAREN, "Expected closing parenthesis") == null) return null;
                return inner;
            }
            case LEFT_BRACKET:
                advance();
                return arrayLiteral(t);
            case LEFT_BRACE:
                if (allowMaps) {
                    advance();
                    return mapLiteral(t);
                }
                break;
            case MULTIPLY:
            case DIVIDE:
                return error(t, "Expected expression before operator");
            default:
                break;
        }
        return error(t, "Expected expression");
    }

    private ExprInterface arrayLiteral(Token bracket) {
        List<ExprInterface> elements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACKET) && !isAtEnd()) {
            ExprInterface element = withMaps();
            if (element == null) return null;
            elements.add(element);
            if (!match(TokenType.COMMA)) break;
        }
        if (consume(TokenType.RIGHT_BRACKET, "Expected ']' after array elements") == null) return null;
        return new ArrayLiteral(elements, bracket.location);
    }

    private ExprInterface mapLiteral(Token brace) {
        LinkedHashMap<String, ExprInterface> entries = new LinkedHashMap<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Token key = peek();
            if (key.type != TokenType.STRING && key.type != TokenType.IDENTIFIER) {
                return error(key, "Expected string or identifier for map key");
            }
            advance();
            if (entries.containsKey(key.literal)) return error(key, "Duplicate map key '" + key.literal + "'");
            if (consume(TokenType.COLON, "Expected ':' after map key") == null) return null;

            ExprInterface value = withMaps();
            if (value == null) return null;
            entries.put(key.literal, value);
            if (!match(TokenType.COMMA)) break;
        }
        if (consume(TokenType.RIGHT_BRACE, "Expected '}' after map entries") == null) return null;
        return new MapLiteral(entries, brace.location);
    }

    /** Parses a nested expression with map syntax re-enabled (inside parens, brackets, arguments). */
    private ExprInterface withMaps() {
        boolean saved = allowMaps;
        allowMaps = true;
        try {
            return expression();
        } finally {
            allowMaps = saved;
        }
    }

    /**
     * Parses the expression in front of a statement block or separator. A first attempt allows map
     * access and map literals; it is kept only if it recorded no error and stops right at
     * {@code follow}. Otherwise the cursor and error list roll back and the clause is parsed again
     * with map syntax off, so a bare '{' ends it.
     */
    private ExprInterface clauseBefore(TokenType follow) {
        Checkpoint checkpoint = mark();
        ExprInterface expr;
        boolean savedSpeculative = speculative;
        speculative = true;
        try {
            expr = expression();
        } finally {
            speculative = savedSpeculative;
        }
        if (expr != null && errors.size() == checkpoint.errorCount && check(follow)) {
            return expr;
        }

        Debug.get().t(TAG, "re-parsing clause at " + tokens.get(checkpoint.position).location + " without map syntax");
        reset(checkpoint);
        boolean saved = allowMaps;
        allowMaps = false;
        try {
            return expression();
        } finally {
            allowMaps = saved;
        }
    }

    // -------------------------
    // Checkpoints and recovery
    // -------------------------

    private static final class Checkpoint {
        final int position;
        final int errorCount;

        Checkpoint(int position, int errorCount) {
            this.position = position;
            this.errorCount = errorCount;
        }
    }

    private Checkpoint mark() {
        return new Checkpoint(current, errors.size());
    }

    private void reset(Checkpoint checkpoint) {
        current = checkpoint.position;
        while (errors.size() > checkpoint.errorCount) {
            errors.remove(errors.size() - 1);
        }
    }

    /** Skips to the next token that can start a statement. */
    private void synchronize(int statementStart) {
        int skipped = 0;
        if (current == statementStart && !isAtEnd()) {
            advance();
            skipped++;
        }
        while (!isAtEnd()) {
            Token t = peek();
            if (t.type == TokenType.KEYWORD && SYNC_KEYWORDS.contains(t.literal)) break;
            advance();
            skipped++;
        }
        Debug.get().d(TAG, "synchronized after " + skipped + " token(s), resuming at " + peek());
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private static boolean isAssignable(ExprInterface expr) {
        return expr instanceof Identifier
                || expr instanceof ArrayAccess
                || expr instanceof MapAccess
                || expr instanceof Member;
    }

    private boolean atExpressionEnd() {
        switch (peek().type) {
            case EOF:
            case RIGHT_PAREN:
            case RIGHT_BRACE:
            case RIGHT_BRACKET:
            case COMMA:
            case SEMICOLON:
                return true;
            default:
                return false;
        }
    }

    private Long parseLong(Token token) {
        try {
            return Long.parseLong(token.literal);
        } catch (NumberFormatException e) {
            return error(token, "Integer literal out of range: " + token.literal);
        }
    }

    private <T> T error(Token token, String message) {
        errors.add(new SyntaxError(message, token.location));
        return null;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        return error(peek(), message);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean matchKeyword(String word) {
        if (!checkKeyword(word)) return false;
        advance();
        return true;
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private boolean checkKeyword(String word) {
        return peek().isKeyword(word);
    }

    private boolean checkNext(TokenType type) {
        return current + 1 < tokens.size() && tokens.get(current + 1).type == type;
    }

    private boolean checkNextKeyword(String word) {
        return current + 1 < tokens.size() && tokens.get(current + 1).isKeyword(word);
    }

    private Token advance() {
        if (isAtEnd()) return peek();
        current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
