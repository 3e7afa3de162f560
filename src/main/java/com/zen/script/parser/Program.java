package com.zen.script.parser;

import java.util.Collections;
import java.util.List;

import com.zen.script.parser.Statement.Stmt;

/** Root of a parsed compilation unit. */
public final class Program {
    private final SourceCode source;
    private final List<Stmt> statements;

    public Program(SourceCode source, List<Stmt> statements) {
        this.source = source;
        this.statements = Collections.unmodifiableList(statements);
    }

    public SourceCode getSource() { return source; }

    public List<Stmt> getStatements() { return statements; }

    public SourceLocation getLocation() {
        if (!statements.isEmpty()) return statements.get(0).getLocation();
        return source == null ? null : source.getLocation(1, 0);
    }

    @Override
    public String toString() {
        return new AstPrinter().print(this);
    }
}
