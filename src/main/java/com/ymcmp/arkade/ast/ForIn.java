package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

public final class ForIn extends Statement {

    public final String indexVar;
    public final String valueVar;
    public final Expression iterable;
    public final List<Statement> body;

    public ForIn(String indexVar, String valueVar, Expression iterable, List<Statement> body) {
        this.indexVar = indexVar;
        this.valueVar = valueVar;
        this.iterable = iterable;
        this.body = Collections.unmodifiableList(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForIn(this);
    }

    @Override
    public String toString() {
        return "for (" + indexVar + ", " + valueVar + ") in " + iterable + " " + body;
    }
}
