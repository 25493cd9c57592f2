package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

public final class IfElse extends Statement {

    public final Expression condition;
    public final List<Statement> thenBody;

    // null when there is no else branch
    public final List<Statement> elseBody;

    public IfElse(Expression condition, List<Statement> thenBody, List<Statement> elseBody) {
        this.condition = condition;
        this.thenBody = Collections.unmodifiableList(thenBody);
        this.elseBody = elseBody == null ? null : Collections.unmodifiableList(elseBody);
    }

    public boolean hasElse() {
        return elseBody != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIfElse(this);
    }

    @Override
    public String toString() {
        return "if (" + condition + ") " + thenBody + (elseBody == null ? "" : " else " + elseBody);
    }
}
