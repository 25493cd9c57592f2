package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

public final class OutputIntrospection extends Expression {

    public final Expression index;
    public final String property;

    public OutputIntrospection(Expression index, String property) {
        this.index = index;
        this.property = property;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOutputIntrospection(this);
    }

    @Override
    public List<Expression> getOperands() {
        return Collections.singletonList(index);
    }

    @Override
    public String toString() {
        return "tx.outputs[" + index + "]." + property;
    }
}
