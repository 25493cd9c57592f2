package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

public final class InputIntrospection extends Expression {

    public final Expression index;
    public final String property;

    public InputIntrospection(Expression index, String property) {
        this.index = index;
        this.property = property;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitInputIntrospection(this);
    }

    @Override
    public List<Expression> getOperands() {
        return Collections.singletonList(index);
    }

    @Override
    public String toString() {
        return "tx.inputs[" + index + "]." + property;
    }
}
