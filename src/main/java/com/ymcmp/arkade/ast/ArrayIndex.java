package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Arrays;

public final class ArrayIndex extends Expression {

    public final Expression array;
    public final Expression index;

    public ArrayIndex(Expression array, Expression index) {
        this.array = array;
        this.index = index;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitArrayIndex(this);
    }

    @Override
    public List<Expression> getOperands() {
        return Arrays.asList(array, index);
    }

    @Override
    public String toString() {
        return array + "[" + index + "]";
    }
}
