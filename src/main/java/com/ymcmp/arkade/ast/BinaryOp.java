package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Arrays;

public final class BinaryOp extends Expression {

    public final Expression left;
    public final BinaryOperator op;
    public final Expression right;

    public BinaryOp(Expression left, BinaryOperator op, Expression right) {
        this.left = left;
        this.op = op;
        this.right = right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public List<Expression> getOperands() {
        return Arrays.asList(left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + op + " " + right + ")";
    }
}
