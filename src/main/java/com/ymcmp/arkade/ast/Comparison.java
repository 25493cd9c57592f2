package com.ymcmp.arkade.ast;

public final class Comparison extends Requirement {

    public final Expression left;
    public final BinaryOperator op;
    public final Expression right;

    public Comparison(Expression left, BinaryOperator op, Expression right) {
        if (!op.isComparison()) {
            throw new IllegalArgumentException("Not a comparison operator: " + op);
        }
        this.left = left;
        this.op = op;
        this.right = right;
    }

    /**
     * A bare {@code require(expr)} is stored as {@code expr == true}.
     */
    public static Comparison standalone(final Expression expr) {
        return new Comparison(expr, BinaryOperator.EQ, Literal.TRUE);
    }

    public boolean isStandalone() {
        return op == BinaryOperator.EQ && Literal.TRUE.equals(right);
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return left + " " + op + " " + right;
    }
}
