package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Arrays;

/**
 * {@code ecMulScalarVerify(k, P, Q)} asserts {@code Q == k * P}.
 */
public final class EcMulScalarVerify extends Expression {

    public final Expression scalar;
    public final Expression pointP;
    public final Expression pointQ;

    public EcMulScalarVerify(Expression scalar, Expression pointP, Expression pointQ) {
        this.scalar = scalar;
        this.pointP = pointP;
        this.pointQ = pointQ;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitEcMulScalarVerify(this);
    }

    // Stack order expected by OP_ECMULSCALARVERIFY
    @Override
    public List<Expression> getOperands() {
        return Arrays.asList(pointQ, pointP, scalar);
    }

    @Override
    public String toString() {
        return "ecMulScalarVerify(" + scalar + ", " + pointP + ", " + pointQ + ")";
    }
}
