package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Arrays;

/**
 * {@code tweakVerify(P, k, Q)} asserts {@code Q == P + k * G}.
 */
public final class TweakVerify extends Expression {

    public final Expression pointP;
    public final Expression tweak;
    public final Expression pointQ;

    public TweakVerify(Expression pointP, Expression tweak, Expression pointQ) {
        this.pointP = pointP;
        this.tweak = tweak;
        this.pointQ = pointQ;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitTweakVerify(this);
    }

    // Stack order expected by OP_TWEAKVERIFY
    @Override
    public List<Expression> getOperands() {
        return Arrays.asList(pointQ, tweak, pointP);
    }

    @Override
    public String toString() {
        return "tweakVerify(" + pointP + ", " + tweak + ", " + pointQ + ")";
    }
}
