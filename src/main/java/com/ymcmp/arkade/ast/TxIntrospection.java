package com.ymcmp.arkade.ast;

public final class TxIntrospection extends Expression {

    public final String property;

    public TxIntrospection(String property) {
        this.property = property;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitTxIntrospection(this);
    }

    @Override
    public String toString() {
        return "tx." + property;
    }
}
