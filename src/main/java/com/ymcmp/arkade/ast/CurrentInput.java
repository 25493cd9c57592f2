package com.ymcmp.arkade.ast;

public final class CurrentInput extends Expression {

    // null means the whole input, which resolves to its scriptPubKey
    public final String property;

    public CurrentInput(String property) {
        this.property = property;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCurrentInput(this);
    }

    @Override
    public String toString() {
        return "tx.input.current" + (property == null ? "" : "." + property);
    }
}
