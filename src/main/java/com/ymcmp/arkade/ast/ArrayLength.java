package com.ymcmp.arkade.ast;

public final class ArrayLength extends Expression {

    public final String arrayName;

    public ArrayLength(String arrayName) {
        this.arrayName = arrayName;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitArrayLength(this);
    }

    @Override
    public String toString() {
        return arrayName + ".length";
    }
}
