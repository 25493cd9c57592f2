package com.ymcmp.arkade.ast;

public final class Variable extends Expression {

    public final String name;

    public Variable(String name) {
        this.name = name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Variable && ((Variable) obj).name.equals(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
