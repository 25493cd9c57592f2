package com.ymcmp.arkade.ast;

public final class LetBinding extends Statement {

    public final String name;
    public final Expression value;

    public LetBinding(String name, Expression value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLetBinding(this);
    }

    @Override
    public String toString() {
        return "let " + name + " = " + value + ";";
    }
}
