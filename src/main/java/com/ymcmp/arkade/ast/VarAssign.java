package com.ymcmp.arkade.ast;

public final class VarAssign extends Statement {

    public final String name;
    public final Expression value;

    public VarAssign(String name, Expression value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVarAssign(this);
    }

    @Override
    public String toString() {
        return name + " = " + value + ";";
    }
}
