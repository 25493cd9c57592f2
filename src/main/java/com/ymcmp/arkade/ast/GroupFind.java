package com.ymcmp.arkade.ast;

public final class GroupFind extends Expression {

    public final String assetId;

    public GroupFind(String assetId) {
        this.assetId = assetId;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitGroupFind(this);
    }

    @Override
    public String toString() {
        return "tx.assetGroups.find(" + assetId + ")";
    }
}
