package com.ymcmp.arkade.ast;

public final class AssetGroupsLength extends Expression {

    public static final AssetGroupsLength INSTANCE = new AssetGroupsLength();

    private AssetGroupsLength() {
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAssetGroupsLength(this);
    }

    @Override
    public String toString() {
        return "tx.assetGroups.length";
    }
}
