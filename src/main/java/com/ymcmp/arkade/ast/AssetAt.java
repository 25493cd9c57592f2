package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Arrays;

public final class AssetAt extends Expression {

    public static final String ASSET_ID = "assetId";
    public static final String AMOUNT = "amount";

    public final IoSource source;
    public final Expression ioIndex;
    public final Expression assetIndex;
    public final String property;

    public AssetAt(IoSource source, Expression ioIndex, Expression assetIndex, String property) {
        this.source = source;
        this.ioIndex = ioIndex;
        this.assetIndex = assetIndex;
        this.property = property;
    }

    public boolean isAmount() {
        return AMOUNT.equals(property);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAssetAt(this);
    }

    @Override
    public List<Expression> getOperands() {
        return Arrays.asList(ioIndex, assetIndex);
    }

    @Override
    public String toString() {
        return "tx." + source.path + "[" + ioIndex + "].assets[" + assetIndex + "]." + property;
    }
}
