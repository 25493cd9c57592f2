package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

/**
 * {@code tx.inputs[i].assets.lookup(id)}: the amount of asset {@code id} held
 * by one input or output, as an 8-byte little-endian integer.
 */
public final class AssetLookup extends Expression {

    public final IoSource source;
    public final Expression index;
    public final String assetId;

    public AssetLookup(IoSource source, Expression index, String assetId) {
        this.source = source;
        this.index = index;
        this.assetId = assetId;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAssetLookup(this);
    }

    @Override
    public List<Expression> getOperands() {
        return Collections.singletonList(index);
    }

    @Override
    public String toString() {
        return "tx." + source.path + "[" + index + "].assets.lookup(" + assetId + ")";
    }
}
