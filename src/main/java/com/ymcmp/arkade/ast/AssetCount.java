package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

public final class AssetCount extends Expression {

    public final IoSource source;
    public final Expression index;

    public AssetCount(IoSource source, Expression index) {
        this.source = source;
        this.index = index;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAssetCount(this);
    }

    @Override
    public List<Expression> getOperands() {
        return Collections.singletonList(index);
    }

    @Override
    public String toString() {
        return "tx." + source.path + "[" + index + "].assets.length";
    }
}
