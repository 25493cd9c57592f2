package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

public final class GroupNumIO extends Expression {

    public final Expression index;
    public final IoSource source;

    public GroupNumIO(Expression index, IoSource source) {
        this.index = index;
        this.source = source;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitGroupNumIO(this);
    }

    @Override
    public List<Expression> getOperands() {
        return Collections.singletonList(index);
    }

    @Override
    public String toString() {
        return "tx.assetGroups[" + index + "].num" + source.suffix;
    }
}
