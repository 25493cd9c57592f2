package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Arrays;

public final class GroupIOAccess extends Expression {

    public final Expression groupIndex;
    public final Expression ioIndex;
    public final IoSource source;

    // null selects the whole entry
    public final String property;

    public GroupIOAccess(Expression groupIndex, Expression ioIndex, IoSource source, String property) {
        this.groupIndex = groupIndex;
        this.ioIndex = ioIndex;
        this.source = source;
        this.property = property;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitGroupIOAccess(this);
    }

    @Override
    public List<Expression> getOperands() {
        return Arrays.asList(groupIndex, ioIndex);
    }

    @Override
    public String toString() {
        return "tx.assetGroups[" + groupIndex + "]." + source.path + "[" + ioIndex + "]"
                + (property == null ? "" : "." + property);
    }
}
