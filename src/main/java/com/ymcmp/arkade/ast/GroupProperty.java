package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

/**
 * A property of one asset group. {@code group} evaluates to the group index:
 * a literal index, a witness variable, or a name bound to
 * {@code tx.assetGroups.find(id)}.
 */
public final class GroupProperty extends Expression {

    public final Expression group;
    public final String property;

    public GroupProperty(Expression group, String property) {
        this.group = group;
        this.property = property;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitGroupProperty(this);
    }

    @Override
    public List<Expression> getOperands() {
        return Collections.singletonList(group);
    }

    @Override
    public String toString() {
        if (group instanceof Variable) {
            return group + "." + property;
        }
        return "tx.assetGroups[" + group + "]." + property;
    }
}
