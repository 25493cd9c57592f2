package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

public abstract class Expression {

    public abstract <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Sub-expressions in evaluation order. Names held as plain strings
     * (signature and key operands) are not expressions and are not listed.
     */
    public List<Expression> getOperands() {
        return Collections.emptyList();
    }
}
