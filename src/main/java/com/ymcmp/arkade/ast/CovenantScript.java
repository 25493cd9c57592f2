package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

/**
 * {@code new Name(args...)}: the output script of a contract instance,
 * used to enforce covenant recursion on an output.
 */
public final class CovenantScript extends Expression {

    public final String contractName;
    public final List<String> arguments;

    public CovenantScript(String contractName, List<String> arguments) {
        this.contractName = contractName;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCovenantScript(this);
    }

    @Override
    public String toString() {
        return "new " + contractName + "(" + String.join(", ", arguments) + ")";
    }
}
