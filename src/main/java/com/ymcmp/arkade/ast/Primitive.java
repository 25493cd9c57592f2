package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;
import java.util.stream.Collectors;

/**
 * Built-in functions that evaluate their operands in order and then apply a
 * single opcode.
 */
public final class Primitive extends Expression {

    public enum Kind {
        SHA256("sha256", 1),
        SHA256_INITIALIZE("sha256Initialize", 1),
        SHA256_UPDATE("sha256Update", 2),
        SHA256_FINALIZE("sha256Finalize", 2),
        NEG64("neg64", 1),
        LE64_TO_SCRIPT_NUM("le64ToScriptNum", 1),
        LE32_TO_LE64("le32ToLe64", 1);

        public final String functionName;
        public final int arity;

        private Kind(String functionName, int arity) {
            this.functionName = functionName;
            this.arity = arity;
        }

        public static Kind fromFunctionName(final String name) {
            for (final Kind kind : values()) {
                if (kind.functionName.equals(name)) {
                    return kind;
                }
            }
            return null;
        }
    }

    public final Kind kind;
    public final List<Expression> operands;

    public Primitive(Kind kind, List<Expression> operands) {
        if (operands.size() != kind.arity) {
            throw new IllegalArgumentException(kind.functionName + " expects " + kind.arity + " argument(s)");
        }
        this.kind = kind;
        this.operands = Collections.unmodifiableList(operands);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public List<Expression> getOperands() {
        return operands;
    }

    @Override
    public String toString() {
        return operands.stream()
                .map(Object::toString)
                .collect(Collectors.joining(", ", kind.functionName + "(", ")"));
    }
}
