package com.ymcmp.arkade.ast;

public final class Literal extends Expression {

    public static final Literal TRUE = new Literal("true");
    public static final Literal FALSE = new Literal("false");

    public final String text;

    public Literal(String text) {
        this.text = text;
    }

    public static Literal of(final long value) {
        return new Literal(Long.toString(value));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Literal && ((Literal) obj).text.equals(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
