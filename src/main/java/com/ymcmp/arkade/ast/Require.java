package com.ymcmp.arkade.ast;

public final class Require extends Statement {

    public final Requirement requirement;

    // Optional failure message from require(expr, "message")
    public final String message;

    public Require(Requirement requirement, String message) {
        this.requirement = requirement;
        this.message = message;
    }

    public Require withRequirement(final Requirement replacement) {
        return new Require(replacement, message);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRequire(this);
    }

    @Override
    public String toString() {
        return "require(" + requirement + (message == null ? "" : ", \"" + message + "\"") + ");";
    }
}
