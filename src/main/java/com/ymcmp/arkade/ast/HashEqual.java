package com.ymcmp.arkade.ast;

public final class HashEqual extends Requirement {

    public final String preimage;
    public final String hash;

    public HashEqual(String preimage, String hash) {
        this.preimage = preimage;
        this.hash = hash;
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitHashEqual(this);
    }

    @Override
    public String toString() {
        return "sha256(" + preimage + ") == " + hash;
    }
}
