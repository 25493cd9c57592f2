package com.ymcmp.arkade.ast;

public final class CheckSig extends Requirement {

    public final String signature;
    public final String pubkey;

    public CheckSig(String signature, String pubkey) {
        this.signature = signature;
        this.pubkey = pubkey;
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitCheckSig(this);
    }

    @Override
    public String toString() {
        return "checkSig(" + signature + ", " + pubkey + ")";
    }
}
