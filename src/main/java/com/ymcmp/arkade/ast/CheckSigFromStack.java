package com.ymcmp.arkade.ast;

public final class CheckSigFromStack extends Requirement {

    public final String signature;
    public final String pubkey;
    public final String message;

    public CheckSigFromStack(String signature, String pubkey, String message) {
        this.signature = signature;
        this.pubkey = pubkey;
        this.message = message;
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitCheckSigFromStack(this);
    }

    @Override
    public String toString() {
        return "checkSigFromStack(" + signature + ", " + pubkey + ", " + message + ")";
    }
}
