package com.ymcmp.arkade.ast;

/**
 * A signature check used as a value, for example as an {@code if} condition.
 */
public final class SignatureCheck extends Expression {

    public enum Kind {
        CHECKSIG("checkSig"),
        FROM_STACK("checkSigFromStack"),
        FROM_STACK_VERIFY("checkSigFromStackVerify");

        public final String functionName;

        private Kind(String functionName) {
            this.functionName = functionName;
        }
    }

    public final Kind kind;
    public final String signature;
    public final String pubkey;

    // null for CHECKSIG
    public final String message;

    public SignatureCheck(Kind kind, String signature, String pubkey, String message) {
        this.kind = kind;
        this.signature = signature;
        this.pubkey = pubkey;
        this.message = message;
    }

    public SignatureCheck withNames(final String newSignature, final String newPubkey, final String newMessage) {
        return new SignatureCheck(kind, newSignature, newPubkey, newMessage);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSignatureCheck(this);
    }

    @Override
    public String toString() {
        return kind.functionName + "(" + signature + ", " + pubkey + (message == null ? "" : ", " + message) + ")";
    }
}
