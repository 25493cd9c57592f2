package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

/**
 * With no signatures this is the tapscript threshold form
 * ({@code CHECKSIG}/{@code CHECKSIGADD} chain), otherwise a legacy
 * {@code CHECKMULTISIG} over the listed signatures.
 */
public final class CheckMultisig extends Requirement {

    public final List<String> signatures;
    public final List<String> pubkeys;
    public final int threshold;

    public CheckMultisig(List<String> signatures, List<String> pubkeys, int threshold) {
        this.signatures = Collections.unmodifiableList(signatures);
        this.pubkeys = Collections.unmodifiableList(pubkeys);
        this.threshold = threshold;
    }

    public boolean isThresholdForm() {
        return signatures.isEmpty();
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitCheckMultisig(this);
    }

    @Override
    public String toString() {
        return "checkMultisig(" + pubkeys + ", " + (signatures.isEmpty() ? Integer.toString(threshold) : signatures.toString()) + ")";
    }
}
