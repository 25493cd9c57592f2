package com.ymcmp.arkade.ast;

public final class After extends Requirement {

    public final long blocks;

    // Witness or constructor name holding the locktime, null for a literal
    public final String timelockVar;

    public After(long blocks, String timelockVar) {
        this.blocks = blocks;
        this.timelockVar = timelockVar;
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitAfter(this);
    }

    @Override
    public String toString() {
        return "tx.time >= " + (timelockVar == null ? Long.toString(blocks) : timelockVar);
    }
}
