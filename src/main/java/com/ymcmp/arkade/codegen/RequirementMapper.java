package com.ymcmp.arkade.codegen;

import java.util.List;
import java.util.ArrayList;

import com.ymcmp.arkade.abi.RequireEntry;

import com.ymcmp.arkade.ast.*;

/**
 * Summarizes the requirements of a function body for the ABI. The entries
 * describe the script, they do not drive its generation.
 *
 * <p>Mapping runs on the unrolled body, so a {@code require} inside a loop
 * yields one entry per iteration, matching the checks in the script.
 */
public final class RequirementMapper implements StatementVisitor<Void>, RequirementVisitor<RequireEntry> {

    private final List<RequireEntry> entries = new ArrayList<>();

    private RequirementMapper() {
    }

    public static List<RequireEntry> map(final List<Statement> statements) {
        final RequirementMapper mapper = new RequirementMapper();
        mapper.collect(statements);
        return mapper.entries;
    }

    public static RequireEntry map(final Requirement requirement) {
        return requirement.accept(new RequirementMapper());
    }

    private void collect(final List<Statement> statements) {
        if (statements == null) return;
        for (final Statement stmt : statements) {
            stmt.accept(this);
        }
    }

    static boolean isAssetCheck(final Expression left) {
        if (left instanceof AssetLookup) return true;
        if (left instanceof BinaryOp) return isAssetCheck(((BinaryOp) left).left);
        return false;
    }

    static boolean isGroupCheck(final Expression left) {
        return left instanceof GroupFind
                || left instanceof GroupProperty
                || left instanceof GroupSum
                || left instanceof GroupNumIO
                || left instanceof GroupIOAccess
                || left instanceof AssetGroupsLength;
    }

    @Override
    public Void visitRequire(Require stmt) {
        final RequireEntry entry = stmt.requirement.accept(this);
        entries.add(stmt.message == null ? entry : new RequireEntry(entry.type, stmt.message));
        return null;
    }

    @Override
    public Void visitLetBinding(LetBinding stmt) {
        return null;
    }

    @Override
    public Void visitVarAssign(VarAssign stmt) {
        return null;
    }

    @Override
    public Void visitIfElse(IfElse stmt) {
        collect(stmt.thenBody);
        collect(stmt.elseBody);
        return null;
    }

    @Override
    public Void visitForIn(ForIn stmt) {
        collect(stmt.body);
        return null;
    }

    @Override
    public RequireEntry visitCheckSig(CheckSig req) {
        return new RequireEntry(RequireEntry.SIGNATURE);
    }

    @Override
    public RequireEntry visitCheckSigFromStack(CheckSigFromStack req) {
        return new RequireEntry(RequireEntry.SIGNATURE_FROM_STACK);
    }

    @Override
    public RequireEntry visitCheckMultisig(CheckMultisig req) {
        return new RequireEntry(RequireEntry.MULTISIG);
    }

    @Override
    public RequireEntry visitAfter(After req) {
        final String blocks = req.timelockVar == null ? Long.toString(req.blocks) : req.timelockVar;
        return new RequireEntry(RequireEntry.OLDER, "Timelock of " + blocks + " blocks");
    }

    @Override
    public RequireEntry visitHashEqual(HashEqual req) {
        return new RequireEntry(RequireEntry.HASH);
    }

    @Override
    public RequireEntry visitComparison(Comparison req) {
        if (isAssetCheck(req.left)) {
            return new RequireEntry(RequireEntry.ASSET_CHECK);
        }
        if (isGroupCheck(req.left)) {
            return new RequireEntry(RequireEntry.GROUP_CHECK);
        }
        return new RequireEntry(RequireEntry.COMPARISON);
    }
}
