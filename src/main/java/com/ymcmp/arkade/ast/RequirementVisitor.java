package com.ymcmp.arkade.ast;

public interface RequirementVisitor<R> {

    public R visitCheckSig(CheckSig req);

    public R visitCheckSigFromStack(CheckSigFromStack req);

    public R visitCheckMultisig(CheckMultisig req);

    public R visitAfter(After req);

    public R visitHashEqual(HashEqual req);

    public R visitComparison(Comparison req);
}
