package com.ymcmp.arkade.ast;

public interface StatementVisitor<R> {

    public R visitRequire(Require stmt);

    public R visitLetBinding(LetBinding stmt);

    public R visitVarAssign(VarAssign stmt);

    public R visitIfElse(IfElse stmt);

    public R visitForIn(ForIn stmt);
}
