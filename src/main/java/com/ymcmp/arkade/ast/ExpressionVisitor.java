package com.ymcmp.arkade.ast;

public interface ExpressionVisitor<R> {

    public R visitVariable(Variable expr);

    public R visitLiteral(Literal expr);

    public R visitProperty(Property expr);

    public R visitCovenantScript(CovenantScript expr);

    public R visitCurrentInput(CurrentInput expr);

    public R visitTxIntrospection(TxIntrospection expr);

    public R visitInputIntrospection(InputIntrospection expr);

    public R visitOutputIntrospection(OutputIntrospection expr);

    public R visitAssetLookup(AssetLookup expr);

    public R visitAssetCount(AssetCount expr);

    public R visitAssetAt(AssetAt expr);

    public R visitGroupFind(GroupFind expr);

    public R visitAssetGroupsLength(AssetGroupsLength expr);

    public R visitGroupProperty(GroupProperty expr);

    public R visitGroupSum(GroupSum expr);

    public R visitGroupNumIO(GroupNumIO expr);

    public R visitGroupIOAccess(GroupIOAccess expr);

    public R visitBinaryOp(BinaryOp expr);

    public R visitArrayIndex(ArrayIndex expr);

    public R visitArrayLength(ArrayLength expr);

    public R visitSignatureCheck(SignatureCheck expr);

    public R visitPrimitive(Primitive expr);

    public R visitEcMulScalarVerify(EcMulScalarVerify expr);

    public R visitTweakVerify(TweakVerify expr);
}
