package com.ymcmp.arkade.pass;

import java.util.List;
import java.util.stream.Collectors;

import com.ymcmp.arkade.ast.*;

/**
 * Rewrites one copy of a loop body for iteration {@code k}. The index
 * variable becomes the literal {@code k}. The value variable becomes the
 * {@code k}-th slot of the iterated array, or the group index {@code k} when
 * iterating asset groups.
 *
 * <p>A nested loop gets the substitution in its iterable and, unless it
 * rebinds the index or value name, in its body too. Its own names are
 * substituted later when that loop is unrolled.
 */
public final class LoopSubstitution implements StatementVisitor<Statement>, RequirementVisitor<Requirement>, ExpressionVisitor<Expression> {

    private final String indexVar;
    private final String valueVar;
    // null when iterating tx.assetGroups
    private final String arrayName;
    private final int k;

    public LoopSubstitution(String indexVar, String valueVar, String arrayName, int k) {
        this.indexVar = indexVar;
        this.valueVar = valueVar;
        this.arrayName = arrayName;
        this.k = k;
    }

    public List<Statement> substitute(final List<Statement> body) {
        return body.stream().map(s -> s.accept(this)).collect(Collectors.toList());
    }

    public Expression substitute(final Expression expr) {
        return expr.accept(this);
    }

    private boolean iteratesGroups() {
        return arrayName == null;
    }

    private boolean isValueVar(final Expression expr) {
        return expr instanceof Variable && ((Variable) expr).name.equals(valueVar);
    }

    private boolean isIndexVar(final Expression expr) {
        return expr instanceof Variable && ((Variable) expr).name.equals(indexVar);
    }

    /**
     * Names held as strings follow the same rules as variables, plus the
     * {@code name[index]} form.
     */
    String substituteName(final String name) {
        if (name == null) return null;
        if (name.equals(valueVar)) {
            return iteratesGroups() ? Integer.toString(k) : AbiDecomposer.slotName(arrayName, k);
        }
        if (name.equals(indexVar)) {
            return Integer.toString(k);
        }

        final String suffix = "[" + indexVar + "]";
        if (name.endsWith(suffix) && name.length() > suffix.length()) {
            return AbiDecomposer.slotName(name.substring(0, name.length() - suffix.length()), k);
        }
        return name;
    }

    private List<String> substituteNames(final List<String> names) {
        return names.stream().map(this::substituteName).collect(Collectors.toList());
    }

    // Statements

    @Override
    public Statement visitRequire(Require stmt) {
        return stmt.withRequirement(stmt.requirement.accept(this));
    }

    @Override
    public Statement visitLetBinding(LetBinding stmt) {
        return new LetBinding(stmt.name, substitute(stmt.value));
    }

    @Override
    public Statement visitVarAssign(VarAssign stmt) {
        return new VarAssign(stmt.name, substitute(stmt.value));
    }

    @Override
    public Statement visitIfElse(IfElse stmt) {
        return new IfElse(substitute(stmt.condition),
                substitute(stmt.thenBody),
                stmt.hasElse() ? substitute(stmt.elseBody) : null);
    }

    @Override
    public Statement visitForIn(ForIn stmt) {
        final Expression iterable = substitute(stmt.iterable);
        if (stmt.indexVar.equals(indexVar) || stmt.indexVar.equals(valueVar)
                || stmt.valueVar.equals(indexVar) || stmt.valueVar.equals(valueVar)) {
            // Inner loop rebinds our names, its body belongs to it
            return new ForIn(stmt.indexVar, stmt.valueVar, iterable, stmt.body);
        }
        return new ForIn(stmt.indexVar, stmt.valueVar, iterable, substitute(stmt.body));
    }

    // Requirements

    @Override
    public Requirement visitCheckSig(CheckSig req) {
        return new CheckSig(substituteName(req.signature), substituteName(req.pubkey));
    }

    @Override
    public Requirement visitCheckSigFromStack(CheckSigFromStack req) {
        return new CheckSigFromStack(substituteName(req.signature), substituteName(req.pubkey), substituteName(req.message));
    }

    @Override
    public Requirement visitCheckMultisig(CheckMultisig req) {
        return new CheckMultisig(substituteNames(req.signatures), substituteNames(req.pubkeys), req.threshold);
    }

    @Override
    public Requirement visitAfter(After req) {
        return new After(req.blocks, substituteName(req.timelockVar));
    }

    @Override
    public Requirement visitHashEqual(HashEqual req) {
        return new HashEqual(substituteName(req.preimage), substituteName(req.hash));
    }

    @Override
    public Requirement visitComparison(Comparison req) {
        return new Comparison(substitute(req.left), req.op, substitute(req.right));
    }

    // Expressions

    @Override
    public Expression visitVariable(Variable expr) {
        if (expr.name.equals(indexVar)) {
            return Literal.of(k);
        }
        if (expr.name.equals(valueVar)) {
            return iteratesGroups() ? Literal.of(k) : new Variable(AbiDecomposer.slotName(arrayName, k));
        }
        return expr;
    }

    @Override
    public Expression visitLiteral(Literal expr) {
        return expr;
    }

    @Override
    public Expression visitProperty(Property expr) {
        return expr;
    }

    @Override
    public Expression visitCovenantScript(CovenantScript expr) {
        return new CovenantScript(expr.contractName, substituteNames(expr.arguments));
    }

    @Override
    public Expression visitCurrentInput(CurrentInput expr) {
        return expr;
    }

    @Override
    public Expression visitTxIntrospection(TxIntrospection expr) {
        return expr;
    }

    @Override
    public Expression visitInputIntrospection(InputIntrospection expr) {
        return new InputIntrospection(substitute(expr.index), expr.property);
    }

    @Override
    public Expression visitOutputIntrospection(OutputIntrospection expr) {
        return new OutputIntrospection(substitute(expr.index), expr.property);
    }

    @Override
    public Expression visitAssetLookup(AssetLookup expr) {
        return new AssetLookup(expr.source, substitute(expr.index), expr.assetId);
    }

    @Override
    public Expression visitAssetCount(AssetCount expr) {
        return new AssetCount(expr.source, substitute(expr.index));
    }

    @Override
    public Expression visitAssetAt(AssetAt expr) {
        return new AssetAt(expr.source, substitute(expr.ioIndex), substitute(expr.assetIndex), expr.property);
    }

    @Override
    public Expression visitGroupFind(GroupFind expr) {
        return expr;
    }

    @Override
    public Expression visitAssetGroupsLength(AssetGroupsLength expr) {
        return expr;
    }

    @Override
    public Expression visitGroupProperty(GroupProperty expr) {
        if (iteratesGroups() && isValueVar(expr.group)) {
            switch (expr.property) {
                case "sumInputs":
                    return new GroupSum(Literal.of(k), IoSource.INPUTS);
                case "sumOutputs":
                    return new GroupSum(Literal.of(k), IoSource.OUTPUTS);
                default:
                    return new GroupProperty(Literal.of(k), expr.property);
            }
        }
        return new GroupProperty(substitute(expr.group), expr.property);
    }

    @Override
    public Expression visitGroupSum(GroupSum expr) {
        return new GroupSum(substitute(expr.index), expr.source);
    }

    @Override
    public Expression visitGroupNumIO(GroupNumIO expr) {
        return new GroupNumIO(substitute(expr.index), expr.source);
    }

    @Override
    public Expression visitGroupIOAccess(GroupIOAccess expr) {
        return new GroupIOAccess(substitute(expr.groupIndex), substitute(expr.ioIndex), expr.source, expr.property);
    }

    @Override
    public Expression visitBinaryOp(BinaryOp expr) {
        return new BinaryOp(substitute(expr.left), expr.op, substitute(expr.right));
    }

    @Override
    public Expression visitArrayIndex(ArrayIndex expr) {
        if (expr.array instanceof Variable && isIndexVar(expr.index)) {
            return new Variable(AbiDecomposer.slotName(((Variable) expr.array).name, k));
        }
        return new ArrayIndex(substitute(expr.array), substitute(expr.index));
    }

    @Override
    public Expression visitArrayLength(ArrayLength expr) {
        return expr;
    }

    @Override
    public Expression visitSignatureCheck(SignatureCheck expr) {
        return expr.withNames(substituteName(expr.signature), substituteName(expr.pubkey), substituteName(expr.message));
    }

    @Override
    public Expression visitPrimitive(Primitive expr) {
        return new Primitive(expr.kind, expr.operands.stream().map(this::substitute).collect(Collectors.toList()));
    }

    @Override
    public Expression visitEcMulScalarVerify(EcMulScalarVerify expr) {
        return new EcMulScalarVerify(substitute(expr.scalar), substitute(expr.pointP), substitute(expr.pointQ));
    }

    @Override
    public Expression visitTweakVerify(TweakVerify expr) {
        return new TweakVerify(substitute(expr.pointP), substitute(expr.tweak), substitute(expr.pointQ));
    }
}
