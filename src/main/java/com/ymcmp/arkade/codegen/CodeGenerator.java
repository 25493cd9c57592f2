package com.ymcmp.arkade.codegen;

import java.util.List;

import com.ymcmp.arkade.ast.*;

import com.ymcmp.arkade.pass.AbiDecomposer;

import com.ymcmp.arkade.script.Opcode;
import com.ymcmp.arkade.script.Script;

import com.ymcmp.arkade.except.InvalidThresholdException;

import static com.ymcmp.arkade.script.Opcode.*;

/**
 * Lowers statements, requirements and expressions into script tokens. Each
 * instance appends to one {@link Script}.
 */
public final class CodeGenerator implements StatementVisitor<Void>, RequirementVisitor<Void>, ExpressionVisitor<Void> {

    public static final int MAX_MULTISIG_KEYS = 20;

    private final Script script;

    public CodeGenerator(Script script) {
        this.script = script;
    }

    public CodeGenerator() {
        this(new Script());
    }

    public Script getScript() {
        return script;
    }

    public CodeGenerator emit(final List<Statement> statements) {
        for (final Statement stmt : statements) {
            stmt.accept(this);
        }
        return this;
    }

    public CodeGenerator emit(final Requirement requirement) {
        requirement.accept(this);
        return this;
    }

    public CodeGenerator emit(final Expression expr) {
        expr.accept(this);
        return this;
    }

    /**
     * Values that the VM carries as 8-byte little-endian integers. Comparing
     * one of them needs the 64-bit opcodes.
     */
    public static boolean is64Bit(final Expression expr) {
        if (expr instanceof AssetLookup || expr instanceof GroupSum) {
            return true;
        }
        if (expr instanceof AssetAt) {
            return ((AssetAt) expr).isAmount();
        }
        if (expr instanceof InputIntrospection) {
            return "value".equals(((InputIntrospection) expr).property);
        }
        if (expr instanceof OutputIntrospection) {
            return "value".equals(((OutputIntrospection) expr).property);
        }
        if (expr instanceof GroupProperty) {
            switch (((GroupProperty) expr).property) {
                case "sumInputs":
                case "sumOutputs":
                case "delta":
                    return true;
                default:
                    return false;
            }
        }
        if (expr instanceof BinaryOp) {
            return ((BinaryOp) expr).op.isArithmetic();
        }
        return false;
    }

    private void emitComparison(final Expression left, final BinaryOperator op, final Expression right) {
        if (is64Bit(left) || is64Bit(right)) {
            emitWidened(left);
            emitWidened(right);
            switch (op) {
                case EQ:
                    script.op(OP_EQUAL, OP_VERIFY);
                    return;
                case NE:
                    script.op(OP_EQUAL, OP_NOT, OP_VERIFY);
                    return;
                case GE:
                    script.op(OP_GREATERTHANOREQUAL64, OP_VERIFY);
                    return;
                case GT:
                    script.op(OP_GREATERTHAN64, OP_VERIFY);
                    return;
                case LE:
                    script.op(OP_LESSTHANOREQUAL64, OP_VERIFY);
                    return;
                case LT:
                    script.op(OP_LESSTHAN64, OP_VERIFY);
                    return;
                default:
                    throw new IllegalArgumentException("Not a comparison operator: " + op);
            }
        }

        emit(left);
        emit(right);
        switch (op) {
            case EQ:
                script.op(OP_EQUAL);
                return;
            case NE:
                script.op(OP_EQUAL, OP_NOT);
                return;
            case GE:
                script.op(OP_GREATERTHANOREQUAL);
                return;
            case GT:
                script.op(OP_GREATERTHAN);
                return;
            case LE:
                script.op(OP_LESSTHANOREQUAL);
                return;
            case LT:
                script.op(OP_LESSTHAN);
                return;
            default:
                throw new IllegalArgumentException("Not a comparison operator: " + op);
        }
    }

    private void emitWidened(final Expression operand) {
        emit(operand);
        if (operand instanceof Variable
                || (operand instanceof AssetAt && !((AssetAt) operand).isAmount())) {
            script.op(OP_SCRIPTNUMTOLE64);
        }
    }

    private void emitArithmetic(final BinaryOp expr) {
        emitWidened(expr.left);
        emitWidened(expr.right);
        switch (expr.op) {
            case ADD:
                script.op(OP_ADD64);
                break;
            case SUB:
                script.op(OP_SUB64);
                break;
            case MUL:
                script.op(OP_MUL64);
                break;
            case DIV:
                script.op(OP_DIV64);
                break;
            default:
                throw new IllegalArgumentException("Not an arithmetic operator: " + expr.op);
        }
        // The 64-bit opcodes also push an overflow flag
        script.op(OP_VERIFY);
    }

    private void emitAssetId(final String assetId) {
        script.placeholder(assetId + AbiDecomposer.TXID_SUFFIX)
                .placeholder(assetId + AbiDecomposer.GIDX_SUFFIX);
    }

    private void emitSource(final IoSource source) {
        script.op(source == IoSource.INPUTS ? OP_0 : OP_1);
    }

    private void emitGroupSum(final Expression group, final IoSource source) {
        emit(group);
        emitSource(source);
        script.op(OP_INSPECTASSETGROUPSUM);
    }

    private void emitGroupNum(final Expression group, final IoSource source) {
        emit(group);
        emitSource(source);
        script.op(OP_INSPECTASSETGROUPNUM);
    }

    // Statements

    @Override
    public Void visitRequire(Require stmt) {
        return stmt.requirement.accept(this);
    }

    @Override
    public Void visitLetBinding(LetBinding stmt) {
        return stmt.value.accept(this);
    }

    @Override
    public Void visitVarAssign(VarAssign stmt) {
        // Assignments rebind a compile-time name
        return null;
    }

    @Override
    public Void visitIfElse(IfElse stmt) {
        emit(stmt.condition);
        script.op(OP_IF);
        emit(stmt.thenBody);
        if (stmt.hasElse()) {
            script.op(OP_ELSE);
            emit(stmt.elseBody);
        }
        script.op(OP_ENDIF);
        return null;
    }

    @Override
    public Void visitForIn(ForIn stmt) {
        throw new IllegalStateException("Loop over " + stmt.iterable + " reached code generation without being unrolled");
    }

    // Requirements

    @Override
    public Void visitCheckSig(CheckSig req) {
        script.placeholder(req.pubkey).placeholder(req.signature).op(OP_CHECKSIG);
        return null;
    }

    @Override
    public Void visitCheckSigFromStack(CheckSigFromStack req) {
        script.placeholder(req.message).placeholder(req.pubkey).placeholder(req.signature).op(OP_CHECKSIGFROMSTACK);
        return null;
    }

    @Override
    public Void visitCheckMultisig(CheckMultisig req) {
        final int keys = req.pubkeys.size();
        if (req.isThresholdForm()) {
            if (req.threshold < 1 || req.threshold > keys) {
                throw new InvalidThresholdException(req.threshold, keys);
            }

            for (int i = 0; i < keys; ++i) {
                script.placeholder(req.pubkeys.get(i)).op(i == 0 ? OP_CHECKSIG : OP_CHECKSIGADD);
            }
            script.number(req.threshold).op(OP_NUMEQUAL);
            return null;
        }

        final int sigs = req.signatures.size();
        if (keys > MAX_MULTISIG_KEYS || sigs > MAX_MULTISIG_KEYS) {
            throw new InvalidThresholdException("checkMultisig accepts at most " + MAX_MULTISIG_KEYS
                    + " keys and signatures, got " + keys + " keys and " + sigs + " signatures");
        }

        script.number(keys);
        req.pubkeys.forEach(script::placeholder);
        script.number(sigs);
        req.signatures.forEach(script::placeholder);
        script.op(OP_CHECKMULTISIG);
        return null;
    }

    @Override
    public Void visitAfter(After req) {
        if (req.timelockVar != null) {
            script.placeholder(req.timelockVar);
        } else {
            script.number(req.blocks);
        }
        script.op(OP_CHECKLOCKTIMEVERIFY, OP_DROP);
        return null;
    }

    @Override
    public Void visitHashEqual(HashEqual req) {
        script.placeholder(req.preimage).op(OP_SHA256).placeholder(req.hash).op(OP_EQUAL);
        return null;
    }

    @Override
    public Void visitComparison(Comparison req) {
        if (req.isStandalone()) {
            emit(req.left);
        } else {
            emitComparison(req.left, req.op, req.right);
        }
        return null;
    }

    // Expressions

    @Override
    public Void visitVariable(Variable expr) {
        script.placeholder(expr.name);
        return null;
    }

    @Override
    public Void visitLiteral(Literal expr) {
        script.literal(expr.text);
        return null;
    }

    @Override
    public Void visitProperty(Property expr) {
        script.placeholder(expr.path);
        return null;
    }

    @Override
    public Void visitCovenantScript(CovenantScript expr) {
        script.placeholder(expr.toString());
        return null;
    }

    @Override
    public Void visitCurrentInput(CurrentInput expr) {
        final Opcode inspect;
        if (expr.property == null) {
            inspect = OP_INSPECTINPUTSCRIPTPUBKEY;
        } else {
            switch (expr.property) {
                case "scriptPubKey":
                    inspect = OP_INSPECTINPUTSCRIPTPUBKEY;
                    break;
                case "value":
                    inspect = OP_INSPECTINPUTVALUE;
                    break;
                case "sequence":
                    inspect = OP_INSPECTINPUTSEQUENCE;
                    break;
                case "outpoint":
                    inspect = OP_INSPECTINPUTOUTPOINT;
                    break;
                default:
                    script.placeholder(expr.toString());
                    return null;
            }
        }
        script.op(OP_PUSHCURRENTINPUTINDEX, inspect);
        return null;
    }

    @Override
    public Void visitTxIntrospection(TxIntrospection expr) {
        switch (expr.property) {
            case "version":
                script.op(OP_INSPECTVERSION);
                break;
            case "locktime":
                script.op(OP_INSPECTLOCKTIME);
                break;
            case "numInputs":
                script.op(OP_INSPECTNUMINPUTS);
                break;
            case "numOutputs":
                script.op(OP_INSPECTNUMOUTPUTS);
                break;
            case "weight":
                script.op(OP_TXWEIGHT);
                break;
            default:
                script.placeholder("tx." + expr.property);
                break;
        }
        return null;
    }

    @Override
    public Void visitInputIntrospection(InputIntrospection expr) {
        final Opcode inspect;
        switch (expr.property) {
            case "value":
                inspect = OP_INSPECTINPUTVALUE;
                break;
            case "scriptPubKey":
                inspect = OP_INSPECTINPUTSCRIPTPUBKEY;
                break;
            case "sequence":
                inspect = OP_INSPECTINPUTSEQUENCE;
                break;
            case "outpoint":
                inspect = OP_INSPECTINPUTOUTPOINT;
                break;
            case "issuance":
                inspect = OP_INSPECTINPUTISSUANCE;
                break;
            default:
                script.placeholder("tx.inputs[?]." + expr.property);
                return null;
        }
        emit(expr.index);
        script.op(inspect);
        return null;
    }

    @Override
    public Void visitOutputIntrospection(OutputIntrospection expr) {
        final Opcode inspect;
        switch (expr.property) {
            case "value":
                inspect = OP_INSPECTOUTPUTVALUE;
                break;
            case "scriptPubKey":
                inspect = OP_INSPECTOUTPUTSCRIPTPUBKEY;
                break;
            case "nonce":
                inspect = OP_INSPECTOUTPUTNONCE;
                break;
            default:
                script.placeholder("tx.outputs[?]." + expr.property);
                return null;
        }
        emit(expr.index);
        script.op(inspect);
        return null;
    }

    @Override
    public Void visitAssetLookup(AssetLookup expr) {
        emit(expr.index);
        emitAssetId(expr.assetId);
        script.op(expr.source == IoSource.INPUTS ? OP_INSPECTINASSETLOOKUP : OP_INSPECTOUTASSETLOOKUP);
        // A missing asset yields -1, fail instead of comparing it
        script.op(OP_DUP, OP_1NEGATE, OP_EQUAL, OP_NOT, OP_VERIFY);
        return null;
    }

    @Override
    public Void visitAssetCount(AssetCount expr) {
        emit(expr.index);
        script.op(expr.source == IoSource.INPUTS ? OP_INSPECTINASSETCOUNT : OP_INSPECTOUTASSETCOUNT);
        return null;
    }

    @Override
    public Void visitAssetAt(AssetAt expr) {
        emit(expr.ioIndex);
        emit(expr.assetIndex);
        script.op(expr.source == IoSource.INPUTS ? OP_INSPECTINASSETAT : OP_INSPECTOUTASSETAT);

        // Leaves txid, gidx and amount on the stack
        if (expr.isAmount()) {
            script.op(OP_NIP, OP_NIP);
        } else {
            script.op(OP_DROP);
        }
        return null;
    }

    @Override
    public Void visitGroupFind(GroupFind expr) {
        emitAssetId(expr.assetId);
        script.op(OP_FINDASSETGROUPBYASSETID);
        return null;
    }

    @Override
    public Void visitAssetGroupsLength(AssetGroupsLength expr) {
        script.op(OP_INSPECTNUMASSETGROUPS);
        return null;
    }

    @Override
    public Void visitGroupProperty(GroupProperty expr) {
        switch (expr.property) {
            case "sumInputs":
                emitGroupSum(expr.group, IoSource.INPUTS);
                break;
            case "sumOutputs":
                emitGroupSum(expr.group, IoSource.OUTPUTS);
                break;
            case "numInputs":
                emitGroupNum(expr.group, IoSource.INPUTS);
                break;
            case "numOutputs":
                emitGroupNum(expr.group, IoSource.OUTPUTS);
                break;
            case "delta":
                emitGroupSum(expr.group, IoSource.OUTPUTS);
                emitGroupSum(expr.group, IoSource.INPUTS);
                script.op(OP_SUB64, OP_VERIFY);
                break;
            case "control":
                emit(expr.group);
                script.op(OP_INSPECTASSETGROUPCTRL);
                break;
            case "metadataHash":
                emit(expr.group);
                script.op(OP_INSPECTASSETGROUPMETADATAHASH);
                break;
            case "assetId":
                emit(expr.group);
                script.op(OP_INSPECTASSETGROUPASSETID);
                break;
            case "isFresh":
                // Fresh assets are issued by this transaction
                emit(expr.group);
                script.op(OP_INSPECTASSETGROUPASSETID, OP_DROP, OP_TXHASH, OP_EQUAL);
                break;
            default:
                script.placeholder(expr.toString());
                break;
        }
        return null;
    }

    @Override
    public Void visitGroupSum(GroupSum expr) {
        emitGroupSum(expr.index, expr.source);
        return null;
    }

    @Override
    public Void visitGroupNumIO(GroupNumIO expr) {
        emitGroupNum(expr.index, expr.source);
        return null;
    }

    @Override
    public Void visitGroupIOAccess(GroupIOAccess expr) {
        emit(expr.groupIndex);
        emit(expr.ioIndex);
        emitSource(expr.source);
        script.op(OP_INSPECTASSETGROUP);
        if ("type".equals(expr.property)) {
            script.op(OP_DROP, OP_DROP);
        }
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOp expr) {
        if (expr.op.isArithmetic()) {
            emitArithmetic(expr);
        } else {
            emitComparison(expr.left, expr.op, expr.right);
        }
        return null;
    }

    @Override
    public Void visitArrayIndex(ArrayIndex expr) {
        emit(expr.array);
        emit(expr.index);
        return null;
    }

    @Override
    public Void visitArrayLength(ArrayLength expr) {
        script.number(AbiDecomposer.ARRAY_LENGTH);
        return null;
    }

    @Override
    public Void visitSignatureCheck(SignatureCheck expr) {
        switch (expr.kind) {
            case CHECKSIG:
                script.placeholder(expr.pubkey).placeholder(expr.signature).op(OP_CHECKSIG);
                break;
            case FROM_STACK:
                script.placeholder(expr.message).placeholder(expr.pubkey).placeholder(expr.signature)
                        .op(OP_CHECKSIGFROMSTACK);
                break;
            case FROM_STACK_VERIFY:
                script.placeholder(expr.message).placeholder(expr.pubkey).placeholder(expr.signature)
                        .op(OP_CHECKSIGFROMSTACKVERIFY);
                break;
        }
        return null;
    }

    @Override
    public Void visitPrimitive(Primitive expr) {
        expr.operands.forEach(this::emit);
        switch (expr.kind) {
            case SHA256:
                script.op(OP_SHA256);
                break;
            case SHA256_INITIALIZE:
                script.op(OP_SHA256INITIALIZE);
                break;
            case SHA256_UPDATE:
                script.op(OP_SHA256UPDATE);
                break;
            case SHA256_FINALIZE:
                script.op(OP_SHA256FINALIZE);
                break;
            case NEG64:
                script.op(OP_NEG64);
                break;
            case LE64_TO_SCRIPT_NUM:
                script.op(OP_LE64TOSCRIPTNUM);
                break;
            case LE32_TO_LE64:
                script.op(OP_LE32TOLE64);
                break;
        }
        return null;
    }

    @Override
    public Void visitEcMulScalarVerify(EcMulScalarVerify expr) {
        expr.getOperands().forEach(this::emit);
        script.op(OP_ECMULSCALARVERIFY);
        return null;
    }

    @Override
    public Void visitTweakVerify(TweakVerify expr) {
        expr.getOperands().forEach(this::emit);
        script.op(OP_TWEAKVERIFY);
        return null;
    }
}
