package com.ymcmp.arkade.codegen;

import java.util.List;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.ymcmp.arkade.ast.*;

import com.ymcmp.arkade.except.InvalidThresholdException;

import static org.junit.jupiter.api.Assertions.*;

public class CodeGeneratorTest {

    private static List<String> asm(final Expression expr) {
        return new CodeGenerator().emit(expr).getScript().toList();
    }

    private static List<String> asm(final Requirement req) {
        return new CodeGenerator().emit(req).getScript().toList();
    }

    private static List<String> asm(final Statement... stmts) {
        return new CodeGenerator().emit(Arrays.asList(stmts)).getScript().toList();
    }

    private static List<String> tokens(final String... tokens) {
        return Arrays.asList(tokens);
    }

    @Test
    public void testCheckSig() {
        assertEquals(tokens("<pk>", "<sig>", "OP_CHECKSIG"), asm(new CheckSig("sig", "pk")));
    }

    @Test
    public void testCheckSigFromStack() {
        assertEquals(tokens("<msg>", "<pk>", "<sig>", "OP_CHECKSIGFROMSTACK"),
                asm(new CheckSigFromStack("sig", "pk", "msg")));
    }

    @Test
    public void testThresholdMultisig() {
        assertEquals(tokens("<a>", "OP_CHECKSIG", "<b>", "OP_CHECKSIGADD", "<c>", "OP_CHECKSIGADD", "OP_2", "OP_NUMEQUAL"),
                asm(new CheckMultisig(Collections.emptyList(), Arrays.asList("a", "b", "c"), 2)));
    }

    @Test
    public void testThreeOfFiveMultisig() {
        assertEquals(tokens("<a>", "OP_CHECKSIG", "<b>", "OP_CHECKSIGADD", "<c>", "OP_CHECKSIGADD",
                "<d>", "OP_CHECKSIGADD", "<e>", "OP_CHECKSIGADD", "OP_3", "OP_NUMEQUAL"),
                asm(new CheckMultisig(Collections.emptyList(), Arrays.asList("a", "b", "c", "d", "e"), 3)));
    }

    @Test
    public void testThresholdAboveKeyCountFails() {
        final CheckMultisig req = new CheckMultisig(Collections.emptyList(), Arrays.asList("a", "b", "c"), 4);
        assertThrows(InvalidThresholdException.class, () -> asm(req));
    }

    @Test
    public void testZeroThresholdFails() {
        final CheckMultisig req = new CheckMultisig(Collections.emptyList(), Arrays.asList("a"), 0);
        assertThrows(InvalidThresholdException.class, () -> asm(req));
    }

    @Test
    public void testLegacyMultisig() {
        assertEquals(tokens("OP_2", "<a>", "<b>", "OP_1", "<s>", "OP_CHECKMULTISIG"),
                asm(new CheckMultisig(Collections.singletonList("s"), Arrays.asList("a", "b"), 1)));
    }

    @Test
    public void testAfterWithLiteralAndVariable() {
        assertEquals(tokens("500", "OP_CHECKLOCKTIMEVERIFY", "OP_DROP"), asm(new After(500, null)));
        assertEquals(tokens("<lock>", "OP_CHECKLOCKTIMEVERIFY", "OP_DROP"), asm(new After(0, "lock")));
    }

    @Test
    public void testHashEqual() {
        assertEquals(tokens("<pre>", "OP_SHA256", "<h>", "OP_EQUAL"), asm(new HashEqual("pre", "h")));
    }

    @Test
    public void testNativeComparison() {
        assertEquals(tokens("<a>", "<b>", "OP_GREATERTHANOREQUAL"),
                asm(new Comparison(new Variable("a"), BinaryOperator.GE, new Variable("b"))));
        assertEquals(tokens("<a>", "<b>", "OP_EQUAL", "OP_NOT"),
                asm(new Comparison(new Variable("a"), BinaryOperator.NE, new Variable("b"))));
    }

    @Test
    public void test64BitComparisonOnOutputValue() {
        assertEquals(tokens("0", "OP_INSPECTOUTPUTVALUE", "<min>", "OP_SCRIPTNUMTOLE64", "OP_LESSTHAN64", "OP_VERIFY"),
                asm(new Comparison(new OutputIntrospection(Literal.of(0), "value"), BinaryOperator.LT, new Variable("min"))));
    }

    @Test
    public void testAssetLookupComparisonWidensWitness() {
        final List<String> result = asm(new Comparison(
                new AssetLookup(IoSource.OUTPUTS, Literal.of(0), "token"), BinaryOperator.GE, new Variable("minAmount")));
        assertEquals(tokens("OP_VERIFY", "<minAmount>", "OP_SCRIPTNUMTOLE64", "OP_GREATERTHANOREQUAL64", "OP_VERIFY"),
                result.subList(result.size() - 5, result.size()));
    }

    @Test
    public void testScriptNumComparisonIsNotWidened() {
        assertEquals(tokens("<a>", "<b>", "OP_GREATERTHAN"),
                asm(new Comparison(new Variable("a"), BinaryOperator.GT, new Variable("b"))));
    }

    @Test
    public void testStandaloneEmitsExpressionOnly() {
        assertEquals(tokens("<flag>"), asm(Comparison.standalone(new Variable("flag"))));
    }

    @Test
    public void testAssetLookupHasGuard() {
        assertEquals(tokens("1", "<tok_txid>", "<tok_gidx>", "OP_INSPECTOUTASSETLOOKUP",
                "OP_DUP", "OP_1NEGATE", "OP_EQUAL", "OP_NOT", "OP_VERIFY"),
                asm(new AssetLookup(IoSource.OUTPUTS, Literal.of(1), "tok")));
    }

    @Test
    public void testAssetComparisonWidensVariables() {
        final Expression sum = new BinaryOp(new AssetLookup(IoSource.INPUTS, Literal.of(0), "t"),
                BinaryOperator.ADD, new Variable("fee"));
        final List<String> result = asm(new Comparison(
                new AssetLookup(IoSource.OUTPUTS, Literal.of(0), "t"), BinaryOperator.GE, sum));

        assertEquals(tokens("<fee>", "OP_SCRIPTNUMTOLE64", "OP_ADD64", "OP_VERIFY", "OP_GREATERTHANOREQUAL64", "OP_VERIFY"),
                result.subList(result.size() - 6, result.size()));
        assertEquals(2, Collections.frequency(result, "OP_1NEGATE"));
    }

    @Test
    public void testAssetAtExtraction() {
        assertEquals(tokens("0", "1", "OP_INSPECTINASSETAT", "OP_NIP", "OP_NIP"),
                asm(new AssetAt(IoSource.INPUTS, Literal.of(0), Literal.of(1), AssetAt.AMOUNT)));
        assertEquals(tokens("0", "1", "OP_INSPECTOUTASSETAT", "OP_DROP"),
                asm(new AssetAt(IoSource.OUTPUTS, Literal.of(0), Literal.of(1), AssetAt.ASSET_ID)));
    }

    @Test
    public void testAssetCount() {
        assertEquals(tokens("<i>", "OP_INSPECTINASSETCOUNT"), asm(new AssetCount(IoSource.INPUTS, new Variable("i"))));
    }

    @Test
    public void testCurrentInput() {
        assertEquals(tokens("OP_PUSHCURRENTINPUTINDEX", "OP_INSPECTINPUTSCRIPTPUBKEY"), asm(new CurrentInput(null)));
        assertEquals(tokens("OP_PUSHCURRENTINPUTINDEX", "OP_INSPECTINPUTVALUE"), asm(new CurrentInput("value")));
        assertEquals(tokens("<tx.input.current.color>"), asm(new CurrentInput("color")));
    }

    @Test
    public void testTxIntrospection() {
        assertEquals(tokens("OP_INSPECTVERSION"), asm(new TxIntrospection("version")));
        assertEquals(tokens("OP_TXWEIGHT"), asm(new TxIntrospection("weight")));
        assertEquals(tokens("<tx.unknown>"), asm(new TxIntrospection("unknown")));
    }

    @Test
    public void testInputAndOutputIntrospection() {
        assertEquals(tokens("0", "OP_INSPECTINPUTOUTPOINT"), asm(new InputIntrospection(Literal.of(0), "outpoint")));
        assertEquals(tokens("2", "OP_INSPECTOUTPUTNONCE"), asm(new OutputIntrospection(Literal.of(2), "nonce")));
        assertEquals(tokens("<tx.inputs[?].color>"), asm(new InputIntrospection(Literal.of(0), "color")));
        assertEquals(tokens("<tx.outputs[?].color>"), asm(new OutputIntrospection(Literal.of(0), "color")));
    }

    @Test
    public void testGroupAccessors() {
        assertEquals(tokens("<a_txid>", "<a_gidx>", "OP_FINDASSETGROUPBYASSETID"), asm(new GroupFind("a")));
        assertEquals(tokens("OP_INSPECTNUMASSETGROUPS"), asm(AssetGroupsLength.INSTANCE));
        assertEquals(tokens("1", "OP_1", "OP_INSPECTASSETGROUPSUM"), asm(new GroupSum(Literal.of(1), IoSource.OUTPUTS)));
        assertEquals(tokens("1", "OP_0", "OP_INSPECTASSETGROUPNUM"), asm(new GroupNumIO(Literal.of(1), IoSource.INPUTS)));
        assertEquals(tokens("0", "2", "OP_1", "OP_INSPECTASSETGROUP", "OP_DROP", "OP_DROP"),
                asm(new GroupIOAccess(Literal.of(0), Literal.of(2), IoSource.OUTPUTS, "type")));
    }

    @Test
    public void testGroupPropertyMacros() {
        final Variable g = new Variable("g");
        assertEquals(tokens("<g>", "OP_1", "OP_INSPECTASSETGROUPSUM", "<g>", "OP_0", "OP_INSPECTASSETGROUPSUM", "OP_SUB64", "OP_VERIFY"),
                asm(new GroupProperty(g, "delta")));
        assertEquals(tokens("<g>", "OP_INSPECTASSETGROUPASSETID", "OP_DROP", "OP_TXHASH", "OP_EQUAL"),
                asm(new GroupProperty(g, "isFresh")));
        assertEquals(tokens("<g>", "OP_INSPECTASSETGROUPCTRL"), asm(new GroupProperty(g, "control")));
        assertEquals(tokens("<g>", "OP_INSPECTASSETGROUPMETADATAHASH"), asm(new GroupProperty(g, "metadataHash")));
        assertEquals(tokens("<g.color>"), asm(new GroupProperty(g, "color")));
    }

    @Test
    public void testGroupDeltaComparisonIs64Bit() {
        final List<String> result = asm(new Comparison(new GroupProperty(new Variable("g"), "delta"), BinaryOperator.EQ, Literal.of(0)));
        assertEquals(tokens("0", "OP_EQUAL", "OP_VERIFY"), result.subList(result.size() - 3, result.size()));
    }

    @Test
    public void testArithmeticWideningRules() {
        final Expression expr = new BinaryOp(
                new AssetAt(IoSource.INPUTS, Literal.of(0), Literal.of(0), AssetAt.ASSET_ID),
                BinaryOperator.MUL,
                Literal.of(3));
        assertEquals(tokens("0", "0", "OP_INSPECTINASSETAT", "OP_DROP", "OP_SCRIPTNUMTOLE64", "3", "OP_MUL64", "OP_VERIFY"),
                asm(expr));
    }

    @Test
    public void testPrimitives() {
        assertEquals(tokens("<ctx>", "<data>", "OP_SHA256UPDATE"),
                asm(new Primitive(Primitive.Kind.SHA256_UPDATE, Arrays.asList(new Variable("ctx"), new Variable("data")))));
        assertEquals(tokens("<x>", "OP_LE32TOLE64"),
                asm(new Primitive(Primitive.Kind.LE32_TO_LE64, Collections.singletonList(new Variable("x")))));
    }

    @Test
    public void testCurveOperandOrder() {
        assertEquals(tokens("<Q>", "<P>", "<k>", "OP_ECMULSCALARVERIFY"),
                asm(new EcMulScalarVerify(new Variable("k"), new Variable("P"), new Variable("Q"))));
        assertEquals(tokens("<Q>", "<k>", "<P>", "OP_TWEAKVERIFY"),
                asm(new TweakVerify(new Variable("P"), new Variable("k"), new Variable("Q"))));
    }

    @Test
    public void testSignatureCheckVerify() {
        assertEquals(tokens("<m>", "<pk>", "<s>", "OP_CHECKSIGFROMSTACKVERIFY"),
                asm(new SignatureCheck(SignatureCheck.Kind.FROM_STACK_VERIFY, "s", "pk", "m")));
    }

    @Test
    public void testIfElseStructure() {
        final IfElse stmt = new IfElse(new Variable("c"),
                Collections.singletonList(new Require(new CheckSig("s1", "k1"), null)),
                Collections.singletonList(new Require(new CheckSig("s2", "k2"), null)));
        assertEquals(tokens("<c>", "OP_IF", "<k1>", "<s1>", "OP_CHECKSIG", "OP_ELSE", "<k2>", "<s2>", "OP_CHECKSIG", "OP_ENDIF"),
                asm(stmt));
    }

    @Test
    public void testBindings() {
        assertEquals(tokens("<a_txid>", "<a_gidx>", "OP_FINDASSETGROUPBYASSETID"),
                asm(new LetBinding("g", new GroupFind("a")), new VarAssign("x", new Variable("y"))));
    }

    @Test
    public void testArrayNodes() {
        assertEquals(tokens("OP_3"), asm(new ArrayLength("keys")));
        assertEquals(tokens("<keys>", "<i>"), asm(new ArrayIndex(new Variable("keys"), new Variable("i"))));
    }

    @Test
    public void testCovenantPlaceholder() {
        assertEquals(tokens("<new Self(a, b)>"), asm(new CovenantScript("Self", Arrays.asList("a", "b"))));
    }

    @Test
    public void testLoopReachingGeneratorIsAnError() {
        final ForIn loop = new ForIn("i", "x", new Variable("xs"), Collections.emptyList());
        assertThrows(IllegalStateException.class, () -> asm(loop));
    }
}
