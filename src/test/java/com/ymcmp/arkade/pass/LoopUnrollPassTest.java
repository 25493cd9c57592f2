package com.ymcmp.arkade.pass;

import java.util.List;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.ymcmp.arkade.ast.*;

import com.ymcmp.arkade.except.UnsupportedIterableException;

import static org.junit.jupiter.api.Assertions.*;

public class LoopUnrollPassTest {

    private static Contract contractOf(final List<Parameter> params, final Function function) {
        return new Contract("Test", params, Collections.singletonList(function), null, null, null);
    }

    @Test
    public void testArrayLoopUnrollsToSlots() {
        final ForIn loop = new ForIn("i", "key", new Variable("keys"), Collections.singletonList(
                new Require(new CheckSig("sigs[i]", "key"), null)));
        final Function function = new Function("spend",
                Collections.singletonList(new Parameter("sigs", "signature[]")),
                Collections.singletonList(loop), false);
        final Contract contract = contractOf(Collections.singletonList(new Parameter("keys", "pubkey[]")), function);

        final Function result = new LoopUnrollPass().process(contract, function);

        assertEquals(AbiDecomposer.ARRAY_LENGTH, result.statements.size());
        for (int k = 0; k < AbiDecomposer.ARRAY_LENGTH; ++k) {
            final CheckSig sig = (CheckSig) ((Require) result.statements.get(k)).requirement;
            assertEquals("sigs_" + k, sig.signature);
            assertEquals("keys_" + k, sig.pubkey);
        }
    }

    @Test
    public void testAssetGroupLoopRewritesSums() {
        final Comparison cmp = new Comparison(
                new GroupProperty(new Variable("g"), "sumOutputs"),
                BinaryOperator.GE,
                new GroupProperty(new Variable("g"), "sumInputs"));
        final ForIn loop = new ForIn("k", "g", new Property(Property.ASSET_GROUPS),
                Collections.singletonList(new Require(cmp, "no burn")));
        final Function function = new Function("check", Collections.emptyList(), Collections.singletonList(loop), false);

        final Function result = new LoopUnrollPass().process(contractOf(Collections.emptyList(), function), function);

        assertEquals(3, result.statements.size());
        final Require second = (Require) result.statements.get(1);
        final Comparison rewritten = (Comparison) second.requirement;
        final GroupSum left = (GroupSum) rewritten.left;
        final GroupSum right = (GroupSum) rewritten.right;
        assertEquals(Literal.of(1), left.index);
        assertEquals(IoSource.OUTPUTS, left.source);
        assertEquals(IoSource.INPUTS, right.source);
        assertEquals("no burn", second.message);
    }

    @Test
    public void testOtherGroupPropertiesUseLiteralIndex() {
        final ForIn loop = new ForIn("k", "g", new Property(Property.ASSET_GROUPS), Collections.singletonList(
                new Require(Comparison.standalone(new GroupProperty(new Variable("g"), "isFresh")), null)));
        final Function function = new Function("check", Collections.emptyList(), Collections.singletonList(loop), false);

        final Function result = new LoopUnrollPass().process(contractOf(Collections.emptyList(), function), function);

        final GroupProperty prop = (GroupProperty) ((Comparison) ((Require) result.statements.get(2)).requirement).left;
        assertEquals(Literal.of(2), prop.group);
        assertEquals("isFresh", prop.property);
    }

    @Test
    public void testIndexVariableBecomesLiteral() {
        final ForIn loop = new ForIn("i", "v", new Variable("values"), Collections.singletonList(
                new Require(new Comparison(new OutputIntrospection(new Variable("i"), "value"),
                        BinaryOperator.GE, new Variable("v")), null)));
        final Function function = new Function("pay",
                Collections.singletonList(new Parameter("values", "int[]")),
                Collections.singletonList(loop), false);

        final Function result = new LoopUnrollPass().process(contractOf(Collections.emptyList(), function), function);

        final Comparison last = (Comparison) ((Require) result.statements.get(2)).requirement;
        assertEquals(Literal.of(2), ((OutputIntrospection) last.left).index);
        assertEquals(new Variable("values_2"), last.right);
    }

    @Test
    public void testNestedLoopsAreFullyUnrolled() {
        final ForIn inner = new ForIn("j", "b", new Variable("bs"), Collections.singletonList(
                new Require(new Comparison(new Variable("a"), BinaryOperator.NE, new Variable("b")), null)));
        final ForIn outer = new ForIn("i", "a", new Variable("as"), Collections.singletonList(inner));
        final Function function = new Function("pairs",
                Arrays.asList(new Parameter("as", "bytes[]"), new Parameter("bs", "bytes[]")),
                Collections.singletonList(outer), false);

        final Function result = new LoopUnrollPass().process(contractOf(Collections.emptyList(), function), function);

        assertEquals(9, result.statements.size());
        assertFalse(LoopUnrollPass.containsLoop(result.statements));
        final Comparison cmp = (Comparison) ((Require) result.statements.get(5)).requirement;
        assertEquals(new Variable("as_1"), cmp.left);
        assertEquals(new Variable("bs_2"), cmp.right);
    }

    @Test
    public void testLoopInsideIfIsUnrolled() {
        final ForIn loop = new ForIn("i", "x", new Variable("xs"), Collections.singletonList(
                new Require(Comparison.standalone(new Variable("x")), null)));
        final IfElse branch = new IfElse(Literal.TRUE, Collections.singletonList(loop), null);
        final Function function = new Function("f",
                Collections.singletonList(new Parameter("xs", "bool[]")),
                Collections.singletonList(branch), false);

        final Function result = new LoopUnrollPass().process(contractOf(Collections.emptyList(), function), function);

        final IfElse unrolled = (IfElse) result.statements.get(0);
        assertEquals(3, unrolled.thenBody.size());
        assertFalse(unrolled.hasElse());
    }

    @Test
    public void testUnsupportedIterableIsRejected() {
        final ForIn loop = new ForIn("i", "x", new Variable("notAnArray"), Collections.emptyList());
        final Function function = new Function("f",
                Collections.singletonList(new Parameter("notAnArray", "int")),
                Collections.singletonList(loop), false);
        final Contract contract = contractOf(Collections.emptyList(), function);

        final UnsupportedIterableException ex = assertThrows(UnsupportedIterableException.class,
                () -> new LoopUnrollPass().process(contract, function));
        assertTrue(ex.getMessage().contains("notAnArray"));
    }

    @Test
    public void testFunctionWithoutLoopsIsReturnedAsIs() {
        final Function function = new Function("f", Collections.emptyList(),
                Collections.singletonList(new Require(new CheckSig("s", "k"), null)), false);
        assertSame(function, new LoopUnrollPass().process(contractOf(Collections.emptyList(), function), function));
    }
}
