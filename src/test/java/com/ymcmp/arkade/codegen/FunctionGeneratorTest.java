package com.ymcmp.arkade.codegen;

import java.util.List;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.ymcmp.arkade.abi.AbiFunction;
import com.ymcmp.arkade.abi.AbiParameter;
import com.ymcmp.arkade.abi.RequireEntry;

import com.ymcmp.arkade.ast.*;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionGeneratorTest {

    private static Contract contract(final Function function, final String serverKey, final Long exit) {
        return new Contract("Vault",
                Arrays.asList(new Parameter("alice", "pubkey"), new Parameter("bob", "pubkey"), new Parameter("op", "pubkey")),
                Collections.singletonList(function), serverKey, exit, null);
    }

    private static final Function SIGNED = new Function("spend",
            Collections.singletonList(new Parameter("aliceSig", "signature")),
            Collections.singletonList(new Require(new CheckSig("aliceSig", "alice"), null)), false);

    private static final Function INSPECTING = new Function("pay",
            Arrays.asList(new Parameter("aliceSig", "signature"), new Parameter("carol", "pubkey")),
            Arrays.asList(
                    new Require(new CheckSig("aliceSig", "alice"), null),
                    new Require(new Comparison(new OutputIntrospection(Literal.of(0), "value"),
                            BinaryOperator.GE, Literal.of(1000)), null)), false);

    @Test
    public void testCooperativeVariantAppendsServerSignature() {
        final AbiFunction result = FunctionGenerator.generate(SIGNED, contract(SIGNED, "op", 144L), true);

        assertTrue(result.serverVariant);
        assertEquals(Arrays.asList("<alice>", "<aliceSig>", "OP_CHECKSIG", "<SERVER_KEY>", "<serverSig>", "OP_CHECKSIG"), result.asm);
        assertEquals(RequireEntry.SERVER_SIGNATURE, result.require.get(result.require.size() - 1).type);
    }

    @Test
    public void testExitVariantAppendsTimelock() {
        final AbiFunction result = FunctionGenerator.generate(SIGNED, contract(SIGNED, "op", 144L), false);

        assertFalse(result.serverVariant);
        assertEquals(Arrays.asList("<alice>", "<aliceSig>", "OP_CHECKSIG", "144", "OP_CHECKSEQUENCEVERIFY", "OP_DROP"), result.asm);
        final RequireEntry last = result.require.get(result.require.size() - 1);
        assertEquals(RequireEntry.OLDER, last.type);
        assertEquals("Exit timelock of 144 blocks", last.message);
    }

    @Test
    public void testNoServerKeyNoTrailer() {
        final AbiFunction result = FunctionGenerator.generate(SIGNED, contract(SIGNED, null, null), true);
        assertEquals(Arrays.asList("<alice>", "<aliceSig>", "OP_CHECKSIG"), result.asm);
        assertFalse(result.hasRequirement(RequireEntry.SERVER_SIGNATURE));
    }

    @Test
    public void testIntrospectionFallbackOnExit() {
        final AbiFunction result = FunctionGenerator.generate(INSPECTING, contract(INSPECTING, "op", 144L), false);

        assertEquals(Arrays.asList(
                "<alice>", "<aliceSig>", "OP_CHECKSIGVERIFY",
                "<bob>", "<bobSig>", "OP_CHECKSIGVERIFY",
                "<carol>", "<carolSig>", "OP_CHECKSIG",
                "144", "OP_CHECKSEQUENCEVERIFY", "OP_DROP"), result.asm);

        assertEquals(Arrays.asList(
                new AbiParameter("aliceSig", "signature"),
                new AbiParameter("carol", "pubkey"),
                new AbiParameter("bobSig", "signature"),
                new AbiParameter("carolSig", "signature")), result.functionInputs);

        assertEquals(RequireEntry.N_OF_N_MULTISIG, result.require.get(0).type);
        assertEquals("3-of-3 signatures required (introspection fallback)", result.require.get(0).message);
        assertFalse(result.asm.contains("OP_INSPECTOUTPUTVALUE"));
    }

    @Test
    public void testIntrospectionKeptOnCooperativePath() {
        final AbiFunction result = FunctionGenerator.generate(INSPECTING, contract(INSPECTING, "op", 144L), true);
        assertTrue(result.asm.contains("OP_INSPECTOUTPUTVALUE"));
        assertFalse(result.hasRequirement(RequireEntry.N_OF_N_MULTISIG));
    }

    @Test
    public void testParticipantKeysExcludeServer() {
        final List<String> keys = FunctionGenerator.participantKeys(INSPECTING, contract(INSPECTING, "op", 144L));
        assertEquals(Arrays.asList("alice", "bob", "carol"), keys);
    }
}
