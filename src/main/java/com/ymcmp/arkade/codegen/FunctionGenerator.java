package com.ymcmp.arkade.codegen;

import java.util.List;
import java.util.ArrayList;

import java.util.logging.Logger;

import com.ymcmp.arkade.abi.AbiFunction;
import com.ymcmp.arkade.abi.AbiParameter;
import com.ymcmp.arkade.abi.RequireEntry;

import com.ymcmp.arkade.ast.Contract;
import com.ymcmp.arkade.ast.Function;
import com.ymcmp.arkade.ast.Parameter;

import com.ymcmp.arkade.pass.AbiDecomposer;
import com.ymcmp.arkade.pass.IntrospectionAnalyzer;

import com.ymcmp.arkade.script.Script;

import static com.ymcmp.arkade.script.Opcode.*;

/**
 * Builds one spending path of a function. The cooperative path appends the
 * operator co-signature; the exit path appends the unilateral exit delay
 * and, when the body inspects the transaction, replaces the body with an
 * N-of-N signature check over every participant key.
 */
public final class FunctionGenerator {

    public static final Logger LOGGER = Logger.getLogger(FunctionGenerator.class.getName());

    public static final String SERVER_KEY = "SERVER_KEY";
    public static final String SERVER_SIG = "serverSig";
    public static final String SIG_SUFFIX = "Sig";

    private FunctionGenerator() {
    }

    public static AbiFunction generate(final Function function, final Contract contract, final boolean serverVariant) {
        final boolean fallback = !serverVariant && IntrospectionAnalyzer.usesIntrospection(function);
        LOGGER.fine(() -> "Generating " + function.name + (serverVariant ? " (cooperative)" : " (exit)")
                + (fallback ? " with N-of-N fallback" : ""));

        final List<AbiParameter> inputs = new ArrayList<>(AbiDecomposer.flatten(function.parameters));
        final List<RequireEntry> require = new ArrayList<>();
        final Script script = new Script();

        if (fallback) {
            final List<String> keys = participantKeys(function, contract);
            for (final String key : keys) {
                if (!hasSignatureFor(inputs, key)) {
                    inputs.add(new AbiParameter(key + SIG_SUFFIX, "signature"));
                }
            }

            final int n = keys.size();
            require.add(new RequireEntry(RequireEntry.N_OF_N_MULTISIG,
                    n + "-of-" + n + " signatures required (introspection fallback)"));

            for (int i = 0; i < n; ++i) {
                final String key = keys.get(i);
                script.placeholder(key).placeholder(key + SIG_SUFFIX)
                        .op(i == n - 1 ? OP_CHECKSIG : OP_CHECKSIGVERIFY);
            }
        } else {
            require.addAll(RequirementMapper.map(function.statements));
            new CodeGenerator(script).emit(function.statements);
        }

        if (serverVariant) {
            if (contract.hasServerKey()) {
                require.add(new RequireEntry(RequireEntry.SERVER_SIGNATURE));
                script.placeholder(SERVER_KEY).placeholder(SERVER_SIG).op(OP_CHECKSIG);
            }
        } else {
            contract.getExitTimelock().ifPresent(exit -> {
                require.add(new RequireEntry(RequireEntry.OLDER, "Exit timelock of " + exit + " blocks"));
                script.literal(Long.toString(exit)).op(OP_CHECKSEQUENCEVERIFY, OP_DROP);
            });
        }

        return new AbiFunction(function.name, inputs, serverVariant, require, script.toList());
    }

    /**
     * Every {@code pubkey} input of the contract and then the function, in
     * declaration order, except the operator key.
     */
    public static List<String> participantKeys(final Function function, final Contract contract) {
        final String serverKey = contract.getServerKey().orElse(null);
        final List<String> keys = new ArrayList<>();
        addKeys(keys, contract.parameters, serverKey);
        addKeys(keys, function.parameters, serverKey);
        return keys;
    }

    private static void addKeys(final List<String> keys, final List<Parameter> params, final String serverKey) {
        for (final AbiParameter param : AbiDecomposer.flatten(params)) {
            if ("pubkey".equals(param.type) && !param.name.equals(serverKey)) {
                keys.add(param.name);
            }
        }
    }

    private static boolean hasSignatureFor(final List<AbiParameter> inputs, final String key) {
        for (final AbiParameter input : inputs) {
            if ("signature".equals(input.type) && input.name.contains(key)) {
                return true;
            }
        }
        return false;
    }
}
