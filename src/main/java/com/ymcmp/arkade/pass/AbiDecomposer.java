package com.ymcmp.arkade.pass;

import java.util.Set;
import java.util.List;
import java.util.ArrayList;

import com.ymcmp.arkade.abi.AbiParameter;

import com.ymcmp.arkade.ast.Contract;
import com.ymcmp.arkade.ast.Parameter;

/**
 * Rewrites source parameters into the flat inputs a spender supplies.
 * An asset identifier becomes its transaction id and group index, and an
 * array becomes {@link #ARRAY_LENGTH} numbered slots.
 */
public final class AbiDecomposer {

    public static final int ARRAY_LENGTH = 3;

    public static final String TXID_SUFFIX = "_txid";
    public static final String GIDX_SUFFIX = "_gidx";

    private AbiDecomposer() {
    }

    public static List<AbiParameter> decomposeConstructor(final Contract contract, final Set<String> assetIds) {
        final ArrayList<AbiParameter> result = new ArrayList<>();
        for (final Parameter param : contract.parameters) {
            if (assetIds.contains(param.name) && "bytes32".equals(param.type)) {
                result.add(new AbiParameter(param.name + TXID_SUFFIX, "bytes32"));
                result.add(new AbiParameter(param.name + GIDX_SUFFIX, "int"));
            } else {
                flattenInto(param, result);
            }
        }
        return result;
    }

    public static List<AbiParameter> flatten(final List<Parameter> params) {
        final ArrayList<AbiParameter> result = new ArrayList<>();
        for (final Parameter param : params) {
            flattenInto(param, result);
        }
        return result;
    }

    public static String slotName(final String arrayName, final int slot) {
        return arrayName + "_" + slot;
    }

    private static void flattenInto(final Parameter param, final List<AbiParameter> result) {
        if (!param.isArray()) {
            result.add(AbiParameter.of(param));
            return;
        }

        final String base = param.getBaseType();
        for (int i = 0; i < ARRAY_LENGTH; ++i) {
            result.add(new AbiParameter(slotName(param.name, i), base));
        }
    }
}
