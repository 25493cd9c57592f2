package com.ymcmp.arkade.converter;

import java.util.List;
import java.util.ArrayList;

import java.util.stream.Collectors;

import com.ymcmp.arkade.abi.AbiFunction;
import com.ymcmp.arkade.abi.ContractArtifact;

/**
 * Human readable opcode listing, one token per line.
 */
public class ListingConverter implements Converter {

    private final List<String> list = new ArrayList<>();

    @Override
    public void convert(final ContractArtifact artifact) {
        final StringBuilder sb = new StringBuilder();
        sb.append("# ").append(artifact.contractName).append('\n')
                .append('\n');

        for (final AbiFunction function : artifact.functions) {
            sb.append("# Function: ").append(function.name)
                    .append(function.serverVariant ? " (cooperative)" : " (exit)").append('\n');
            for (final String token : function.asm) {
                sb.append(token).append('\n');
            }
            sb.append('\n');
        }

        list.add(sb.toString());
    }

    @Override
    public void reset() {
        list.clear();
    }

    @Override
    public String getResult() {
        return list.stream().collect(Collectors.joining("\n"));
    }
}
