package com.ymcmp.arkade.abi;

import java.util.List;
import java.util.Optional;
import java.util.Collections;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Compiler output for one contract: its flattened constructor inputs and two
 * script variants per callable function.
 */
@JsonPropertyOrder({"contractName", "constructorInputs", "functions", "source", "compiler", "updatedAt"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ContractArtifact {

    @JsonProperty("contractName")
    public final String contractName;

    @JsonProperty("constructorInputs")
    public final List<AbiParameter> constructorInputs;

    @JsonProperty("functions")
    public final List<AbiFunction> functions;

    @JsonProperty("source")
    public final String source;

    @JsonProperty("compiler")
    public final CompilerMetadata compiler;

    @JsonProperty("updatedAt")
    public final String updatedAt;

    public ContractArtifact(String contractName, List<AbiParameter> constructorInputs, List<AbiFunction> functions,
                            String source, CompilerMetadata compiler, String updatedAt) {
        this.contractName = contractName;
        this.constructorInputs = Collections.unmodifiableList(constructorInputs);
        this.functions = Collections.unmodifiableList(functions);
        this.source = source;
        this.compiler = compiler;
        this.updatedAt = updatedAt;
    }

    public ContractArtifact withoutMetadata() {
        return new ContractArtifact(contractName, constructorInputs, functions, null, null, null);
    }

    public Optional<AbiFunction> findFunction(final String name, final boolean serverVariant) {
        return functions.stream()
                .filter(f -> f.name.equals(name) && f.serverVariant == serverVariant)
                .findFirst();
    }
}
