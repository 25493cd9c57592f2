package com.ymcmp.arkade.abi;

import java.util.List;
import java.util.Collections;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"name", "functionInputs", "serverVariant", "require", "asm"})
public final class AbiFunction {

    @JsonProperty("name")
    public final String name;

    @JsonProperty("functionInputs")
    public final List<AbiParameter> functionInputs;

    @JsonProperty("serverVariant")
    public final boolean serverVariant;

    @JsonProperty("require")
    public final List<RequireEntry> require;

    @JsonProperty("asm")
    public final List<String> asm;

    public AbiFunction(String name, List<AbiParameter> functionInputs, boolean serverVariant,
                       List<RequireEntry> require, List<String> asm) {
        this.name = name;
        this.functionInputs = Collections.unmodifiableList(functionInputs);
        this.serverVariant = serverVariant;
        this.require = Collections.unmodifiableList(require);
        this.asm = Collections.unmodifiableList(asm);
    }

    public boolean hasRequirement(final String type) {
        return require.stream().anyMatch(r -> r.type.equals(type));
    }

    @Override
    public String toString() {
        return name + (serverVariant ? " (cooperative)" : " (exit)");
    }
}
