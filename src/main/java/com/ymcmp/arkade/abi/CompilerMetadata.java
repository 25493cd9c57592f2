package com.ymcmp.arkade.abi;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"name", "version"})
public final class CompilerMetadata {

    @JsonProperty("name")
    public final String name;

    @JsonProperty("version")
    public final String version;

    public CompilerMetadata(String name, String version) {
        this.name = name;
        this.version = version;
    }

    @Override
    public String toString() {
        return name + " " + version;
    }
}
