package com.ymcmp.arkade.abi;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import com.ymcmp.arkade.ast.Parameter;

@JsonPropertyOrder({"name", "type"})
public final class AbiParameter {

    @JsonProperty("name")
    public final String name;

    @JsonProperty("type")
    public final String type;

    public AbiParameter(String name, String type) {
        this.name = name;
        this.type = type;
    }

    public static AbiParameter of(final Parameter param) {
        return new AbiParameter(param.name, param.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj instanceof AbiParameter) {
            final AbiParameter other = (AbiParameter) obj;
            return name.equals(other.name) && type.equals(other.type);
        }
        return false;
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
