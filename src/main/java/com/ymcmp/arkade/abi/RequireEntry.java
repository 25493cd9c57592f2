package com.ymcmp.arkade.abi;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Descriptive metadata for one requirement a function enforces. It does not
 * drive code generation.
 */
@JsonPropertyOrder({"type", "message"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RequireEntry {

    public static final String SIGNATURE = "signature";
    public static final String SIGNATURE_FROM_STACK = "signatureFromStack";
    public static final String MULTISIG = "multisig";
    public static final String OLDER = "older";
    public static final String HASH = "hash";
    public static final String ASSET_CHECK = "assetCheck";
    public static final String GROUP_CHECK = "groupCheck";
    public static final String COMPARISON = "comparison";
    public static final String SERVER_SIGNATURE = "serverSignature";
    public static final String N_OF_N_MULTISIG = "nOfNMultisig";

    @JsonProperty("type")
    public final String type;

    @JsonProperty("message")
    public final String message;

    public RequireEntry(String type, String message) {
        this.type = type;
        this.message = message;
    }

    public RequireEntry(String type) {
        this(type, null);
    }

    @Override
    public String toString() {
        return message == null ? type : type + " (" + message + ")";
    }
}
