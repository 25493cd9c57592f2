package com.ymcmp.arkade.converter;

import java.util.Arrays;
import java.util.Collections;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;

import com.ymcmp.arkade.abi.AbiFunction;
import com.ymcmp.arkade.abi.AbiParameter;
import com.ymcmp.arkade.abi.RequireEntry;
import com.ymcmp.arkade.abi.CompilerMetadata;
import com.ymcmp.arkade.abi.ContractArtifact;

import static org.junit.jupiter.api.Assertions.*;

public class ConverterTest {

    private static final ContractArtifact ARTIFACT = new ContractArtifact("Demo",
            Collections.singletonList(new AbiParameter("owner", "pubkey")),
            Arrays.asList(
                    new AbiFunction("spend", Collections.singletonList(new AbiParameter("ownerSig", "signature")), true,
                            Arrays.asList(new RequireEntry(RequireEntry.SIGNATURE), new RequireEntry(RequireEntry.SERVER_SIGNATURE)),
                            Arrays.asList("<owner>", "<ownerSig>", "OP_CHECKSIG", "<SERVER_KEY>", "<serverSig>", "OP_CHECKSIG")),
                    new AbiFunction("spend", Collections.singletonList(new AbiParameter("ownerSig", "signature")), false,
                            Arrays.asList(new RequireEntry(RequireEntry.SIGNATURE), new RequireEntry(RequireEntry.OLDER, "Exit timelock of 10 blocks")),
                            Arrays.asList("<owner>", "<ownerSig>", "OP_CHECKSIG", "10", "OP_CHECKSEQUENCEVERIFY", "OP_DROP"))),
            "contract Demo() {}", new CompilerMetadata("arkade-compiler", "0.1.0"), "2026-01-01T00:00:00Z");

    @Test
    public void testJsonShape() throws Exception {
        final JsonConverter conv = new JsonConverter();
        conv.convert(ARTIFACT);
        final JsonNode root = new ObjectMapper().readTree(conv.getResult());

        assertEquals("Demo", root.get("contractName").asText());
        assertEquals("owner", root.get("constructorInputs").get(0).get("name").asText());
        assertEquals(2, root.get("functions").size());

        final JsonNode coop = root.get("functions").get(0);
        assertTrue(coop.get("serverVariant").asBoolean());
        assertEquals("signature", coop.get("require").get(0).get("type").asText());
        assertFalse(coop.get("require").get(0).has("message"));
        assertEquals("OP_CHECKSIG", coop.get("asm").get(2).asText());

        assertEquals("arkade-compiler", root.get("compiler").get("name").asText());
        assertEquals("2026-01-01T00:00:00Z", root.get("updatedAt").asText());
    }

    @Test
    public void testMetadataIsOmitted() throws Exception {
        final JsonConverter conv = new JsonConverter();
        conv.convert(ARTIFACT.withoutMetadata());
        final JsonNode root = new ObjectMapper().readTree(conv.getResult());

        assertFalse(root.has("source"));
        assertFalse(root.has("compiler"));
        assertFalse(root.has("updatedAt"));
    }

    @Test
    public void testJsonIsPrettyPrinted() {
        final JsonConverter conv = new JsonConverter();
        conv.convert(ARTIFACT);
        assertTrue(conv.getResult().contains("\n"));

        conv.reset();
        assertEquals("", conv.getResult());
    }

    @Test
    public void testListing() {
        final ListingConverter conv = new ListingConverter();
        conv.convert(ARTIFACT);
        final String[] lines = conv.getResult().split("\n", -1);

        assertEquals("# Demo", lines[0]);
        assertEquals("", lines[1]);
        assertEquals("# Function: spend (cooperative)", lines[2]);
        assertEquals("<owner>", lines[3]);
        assertEquals("OP_CHECKSIG", lines[8]);
        assertEquals("", lines[9]);
        assertEquals("# Function: spend (exit)", lines[10]);
        assertEquals("OP_DROP", lines[16]);
    }
}
