package com.ymcmp.arkade.converter;

import java.io.UncheckedIOException;

import java.util.List;
import java.util.ArrayList;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import com.fasterxml.jackson.core.JsonProcessingException;

import com.ymcmp.arkade.abi.ContractArtifact;

public class JsonConverter implements Converter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final List<String> list = new ArrayList<>();

    @Override
    public void convert(final ContractArtifact artifact) {
        try {
            list.add(MAPPER.writeValueAsString(artifact));
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Cannot serialize artifact of " + artifact.contractName, ex);
        }
    }

    @Override
    public void reset() {
        list.clear();
    }

    @Override
    public String getResult() {
        return String.join("\n", list);
    }
}
