package com.ymcmp.arkade;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import java.util.Properties;

import com.ymcmp.arkade.abi.CompilerMetadata;

public final class CompilerInfo {

    public static final String RESOURCE = "compiler.properties";

    private static final CompilerMetadata METADATA = load();

    private CompilerInfo() {
    }

    public static CompilerMetadata getMetadata() {
        return METADATA;
    }

    private static CompilerMetadata load() {
        final Properties props = new Properties();
        try (final InputStream in = CompilerInfo.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, ex);
        }
        return new CompilerMetadata(props.getProperty("name", "arkade-compiler"),
                props.getProperty("version", "unknown"));
    }
}
