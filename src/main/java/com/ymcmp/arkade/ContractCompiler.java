package com.ymcmp.arkade;

import java.io.IOException;

import java.nio.file.Path;
import java.nio.file.Files;

import java.nio.charset.StandardCharsets;

import java.time.Clock;
import java.time.Instant;

import java.util.List;
import java.util.Arrays;
import java.util.ArrayList;
import java.util.SortedSet;

import java.util.logging.Logger;

import org.antlr.v4.runtime.CharStreams;

import com.ymcmp.arkade.abi.AbiFunction;
import com.ymcmp.arkade.abi.AbiParameter;
import com.ymcmp.arkade.abi.ContractArtifact;

import com.ymcmp.arkade.ast.Contract;
import com.ymcmp.arkade.ast.Function;

import com.ymcmp.arkade.codegen.FunctionGenerator;

import com.ymcmp.arkade.except.CannotLoadFileException;
import com.ymcmp.arkade.except.InvalidSourceFileException;

import com.ymcmp.arkade.pass.Pass;
import com.ymcmp.arkade.pass.AbiDecomposer;
import com.ymcmp.arkade.pass.LoopUnrollPass;
import com.ymcmp.arkade.pass.AssetIdCollector;

/**
 * Compiles one contract source into its artifact. Instances hold no state
 * between calls and can be shared.
 */
public class ContractCompiler {

    public static final Logger LOGGER = Logger.getLogger(ContractCompiler.class.getName());

    public static final String SOURCE_EXTENSION = "ark";

    private static final List<Pass> PASSES = Arrays.asList(new LoopUnrollPass());

    private final Clock clock;

    public ContractCompiler() {
        this(Clock.systemUTC());
    }

    public ContractCompiler(final Clock clock) {
        this.clock = clock;
    }

    public ContractArtifact compile(final Path path) {
        final String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
        if (!fileName.endsWith("." + SOURCE_EXTENSION)) {
            throw new InvalidSourceFileException(path, SOURCE_EXTENSION);
        }

        LOGGER.info("Loading file: " + path);
        try {
            return compile(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new CannotLoadFileException(path, ex);
        }
    }

    public ContractArtifact compile(final String source) {
        final Contract contract = new AstBuilder().build(CharStreams.fromString(source));
        return compile(contract, source);
    }

    public ContractArtifact compile(final Contract contract, final String source) {
        final SortedSet<String> assetIds = AssetIdCollector.collect(contract);
        if (!assetIds.isEmpty()) {
            LOGGER.info("Asset identifiers: " + assetIds);
        }
        final List<AbiParameter> constructorInputs = AbiDecomposer.decomposeConstructor(contract, assetIds);

        final List<AbiFunction> functions = new ArrayList<>();
        for (final Function declared : contract.functions) {
            if (declared.internal) {
                LOGGER.info("Skipping internal function " + declared.name);
                continue;
            }

            Function function = declared;
            for (final Pass pass : PASSES) {
                function = pass.process(contract, function);
                pass.reset();
            }

            LOGGER.info("Generating function " + function.name);
            functions.add(FunctionGenerator.generate(function, contract, true));
            functions.add(FunctionGenerator.generate(function, contract, false));
        }

        return new ContractArtifact(contract.name, constructorInputs, functions,
                source, CompilerInfo.getMetadata(), Instant.now(clock).toString());
    }
}
