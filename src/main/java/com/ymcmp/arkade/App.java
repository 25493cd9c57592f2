package com.ymcmp.arkade;

import java.io.IOException;
import java.io.PrintStream;

import java.util.List;
import java.util.ArrayList;

import java.util.logging.Level;
import java.util.logging.Logger;

import java.nio.file.Path;
import java.nio.file.Files;
import java.nio.file.Paths;

import java.nio.charset.StandardCharsets;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import com.ymcmp.arkade.abi.ContractArtifact;

import com.ymcmp.arkade.converter.Converter;
import com.ymcmp.arkade.converter.JsonConverter;
import com.ymcmp.arkade.converter.ListingConverter;

import com.ymcmp.arkade.except.CompilationException;

public class App {

    public static final int EXIT_OK = 0;
    public static final int EXIT_COMPILE_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    // Held so the configured level is not lost with the logger
    private static final Logger PACKAGE_LOGGER = Logger.getLogger(App.class.getPackage().getName());

    public static class Args {

        @Parameter(description="<file.ark>", converter=PathConverter.class)
        private List<Path> inputPaths = new ArrayList<>();

        @Parameter(names={"--output", "-o"}, description="Output JSON path, defaults to <name>.json", converter=PathConverter.class)
        private Path output;

        @Parameter(names={"--listing"}, description="Also write an opcode listing to this path", converter=PathConverter.class)
        private Path listing;

        @Parameter(names={"--no-metadata"}, description="Omit source, compiler and timestamp from the output")
        private boolean noMetadata = false;

        @Parameter(names={"--debug"}, description="Run compiler in debug mode")
        private boolean debug = false;

        @Parameter(names={"--help", "-h"}, description="Displays help", help=true)
        private boolean help = false;
    }

    public static class PathConverter implements IStringConverter<Path> {
        @Override
        public Path convert(String value) {
            return Paths.get(value);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(final String[] args, final PrintStream out, final PrintStream err) {
        final Args argData = new Args();
        final JCommander instance = JCommander.newBuilder()
                .programName("arkadec")
                .addObject(argData)
                .build();
        try {
            instance.parse(args);
        } catch (ParameterException ex) {
            err.println(ex.getMessage());
            err.print(usage(instance));
            return EXIT_USAGE;
        }

        if (argData.help) {
            out.print(usage(instance));
            return EXIT_OK;
        }

        if (argData.inputPaths.size() != 1) {
            err.println(argData.inputPaths.isEmpty() ? "Missing input file" : "Expected exactly one input file");
            err.print(usage(instance));
            return EXIT_USAGE;
        }

        PACKAGE_LOGGER.setLevel(argData.debug ? Level.INFO : Level.OFF);

        final Path input = argData.inputPaths.get(0);
        final Path output = argData.output != null ? argData.output : defaultOutput(input);
        try {
            ContractArtifact artifact = new ContractCompiler().compile(input);
            if (argData.noMetadata) {
                artifact = artifact.withoutMetadata();
            }

            write(output, new JsonConverter(), artifact);
            if (argData.listing != null) {
                write(argData.listing, new ListingConverter(), artifact);
            }
        } catch (CompilationException ex) {
            err.println("Compilation error: " + ex.getMessage());
            return EXIT_COMPILE_ERROR;
        } catch (IOException ex) {
            err.println("Compilation error: Cannot write output: " + ex.getMessage());
            return EXIT_COMPILE_ERROR;
        }

        out.println("Compilation successful. Output written to " + output);
        return EXIT_OK;
    }

    static Path defaultOutput(final Path input) {
        final String fileName = input.getFileName().toString();
        final int dot = fileName.lastIndexOf('.');
        return Paths.get((dot < 0 ? fileName : fileName.substring(0, dot)) + ".json");
    }

    private static void write(final Path path, final Converter conv, final ContractArtifact artifact) throws IOException {
        conv.convert(artifact);
        Files.write(path, conv.getResult().getBytes(StandardCharsets.UTF_8));
        conv.reset();
    }

    private static String usage(final JCommander instance) {
        final StringBuilder sb = new StringBuilder();
        instance.getUsageFormatter().usage(sb);
        return sb.toString();
    }
}
