package com.ymcmp.arkade.except;

import java.nio.file.Path;

public class InvalidSourceFileException extends CompilationException {

    public InvalidSourceFileException(final Path p, final String extension) {
        super("Input file must have ." + extension + " extension: " + p);
    }
}
