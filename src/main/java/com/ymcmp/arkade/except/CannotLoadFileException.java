package com.ymcmp.arkade.except;

import java.nio.file.Path;

public class CannotLoadFileException extends CompilationException {

    public CannotLoadFileException(final Path p, Throwable stacktrace) {
        super("Cannot load file: " + p, stacktrace);
    }
}
