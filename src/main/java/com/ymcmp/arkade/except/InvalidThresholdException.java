package com.ymcmp.arkade.except;

public class InvalidThresholdException extends CompilationException {

    public InvalidThresholdException(long threshold, int keys) {
        super("Threshold " + threshold + " is not satisfiable with " + keys + " public key(s)");
    }

    public InvalidThresholdException(String message) {
        super(message);
    }
}
