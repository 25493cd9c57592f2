package com.ymcmp.arkade.except;

public class DuplicateSymbolException extends CompilationException {

    public DuplicateSymbolException(String name, String scope) {
        super("Duplicate symbol: " + name + " in " + scope);
    }
}
