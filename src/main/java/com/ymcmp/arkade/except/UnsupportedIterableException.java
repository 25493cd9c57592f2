package com.ymcmp.arkade.except;

public class UnsupportedIterableException extends CompilationException {

    public UnsupportedIterableException(String iterable, String function) {
        super("Cannot unroll loop over " + iterable + " in function " + function
                + ": only tx.assetGroups and array parameters can be iterated");
    }
}
