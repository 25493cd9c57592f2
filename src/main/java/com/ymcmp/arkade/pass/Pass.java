package com.ymcmp.arkade.pass;

import com.ymcmp.arkade.ast.Contract;
import com.ymcmp.arkade.ast.Function;

public interface Pass {

    /**
     * Returns the rewritten function. The input is never modified.
     */
    public Function process(Contract contract, Function function);

    public default void reset() {
        // Do nothing
    }
}
