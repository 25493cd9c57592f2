package com.ymcmp.arkade.pass;

import com.ymcmp.arkade.ast.AssetAt;
import com.ymcmp.arkade.ast.Function;
import com.ymcmp.arkade.ast.GroupSum;
import com.ymcmp.arkade.ast.GroupFind;
import com.ymcmp.arkade.ast.GroupNumIO;
import com.ymcmp.arkade.ast.AssetCount;
import com.ymcmp.arkade.ast.Expression;
import com.ymcmp.arkade.ast.AssetLookup;
import com.ymcmp.arkade.ast.CurrentInput;
import com.ymcmp.arkade.ast.GroupIOAccess;
import com.ymcmp.arkade.ast.GroupProperty;
import com.ymcmp.arkade.ast.CovenantScript;
import com.ymcmp.arkade.ast.TxIntrospection;
import com.ymcmp.arkade.ast.AssetGroupsLength;
import com.ymcmp.arkade.ast.InputIntrospection;
import com.ymcmp.arkade.ast.OutputIntrospection;

public final class IntrospectionAnalyzer {

    private IntrospectionAnalyzer() {
    }

    /**
     * A function uses introspection when any expression in its body reads
     * transaction, input, output or asset data. Such functions cannot be
     * spent unilaterally with the same script.
     */
    public static boolean usesIntrospection(final Function function) {
        final boolean[] found = { false };
        TreeWalker.forEachExpression(function.statements, expr -> {
            if (isIntrospection(expr)) found[0] = true;
        });
        return found[0];
    }

    public static boolean isIntrospection(final Expression expr) {
        return expr instanceof TxIntrospection
                || expr instanceof InputIntrospection
                || expr instanceof OutputIntrospection
                || expr instanceof CurrentInput
                || expr instanceof AssetLookup
                || expr instanceof AssetCount
                || expr instanceof AssetAt
                || expr instanceof GroupFind
                || expr instanceof GroupProperty
                || expr instanceof AssetGroupsLength
                || expr instanceof GroupSum
                || expr instanceof GroupNumIO
                || expr instanceof GroupIOAccess
                || expr instanceof CovenantScript;
    }
}
