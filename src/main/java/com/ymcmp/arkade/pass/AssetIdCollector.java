package com.ymcmp.arkade.pass;

import java.util.TreeSet;
import java.util.SortedSet;
import java.util.Collections;

import com.ymcmp.arkade.ast.Contract;
import com.ymcmp.arkade.ast.Function;
import com.ymcmp.arkade.ast.GroupFind;
import com.ymcmp.arkade.ast.AssetLookup;

public final class AssetIdCollector {

    private AssetIdCollector() {
    }

    /**
     * Names used as asset identifiers by lookups and group searches in any
     * function, sorted.
     */
    public static SortedSet<String> collect(final Contract contract) {
        final TreeSet<String> ids = new TreeSet<>();
        for (final Function function : contract.functions) {
            TreeWalker.forEachExpression(function.statements, expr -> {
                if (expr instanceof AssetLookup) {
                    ids.add(((AssetLookup) expr).assetId);
                } else if (expr instanceof GroupFind) {
                    ids.add(((GroupFind) expr).assetId);
                }
            });
        }
        return Collections.unmodifiableSortedSet(ids);
    }
}
