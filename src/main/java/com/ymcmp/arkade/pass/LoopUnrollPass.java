package com.ymcmp.arkade.pass;

import java.util.List;
import java.util.ArrayList;

import java.util.logging.Logger;

import com.ymcmp.arkade.ast.ForIn;
import com.ymcmp.arkade.ast.IfElse;
import com.ymcmp.arkade.ast.Contract;
import com.ymcmp.arkade.ast.Function;
import com.ymcmp.arkade.ast.Property;
import com.ymcmp.arkade.ast.Variable;
import com.ymcmp.arkade.ast.Parameter;
import com.ymcmp.arkade.ast.Statement;
import com.ymcmp.arkade.ast.Expression;

import com.ymcmp.arkade.except.UnsupportedIterableException;

/**
 * Replaces every {@code for} loop with {@link AbiDecomposer#ARRAY_LENGTH}
 * substituted copies of its body. Copies are unrolled again until no loop
 * remains.
 */
public final class LoopUnrollPass implements Pass {

    public static final Logger LOGGER = Logger.getLogger(LoopUnrollPass.class.getName());

    @Override
    public Function process(final Contract contract, final Function function) {
        if (!containsLoop(function.statements)) {
            return function;
        }
        return function.withStatements(unroll(contract, function, function.statements));
    }

    private List<Statement> unroll(final Contract contract, final Function function, final List<Statement> block) {
        final ArrayList<Statement> result = new ArrayList<>();
        for (final Statement stmt : block) {
            if (stmt instanceof ForIn) {
                final ForIn loop = (ForIn) stmt;
                final String arrayName = resolveIterable(contract, function, loop.iterable);
                LOGGER.fine(() -> "Unrolling " + loop.iterable + " in " + function.name);

                for (int k = 0; k < AbiDecomposer.ARRAY_LENGTH; ++k) {
                    final LoopSubstitution subst = new LoopSubstitution(loop.indexVar, loop.valueVar, arrayName, k);
                    // Inner loops are unrolled against the substituted body
                    result.addAll(unroll(contract, function, subst.substitute(loop.body)));
                }
            } else if (stmt instanceof IfElse) {
                final IfElse branch = (IfElse) stmt;
                result.add(new IfElse(branch.condition,
                        unroll(contract, function, branch.thenBody),
                        branch.hasElse() ? unroll(contract, function, branch.elseBody) : null));
            } else {
                result.add(stmt);
            }
        }
        return result;
    }

    /**
     * Returns the array name being iterated, or {@code null} for asset groups.
     */
    private String resolveIterable(final Contract contract, final Function function, final Expression iterable) {
        if (iterable instanceof Property && ((Property) iterable).isAssetGroups()) {
            return null;
        }

        if (iterable instanceof Variable) {
            final String name = ((Variable) iterable).name;
            if (isArrayParameter(contract.parameters, name) || isArrayParameter(function.parameters, name)) {
                return name;
            }
        }

        throw new UnsupportedIterableException(iterable.toString(), function.name);
    }

    private static boolean isArrayParameter(final List<Parameter> params, final String name) {
        for (final Parameter param : params) {
            if (param.name.equals(name)) {
                return param.isArray();
            }
        }
        return false;
    }

    static boolean containsLoop(final List<Statement> block) {
        if (block == null) return false;
        for (final Statement stmt : block) {
            if (stmt instanceof ForIn) return true;
            if (stmt instanceof IfElse) {
                final IfElse branch = (IfElse) stmt;
                if (containsLoop(branch.thenBody) || containsLoop(branch.elseBody)) return true;
            }
        }
        return false;
    }
}
