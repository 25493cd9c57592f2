package com.ymcmp.arkade.pass;

import java.util.List;

import java.util.function.Consumer;

import com.ymcmp.arkade.ast.After;
import com.ymcmp.arkade.ast.ForIn;
import com.ymcmp.arkade.ast.IfElse;
import com.ymcmp.arkade.ast.Require;
import com.ymcmp.arkade.ast.CheckSig;
import com.ymcmp.arkade.ast.HashEqual;
import com.ymcmp.arkade.ast.Statement;
import com.ymcmp.arkade.ast.VarAssign;
import com.ymcmp.arkade.ast.Comparison;
import com.ymcmp.arkade.ast.Expression;
import com.ymcmp.arkade.ast.LetBinding;
import com.ymcmp.arkade.ast.CheckMultisig;
import com.ymcmp.arkade.ast.StatementVisitor;
import com.ymcmp.arkade.ast.CheckSigFromStack;
import com.ymcmp.arkade.ast.RequirementVisitor;

/**
 * Visits every expression node reachable from a statement list, parents
 * before their operands.
 */
public final class TreeWalker implements StatementVisitor<Void>, RequirementVisitor<Void> {

    private final Consumer<Expression> action;

    private TreeWalker(Consumer<Expression> action) {
        this.action = action;
    }

    public static void forEachExpression(final List<Statement> statements, final Consumer<Expression> action) {
        new TreeWalker(action).walk(statements);
    }

    public static void forEachExpression(final Expression expr, final Consumer<Expression> action) {
        new TreeWalker(action).walk(expr);
    }

    private void walk(final List<Statement> statements) {
        if (statements == null) return;
        for (final Statement stmt : statements) {
            stmt.accept(this);
        }
    }

    private void walk(final Expression expr) {
        action.accept(expr);
        for (final Expression operand : expr.getOperands()) {
            walk(operand);
        }
    }

    @Override
    public Void visitRequire(Require stmt) {
        return stmt.requirement.accept(this);
    }

    @Override
    public Void visitLetBinding(LetBinding stmt) {
        walk(stmt.value);
        return null;
    }

    @Override
    public Void visitVarAssign(VarAssign stmt) {
        walk(stmt.value);
        return null;
    }

    @Override
    public Void visitIfElse(IfElse stmt) {
        walk(stmt.condition);
        walk(stmt.thenBody);
        walk(stmt.elseBody);
        return null;
    }

    @Override
    public Void visitForIn(ForIn stmt) {
        walk(stmt.iterable);
        walk(stmt.body);
        return null;
    }

    @Override
    public Void visitComparison(Comparison req) {
        walk(req.left);
        walk(req.right);
        return null;
    }

    // The remaining requirements only hold names

    @Override
    public Void visitCheckSig(CheckSig req) {
        return null;
    }

    @Override
    public Void visitCheckSigFromStack(CheckSigFromStack req) {
        return null;
    }

    @Override
    public Void visitCheckMultisig(CheckMultisig req) {
        return null;
    }

    @Override
    public Void visitAfter(After req) {
        return null;
    }

    @Override
    public Void visitHashEqual(HashEqual req) {
        return null;
    }
}
