package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Collections;

public final class Function {

    public final String name;
    public final List<Parameter> parameters;
    public final List<Statement> statements;
    public final boolean internal;

    public Function(String name, List<Parameter> parameters, List<Statement> statements, boolean internal) {
        this.name = name;
        this.parameters = Collections.unmodifiableList(parameters);
        this.statements = Collections.unmodifiableList(statements);
        this.internal = internal;
    }

    public Function withStatements(final List<Statement> newStatements) {
        return new Function(name, parameters, newStatements, internal);
    }

    @Override
    public String toString() {
        return "function " + name + parameters;
    }
}
