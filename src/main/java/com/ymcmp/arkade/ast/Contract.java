package com.ymcmp.arkade.ast;

import java.util.List;
import java.util.Optional;
import java.util.Collections;

/**
 * Root of the syntax tree. The tree is built once per compilation and every
 * pass that rewrites it produces a new instance.
 */
public final class Contract {

    public final String name;
    public final List<Parameter> parameters;
    public final List<Function> functions;

    private final String serverKey;
    private final Long exitTimelock;
    private final Long renewTimelock;

    public Contract(String name, List<Parameter> parameters, List<Function> functions,
                    String serverKey, Long exitTimelock, Long renewTimelock) {
        this.name = name;
        this.parameters = Collections.unmodifiableList(parameters);
        this.functions = Collections.unmodifiableList(functions);
        this.serverKey = serverKey;
        this.exitTimelock = exitTimelock;
        this.renewTimelock = renewTimelock;
    }

    public boolean hasServerKey() {
        return serverKey != null;
    }

    public Optional<String> getServerKey() {
        return Optional.ofNullable(serverKey);
    }

    public Optional<Long> getExitTimelock() {
        return Optional.ofNullable(exitTimelock);
    }

    public Optional<Long> getRenewTimelock() {
        return Optional.ofNullable(renewTimelock);
    }
}
