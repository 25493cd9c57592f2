package com.ymcmp.arkade.script;

import java.util.List;
import java.util.ArrayList;
import java.util.Collections;

/**
 * Append-only token buffer for generated script. A token is an opcode
 * mnemonic, a {@code <name>} placeholder resolved at spend time, or a literal
 * push written as text.
 */
public final class Script {

    private final List<String> tokens = new ArrayList<>();

    public Script op(final Opcode... ops) {
        for (final Opcode op : ops) {
            tokens.add(op.name());
        }
        return this;
    }

    public Script placeholder(final String name) {
        tokens.add(placeholderOf(name));
        return this;
    }

    public Script literal(final String text) {
        tokens.add(text);
        return this;
    }

    /**
     * Pushes {@code n}, using the single-byte opcode when one exists.
     */
    public Script number(final long n) {
        if (Opcode.isSmallInt(n)) {
            op(Opcode.smallInt((int) n));
        } else {
            tokens.add(Long.toString(n));
        }
        return this;
    }

    public List<String> toList() {
        return Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    public static String placeholderOf(final String name) {
        return "<" + name + ">";
    }

    @Override
    public String toString() {
        return String.join(" ", tokens);
    }
}
