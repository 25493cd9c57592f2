package com.ymcmp.arkade.script;

import java.util.List;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptTest {

    @Test
    public void testSmallNumbersUseOpcodes() {
        final Script script = new Script().number(0).number(16).number(17).number(-1);
        assertEquals(Arrays.asList("OP_0", "OP_16", "17", "-1"), script.toList());
    }

    @Test
    public void testPlaceholders() {
        final Script script = new Script().placeholder("pk").op(Opcode.OP_CHECKSIG);
        assertEquals("<pk> OP_CHECKSIG", script.toString());
    }

    @Test
    public void testToListIsSnapshot() {
        final Script script = new Script().op(Opcode.OP_1);
        final List<String> before = script.toList();
        script.op(Opcode.OP_2);
        assertEquals(1, before.size());
        assertEquals(2, script.toList().size());
        assertThrows(UnsupportedOperationException.class, () -> before.add("x"));
    }

    @Test
    public void testOpcodeLookup() {
        assertEquals(Opcode.OP_3, Opcode.smallInt(3));
        assertThrows(IllegalArgumentException.class, () -> Opcode.smallInt(17));
    }
}
