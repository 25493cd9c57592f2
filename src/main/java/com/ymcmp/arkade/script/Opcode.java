package com.ymcmp.arkade.script;

public enum Opcode {
    OP_0, OP_1, OP_2, OP_3, OP_4, OP_5, OP_6, OP_7, OP_8,
    OP_9, OP_10, OP_11, OP_12, OP_13, OP_14, OP_15, OP_16,
    OP_1NEGATE,

    OP_IF,
    OP_ELSE,
    OP_ENDIF,
    OP_VERIFY,

    OP_DROP,
    OP_DUP,
    OP_NIP,

    OP_EQUAL,
    OP_NOT,
    OP_NUMEQUAL,
    OP_GREATERTHANOREQUAL,
    OP_GREATERTHAN,
    OP_LESSTHANOREQUAL,
    OP_LESSTHAN,

    OP_ADD64,
    OP_SUB64,
    OP_MUL64,
    OP_DIV64,
    OP_NEG64,
    OP_GREATERTHANOREQUAL64,
    OP_GREATERTHAN64,
    OP_LESSTHANOREQUAL64,
    OP_LESSTHAN64,
    OP_SCRIPTNUMTOLE64,
    OP_LE64TOSCRIPTNUM,
    OP_LE32TOLE64,

    OP_SHA256,
    OP_SHA256INITIALIZE,
    OP_SHA256UPDATE,
    OP_SHA256FINALIZE,

    OP_CHECKSIG,
    OP_CHECKSIGVERIFY,
    OP_CHECKSIGADD,
    OP_CHECKMULTISIG,
    OP_CHECKSIGFROMSTACK,
    OP_CHECKSIGFROMSTACKVERIFY,
    OP_ECMULSCALARVERIFY,
    OP_TWEAKVERIFY,

    OP_CHECKLOCKTIMEVERIFY,
    OP_CHECKSEQUENCEVERIFY,

    OP_INSPECTVERSION,
    OP_INSPECTLOCKTIME,
    OP_INSPECTNUMINPUTS,
    OP_INSPECTNUMOUTPUTS,
    OP_TXWEIGHT,
    OP_TXHASH,

    OP_PUSHCURRENTINPUTINDEX,
    OP_INSPECTINPUTVALUE,
    OP_INSPECTINPUTSCRIPTPUBKEY,
    OP_INSPECTINPUTSEQUENCE,
    OP_INSPECTINPUTOUTPOINT,
    OP_INSPECTINPUTISSUANCE,
    OP_INSPECTOUTPUTVALUE,
    OP_INSPECTOUTPUTSCRIPTPUBKEY,
    OP_INSPECTOUTPUTNONCE,

    OP_INSPECTINASSETLOOKUP,
    OP_INSPECTOUTASSETLOOKUP,
    OP_INSPECTINASSETCOUNT,
    OP_INSPECTOUTASSETCOUNT,
    OP_INSPECTINASSETAT,
    OP_INSPECTOUTASSETAT,

    OP_INSPECTNUMASSETGROUPS,
    OP_FINDASSETGROUPBYASSETID,
    OP_INSPECTASSETGROUP,
    OP_INSPECTASSETGROUPNUM,
    OP_INSPECTASSETGROUPSUM,
    OP_INSPECTASSETGROUPCTRL,
    OP_INSPECTASSETGROUPMETADATAHASH,
    OP_INSPECTASSETGROUPASSETID;

    private static final int MAX_SMALL_INT = 16;

    public static boolean isSmallInt(final long n) {
        return 0 <= n && n <= MAX_SMALL_INT;
    }

    public static Opcode smallInt(final int n) {
        if (!isSmallInt(n)) {
            throw new IllegalArgumentException("No single-opcode push for " + n);
        }
        return values()[OP_0.ordinal() + n];
    }
}
