package dev.sint.bytecode;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Target machine opcodes: mnemonic, binary code and immediate shape.
 *
 * <p>{@link #LABEL} is a pseudo opcode; it has no binary encoding and never executes.</p>
 */
public enum Opcode {
    PUSH_INT("pushint", 0x81, Immediate.U64),
    DUP("dup", 0x49, Immediate.NONE),
    SWAP("swap", 0x4c, Immediate.NONE),
    POP("pop", 0x48, Immediate.NONE),
    COVER("cover", 0x4e, Immediate.U8),
    UNCOVER("uncover", 0x4f, Immediate.U8),
    BIT_AND("&", 0x1a, Immediate.NONE),
    BIT_OR("|", 0x19, Immediate.NONE),
    BIT_XOR("^", 0x1b, Immediate.NONE),
    BIT_NOT("~", 0x1c, Immediate.NONE),
    GET_BIT("getbit", 0x53, Immediate.NONE),
    ADDW("addw", 0x1e, Immediate.NONE),
    SHR("shr", 0x91, Immediate.NONE),
    SHL("shl", 0x90, Immediate.NONE),
    EQ("==", 0x12, Immediate.NONE),
    NOT("!", 0x14, Immediate.NONE),
    OR("||", 0x11, Immediate.NONE),
    AND("&&", 0x10, Immediate.NONE),
    ASSERT("assert", 0x44, Immediate.NONE),
    ERR("err", 0x00, Immediate.NONE),
    BZ("bz", 0x41, Immediate.LABEL),
    BNZ("bnz", 0x40, Immediate.LABEL),
    B("b", 0x42, Immediate.LABEL),
    LABEL(":", -1, Immediate.LABEL);

    /** Shape of the single immediate an opcode carries, if any. */
    public enum Immediate {
        NONE,
        U8,
        U64,
        LABEL
    }

    private static final Map<String, Opcode> BY_MNEMONIC = new TreeMap<>();
    private static final Opcode[] BY_CODE = new Opcode[256];

    static {
        for (Opcode op : values()) {
            if (op == LABEL) {
                continue;
            }
            BY_MNEMONIC.put(op.mnemonic, op);
            BY_CODE[op.code] = op;
        }
    }

    private final String mnemonic;
    private final int code;
    private final Immediate immediate;

    Opcode(String mnemonic, int code, Immediate immediate) {
        this.mnemonic = mnemonic;
        this.code = code;
        this.immediate = immediate;
    }

    public String mnemonic() {
        return mnemonic;
    }

    /** Binary opcode byte; {@code -1} for {@link #LABEL}. */
    public int code() {
        return code;
    }

    public Immediate immediate() {
        return immediate;
    }

    public int immediateCount() {
        return immediate == Immediate.NONE ? 0 : 1;
    }

    public boolean isBranch() {
        return this == BZ || this == BNZ || this == B;
    }

    public boolean isPseudo() {
        return this == LABEL;
    }

    public static Optional<Opcode> byMnemonic(String mnemonic) {
        return Optional.ofNullable(BY_MNEMONIC.get(mnemonic));
    }

    public static Optional<Opcode> byCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE[code]);
    }
}
