package dev.sint.bytecode;

import java.util.List;
import java.util.Objects;

public sealed interface Instruction
        permits Instruction.PushInt,
                Instruction.Dup,
                Instruction.Swap,
                Instruction.Pop,
                Instruction.Cover,
                Instruction.Uncover,
                Instruction.BitAnd,
                Instruction.BitOr,
                Instruction.BitXor,
                Instruction.BitNot,
                Instruction.GetBit,
                Instruction.AddW,
                Instruction.Shr,
                Instruction.Shl,
                Instruction.Eq,
                Instruction.Not,
                Instruction.Or,
                Instruction.And,
                Instruction.Assert,
                Instruction.Err,
                Instruction.Bz,
                Instruction.Bnz,
                Instruction.B,
                Instruction.Label {
    Opcode opcode();

    /** Words consumed from the top of the stack. */
    int pops();

    /** Words left on the stack afterwards. */
    int pushes();

    /** Pushes an unsigned 64-bit literal. */
    record PushInt(long value) implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.PUSH_INT;
        }

        @Override
        public int pops() {
            return 0;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    record Dup() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.DUP;
        }

        @Override
        public int pops() {
            return 1;
        }

        @Override
        public int pushes() {
            return 2;
        }
    }

    record Swap() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.SWAP;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 2;
        }
    }

    record Pop() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.POP;
        }

        @Override
        public int pops() {
            return 1;
        }

        @Override
        public int pushes() {
            return 0;
        }
    }

    /** Moves the top word down so that {@code depth} words sit above it. */
    record Cover(int depth) implements Instruction {
        public Cover {
            checkU8(depth, "depth");
        }

        @Override
        public Opcode opcode() {
            return Opcode.COVER;
        }

        @Override
        public int pops() {
            return depth + 1;
        }

        @Override
        public int pushes() {
            return depth + 1;
        }
    }

    /** Moves the word with {@code depth} words above it to the top. */
    record Uncover(int depth) implements Instruction {
        public Uncover {
            checkU8(depth, "depth");
        }

        @Override
        public Opcode opcode() {
            return Opcode.UNCOVER;
        }

        @Override
        public int pops() {
            return depth + 1;
        }

        @Override
        public int pushes() {
            return depth + 1;
        }
    }

    record BitAnd() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.BIT_AND;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    record BitOr() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.BIT_OR;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    record BitXor() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.BIT_XOR;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    record BitNot() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.BIT_NOT;
        }

        @Override
        public int pops() {
            return 1;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    /**
     * Pops a bit index, then a word, and pushes that bit of the word (0 = least significant).
     * An index above 63 traps.
     */
    record GetBit() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.GET_BIT;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    /** Unsigned 128-bit sum of the two top words: pushes the carry word, then the low word. */
    record AddW() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.ADDW;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 2;
        }
    }

    record Shr() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.SHR;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    record Shl() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.SHL;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    record Eq() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.EQ;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    record Not() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.NOT;
        }

        @Override
        public int pops() {
            return 1;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    record Or() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.OR;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    record And() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.AND;
        }

        @Override
        public int pops() {
            return 2;
        }

        @Override
        public int pushes() {
            return 1;
        }
    }

    record Assert() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.ASSERT;
        }

        @Override
        public int pops() {
            return 1;
        }

        @Override
        public int pushes() {
            return 0;
        }
    }

    record Err() implements Instruction {
        @Override
        public Opcode opcode() {
            return Opcode.ERR;
        }

        @Override
        public int pops() {
            return 0;
        }

        @Override
        public int pushes() {
            return 0;
        }
    }

    record Bz(String target) implements Instruction {
        public Bz {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public Opcode opcode() {
            return Opcode.BZ;
        }

        @Override
        public int pops() {
            return 1;
        }

        @Override
        public int pushes() {
            return 0;
        }
    }

    record Bnz(String target) implements Instruction {
        public Bnz {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public Opcode opcode() {
            return Opcode.BNZ;
        }

        @Override
        public int pops() {
            return 1;
        }

        @Override
        public int pushes() {
            return 0;
        }
    }

    record B(String target) implements Instruction {
        public B {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public Opcode opcode() {
            return Opcode.B;
        }

        @Override
        public int pops() {
            return 0;
        }

        @Override
        public int pushes() {
            return 0;
        }
    }

    record Label(String name) implements Instruction {
        public Label {
            Objects.requireNonNull(name, "name");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("label name must not be empty");
            }
        }

        @Override
        public Opcode opcode() {
            return Opcode.LABEL;
        }

        @Override
        public int pops() {
            return 0;
        }

        @Override
        public int pushes() {
            return 0;
        }
    }

    /**
     * Builds the instruction for a non-branch opcode from its numeric immediates.
     *
     * @throws IllegalArgumentException if the opcode is a branch or label, or the immediates do not fit
     */
    static Instruction of(Opcode op, List<Long> immediates) {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(immediates, "immediates");
        if (op.immediate() == Opcode.Immediate.LABEL) {
            throw new IllegalArgumentException("`" + op.mnemonic() + "` takes a label, not numeric immediates");
        }
        if (immediates.size() != op.immediateCount()) {
            throw new IllegalArgumentException(
                    "`"
                            + op.mnemonic()
                            + "` expects "
                            + op.immediateCount()
                            + " immediate(s), got "
                            + immediates.size());
        }
        return switch (op) {
            case PUSH_INT -> new PushInt(immediates.get(0));
            case DUP -> new Dup();
            case SWAP -> new Swap();
            case POP -> new Pop();
            case COVER -> new Cover(u8(immediates.get(0)));
            case UNCOVER -> new Uncover(u8(immediates.get(0)));
            case BIT_AND -> new BitAnd();
            case BIT_OR -> new BitOr();
            case BIT_XOR -> new BitXor();
            case BIT_NOT -> new BitNot();
            case GET_BIT -> new GetBit();
            case ADDW -> new AddW();
            case SHR -> new Shr();
            case SHL -> new Shl();
            case EQ -> new Eq();
            case NOT -> new Not();
            case OR -> new Or();
            case AND -> new And();
            case ASSERT -> new Assert();
            case ERR -> new Err();
            case BZ, BNZ, B, LABEL -> throw new IllegalArgumentException("unexpected opcode " + op);
        };
    }

    /** Builds a branch or label instruction. */
    static Instruction of(Opcode op, String label) {
        return switch (op) {
            case BZ -> new Bz(label);
            case BNZ -> new Bnz(label);
            case B -> new B(label);
            case LABEL -> new Label(label);
            default -> throw new IllegalArgumentException("`" + op.mnemonic() + "` does not take a label");
        };
    }

    /** Numeric immediates of this instruction, in encoding order. */
    static List<Long> immediates(Instruction inst) {
        if (inst instanceof PushInt i) {
            return List.of(i.value());
        }
        if (inst instanceof Cover i) {
            return List.of((long) i.depth());
        }
        if (inst instanceof Uncover i) {
            return List.of((long) i.depth());
        }
        return List.of();
    }

    /** Label operand of a branch or label instruction, or {@code null}. */
    static String label(Instruction inst) {
        if (inst instanceof Bz i) {
            return i.target();
        }
        if (inst instanceof Bnz i) {
            return i.target();
        }
        if (inst instanceof B i) {
            return i.target();
        }
        if (inst instanceof Label i) {
            return i.name();
        }
        return null;
    }

    private static int u8(long v) {
        if (v < 0 || v > 0xFF) {
            throw new IllegalArgumentException("u8 immediate out of range: " + v);
        }
        return (int) v;
    }

    private static void checkU8(int v, String what) {
        if (v < 0 || v > 0xFF) {
            throw new IllegalArgumentException(what + " must be in 0..255, got " + v);
        }
    }
}
