package dev.sint.bytecode;

import java.util.List;

final class AsmWriter {
    private AsmWriter() {}

    static String write(Program program) {
        StringBuilder sb = new StringBuilder();
        for (Instruction inst : program.code()) {
            sb.append(line(inst)).append('\n');
        }
        return sb.toString();
    }

    static String line(Instruction inst) {
        Opcode op = inst.opcode();
        if (op.isPseudo()) {
            return Instruction.label(inst) + ":";
        }
        StringBuilder sb = new StringBuilder(op.mnemonic());
        if (op.immediate() == Opcode.Immediate.LABEL) {
            sb.append(' ').append(Instruction.label(inst));
            return sb.toString();
        }
        List<Long> immediates = Instruction.immediates(inst);
        for (long v : immediates) {
            sb.append(' ').append(Long.toUnsignedString(v));
        }
        return sb.toString();
    }
}
