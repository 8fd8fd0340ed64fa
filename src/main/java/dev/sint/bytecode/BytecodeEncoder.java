package dev.sint.bytecode;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

final class BytecodeEncoder {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    byte[] encode(Program program) throws BytecodeEncodeException {
        writeBytes(Bytecode.MAGIC);
        writeU16(Bytecode.VERSION_MAJOR);
        writeU16(Bytecode.VERSION_MINOR);
        writeU32(program.instructionCount());

        // Byte offset (relative to the instruction stream) of every pc; labels take no space.
        List<Instruction> code = program.code();
        int[] offsets = new int[code.size() + 1];
        int offset = 0;
        for (int pc = 0; pc < code.size(); pc++) {
            offsets[pc] = offset;
            offset += encodedSize(code.get(pc));
        }
        offsets[code.size()] = offset;

        Map<String, Integer> labelOffsets = new TreeMap<>();
        for (Map.Entry<String, Integer> e : program.labels().entrySet()) {
            labelOffsets.put(e.getKey(), offsets[e.getValue()]);
        }

        for (int pc = 0; pc < code.size(); pc++) {
            writeInstruction(code.get(pc), offsets[pc + 1], labelOffsets);
        }
        return out.toByteArray();
    }

    static int encodedSize(Instruction inst) {
        return switch (inst.opcode().immediate()) {
            case NONE -> 1;
            case U8 -> 2;
            case U64 -> 1 + varUintSize(Instruction.immediates(inst).get(0));
            case LABEL -> inst.opcode().isPseudo() ? 0 : 3;
        };
    }

    private void writeInstruction(Instruction inst, int nextOffset, Map<String, Integer> labelOffsets)
            throws BytecodeEncodeException {
        Opcode op = inst.opcode();
        if (op.isPseudo()) {
            return;
        }
        writeU8(op.code());
        switch (op.immediate()) {
            case NONE -> {}
            case U8 -> writeU8(Instruction.immediates(inst).get(0).intValue());
            case U64 -> writeVarUint(Instruction.immediates(inst).get(0));
            case LABEL -> {
                String target = Instruction.label(inst);
                Integer targetOffset = labelOffsets.get(target);
                if (targetOffset == null) {
                    throw new BytecodeEncodeException("unknown label `" + target + "`");
                }
                int rel = targetOffset - nextOffset;
                if (rel < Short.MIN_VALUE || rel > Short.MAX_VALUE) {
                    throw new BytecodeEncodeException(
                            "branch to `" + target + "` out of i16 range (offset " + rel + ")");
                }
                writeU16(rel);
            }
        }
    }

    private void writeBytes(byte[] bytes) {
        out.writeBytes(bytes);
    }

    private void writeU8(int v) {
        out.write(v & 0xFF);
    }

    private void writeU16(int v) {
        writeU8(v);
        writeU8(v >>> 8);
    }

    private void writeU32(long v) throws BytecodeEncodeException {
        if (v < 0 || v > 0xFFFF_FFFFL) {
            throw new BytecodeEncodeException("u32 overflow");
        }
        writeU8((int) (v));
        writeU8((int) (v >>> 8));
        writeU8((int) (v >>> 16));
        writeU8((int) (v >>> 24));
    }

    /** LEB128, treating {@code v} as unsigned. */
    private void writeVarUint(long v) {
        while ((v & ~0x7FL) != 0) {
            writeU8((int) ((v & 0x7F) | 0x80));
            v >>>= 7;
        }
        writeU8((int) v);
    }

    private static int varUintSize(long v) {
        int n = 1;
        while ((v & ~0x7FL) != 0) {
            v >>>= 7;
            n++;
        }
        return n;
    }
}
