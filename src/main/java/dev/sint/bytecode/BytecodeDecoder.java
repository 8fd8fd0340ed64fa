package dev.sint.bytecode;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

final class BytecodeDecoder {
    private byte[] bytes;
    private int pos;

    Program decode(byte[] bytes) throws BytecodeDecodeException {
        this.bytes = bytes;
        this.pos = 0;

        expectBytes(Bytecode.MAGIC, "bad magic");
        int major = readU16();
        int minor = readU16();
        if (major != Bytecode.VERSION_MAJOR || minor != Bytecode.VERSION_MINOR) {
            throw err(
                    "unsupported bytecode version "
                            + major
                            + "."
                            + minor
                            + " (expected "
                            + Bytecode.VERSION_MAJOR
                            + "."
                            + Bytecode.VERSION_MINOR
                            + ")");
        }
        int count = readLen();
        int streamStart = pos;

        // Instructions keyed by stream offset; branch targets are resolved once all offsets are known.
        List<Instruction> decoded = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();
        List<Integer> targets = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int start = pos - streamStart;
            int opPos = pos;
            int code = readU8();
            Opcode op = Opcode.byCode(code).orElse(null);
            if (op == null) {
                pos = opPos;
                throw err("unknown opcode 0x" + Integer.toHexString(code));
            }
            starts.add(start);
            switch (op.immediate()) {
                case NONE -> {
                    decoded.add(Instruction.of(op, List.of()));
                    targets.add(null);
                }
                case U8 -> {
                    int v = readU8();
                    try {
                        decoded.add(Instruction.of(op, List.of((long) v)));
                    } catch (IllegalArgumentException e) {
                        throw err(op.mnemonic() + ": " + e.getMessage());
                    }
                    targets.add(null);
                }
                case U64 -> {
                    decoded.add(Instruction.of(op, List.of(readVarUint())));
                    targets.add(null);
                }
                case LABEL -> {
                    int rel = (short) readU16();
                    decoded.add(null);
                    targets.add(pos - streamStart + rel);
                }
            }
        }
        int end = pos - streamStart;

        if (remaining() != 0) {
            throw err("trailing bytes");
        }

        NavigableMap<Integer, Integer> indexByStart = new TreeMap<>();
        for (int i = 0; i < starts.size(); i++) {
            indexByStart.put(starts.get(i), i);
        }
        indexByStart.put(end, count);

        NavigableMap<Integer, String> labelByIndex = new TreeMap<>();
        for (int i = 0; i < count; i++) {
            Integer target = targets.get(i);
            if (target == null) {
                continue;
            }
            Integer index = indexByStart.get(target);
            if (index == null) {
                throw new BytecodeDecodeException(
                        "branch at instruction " + i + " targets offset " + target + " inside an instruction",
                        streamStart + starts.get(i));
            }
            labelByIndex.put(index, "L" + index);
        }

        List<Instruction> code = new ArrayList<>(count + labelByIndex.size());
        for (int i = 0; i <= count; i++) {
            String label = labelByIndex.get(i);
            if (label != null) {
                code.add(new Instruction.Label(label));
            }
            if (i == count) {
                break;
            }
            Instruction inst = decoded.get(i);
            if (inst == null) {
                Opcode op = Opcode.byCode(bytes[streamStart + starts.get(i)] & 0xFF).orElseThrow();
                inst = Instruction.of(op, "L" + indexByStart.get(targets.get(i)));
            }
            code.add(inst);
        }

        Program program = new Program(code);
        try {
            ProgramVerifier.verify(program);
        } catch (VerifyException e) {
            throw err(e.getMessage());
        }
        return program;
    }

    private BytecodeDecodeException err(String message) {
        return new BytecodeDecodeException(message, pos);
    }

    private int remaining() {
        return Math.max(0, bytes.length - pos);
    }

    private void expectBytes(byte[] expected, String message) throws BytecodeDecodeException {
        byte[] got = readExact(expected.length);
        for (int i = 0; i < expected.length; i++) {
            if (got[i] != expected[i]) {
                throw err(message);
            }
        }
    }

    private byte[] readExact(int n) throws BytecodeDecodeException {
        if (n < 0) {
            throw err("offset overflow");
        }
        int end = pos + n;
        if (end < pos || end > bytes.length) {
            throw err("unexpected EOF");
        }
        byte[] slice = new byte[n];
        System.arraycopy(bytes, pos, slice, 0, n);
        pos = end;
        return slice;
    }

    private int readU8() throws BytecodeDecodeException {
        return readExact(1)[0] & 0xFF;
    }

    private int readU16() throws BytecodeDecodeException {
        byte[] b = readExact(2);
        return ((b[1] & 0xFF) << 8) | (b[0] & 0xFF);
    }

    private long readU32() throws BytecodeDecodeException {
        byte[] b = readExact(4);
        return ((long) (b[3] & 0xFF) << 24)
                | ((long) (b[2] & 0xFF) << 16)
                | ((long) (b[1] & 0xFF) << 8)
                | ((long) (b[0] & 0xFF));
    }

    private int readLen() throws BytecodeDecodeException {
        long n = readU32();
        if (n > Integer.MAX_VALUE) {
            throw err("length overflow");
        }
        return (int) n;
    }

    private long readVarUint() throws BytecodeDecodeException {
        long v = 0;
        for (int shift = 0; shift < 64; shift += 7) {
            int b = readU8();
            if (shift == 63 && (b & 0x7E) != 0) {
                throw err("varuint overflows 64 bits");
            }
            v |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return v;
            }
        }
        throw err("varuint longer than 10 bytes");
    }
}
