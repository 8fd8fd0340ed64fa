package dev.sint.bytecode;

import java.util.ArrayList;
import java.util.List;

final class AsmParser {
    private final String text;
    private int lineNo;

    AsmParser(String text) {
        this.text = text;
    }

    Program parse() throws AsmParseException {
        List<Instruction> code = new ArrayList<>();
        lineNo = 0;
        for (String raw : text.split("\r?\n", -1)) {
            lineNo++;
            String line = stripComment(raw).trim();
            if (line.isEmpty()) {
                continue;
            }
            code.add(parseLine(line));
        }
        try {
            return new Program(code);
        } catch (IllegalArgumentException e) {
            throw new AsmParseException(e.getMessage(), lineNo);
        }
    }

    private Instruction parseLine(String line) throws AsmParseException {
        if (line.endsWith(":")) {
            String name = line.substring(0, line.length() - 1);
            if (!isLabelName(name)) {
                throw err("invalid label `" + name + "`");
            }
            return new Instruction.Label(name);
        }

        String[] parts = line.split("\\s+");
        Opcode op = Opcode.byMnemonic(parts[0]).orElse(null);
        if (op == null) {
            throw err("unknown mnemonic `" + parts[0] + "`");
        }
        int expected = op.immediateCount();
        if (parts.length - 1 != expected) {
            throw err("`" + op.mnemonic() + "` expects " + expected + " immediate(s), got " + (parts.length - 1));
        }

        if (op.immediate() == Opcode.Immediate.LABEL) {
            if (!isLabelName(parts[1])) {
                throw err("invalid label `" + parts[1] + "`");
            }
            return Instruction.of(op, parts[1]);
        }

        List<Long> immediates = new ArrayList<>(expected);
        for (int i = 1; i < parts.length; i++) {
            immediates.add(parseWord(parts[i]));
        }
        try {
            return Instruction.of(op, immediates);
        } catch (IllegalArgumentException e) {
            throw err(op.mnemonic() + ": " + e.getMessage());
        }
    }

    /** Unsigned decimal, {@code 0x} hex, or a negative decimal taken in two's complement. */
    private long parseWord(String s) throws AsmParseException {
        try {
            if (s.startsWith("0x") || s.startsWith("0X")) {
                return Long.parseUnsignedLong(s.substring(2), 16);
            }
            if (s.startsWith("-")) {
                return Long.parseLong(s);
            }
            return Long.parseUnsignedLong(s);
        } catch (NumberFormatException e) {
            throw err("invalid 64-bit word `" + s + "`");
        }
    }

    private static String stripComment(String line) {
        int idx = line.indexOf("//");
        return idx < 0 ? line : line.substring(0, idx);
    }

    private static boolean isLabelName(String name) {
        if (name.isEmpty() || !(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_')) {
                return false;
            }
        }
        return true;
    }

    private AsmParseException err(String message) {
        return new AsmParseException(message, lineNo);
    }
}
