package dev.sint.bytecode;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A linear instruction sequence for the target machine.
 *
 * <p>Labels are unique and every branch names an existing label.</p>
 */
public record Program(List<Instruction> code) {
    public Program {
        Objects.requireNonNull(code, "code");
        code = List.copyOf(code);
        Map<String, Integer> labels = new TreeMap<>();
        for (int pc = 0; pc < code.size(); pc++) {
            if (code.get(pc) instanceof Instruction.Label l && labels.put(l.name(), pc) != null) {
                throw new IllegalArgumentException("duplicate label `" + l.name() + "`");
            }
        }
        for (int pc = 0; pc < code.size(); pc++) {
            Instruction inst = code.get(pc);
            if (inst.opcode().isBranch()) {
                String target = Instruction.label(inst);
                if (!labels.containsKey(target)) {
                    throw new IllegalArgumentException("pc " + pc + ": branch to unknown label `" + target + "`");
                }
            }
        }
    }

    public static Program of(Instruction... code) {
        return new Program(List.of(code));
    }

    public int size() {
        return code.size();
    }

    /** Label name to the pc of its {@link Instruction.Label}. */
    public Map<String, Integer> labels() {
        Map<String, Integer> out = new TreeMap<>();
        for (int pc = 0; pc < code.size(); pc++) {
            if (code.get(pc) instanceof Instruction.Label l) {
                out.put(l.name(), pc);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    public Optional<Integer> labelPc(String name) {
        return Optional.ofNullable(labels().get(name));
    }

    /** Number of instructions that are not labels. */
    public int instructionCount() {
        int n = 0;
        for (Instruction inst : code) {
            if (!inst.opcode().isPseudo()) {
                n++;
            }
        }
        return n;
    }
}
