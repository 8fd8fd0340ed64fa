package dev.sint.vm;

import dev.sint.bytecode.Instruction;
import dev.sint.bytecode.Program;
import dev.sint.bytecode.ProgramVerifier;
import dev.sint.bytecode.StackProfile;
import dev.sint.bytecode.VerifyException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reference interpreter for the unsigned-word stack machine.
 *
 * <p>The host drives execution with {@link #step(Long)}. A program succeeds when control falls
 * off the end with exactly one word on the stack; {@code assert} on zero, {@code err}, stack
 * underflow, shifts by 64 or more and bit reads past bit 63 abort it with {@link StepResult.Trap}.</p>
 */
public final class StackMachine {
    private final Program program;
    private final Map<String, Integer> labels;
    private final long[] stack = new long[ProgramVerifier.MAX_STACK_DEPTH];
    private int sp;
    private int pc;
    private long executed;

    private MachineState state = new MachineState.Running();

    public StackMachine(Program program) throws VmError {
        this(program, List.of());
    }

    /**
     * @param initialStack words present before the first instruction, bottom first
     */
    public StackMachine(Program program, List<Long> initialStack) throws VmError {
        this.program = Objects.requireNonNull(program, "program");
        Objects.requireNonNull(initialStack, "initialStack");

        StackProfile profile;
        try {
            profile = ProgramVerifier.verify(program);
        } catch (VerifyException e) {
            throw new VmError.InvalidProgram(e.getMessage());
        }
        if (profile.requiredInputs() > initialStack.size()) {
            throw new VmError.InvalidProgram(
                    "program needs "
                            + profile.requiredInputs()
                            + " input word(s), got "
                            + initialStack.size());
        }
        if (profile.reachesEnd() && initialStack.size() + profile.netEffect() != 1) {
            throw new VmError.InvalidProgram(
                    "program would end with "
                            + (initialStack.size() + profile.netEffect())
                            + " word(s) on the stack, expected 1");
        }
        if (initialStack.size() + profile.maxDepth() - profile.requiredInputs() > stack.length) {
            throw new VmError.InvalidState("initial stack too deep: " + initialStack.size());
        }

        this.labels = program.labels();
        for (long w : initialStack) {
            stack[sp++] = w;
        }
    }

    public Program program() {
        return program;
    }

    /** Instructions executed so far, labels excluded. */
    public long executedInstructions() {
        return executed;
    }

    /** Current stack contents, bottom first. */
    public List<Long> stack() {
        Long[] out = new Long[sp];
        for (int i = 0; i < sp; i++) {
            out[i] = stack[i];
        }
        return List.of(out);
    }

    /**
     * Runs until the program finishes, traps, or uses up {@code fuel} instructions.
     *
     * @param fuel instruction budget for this call, or {@code null} for no limit
     */
    public StepResult step(Long fuel) {
        if (state instanceof MachineState.Done done) {
            return new StepResult.Done(done.value);
        }
        if (state instanceof MachineState.Trapped trapped) {
            return new StepResult.Trap(trapped.message);
        }

        long remaining = (fuel == null) ? Long.MAX_VALUE : fuel.longValue();
        List<Instruction> code = program.code();

        while (true) {
            if (pc >= code.size()) {
                if (sp != 1) {
                    return trap("program ended with " + sp + " word(s) on the stack, expected 1");
                }
                state = new MachineState.Done(stack[0]);
                return new StepResult.Done(stack[0]);
            }

            Instruction inst = code.get(pc);
            if (inst instanceof Instruction.Label) {
                pc += 1;
                continue;
            }

            if (fuel != null && remaining == 0) {
                return new StepResult.Yield(0);
            }
            if (fuel != null) {
                remaining -= 1;
            }

            int at = pc;
            pc += 1;
            executed += 1;
            try {
                exec(inst);
            } catch (MachineTrap t) {
                return trap("pc " + at + " `" + inst.opcode().mnemonic() + "`: " + t.getMessage());
            }
        }
    }

    /** Runs to completion. */
    public StepResult run() {
        return step(null);
    }

    // ====== Machine state ======

    private sealed interface MachineState permits MachineState.Running, MachineState.Done, MachineState.Trapped {
        record Running() implements MachineState {}

        record Done(long value) implements MachineState {}

        record Trapped(String message) implements MachineState {
            public Trapped {
                Objects.requireNonNull(message, "message");
            }
        }
    }

    // ====== Trap plumbing ======

    private static final class MachineTrap extends Exception {
        MachineTrap(String message) {
            super(message);
        }
    }

    private StepResult trap(String message) {
        state = new MachineState.Trapped(message);
        return new StepResult.Trap(message);
    }

    // ====== Instructions ======

    private void exec(Instruction inst) throws MachineTrap {
        if (inst instanceof Instruction.PushInt i) {
            push(i.value());
            return;
        }
        if (inst instanceof Instruction.Dup) {
            long v = peek(0);
            push(v);
            return;
        }
        if (inst instanceof Instruction.Swap) {
            need(2);
            long top = stack[sp - 1];
            stack[sp - 1] = stack[sp - 2];
            stack[sp - 2] = top;
            return;
        }
        if (inst instanceof Instruction.Pop) {
            pop();
            return;
        }
        if (inst instanceof Instruction.Cover i) {
            int n = i.depth();
            need(n + 1);
            long top = stack[sp - 1];
            System.arraycopy(stack, sp - 1 - n, stack, sp - n, n);
            stack[sp - 1 - n] = top;
            return;
        }
        if (inst instanceof Instruction.Uncover i) {
            int n = i.depth();
            need(n + 1);
            long picked = stack[sp - 1 - n];
            System.arraycopy(stack, sp - n, stack, sp - 1 - n, n);
            stack[sp - 1] = picked;
            return;
        }
        if (inst instanceof Instruction.BitAnd) {
            long b = pop();
            long a = pop();
            push(a & b);
            return;
        }
        if (inst instanceof Instruction.BitOr) {
            long b = pop();
            long a = pop();
            push(a | b);
            return;
        }
        if (inst instanceof Instruction.BitXor) {
            long b = pop();
            long a = pop();
            push(a ^ b);
            return;
        }
        if (inst instanceof Instruction.BitNot) {
            push(~pop());
            return;
        }
        if (inst instanceof Instruction.GetBit) {
            long index = pop();
            long a = pop();
            if (Long.compareUnsigned(index, 63) > 0) {
                throw new MachineTrap("bit index " + Long.toUnsignedString(index) + " out of range");
            }
            push((a >>> index) & 1L);
            return;
        }
        if (inst instanceof Instruction.AddW) {
            long b = pop();
            long a = pop();
            long low = a + b;
            long carry = Long.compareUnsigned(low, a) < 0 ? 1L : 0L;
            push(carry);
            push(low);
            return;
        }
        if (inst instanceof Instruction.Shr) {
            long amount = pop();
            long a = pop();
            push(a >>> shiftAmount(amount));
            return;
        }
        if (inst instanceof Instruction.Shl) {
            long amount = pop();
            long a = pop();
            push(a << shiftAmount(amount));
            return;
        }
        if (inst instanceof Instruction.Eq) {
            long b = pop();
            long a = pop();
            push(a == b ? 1L : 0L);
            return;
        }
        if (inst instanceof Instruction.Not) {
            push(pop() == 0 ? 1L : 0L);
            return;
        }
        if (inst instanceof Instruction.Or) {
            long b = pop();
            long a = pop();
            push((a != 0 || b != 0) ? 1L : 0L);
            return;
        }
        if (inst instanceof Instruction.And) {
            long b = pop();
            long a = pop();
            push((a != 0 && b != 0) ? 1L : 0L);
            return;
        }
        if (inst instanceof Instruction.Assert) {
            if (pop() == 0) {
                throw new MachineTrap("assert failed");
            }
            return;
        }
        if (inst instanceof Instruction.Err) {
            throw new MachineTrap("err");
        }
        if (inst instanceof Instruction.Bz i) {
            if (pop() == 0) {
                jump(i.target());
            }
            return;
        }
        if (inst instanceof Instruction.Bnz i) {
            if (pop() != 0) {
                jump(i.target());
            }
            return;
        }
        if (inst instanceof Instruction.B i) {
            jump(i.target());
            return;
        }
        throw new MachineTrap("unknown instruction");
    }

    private static int shiftAmount(long amount) throws MachineTrap {
        if (Long.compareUnsigned(amount, 63) > 0) {
            throw new MachineTrap("shift amount " + Long.toUnsignedString(amount) + " out of range");
        }
        return (int) amount;
    }

    private void jump(String label) throws MachineTrap {
        Integer target = labels.get(label);
        if (target == null) {
            throw new MachineTrap("unknown label `" + label + "`");
        }
        pc = target;
    }

    private void need(int n) throws MachineTrap {
        if (sp < n) {
            throw new MachineTrap("stack underflow: need " + n + ", have " + sp);
        }
    }

    private long peek(int depth) throws MachineTrap {
        need(depth + 1);
        return stack[sp - 1 - depth];
    }

    private long pop() throws MachineTrap {
        need(1);
        sp -= 1;
        return stack[sp];
    }

    private void push(long v) throws MachineTrap {
        if (sp >= stack.length) {
            throw new MachineTrap("stack overflow");
        }
        stack[sp++] = v;
    }
}
