package dev.sint.bytecode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * Static stack-depth verifier.
 *
 * <p>Walks every reachable path once. Depths are relative to the entry depth, so a fragment that
 * reads words pushed by surrounding code gets a positive {@link StackProfile#requiredInputs()}
 * instead of an error.</p>
 */
public final class ProgramVerifier {
    /** Same limit the interpreter enforces at run time. */
    public static final int MAX_STACK_DEPTH = 1000;

    private ProgramVerifier() {}

    public static StackProfile verify(Program program) throws VerifyException {
        int size = program.size();
        Map<String, Integer> labels = program.labels();

        // depthAt[size] is the exit depth.
        Integer[] depthAt = new Integer[size + 1];
        Deque<Integer> work = new ArrayDeque<>();
        depthAt[0] = 0;
        work.push(0);

        int lowest = 0;
        int highest = 0;
        while (!work.isEmpty()) {
            int pc = work.pop();
            if (pc == size) {
                continue;
            }
            Instruction inst = program.code().get(pc);
            int depth = depthAt[pc];
            int low = depth - inst.pops();
            lowest = Math.min(lowest, low);
            int after = low + inst.pushes();
            highest = Math.max(highest, Math.max(depth, after));

            if (inst instanceof Instruction.Err) {
                continue;
            }
            if (inst instanceof Instruction.B b) {
                flow(depthAt, work, labels.get(b.target()), after, pc);
                continue;
            }
            if (inst.opcode().isBranch()) {
                flow(depthAt, work, labels.get(Instruction.label(inst)), after, pc);
            }
            flow(depthAt, work, pc + 1, after, pc);
        }

        int required = -lowest;
        int maxDepth = required + highest;
        if (maxDepth > MAX_STACK_DEPTH) {
            throw new VerifyException("stack depth " + maxDepth + " exceeds limit " + MAX_STACK_DEPTH);
        }
        Integer exit = depthAt[size];
        if (exit == null) {
            return new StackProfile(required, 0, maxDepth, false);
        }
        return new StackProfile(required, exit, maxDepth, true);
    }

    /**
     * Verifies a complete program: it must need no inputs and finish with exactly one word.
     */
    public static StackProfile verifyStandalone(Program program) throws VerifyException {
        StackProfile profile = verify(program);
        if (profile.requiredInputs() != 0) {
            throw new VerifyException(
                    "program reads " + profile.requiredInputs() + " word(s) below its entry depth");
        }
        if (profile.reachesEnd() && profile.netEffect() != 1) {
            throw new VerifyException("program ends with " + profile.netEffect() + " word(s) on the stack, expected 1");
        }
        return profile;
    }

    private static void flow(Integer[] depthAt, Deque<Integer> work, Integer target, int depth, int from)
            throws VerifyException {
        if (target == null) {
            throw new VerifyException("pc " + from + ": branch target missing");
        }
        Integer seen = depthAt[target];
        if (seen == null) {
            depthAt[target] = depth;
            work.push(target);
        } else if (seen != depth) {
            throw new VerifyException(
                    "inconsistent stack depth at pc "
                            + target
                            + ": "
                            + seen
                            + " vs "
                            + depth
                            + " (from pc "
                            + from
                            + ")");
        }
    }
}
