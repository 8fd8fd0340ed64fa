package dev.sint.vm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

import dev.sint.bytecode.Instruction;
import dev.sint.bytecode.Instruction.*;
import dev.sint.bytecode.Program;
import java.util.List;
import org.junit.jupiter.api.Test;

class StackMachineTest {

    private static long result(Instruction... code) throws VmError {
        StepResult r = new StackMachine(Program.of(code)).run();
        assertThat(r).isInstanceOf(StepResult.Done.class);
        return ((StepResult.Done) r).value();
    }

    private static String trap(Instruction... code) throws VmError {
        StepResult r = new StackMachine(Program.of(code)).run();
        assertThat(r).isInstanceOf(StepResult.Trap.class);
        return ((StepResult.Trap) r).message();
    }

    @Test void pushIntLeavesItsWord() throws Exception {
        assertEquals(-1L, result(new PushInt(-1L)));
    }

    @Test void stackShuffles() throws Exception {
        assertEquals(1, result(new PushInt(1), new PushInt(2), new Swap(), new Swap(), new Pop()));
        assertEquals(2, result(new PushInt(1), new PushInt(2), new Swap(), new Pop()));
        assertEquals(0, result(new PushInt(7), new Dup(), new BitXor()));
    }

    @Test void coverMovesTopDown() throws Exception {
        StackMachine m = new StackMachine(
                Program.of(new Cover(2), new Pop(), new Pop()), List.of(1L, 2L, 3L));
        assertEquals(new StepResult.Done(3), m.run());

        StackMachine peek = new StackMachine(
                Program.of(new Cover(2), new Swap(), new Pop(), new Swap(), new Pop()), List.of(1L, 2L, 3L));
        // 1 2 3 -> 3 1 2 -> 3 2 1 -> 3 2 -> 2 3 -> 2
        assertEquals(new StepResult.Done(2), peek.run());
    }

    @Test void uncoverBringsWordUp() throws Exception {
        // 1 2 3 -> 2 3 1
        StackMachine m = new StackMachine(
                Program.of(new Uncover(2), new Cover(1), new Pop(), new Pop()), List.of(1L, 2L, 3L));
        assertEquals(new StepResult.Done(2), m.run());
        StackMachine inverse = new StackMachine(
                Program.of(new Uncover(2), new Cover(2), new Pop(), new Pop()), List.of(1L, 2L, 3L));
        assertEquals(new StepResult.Done(1), inverse.run());
    }

    @Test void coverAndUncoverByZeroAreNoOps() throws Exception {
        assertEquals(5, result(new PushInt(5), new Cover(0), new Uncover(0)));
    }

    @Test void bitwise() throws Exception {
        assertEquals(0b1000, result(new PushInt(0b1100), new PushInt(0b1010), new BitAnd()));
        assertEquals(0b1110, result(new PushInt(0b1100), new PushInt(0b1010), new BitOr()));
        assertEquals(0b0110, result(new PushInt(0b1100), new PushInt(0b1010), new BitXor()));
        assertEquals(-1L, result(new PushInt(0), new BitNot()));
    }

    @Test void getBitReadsOneBit() throws Exception {
        assertEquals(1, result(new PushInt(Long.MIN_VALUE), new PushInt(63), new GetBit()));
        assertEquals(0, result(new PushInt(Long.MAX_VALUE), new PushInt(63), new GetBit()));
        assertEquals(1, result(new PushInt(4), new PushInt(2), new GetBit()));
        assertEquals(0, result(new PushInt(4), new PushInt(0), new GetBit()));
    }

    @Test void getBitPastTheWordTraps() throws Exception {
        assertThat(trap(new PushInt(1), new PushInt(64), new GetBit()))
                .isEqualTo("pc 2 `getbit`: bit index 64 out of range");
    }

    @Test void addWPushesCarryThenLow() throws Exception {
        StackMachine carry = new StackMachine(Program.of(new AddW(), new Pop()), List.of(-1L, 3L));
        assertEquals(new StepResult.Done(1), carry.run());
        StackMachine low = new StackMachine(Program.of(new AddW(), new Swap(), new Pop()), List.of(-1L, 3L));
        assertEquals(new StepResult.Done(2), low.run());
        StackMachine noCarry = new StackMachine(Program.of(new AddW(), new Pop()), List.of(3L, 4L));
        assertEquals(new StepResult.Done(0), noCarry.run());
    }

    @Test void shiftsAreLogical() throws Exception {
        assertEquals(1, result(new PushInt(Long.MIN_VALUE), new PushInt(63), new Shr()));
        assertEquals(Long.MIN_VALUE, result(new PushInt(1), new PushInt(63), new Shl()));
        assertEquals(9, result(new PushInt(9), new PushInt(0), new Shr()));
    }

    @Test void shiftByWordSizeTraps() throws Exception {
        assertThat(trap(new PushInt(1), new PushInt(64), new Shr()))
                .isEqualTo("pc 2 `shr`: shift amount 64 out of range");
        assertThat(trap(new PushInt(1), new PushInt(-1L), new Shl()))
                .contains("shift amount 18446744073709551615 out of range");
    }

    @Test void logicalOperatorsYieldZeroOrOne() throws Exception {
        assertEquals(1, result(new PushInt(5), new PushInt(5), new Eq()));
        assertEquals(0, result(new PushInt(5), new PushInt(6), new Eq()));
        assertEquals(1, result(new PushInt(0), new Not()));
        assertEquals(0, result(new PushInt(9), new Not()));
        assertEquals(1, result(new PushInt(0), new PushInt(7), new Or()));
        assertEquals(0, result(new PushInt(0), new PushInt(0), new Or()));
        assertEquals(1, result(new PushInt(3), new PushInt(7), new And()));
        assertEquals(0, result(new PushInt(3), new PushInt(0), new And()));
    }

    @Test void assertTrapsOnZero() throws Exception {
        assertEquals(4, result(new PushInt(4), new PushInt(1), new Assert()));
        assertThat(trap(new PushInt(4), new PushInt(0), new Assert()))
                .isEqualTo("pc 2 `assert`: assert failed");
    }

    @Test void errAlwaysTraps() throws Exception {
        assertThat(trap(new Err())).isEqualTo("pc 0 `err`: err");
    }

    @Test void conditionalBranches() throws Exception {
        Instruction[] select = {
            new Bz("else"), new PushInt(10), new B("end"), new Label("else"), new PushInt(20), new Label("end")
        };
        assertEquals(new StepResult.Done(10), new StackMachine(Program.of(select), List.of(1L)).run());
        assertEquals(new StepResult.Done(20), new StackMachine(Program.of(select), List.of(0L)).run());

        Instruction[] skip = {new Bnz("out"), new Err(), new Label("out"), new PushInt(3)};
        assertEquals(new StepResult.Done(3), new StackMachine(Program.of(skip), List.of(9L)).run());
        assertThat(new StackMachine(Program.of(skip), List.of(0L)).run()).isInstanceOf(StepResult.Trap.class);
    }

    @Test void fuelYieldsAndResumes() throws Exception {
        StackMachine m = new StackMachine(Program.of(
                new PushInt(1), new Label("x"), new PushInt(2), new BitOr(), new PushInt(4), new BitOr()));
        assertEquals(new StepResult.Yield(0), m.step(2L));
        assertEquals(2, m.executedInstructions());
        assertEquals(List.of(1L, 2L), m.stack());
        assertEquals(new StepResult.Yield(0), m.step(0L));
        assertEquals(new StepResult.Done(7), m.step(10L));
        assertEquals(5, m.executedInstructions());
    }

    @Test void finishedMachineRepeatsItsResult() throws Exception {
        StackMachine done = new StackMachine(Program.of(new PushInt(8)));
        assertEquals(new StepResult.Done(8), done.run());
        assertEquals(new StepResult.Done(8), done.step(0L));

        StackMachine trapped = new StackMachine(Program.of(new Err()));
        StepResult first = trapped.run();
        assertEquals(first, trapped.run());
        assertEquals(1, trapped.executedInstructions());
    }

    @Test void initialStackIsVisibleAndCounted() throws Exception {
        StackMachine m = new StackMachine(Program.of(new BitXor()), List.of(6L, 3L));
        assertEquals(List.of(6L, 3L), m.stack());
        assertEquals(new StepResult.Done(5), m.run());
        assertEquals(List.of(5L), m.stack());
    }

    @Test void rejectsUnderflowingProgram() {
        assertThatThrownBy(() -> new StackMachine(Program.of(new PushInt(1), new BitAnd())))
                .isInstanceOf(VmError.InvalidProgram.class);
    }

    @Test void rejectsMissingInputs() {
        assertThatThrownBy(() -> new StackMachine(Program.of(new BitAnd()), List.of(1L)))
                .isInstanceOf(VmError.InvalidProgram.class)
                .hasMessageContaining("needs 2 input word(s), got 1");
    }

    @Test void rejectsWrongExitDepth() {
        assertThatThrownBy(() -> new StackMachine(Program.of(new PushInt(1), new PushInt(2))))
                .isInstanceOf(VmError.InvalidProgram.class)
                .hasMessageContaining("expected 1");
        assertThatThrownBy(() -> new StackMachine(Program.of()))
                .isInstanceOf(VmError.InvalidProgram.class);
    }

    @Test void programThatAlwaysTrapsNeedsNoExitDepth() throws Exception {
        StackMachine m = new StackMachine(Program.of(new PushInt(1), new PushInt(2), new Err()));
        assertThat(m.run()).isInstanceOf(StepResult.Trap.class);
    }
}
