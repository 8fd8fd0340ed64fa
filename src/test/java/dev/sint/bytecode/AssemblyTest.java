package dev.sint.bytecode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AssemblyTest {

    @Test void printsOneInstructionPerLine() {
        Program p = Program.of(
                new Instruction.PushInt(-1L),
                new Instruction.Cover(2),
                new Instruction.Bnz("done"),
                new Instruction.Label("done"),
                new Instruction.Or());
        assertEquals(
                "pushint 18446744073709551615\ncover 2\nbnz done\ndone:\n||\n",
                Assembly.print(p));
    }

    @Test void parsesWhatItPrints() throws Exception {
        Program p = Program.of(
                new Instruction.PushInt(0x8000_0000_0000_0000L),
                new Instruction.Dup(),
                new Instruction.PushInt(63),
                new Instruction.GetBit(),
                new Instruction.Bz("else_0"),
                new Instruction.Uncover(1),
                new Instruction.B("end_0"),
                new Instruction.Label("else_0"),
                new Instruction.Swap(),
                new Instruction.Label("end_0"),
                new Instruction.BitOr());
        assertEquals(p, Assembly.parse(Assembly.print(p)));
    }

    @Test void acceptsHexNegativeAndComments() throws Exception {
        Program p = Assembly.parse(String.join("\n",
                "// leading comment",
                "",
                "pushint 0xff   // hex",
                "pushint -2",
                "  addw",
                "pop"));
        assertEquals(Program.of(
                new Instruction.PushInt(255),
                new Instruction.PushInt(0xFFFF_FFFF_FFFF_FFFEL),
                new Instruction.AddW(),
                new Instruction.Pop()), p);
    }

    @Test void unknownMnemonicReportsLine() {
        AsmParseException e = assertThrows(AsmParseException.class,
                () -> Assembly.parse("pushint 1\n\nfrobnicate\n"));
        assertEquals(3, e.line());
        assertThat(e.getMessage()).contains("unknown mnemonic `frobnicate`");
    }

    @Test void immediateCountIsChecked() {
        AsmParseException e = assertThrows(AsmParseException.class, () -> Assembly.parse("dup 3"));
        assertEquals(1, e.line());
        assertThat(e.getMessage()).contains("expects 0 immediate(s), got 1");
    }

    @Test void wordOutOfRange() {
        AsmParseException e = assertThrows(AsmParseException.class,
                () -> Assembly.parse("pushint 18446744073709551616"));
        assertThat(e.getMessage()).contains("invalid 64-bit word");
    }

    @Test void u8ImmediateOutOfRange() {
        AsmParseException e = assertThrows(AsmParseException.class, () -> Assembly.parse("cover 256"));
        assertThat(e.getMessage()).contains("cover");
    }

    @Test void badLabels() {
        assertThrows(AsmParseException.class, () -> Assembly.parse("1abc:"));
        assertThrows(AsmParseException.class, () -> Assembly.parse("b 9x"));
        assertThrows(AsmParseException.class, () -> Assembly.parse("b missing"));
        assertThrows(AsmParseException.class, () -> Assembly.parse("x:\nx:"));
    }
}
