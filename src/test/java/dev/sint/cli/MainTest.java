package dev.sint.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import dev.sint.bytecode.Bytecode;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
    private static final String WIDE_ADD = "addw\nswap\npop   // drop the carry\n";

    @TempDir Path dir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Main.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String text) throws IOException {
        return Files.writeString(dir.resolve(name), text, StandardCharsets.UTF_8);
    }

    @Test void runsTextProgramWithInputs() throws Exception {
        Path prog = write("add.s", WIDE_ADD);
        assertEquals(Main.EXIT_OK, run(prog.toString(), "-1", "3"));
        assertEquals("2 (unsigned 2)\n", out().replace(System.lineSeparator(), "\n"));
    }

    @Test void printsNegativeResultBothWays() throws Exception {
        Path prog = write("neg.s", "pushint -5\n");
        assertEquals(Main.EXIT_OK, run(prog.toString()));
        assertThat(out()).startsWith("-5 (unsigned 18446744073709551611)");
    }

    @Test void trapExitsWithFailure() throws Exception {
        Path prog = write("trap.s", "pushint 1\npushint 0\nassert\n");
        assertEquals(Main.EXIT_FAILURE, run(prog.toString()));
        assertThat(err()).contains("runtime error: pc 2 `assert`: assert failed");
        assertThat(out()).isEmpty();
    }

    @Test void outOfFuel() throws Exception {
        Path prog = write("two.s", "pushint 1\npushint 2\n|\n");
        assertEquals(Main.EXIT_FAILURE, run("--fuel", "1", prog.toString()));
        assertThat(err()).contains("out of fuel after 1 instruction(s)");
    }

    @Test void dumpPrintsProgramFirst() throws Exception {
        Path prog = write("dump.s", "pushint 0x10\n");
        assertEquals(Main.EXIT_OK, run("--dump", prog.toString()));
        assertThat(out()).startsWith("pushint 16\n").contains("16 (unsigned 16)");
    }

    @Test void badInputIsUsageError() throws Exception {
        Path prog = write("add.s", WIDE_ADD);
        assertEquals(Main.EXIT_USAGE, run(prog.toString(), "1", "abc"));
        assertThat(err()).contains("bad input `abc`");

        setUp();
        assertEquals(Main.EXIT_USAGE, run(prog.toString(), "1", "9223372036854775808"));
        assertThat(err()).contains("bad input `9223372036854775808`");
    }

    @Test void usageErrors() {
        assertEquals(Main.EXIT_USAGE, run());
        assertThat(err()).contains("usage:");
        assertEquals(Main.EXIT_USAGE, run("--fuel"));
        assertEquals(Main.EXIT_USAGE, run("--fuel", "-3", "x.s"));
        assertEquals(Main.EXIT_USAGE, run("--nope", "x.s"));
        assertEquals(Main.EXIT_USAGE, run("asm", "only-one"));
        assertEquals(Main.EXIT_USAGE, run("disasm"));
    }

    @Test void helpGoesToStdout() {
        assertEquals(Main.EXIT_OK, run("--help"));
        assertThat(out()).contains("usage:");
        assertThat(err()).isEmpty();
    }

    @Test void missingFile() {
        assertEquals(Main.EXIT_FAILURE, run(dir.resolve("absent.s").toString()));
        assertThat(err()).contains("failed to read file");
    }

    @Test void malformedAssembly() throws Exception {
        Path prog = write("bad.s", "pushint 1\nbogus\n");
        assertEquals(Main.EXIT_FAILURE, run(prog.toString()));
        assertThat(err()).contains("load error: line 2: unknown mnemonic `bogus`");
    }

    @Test void programNeedingMoreInputs() throws Exception {
        Path prog = write("add.s", WIDE_ADD);
        assertEquals(Main.EXIT_FAILURE, run(prog.toString(), "7"));
        assertThat(err()).contains("vm init error:");
    }

    @Test void assembleRunAndDisassemble() throws Exception {
        Path text = write("add.s", WIDE_ADD);
        Path bin = dir.resolve("add.bin");

        assertEquals(Main.EXIT_OK, run("asm", text.toString(), bin.toString()));
        byte[] bytes = Files.readAllBytes(bin);
        assertTrue(Bytecode.looksLikeBytecode(bytes));
        assertThat(out()).contains("wrote " + bytes.length + " bytes to " + bin);

        setUp();
        assertEquals(Main.EXIT_OK, run(bin.toString(), "40", "2"));
        assertThat(out()).startsWith("42 (unsigned 42)");

        setUp();
        assertEquals(Main.EXIT_OK, run("disasm", bin.toString()));
        assertEquals("addw\nswap\npop\n", out());
    }

    @Test void disassembleRejectsText() throws Exception {
        Path text = write("add.s", WIDE_ADD);
        assertEquals(Main.EXIT_FAILURE, run("disasm", text.toString()));
        assertThat(err()).contains("load error: decode error at").contains("bad magic");
    }
}
