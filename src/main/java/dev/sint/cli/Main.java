package dev.sint.cli;

import dev.sint.arith.SignedWords;
import dev.sint.bytecode.Assembly;
import dev.sint.bytecode.Bytecode;
import dev.sint.bytecode.Program;
import dev.sint.expr.CodegenException;
import dev.sint.vm.StackMachine;
import dev.sint.vm.StepResult;
import dev.sint.vm.VmError;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private Main() {}

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length > 0 && args[0].equals("asm")) {
            return assemble(args, out, err);
        }
        if (args.length > 0 && args[0].equals("disasm")) {
            return disassemble(args, out, err);
        }

        Args parsed = Args.parse(args);
        if (parsed == null) {
            usage(err);
            return EXIT_USAGE;
        }
        if (parsed.help) {
            usage(out);
            return EXIT_OK;
        }

        List<Long> inputs = new ArrayList<>(parsed.inputs.size());
        for (String s : parsed.inputs) {
            try {
                inputs.add(SignedWords.encode(new BigInteger(s)));
            } catch (NumberFormatException | CodegenException e) {
                err.println("bad input `" + s + "`: " + e.getMessage());
                return EXIT_USAGE;
            }
        }

        Program program;
        try {
            program = load(Path.of(parsed.programPath));
        } catch (IOException e) {
            err.println("failed to read file: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (Exception e) {
            err.println("load error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (parsed.dump) {
            out.print(Assembly.print(program));
        }

        StackMachine machine;
        try {
            machine = new StackMachine(program, inputs);
        } catch (VmError e) {
            err.println("vm init error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        StepResult r = machine.step(parsed.fuel);
        if (r instanceof StepResult.Done done) {
            out.println(SignedWords.decode(done.value()) + " (unsigned " + Long.toUnsignedString(done.value()) + ")");
            return EXIT_OK;
        }
        if (r instanceof StepResult.Trap trap) {
            err.println("runtime error: " + trap.message());
            return EXIT_FAILURE;
        }
        if (r instanceof StepResult.Yield) {
            err.println("runtime error: out of fuel after " + machine.executedInstructions() + " instruction(s)");
            return EXIT_FAILURE;
        }
        err.println("runtime error: unknown StepResult: " + r);
        return EXIT_FAILURE;
    }

    /** Binary when the file starts with the bytecode magic, text assembly otherwise. */
    static Program load(Path path) throws Exception {
        byte[] bytes = Files.readAllBytes(path);
        if (Bytecode.looksLikeBytecode(bytes)) {
            return Bytecode.fromBytes(bytes);
        }
        return Assembly.parse(new String(bytes, StandardCharsets.UTF_8));
    }

    private static int assemble(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 3) {
            usage(err);
            return EXIT_USAGE;
        }
        try {
            String text = Files.readString(Path.of(args[1]), StandardCharsets.UTF_8);
            byte[] bytes = Bytecode.toBytes(Assembly.parse(text));
            Files.write(Path.of(args[2]), bytes);
            out.println("wrote " + bytes.length + " bytes to " + args[2]);
            return EXIT_OK;
        } catch (IOException e) {
            err.println("i/o error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (Exception e) {
            err.println("asm error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int disassemble(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 2) {
            usage(err);
            return EXIT_USAGE;
        }
        try {
            Program program = Bytecode.fromBytes(Files.readAllBytes(Path.of(args[1])));
            out.print(Assembly.print(program));
            return EXIT_OK;
        } catch (IOException e) {
            err.println("i/o error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (Exception e) {
            err.println("load error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void usage(PrintStream out) {
        out.println("usage: sint [--fuel N] [--dump] <program> [inputs...]");
        out.println("       sint asm <in.s> <out.bin>");
        out.println("       sint disasm <in.bin>");
    }

    private static final class Args {
        boolean help;
        boolean dump;
        Long fuel;
        String programPath;
        List<String> inputs = List.of();

        static Args parse(String[] argv) {
            Args a = new Args();
            ArrayList<String> args = new ArrayList<>(List.of(argv));
            int i = 0;
            loop:
            while (i < args.size()) {
                String s = args.get(i);
                if (!s.startsWith("--")) {
                    break;
                }
                switch (s) {
                    case "--help" -> {
                        a.help = true;
                        i++;
                    }
                    case "--dump" -> {
                        a.dump = true;
                        i++;
                    }
                    case "--fuel" -> {
                        if (i + 1 >= args.size()) {
                            return null;
                        }
                        try {
                            a.fuel = Long.parseLong(args.get(i + 1));
                        } catch (NumberFormatException e) {
                            return null;
                        }
                        if (a.fuel < 0) {
                            return null;
                        }
                        i += 2;
                    }
                    case "--" -> {
                        i++;
                        break loop;
                    }
                    default -> {
                        return null;
                    }
                }
            }

            if (a.help) {
                return a;
            }

            if (i >= args.size()) {
                return null;
            }

            a.programPath = args.get(i);
            i++;
            if (i < args.size()) {
                a.inputs = List.copyOf(args.subList(i, args.size()));
            }
            return a;
        }
    }
}
