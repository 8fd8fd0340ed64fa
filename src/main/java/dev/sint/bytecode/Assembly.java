package dev.sint.bytecode;

/** Text form of a {@link Program}: one instruction per line. */
public final class Assembly {
    private Assembly() {}

    public static String print(Program program) {
        return AsmWriter.write(program);
    }

    public static Program parse(String text) throws AsmParseException {
        return new AsmParser(text).parse();
    }
}
