package dev.sint.bytecode;

/** Binary form of a {@link Program}. */
public final class Bytecode {
    static final byte[] MAGIC = new byte[] {'S', 'I', 'N', 'T', 'B', 'C', '0', 0};
    static final int VERSION_MAJOR = 0;
    static final int VERSION_MINOR = 1;

    private Bytecode() {}

    public static byte[] toBytes(Program program) throws BytecodeEncodeException {
        return new BytecodeEncoder().encode(program);
    }

    public static Program fromBytes(byte[] bytes) throws BytecodeDecodeException {
        return new BytecodeDecoder().decode(bytes);
    }

    /** Whether {@code bytes} starts with the binary magic. */
    public static boolean looksLikeBytecode(byte[] bytes) {
        if (bytes.length < MAGIC.length) {
            return false;
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (bytes[i] != MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
}
