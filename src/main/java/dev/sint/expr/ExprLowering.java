package dev.sint.expr;

import dev.sint.bytecode.Instruction;
import dev.sint.bytecode.Program;
import dev.sint.bytecode.ProgramVerifier;
import dev.sint.bytecode.StackProfile;
import dev.sint.bytecode.VerifyException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flattens a node tree into a linear program: depth first, operands left to right, then the
 * node's own opcode.
 *
 * <p>A conditional lowers to {@code cond; bz else_k; then; b end_k; else_k: else; end_k:}, with
 * {@code k} numbered in emission order so equal trees give equal programs.</p>
 */
public final class ExprLowering {
    private final List<Instruction> code = new ArrayList<>();
    private int nextLabel;

    private ExprLowering() {}

    public static Program lower(Expr root) {
        Objects.requireNonNull(root, "root");
        ExprLowering lowering = new ExprLowering();
        lowering.emit(root);
        return new Program(lowering.code);
    }

    /**
     * Static stack profile of a node.
     *
     * @throws VerifyException if the lowered code has inconsistent branch depths
     */
    public static StackProfile profile(Expr root) throws VerifyException {
        return ProgramVerifier.verify(lower(root));
    }

    private void emit(Expr expr) {
        if (expr instanceof OpExpr op) {
            for (Expr operand : op.operands()) {
                emit(operand);
            }
            code.add(op.instruction());
            return;
        }
        if (expr instanceof CondExpr cond) {
            int k = nextLabel++;
            String elseLabel = "else_" + k;
            String endLabel = "end_" + k;
            emit(cond.condition());
            code.add(new Instruction.Bz(elseLabel));
            emit(cond.whenTrue());
            code.add(new Instruction.B(endLabel));
            code.add(new Instruction.Label(elseLabel));
            emit(cond.whenFalse());
            code.add(new Instruction.Label(endLabel));
            return;
        }
        throw new IllegalStateException("unknown node: " + expr);
    }
}
