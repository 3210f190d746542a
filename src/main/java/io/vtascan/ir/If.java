package io.vtascan.ir;

import java.util.Objects;

/**
 * Branches to {@code thenBlock} if {@code cond} holds, else to {@code elseBlock}.
 */
public final class If extends Instruction {

    private final Value cond;
    private final int thenBlock;
    private final int elseBlock;

    public If(Value cond, int thenBlock, int elseBlock) {
        this.cond = Objects.requireNonNull(cond, "cond");
        this.thenBlock = thenBlock;
        this.elseBlock = elseBlock;
    }

    public Value cond() {
        return cond;
    }

    public int thenBlock() {
        return thenBlock;
    }

    public int elseBlock() {
        return elseBlock;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitIf(this);
    }

    @Override
    public String toString() {
        return "if " + cond.name() + " goto " + thenBlock + " else " + elseBlock;
    }
}
