package io.vtascan.ir;

public final class Jump extends Instruction {

    private final int target;

    public Jump(int target) {
        this.target = target;
    }

    /**
     * Returns the index of the successor block.
     */
    public int target() {
        return target;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitJump(this);
    }

    @Override
    public String toString() {
        return "jump " + target;
    }
}
