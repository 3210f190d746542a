package io.vtascan.ir;

/**
 * An instruction of a function body. Instructions that define a value extend {@link Register}.
 */
public abstract class Instruction {

    private BasicBlock block;
    private int index = -1;

    void attach(BasicBlock owner, int position) {
        if (block != null) {
            throw new IllegalStateException("Instruction already belongs to " + block + ": " + this);
        }
        this.block = owner;
        this.index = position;
    }

    /**
     * Returns the function containing this instruction, or null if it was never added to a block.
     */
    public Function parent() {
        return block == null ? null : block.parent();
    }

    public BasicBlock block() {
        return block;
    }

    /**
     * Returns a human-readable location, e.g. {@code P.main: block 0, instruction 3}.
     */
    public String location() {
        if (block == null) {
            return "<detached>";
        }
        return block.parent().qualifiedName() + ": block " + block.index() + ", instruction " + index;
    }

    /**
     * Dispatches to the visitor method for this instruction class.
     */
    public abstract void accept(InstructionVisitor visitor);
}
