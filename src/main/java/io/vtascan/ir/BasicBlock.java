package io.vtascan.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block: an ordered list of instructions of one function.
 */
public final class BasicBlock {

    private final Function parent;
    private final int index;
    private final List<Instruction> instructions = new ArrayList<>();

    BasicBlock(Function parent, int index) {
        this.parent = parent;
        this.index = index;
    }

    public Function parent() {
        return parent;
    }

    public int index() {
        return index;
    }

    public List<Instruction> instructions() {
        return Collections.unmodifiableList(instructions);
    }

    <T extends Instruction> T add(T instruction) {
        parent.checkOpen();
        instruction.attach(this, instructions.size());
        instructions.add(instruction);
        return instruction;
    }

    @Override
    public String toString() {
        return parent.name() + "." + index;
    }
}
