package io.vtascan.ir;

public final class RunDefers extends Instruction {

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitRunDefers(this);
    }

    @Override
    public String toString() {
        return "rundefers";
    }
}
