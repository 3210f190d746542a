package io.vtascan.ir;

import java.util.Objects;

/**
 * Starts the call in a new goroutine.
 */
public final class Go extends Instruction implements CallInstruction {

    private final CallCommon common;

    public Go(CallCommon common) {
        this.common = Objects.requireNonNull(common, "common");
    }

    @Override
    public CallCommon common() {
        return common;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitGo(this);
    }

    @Override
    public String toString() {
        return "go " + common;
    }
}
