package io.vtascan.ir;

import java.util.Objects;

/**
 * Pushes the call on the function's defer stack.
 */
public final class Defer extends Instruction implements CallInstruction {

    private final CallCommon common;

    public Defer(CallCommon common) {
        this.common = Objects.requireNonNull(common, "common");
    }

    @Override
    public CallCommon common() {
        return common;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitDefer(this);
    }

    @Override
    public String toString() {
        return "defer " + common;
    }
}
