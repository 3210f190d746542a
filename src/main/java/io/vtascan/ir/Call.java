package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * A function call or interface method invocation; the register holds the result (a tuple when
 * the callee returns several values).
 */
public final class Call extends Register implements CallInstruction {

    private final CallCommon common;

    public Call(String name, CallCommon common, Type type) {
        super(name, type);
        this.common = Objects.requireNonNull(common, "common");
    }

    @Override
    public CallCommon common() {
        return common;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitCall(this);
    }

    @Override
    protected String describe() {
        return common.toString();
    }
}
