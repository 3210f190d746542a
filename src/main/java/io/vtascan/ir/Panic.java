package io.vtascan.ir;

import java.util.Objects;

public final class Panic extends Instruction {

    private final Value x;

    public Panic(Value x) {
        this.x = Objects.requireNonNull(x, "x");
    }

    public Value x() {
        return x;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitPanic(this);
    }

    @Override
    public String toString() {
        return "panic " + x.name();
    }
}
