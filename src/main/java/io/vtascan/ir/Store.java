package io.vtascan.ir;

import java.util.Objects;

/**
 * Stores {@code val} at the address {@code addr}: {@code *addr = val}.
 */
public final class Store extends Instruction {

    private final Value addr;
    private final Value val;

    public Store(Value addr, Value val) {
        this.addr = Objects.requireNonNull(addr, "addr");
        this.val = Objects.requireNonNull(val, "val");
    }

    public Value addr() {
        return addr;
    }

    public Value val() {
        return val;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitStore(this);
    }

    @Override
    public String toString() {
        return "*" + addr.name() + " = " + val.name();
    }
}
