package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

public final class MakeSlice extends Register {

    private final Value len;
    private final Value cap;

    public MakeSlice(String name, Type type, Value len, Value cap) {
        super(name, type);
        this.len = Objects.requireNonNull(len, "len");
        this.cap = Objects.requireNonNull(cap, "cap");
    }

    public Value len() {
        return len;
    }

    public Value cap() {
        return cap;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitMakeSlice(this);
    }

    @Override
    protected String describe() {
        return "make " + type() + " " + len.name() + " " + cap.name();
    }
}
