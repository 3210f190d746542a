package io.vtascan.ir;

import io.vtascan.types.ChanType;

import java.util.Objects;

public final class MakeChan extends Register {

    private final Value size;

    public MakeChan(String name, ChanType type, Value size) {
        super(name, type);
        this.size = Objects.requireNonNull(size, "size");
    }

    public Value size() {
        return size;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitMakeChan(this);
    }

    @Override
    protected String describe() {
        return "make " + type() + " " + size.name();
    }
}
