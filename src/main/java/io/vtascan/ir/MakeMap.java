package io.vtascan.ir;

import io.vtascan.types.Type;

public final class MakeMap extends Register {

    private final Value reserve;

    /**
     * @param reserve Initial space hint, may be null
     */
    public MakeMap(String name, Type type, Value reserve) {
        super(name, type);
        this.reserve = reserve;
    }

    public Value reserve() {
        return reserve;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitMakeMap(this);
    }

    @Override
    protected String describe() {
        return "make " + type() + (reserve == null ? "" : " " + reserve.name());
    }
}
