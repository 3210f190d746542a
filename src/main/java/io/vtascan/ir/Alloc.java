package io.vtascan.ir;

import io.vtascan.types.PointerType;
import io.vtascan.types.Type;

/**
 * Allocates a variable of the given type and yields its address.
 */
public final class Alloc extends Register {

    private final boolean heap;

    public Alloc(String name, Type allocated, boolean heap) {
        super(name, new PointerType(allocated));
        this.heap = heap;
    }

    public Type allocated() {
        return ((PointerType) type()).elem();
    }

    public boolean isHeap() {
        return heap;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitAlloc(this);
    }

    @Override
    protected String describe() {
        return (heap ? "new " : "local ") + allocated();
    }
}
