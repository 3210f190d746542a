package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Slices a string, slice or pointer to array: {@code x[low:high:max]}. Bounds may be null.
 */
public final class Slice extends Register {

    private final Value x;
    private final Value low;
    private final Value high;
    private final Value max;

    public Slice(String name, Value x, Value low, Value high, Value max, Type type) {
        super(name, type);
        this.x = Objects.requireNonNull(x, "x");
        this.low = low;
        this.high = high;
        this.max = max;
    }

    public Value x() {
        return x;
    }

    public Value low() {
        return low;
    }

    public Value high() {
        return high;
    }

    public Value max() {
        return max;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitSlice(this);
    }

    @Override
    protected String describe() {
        StringBuilder sb = new StringBuilder("slice ").append(x.name()).append('[');
        sb.append(low == null ? "" : low.name()).append(':').append(high == null ? "" : high.name());
        if (max != null) {
            sb.append(':').append(max.name());
        }
        return sb.append(']').toString();
    }
}
