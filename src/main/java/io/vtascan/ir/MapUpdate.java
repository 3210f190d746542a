package io.vtascan.ir;

import java.util.Objects;

/**
 * Stores {@code value} under {@code key} in a map: {@code m[key] = value}.
 */
public final class MapUpdate extends Instruction {

    private final Value map;
    private final Value key;
    private final Value value;

    public MapUpdate(Value map, Value key, Value value) {
        this.map = Objects.requireNonNull(map, "map");
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    public Value map() {
        return map;
    }

    public Value key() {
        return key;
    }

    public Value value() {
        return value;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitMapUpdate(this);
    }

    @Override
    public String toString() {
        return map.name() + "[" + key.name() + "] = " + value.name();
    }
}
