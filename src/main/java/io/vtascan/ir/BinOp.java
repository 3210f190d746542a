package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * A binary operation such as {@code x + y} or {@code x == y}.
 */
public final class BinOp extends Register {

    private final String op;
    private final Value x;
    private final Value y;

    public BinOp(String name, String op, Value x, Value y, Type type) {
        super(name, type);
        this.op = Objects.requireNonNull(op, "op");
        this.x = Objects.requireNonNull(x, "x");
        this.y = Objects.requireNonNull(y, "y");
    }

    public String op() {
        return op;
    }

    public Value x() {
        return x;
    }

    public Value y() {
        return y;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitBinOp(this);
    }

    @Override
    protected String describe() {
        return x.name() + " " + op + " " + y.name();
    }
}
