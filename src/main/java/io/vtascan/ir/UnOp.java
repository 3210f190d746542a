package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * A unary operation: pointer dereference, channel receive or arithmetic.
 */
public final class UnOp extends Register {

    public enum Op {
        DEREF("*"),
        RECV("<-"),
        NEG("-"),
        NOT("!"),
        XOR("^");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Op op;
    private final Value x;
    private final boolean commaOk;

    public UnOp(String name, Op op, Value x, boolean commaOk, Type type) {
        super(name, type);
        this.op = Objects.requireNonNull(op, "op");
        this.x = Objects.requireNonNull(x, "x");
        this.commaOk = commaOk;
    }

    public Op op() {
        return op;
    }

    public Value x() {
        return x;
    }

    /**
     * True for a receive that also yields the "ok" flag; the result is then a tuple.
     */
    public boolean commaOk() {
        return commaOk;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitUnOp(this);
    }

    @Override
    protected String describe() {
        return op.symbol() + x.name() + (commaOk ? ",ok" : "");
    }
}
