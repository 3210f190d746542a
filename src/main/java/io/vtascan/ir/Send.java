package io.vtascan.ir;

import java.util.Objects;

/**
 * Sends {@code x} on a channel.
 */
public final class Send extends Instruction {

    private final Value chan;
    private final Value x;

    public Send(Value chan, Value x) {
        this.chan = Objects.requireNonNull(chan, "chan");
        this.x = Objects.requireNonNull(x, "x");
    }

    public Value chan() {
        return chan;
    }

    public Value x() {
        return x;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitSend(this);
    }

    @Override
    public String toString() {
        return "send " + chan.name() + " <- " + x.name();
    }
}
