package io.vtascan.ir;

import io.vtascan.types.ChanDir;
import io.vtascan.types.TupleType;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Waits on several channel operations. The result is the tuple
 * {@code (index int, recvOk bool, r_0, ... r_n-1)} holding one component per receive state.
 */
public final class Select extends Register {

    /**
     * One case of a select: a send of {@code send} on {@code chan}, or a receive from it
     * ({@code send} is null).
     */
    public record SelectState(ChanDir dir, Value chan, Value send) {

        public SelectState {
            Objects.requireNonNull(dir, "dir");
            Objects.requireNonNull(chan, "chan");
            if (dir == ChanDir.SEND_ONLY && send == null) {
                throw new IllegalArgumentException("send state needs a value");
            }
            if (dir == ChanDir.RECV_ONLY && send != null) {
                throw new IllegalArgumentException("receive state cannot carry a value");
            }
            if (dir == ChanDir.SEND_RECV) {
                throw new IllegalArgumentException("select state must send or receive");
            }
        }

        public boolean isSend() {
            return dir == ChanDir.SEND_ONLY;
        }
    }

    private final List<SelectState> states;
    private final boolean blocking;

    public Select(String name, List<SelectState> states, boolean blocking, TupleType type) {
        super(name, type);
        this.states = List.copyOf(states);
        this.blocking = blocking;
    }

    public List<SelectState> states() {
        return states;
    }

    public boolean isBlocking() {
        return blocking;
    }

    @Override
    public TupleType type() {
        return (TupleType) super.type();
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitSelect(this);
    }

    @Override
    protected String describe() {
        return "select " + (blocking ? "blocking " : "nonblocking ") + states.stream()
                .map(s -> s.isSend() ? s.chan().name() + "<-" + s.send().name() : "<-" + s.chan().name())
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
