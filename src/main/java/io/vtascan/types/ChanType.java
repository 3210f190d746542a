package io.vtascan.types;

import java.util.Objects;

/**
 * A channel type such as {@code chan T}, {@code <-chan T} or {@code chan<- T}.
 */
public record ChanType(Type elem, ChanDir dir) implements Type {

    public ChanType {
        Objects.requireNonNull(elem, "elem");
        Objects.requireNonNull(dir, "dir");
    }

    public ChanType(Type elem) {
        this(elem, ChanDir.SEND_RECV);
    }

    @Override
    public String toString() {
        return dir.prefix() + elem;
    }
}
