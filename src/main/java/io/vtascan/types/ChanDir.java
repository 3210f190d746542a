package io.vtascan.types;

/**
 * Direction of a channel type, or of a select state.
 */
public enum ChanDir {
    /** Bidirectional channel: {@code chan T} */
    SEND_RECV("chan "),
    /** Send-only channel: {@code chan<- T} */
    SEND_ONLY("chan<- "),
    /** Receive-only channel: {@code <-chan T} */
    RECV_ONLY("<-chan ");

    private final String prefix;

    ChanDir(String prefix) {
        this.prefix = prefix;
    }

    String prefix() {
        return prefix;
    }
}
