package me.landon.depthsync.session;

public enum ConnectionState {
    DISCONNECTED(false),
    CONNECTING(false),
    OPEN(true),
    CLOSED(false);

    private final boolean canSend;

    ConnectionState(boolean canSend) {
        this.canSend = canSend;
    }

    public boolean canSend() {
        return canSend;
    }

    public boolean isActive() {
        return this == CONNECTING || this == OPEN;
    }
}
