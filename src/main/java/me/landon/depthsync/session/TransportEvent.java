package me.landon.depthsync.session;

import java.util.Objects;

/**
 * Socket callbacks reified as events so they can be queued onto the event loop and applied in
 * arrival order. Every event carries the id of the connection that produced it; events from a
 * superseded connection are ignored.
 */
public sealed interface TransportEvent
        permits TransportEvent.Opened,
                TransportEvent.TextReceived,
                TransportEvent.BinaryReceived,
                TransportEvent.Failed,
                TransportEvent.Closed {

    long connectionId();

    record Opened(long connectionId) implements TransportEvent {}

    record TextReceived(long connectionId, String text) implements TransportEvent {
        public TextReceived {
            text = Objects.requireNonNull(text, "text");
        }
    }

    /** Ownership of {@code payload} passes to the receiver. */
    record BinaryReceived(long connectionId, byte[] payload) implements TransportEvent {
        public BinaryReceived {
            payload = Objects.requireNonNull(payload, "payload");
        }
    }

    record Failed(long connectionId, Throwable error) implements TransportEvent {
        public Failed {
            error = Objects.requireNonNull(error, "error");
        }
    }

    record Closed(long connectionId, int code, String reason) implements TransportEvent {
        public Closed {
            reason = reason == null ? "" : reason;
        }
    }
}
