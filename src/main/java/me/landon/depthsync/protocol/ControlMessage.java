package me.landon.depthsync.protocol;

import java.util.Objects;

/** JSON text messages exchanged next to the binary frames. */
public sealed interface ControlMessage
        permits ControlMessage.DepthRequest,
                ControlMessage.ServerError,
                ControlMessage.Unrecognized {

    record DepthRequest(long timeMs) implements ControlMessage {
        public DepthRequest {
            if (timeMs < 0) {
                throw new IllegalArgumentException("timeMs must not be negative: " + timeMs);
            }
        }
    }

    record ServerError(String message) implements ControlMessage {
        public ServerError {
            message = Objects.requireNonNull(message, "message");
        }
    }

    record Unrecognized(String type) implements ControlMessage {
        public Unrecognized {
            type = Objects.requireNonNull(type, "type");
        }
    }
}
