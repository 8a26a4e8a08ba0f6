package me.landon.depthsync.protocol;

import java.util.Objects;

public final class BinaryDecodingException extends Exception {
    private static final long serialVersionUID = 1L;

    /** Why a binary payload was rejected. Each reason is counted separately. */
    public enum Reason {
        TRUNCATED,
        UNKNOWN_TAG,
        VERSION_MISMATCH,
        DIMENSIONS_OUT_OF_BOUNDS,
        SIZE_MISMATCH,
        CORRUPT_PAYLOAD,
        OUT_OF_ORDER
    }

    private final Reason reason;

    public BinaryDecodingException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public BinaryDecodingException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
