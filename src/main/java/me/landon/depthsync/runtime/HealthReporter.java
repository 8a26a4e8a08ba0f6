package me.landon.depthsync.runtime;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;
import me.landon.depthsync.buffer.JitterBuffer;
import me.landon.depthsync.session.FrameTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Periodic one-line summary of buffer depth and link quality. */
public final class HealthReporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(HealthReporter.class);

    private final JitterBuffer buffer;
    private final FrameTransport transport;
    private final Consumer<String> remoteSink;
    private final boolean verbose;

    /**
     * @param remoteSink receives every report line, or {@code null} to keep reports local
     * @param verbose log reports at INFO instead of DEBUG
     */
    public HealthReporter(
            JitterBuffer buffer,
            FrameTransport transport,
            Consumer<String> remoteSink,
            boolean verbose) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.remoteSink = remoteSink;
        this.verbose = verbose;
    }

    public String report() {
        String message =
                format(
                        buffer.size(),
                        transport.rttMs(),
                        transport.jitterMs(),
                        transport.inflightCount());

        if (verbose) {
            LOGGER.info(message);
        } else {
            LOGGER.debug(message);
        }

        if (remoteSink != null) {
            try {
                remoteSink.accept(message);
            } catch (RuntimeException ex) {
                LOGGER.debug("Remote health report failed: {}", ex.toString());
            }
        }

        return message;
    }

    static String format(int bufferSize, double rttMs, double jitterMs, int inflight) {
        return String.format(
                Locale.ROOT,
                "[Health] Buffer=%d RTT=%.0fms Jitter=%.1fms Inflight=%d",
                bufferSize,
                rttMs,
                jitterMs,
                inflight);
    }
}
