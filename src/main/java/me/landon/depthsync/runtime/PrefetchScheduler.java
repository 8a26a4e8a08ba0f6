package me.landon.depthsync.runtime;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import java.util.Objects;
import me.landon.depthsync.buffer.JitterBuffer;
import me.landon.depthsync.session.FrameTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the playback position into depth requests, once per display refresh.
 *
 * <p>Requests cover a fixed window of {@link #WINDOW_MS} starting one lead time ahead of playback.
 * Each tick issues at most as many requests as there are free in-flight slots.
 */
public final class PrefetchScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrefetchScheduler.class);

    public static final double DEFAULT_FPS = 30.0;
    public static final double WINDOW_MS = 3000.0;
    public static final double MIN_AUTO_LEAD_MS = 100.0;
    public static final double MAX_AUTO_LEAD_MS = 3000.0;
    public static final double AUTO_LEAD_MARGIN_MS = 100.0;
    public static final long MIN_TIMEOUT_MS = 1000;
    public static final double TIMEOUT_MARGIN_MS = 500.0;

    /** What one tick decided. {@code issued} is empty when no slot was free. */
    public record TickResult(
            double playbackMs,
            double leadMs,
            long timeoutMs,
            double startMs,
            double endMs,
            int availableSlots,
            int missingCount,
            LongList issued) {
        public TickResult {
            issued = LongLists.unmodifiable(new LongArrayList(issued));
        }
    }

    private final JitterBuffer buffer;
    private final FrameTransport transport;
    private final double stepMs;

    public PrefetchScheduler(JitterBuffer buffer, FrameTransport transport, double sessionFps) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.transport = Objects.requireNonNull(transport, "transport");
        double fps = sessionFps > 0 && Double.isFinite(sessionFps) ? sessionFps : DEFAULT_FPS;
        this.stepMs = 1000.0 / fps;
    }

    public TickResult tick(double playbackMs, TuningSnapshot tuning) {
        Objects.requireNonNull(tuning, "tuning");
        double rtt = transport.rttMs();
        double leadMs = leadMs(tuning, rtt);
        long timeoutMs = timeoutMs(rtt);

        double startMs = Math.ceil(Math.max(0.0, playbackMs + leadMs) / stepMs) * stepMs;
        double endMs = startMs + WINDOW_MS;

        int inflight = transport.inflightCount();
        int availableSlots = Math.max(0, tuning.maxInflightRequests() - inflight);
        LongList issued = LongLists.EMPTY_LIST;
        int missingCount = 0;

        if (availableSlots > 0) {
            LongList missing = buffer.getMissing(startMs, endMs, stepMs, timeoutMs);
            missingCount = missing.size();
            issued = missing.subList(0, Math.min(availableSlots, missing.size()));

            for (int i = 0; i < issued.size(); i++) {
                transport.enqueueRequest(issued.getLong(i));
            }

            if (!issued.isEmpty()) {
                LOGGER.debug(
                        "RTT={}ms Lead={}ms Inflight={}/{} Req={} Missing={}",
                        Math.round(rtt),
                        Math.round(leadMs),
                        inflight,
                        tuning.maxInflightRequests(),
                        issued.size(),
                        missingCount);
            }
        }

        buffer.cleanup(playbackMs);

        return new TickResult(
                playbackMs,
                leadMs,
                timeoutMs,
                startMs,
                endMs,
                availableSlots,
                missingCount,
                issued);
    }

    public double stepMs() {
        return stepMs;
    }

    static double leadMs(TuningSnapshot tuning, double rttMs) {
        if (!tuning.autoLeadEnabled()) {
            return tuning.leadTimeMs();
        }

        double lead = Math.max(MIN_AUTO_LEAD_MS, rttMs + AUTO_LEAD_MARGIN_MS);
        return Math.min(MAX_AUTO_LEAD_MS, lead);
    }

    static long timeoutMs(double rttMs) {
        return Math.max(MIN_TIMEOUT_MS, Math.round(rttMs * 2 + TIMEOUT_MARGIN_MS));
    }
}
