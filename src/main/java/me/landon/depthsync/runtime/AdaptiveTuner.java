package me.landon.depthsync.runtime;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import me.landon.depthsync.network.SessionStatus;
import me.landon.depthsync.network.StatusSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retunes in-flight capacity and lead time from the server's rolling statistics.
 *
 * <p>At most one status request is outstanding. Results are applied on the event loop.
 */
public final class AdaptiveTuner {
    private static final Logger LOGGER = LoggerFactory.getLogger(AdaptiveTuner.class);

    public static final int INFLIGHT_PER_WORKER = 4;
    public static final double BASE_SAFETY_S = 0.05;
    public static final double INFER_SAFETY_FACTOR = 0.1;
    public static final double DEFAULT_DECODE_S = 0.05;
    public static final double PIPELINE_LEAD_PER_WORKER_MS = 40.0;
    public static final double MIN_LEAD_MS = 50.0;
    public static final double MAX_LEAD_MS = 2000.0;
    public static final double LEAD_HYSTERESIS_MS = 20.0;

    private final StatusSource statusSource;
    private final String sessionId;
    private final TuningState tuningState;
    private final Executor eventLoop;

    private boolean pollInFlight;
    private long pollFailures;

    public AdaptiveTuner(
            StatusSource statusSource,
            String sessionId,
            TuningState tuningState,
            Executor eventLoop) {
        this.statusSource = Objects.requireNonNull(statusSource, "statusSource");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.tuningState = Objects.requireNonNull(tuningState, "tuningState");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
    }

    /** Requests a fresh status unless the previous request is still outstanding. */
    public void poll() {
        if (pollInFlight) {
            return;
        }

        pollInFlight = true;

        try {
            statusSource.fetchStatus(
                    sessionId,
                    new StatusSource.Callback() {
                        @Override
                        public void onStatus(SessionStatus status) {
                            post(() -> onPollCompleted(status));
                        }

                        @Override
                        public void onFailure(Exception error) {
                            post(() -> onPollFailed(error));
                        }
                    });
        } catch (RuntimeException ex) {
            onPollFailed(ex);
        }
    }

    /**
     * Applies one status document to the tuning state.
     *
     * @return the snapshot in effect afterwards
     */
    public TuningSnapshot adjust(SessionStatus status) {
        Objects.requireNonNull(status, "status");
        TuningSnapshot current = tuningState.snapshot();
        int workers = status.config != null ? status.config.inferenceWorkers : 0;

        if (workers > 0) {
            int targetInflight = workers * INFLIGHT_PER_WORKER;

            if (current.maxInflightRequests() != targetInflight) {
                current = tuningState.update(s -> s.withMaxInflightRequests(targetInflight));
                LOGGER.debug("Adjusted maxInflight to {}", targetInflight);
            }
        }

        SessionStatus.RollingStats stats = status.rollingStats;

        if (!current.autoLeadEnabled() || stats == null) {
            return current;
        }

        double safety = BASE_SAFETY_S + stats.inferAvgSeconds * INFER_SAFETY_FACTOR;
        // Servers that do not time decoding report nothing or zero.
        double decode =
                stats.decodeAvgSeconds != null && stats.decodeAvgSeconds > 0
                        ? stats.decodeAvgSeconds
                        : DEFAULT_DECODE_S;
        double processing = stats.queueAvgSeconds + decode + stats.inferAvgSeconds + safety;
        double targetLeadMs = processing * 1000.0;

        if (workers > 0) {
            targetLeadMs = Math.max(targetLeadMs, workers * PIPELINE_LEAD_PER_WORKER_MS);
        }

        targetLeadMs = Math.max(MIN_LEAD_MS, Math.min(MAX_LEAD_MS, targetLeadMs));

        if (Math.abs(targetLeadMs - current.leadTimeMs()) > LEAD_HYSTERESIS_MS) {
            int leadMs = (int) Math.round(targetLeadMs);
            current = tuningState.update(s -> s.withLeadTimeMs(leadMs));
            LOGGER.debug(
                    "Adjusted lead to {}ms (infer={}s)",
                    leadMs,
                    String.format(Locale.ROOT, "%.3f", stats.inferAvgSeconds));
        }

        return current;
    }

    public boolean isPollInFlight() {
        return pollInFlight;
    }

    public long pollFailures() {
        return pollFailures;
    }

    private void onPollCompleted(SessionStatus status) {
        pollInFlight = false;

        try {
            adjust(status);
        } catch (RuntimeException ex) {
            LOGGER.warn("Ignoring unusable session status", ex);
        }
    }

    private void onPollFailed(Exception error) {
        pollInFlight = false;
        pollFailures++;
        LOGGER.debug("Status poll failed: {}", error.toString());
    }

    private void post(Runnable task) {
        try {
            eventLoop.execute(task);
        } catch (RejectedExecutionException ex) {
            LOGGER.debug("Event loop stopped, dropping status result");
        }
    }
}
