package me.landon.depthsync.session;

/**
 * Exponential moving average of request round-trip time.
 *
 * <pre>
 * first sample:  rtt = min(INITIAL_CLAMP_MS, sample)
 * later samples: rtt = rtt * (1 - ALPHA) + min(SAMPLE_CLAMP_MS, sample) * ALPHA
 * </pre>
 *
 * <p>The clamps keep one huge response (for example the server loading its model) from
 * dominating the estimate.
 */
public final class RttEstimator {
    public static final double ALPHA = 0.1;
    public static final double INITIAL_CLAMP_MS = 1000.0;
    public static final double SAMPLE_CLAMP_MS = 2000.0;

    private double rttMs;
    private boolean hasSample;
    private long sampleCount;

    public void addSample(double durationMs) {
        double duration = Math.max(0.0, durationMs);

        if (!hasSample) {
            rttMs = Math.min(INITIAL_CLAMP_MS, duration);
            hasSample = true;
        } else {
            double clamped = Math.min(SAMPLE_CLAMP_MS, duration);
            rttMs = rttMs * (1 - ALPHA) + clamped * ALPHA;
        }

        sampleCount++;
    }

    /** Current estimate in milliseconds, or 0 before the first sample. */
    public double rttMs() {
        return rttMs;
    }

    public boolean hasSample() {
        return hasSample;
    }

    public long sampleCount() {
        return sampleCount;
    }
}
