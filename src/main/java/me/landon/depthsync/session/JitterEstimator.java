package me.landon.depthsync.session;

/** Standard deviation of the gaps between the most recent frame arrivals. */
public final class JitterEstimator {
    public static final int WINDOW_SIZE = 30;

    private final double[] gaps = new double[WINDOW_SIZE];
    private int count;
    private int next;
    private boolean hasArrival;
    private long lastArrivalMs;

    public void onArrival(long nowMs) {
        if (hasArrival) {
            gaps[next] = nowMs - lastArrivalMs;
            next = (next + 1) % WINDOW_SIZE;
            count = Math.min(WINDOW_SIZE, count + 1);
        }

        hasArrival = true;
        lastArrivalMs = nowMs;
    }

    /** Population standard deviation of the window, or 0 with fewer than two gaps. */
    public double jitterMs() {
        if (count < 2) {
            return 0.0;
        }

        double sum = 0.0;
        for (int i = 0; i < count; i++) {
            sum += gaps[i];
        }

        double mean = sum / count;
        double squares = 0.0;
        for (int i = 0; i < count; i++) {
            double delta = gaps[i] - mean;
            squares += delta * delta;
        }

        return Math.sqrt(squares / count);
    }

    public int sampleCount() {
        return count;
    }
}
