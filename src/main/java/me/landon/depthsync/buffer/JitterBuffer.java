package me.landon.depthsync.buffer;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;
import me.landon.depthsync.protocol.DepthFrame;

/**
 * Time-indexed store of decoded depth frames.
 *
 * <p>Frames are kept in ascending timestamp order. Lookups tolerate up to {@link #TOLERANCE_MS}
 * of drift between playback time and frame time, and frames that fall more than {@link
 * #PRUNE_AGE_MS} behind a lookup are discarded. Outstanding requests live in the shared {@link
 * RequestTracker}.
 */
public final class JitterBuffer {
    public static final long TOLERANCE_MS = 33;
    public static final long PRUNE_AGE_MS = 1000;
    public static final long MARKER_RETENTION_MS = 2000;

    private final List<DepthFrame> frames = new ArrayList<>();
    private final RequestTracker requestTracker;
    private final LongSupplier clock;

    public JitterBuffer(RequestTracker requestTracker, LongSupplier clock) {
        this.requestTracker = Objects.requireNonNull(requestTracker, "requestTracker");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void add(DepthFrame frame) {
        Objects.requireNonNull(frame, "frame");
        requestTracker.resolve(frame.timestampMs());

        int index = frames.size();

        // Frames arrive close to ordered, so scan back from the tail.
        while (index > 0 && frames.get(index - 1).timestampMs() > frame.timestampMs()) {
            index--;
        }

        frames.add(index, frame);
    }

    /**
     * Finds the frame closest to {@code timeMs}.
     *
     * <p>Frames older than {@code timeMs - PRUNE_AGE_MS} are dropped as a side effect.
     *
     * @return the closest frame within {@link #TOLERANCE_MS}, or {@code null} if there is none
     */
    public DepthFrame getFrame(double timeMs) {
        DepthFrame best = null;
        double bestDiff = Double.MAX_VALUE;
        int pruneIndex = -1;

        for (int i = 0; i < frames.size(); i++) {
            DepthFrame frame = frames.get(i);
            long timestamp = frame.timestampMs();
            double diff = Math.abs(timestamp - timeMs);

            if (timestamp < timeMs - PRUNE_AGE_MS) {
                pruneIndex = i;
            }

            if (diff < bestDiff && diff <= TOLERANCE_MS) {
                bestDiff = diff;
                best = frame;
            }

            if (timestamp > timeMs + TOLERANCE_MS) {
                break;
            }
        }

        if (pruneIndex >= 0) {
            frames.subList(0, pruneIndex + 1).clear();
        }

        return best;
    }

    /**
     * Lists grid timestamps in {@code [startMs, endMs]} that are neither buffered nor awaiting a
     * response, and marks each returned timestamp as requested.
     *
     * <p>Grid points are rounded to whole milliseconds, the unit requests are sent in.
     */
    public LongList getMissing(double startMs, double endMs, double stepMs, long timeoutMs) {
        if (!(stepMs > 0)) {
            throw new IllegalArgumentException("stepMs must be positive: " + stepMs);
        }

        LongList missing = new LongArrayList();
        long now = clock.getAsLong();
        double halfStep = stepMs * 0.5;

        for (int i = 0; ; i++) {
            double gridPoint = startMs + i * stepMs;

            if (gridPoint > endMs) {
                break;
            }

            long timestamp = Math.round(gridPoint);

            if (hasFrameNear(timestamp, halfStep)) {
                continue;
            }

            if (requestTracker.isAwaiting(timestamp, now, timeoutMs)) {
                continue;
            }

            missing.add(timestamp);
            requestTracker.mark(timestamp, now);
        }

        return missing;
    }

    /** Forgets requests that fell more than two seconds behind playback. */
    public void cleanup(double currentPlaybackTimeMs) {
        requestTracker.clearBefore(
                (long) Math.ceil(currentPlaybackTimeMs - MARKER_RETENTION_MS));
    }

    public void clear() {
        frames.clear();
        requestTracker.clear();
    }

    public int size() {
        return frames.size();
    }

    public int requestedSize() {
        return requestTracker.markedCount();
    }

    public List<DepthFrame> framesSnapshot() {
        return List.copyOf(frames);
    }

    private boolean hasFrameNear(long timestamp, double halfStep) {
        for (DepthFrame frame : frames) {
            if (Math.abs(frame.timestampMs() - timestamp) < halfStep) {
                return true;
            }
        }

        return false;
    }
}
