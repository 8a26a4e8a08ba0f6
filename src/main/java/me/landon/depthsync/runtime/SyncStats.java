package me.landon.depthsync.runtime;

/**
 * Render-side sync counters: how often a playing frame found a depth map, missed one while frames
 * were buffered, or found the buffer empty.
 */
public final class SyncStats {
    private long lookups;
    private long hits;
    private long misses;
    private long starvations;
    private double lastDeltaMs;
    private double totalDeltaMs;

    void recordHit(double deltaMs, int bufferSize) {
        lookups++;
        hits++;
        lastDeltaMs = deltaMs;
        totalDeltaMs += deltaMs;
        recordStarvation(bufferSize);
    }

    void recordMiss(int bufferSize) {
        lookups++;

        // An empty buffer is starvation, not a miss.
        if (bufferSize > 0) {
            misses++;
        }

        recordStarvation(bufferSize);
    }

    public long lookups() {
        return lookups;
    }

    public long hits() {
        return hits;
    }

    public long misses() {
        return misses;
    }

    public long starvations() {
        return starvations;
    }

    public double lastDeltaMs() {
        return lastDeltaMs;
    }

    public double averageDeltaMs() {
        return hits == 0 ? 0.0 : totalDeltaMs / hits;
    }

    private void recordStarvation(int bufferSize) {
        if (bufferSize == 0) {
            starvations++;
        }
    }
}
