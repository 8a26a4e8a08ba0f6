package me.landon.depthsync.runtime;

import me.landon.depthsync.config.DepthSyncConfig;

/** Flow-control parameters read once per scheduler tick. */
public record TuningSnapshot(int maxInflightRequests, int leadTimeMs, boolean autoLeadEnabled) {
    public TuningSnapshot {
        if (maxInflightRequests < 1) {
            throw new IllegalArgumentException(
                    "maxInflightRequests must be positive: " + maxInflightRequests);
        }

        if (leadTimeMs < 0) {
            throw new IllegalArgumentException("leadTimeMs must not be negative: " + leadTimeMs);
        }
    }

    public static TuningSnapshot fromConfig(DepthSyncConfig config) {
        return new TuningSnapshot(
                config.maxInflightRequests, config.depthLeadMs, config.autoLeadEnabled);
    }

    public TuningSnapshot withMaxInflightRequests(int value) {
        return new TuningSnapshot(value, leadTimeMs, autoLeadEnabled);
    }

    public TuningSnapshot withLeadTimeMs(int value) {
        return new TuningSnapshot(maxInflightRequests, value, autoLeadEnabled);
    }

    public TuningSnapshot withAutoLeadEnabled(boolean value) {
        return new TuningSnapshot(maxInflightRequests, leadTimeMs, value);
    }
}
