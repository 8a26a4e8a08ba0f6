package me.landon.depthsync.network;

import com.google.gson.annotations.SerializedName;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status document returned by {@code GET /api/sessions/{id}/status}.
 *
 * <p>{@link #config} and {@link #rollingStats} are absent on older servers and stay {@code null}.
 */
public final class SessionStatus {
    @SerializedName("session_id")
    public String sessionId;

    public int width;
    public int height;
    public double fps;

    @SerializedName("duration_ms")
    public Double durationMs;

    @SerializedName("buffer_length")
    public int bufferLength;

    @SerializedName("last_depth_time_ms")
    public Double lastDepthTimeMs;

    public Map<String, Double> telemetry = new LinkedHashMap<>();

    @SerializedName("rolling_stats")
    public RollingStats rollingStats;

    public ServerConfig config;

    /** Rolling server-side averages; durations are in seconds. */
    public static final class RollingStats {
        @SerializedName("depth_fps")
        public double depthFps;

        @SerializedName("latency_ms")
        public double latencyMs;

        @SerializedName("infer_avg_s")
        public double inferAvgSeconds;

        @SerializedName("queue_avg_s")
        public double queueAvgSeconds;

        @SerializedName("ws_send_avg_s")
        public double sendAvgSeconds;

        @SerializedName("decode_avg_s")
        public Double decodeAvgSeconds;

        @SerializedName("drop_count")
        public long dropCount;
    }

    public static final class ServerConfig {
        @SerializedName("inference_workers")
        public int inferenceWorkers;

        @SerializedName("process_res")
        public int processResolution;

        @SerializedName("downsample_factor")
        public int downsampleFactor;
    }
}
