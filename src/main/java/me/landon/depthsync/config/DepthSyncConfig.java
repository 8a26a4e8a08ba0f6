package me.landon.depthsync.config;

import java.util.Locale;
import me.landon.depthsync.protocol.DepthFrameCodec;

public final class DepthSyncConfig {
    public static final String DEFAULT_SERVER_BASE_URL = "http://localhost:8000";
    private static final String VERSION_POLICY_REJECT = "REJECT";
    private static final String VERSION_POLICY_TOLERATE = "TOLERATE";
    public static final int DEFAULT_MAX_INFLIGHT_REQUESTS = 8;
    public static final int DEFAULT_DEPTH_LEAD_MS = 2000;
    public static final int MAX_DEPTH_LEAD_MS = 3000;
    public static final int DEFAULT_REFRESH_INTERVAL_MS = 16;
    public static final int DEFAULT_STATUS_POLL_INTERVAL_MS = 500;
    public static final int DEFAULT_HEALTH_REPORT_INTERVAL_MS = 5000;

    public String serverBaseUrl = DEFAULT_SERVER_BASE_URL;
    public int maxInflightRequests = DEFAULT_MAX_INFLIGHT_REQUESTS;
    public int depthLeadMs = DEFAULT_DEPTH_LEAD_MS;
    public boolean autoLeadEnabled = false;
    public String frameVersionPolicy = VERSION_POLICY_REJECT;
    public boolean logMalformedOncePerConnection = true;
    public int refreshIntervalMs = DEFAULT_REFRESH_INTERVAL_MS;
    public int statusPollIntervalMs = DEFAULT_STATUS_POLL_INTERVAL_MS;
    public int healthReportIntervalMs = DEFAULT_HEALTH_REPORT_INTERVAL_MS;
    public boolean remoteHealthLogging = false;
    public boolean verboseHealthLogging = false;

    public static DepthSyncConfig defaults() {
        return new DepthSyncConfig();
    }

    public void sanitize() {
        if (serverBaseUrl == null || serverBaseUrl.isBlank()) {
            serverBaseUrl = DEFAULT_SERVER_BASE_URL;
        }

        serverBaseUrl = serverBaseUrl.trim();

        while (serverBaseUrl.endsWith("/")) {
            serverBaseUrl = serverBaseUrl.substring(0, serverBaseUrl.length() - 1);
        }

        String lowerUrl = serverBaseUrl.toLowerCase(Locale.ROOT);
        if (!lowerUrl.startsWith("http://") && !lowerUrl.startsWith("https://")) {
            serverBaseUrl = DEFAULT_SERVER_BASE_URL;
        }

        if (frameVersionPolicy == null || frameVersionPolicy.isBlank()) {
            frameVersionPolicy = VERSION_POLICY_REJECT;
        } else {
            frameVersionPolicy = frameVersionPolicy.trim().toUpperCase(Locale.ROOT);
        }

        if (!VERSION_POLICY_REJECT.equals(frameVersionPolicy)
                && !VERSION_POLICY_TOLERATE.equals(frameVersionPolicy)) {
            frameVersionPolicy = VERSION_POLICY_REJECT;
        }

        maxInflightRequests = Math.max(1, maxInflightRequests);
        depthLeadMs = clamp(depthLeadMs, 0, MAX_DEPTH_LEAD_MS);
        refreshIntervalMs = clamp(refreshIntervalMs, 1, 1000);

        if (statusPollIntervalMs <= 0) {
            statusPollIntervalMs = DEFAULT_STATUS_POLL_INTERVAL_MS;
        }

        if (healthReportIntervalMs <= 0) {
            healthReportIntervalMs = DEFAULT_HEALTH_REPORT_INTERVAL_MS;
        }
    }

    public DepthFrameCodec.VersionPolicy versionPolicy() {
        return VERSION_POLICY_TOLERATE.equals(frameVersionPolicy)
                ? DepthFrameCodec.VersionPolicy.TOLERATE
                : DepthFrameCodec.VersionPolicy.REJECT;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
