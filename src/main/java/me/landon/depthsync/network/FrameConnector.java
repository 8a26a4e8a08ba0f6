package me.landon.depthsync.network;

@FunctionalInterface
public interface FrameConnector {
    /**
     * Starts opening the depth stream of a session. Must not block; the outcome is reported
     * through {@code listener}.
     */
    FrameLink open(String sessionId, FrameLink.Listener listener);
}
