package me.landon.depthsync.network;

/** Asynchronous access to the server's per-session status document. */
public interface StatusSource {
    interface Callback {
        void onStatus(SessionStatus status);

        void onFailure(Exception error);
    }

    /** Starts a status request. Must not block; exactly one callback method fires. */
    void fetchStatus(String sessionId, Callback callback);
}
