package me.landon.depthsync.network;

/** One open (or opening) bidirectional frame connection. */
public interface FrameLink {
    /** Callbacks fired by the link, possibly from a network thread. */
    interface Listener {
        void onOpen();

        void onText(String text);

        void onBinary(byte[] payload);

        void onFailure(Throwable error);

        void onClosed(int code, String reason);
    }

    /**
     * Queues a text message.
     *
     * @return false if the link refused the message, in which case it was not transmitted
     */
    boolean sendText(String text);

    void close();
}
