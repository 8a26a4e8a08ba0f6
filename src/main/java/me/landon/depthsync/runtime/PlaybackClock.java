package me.landon.depthsync.runtime;

/** Position of the video being played, owned by the player. */
public interface PlaybackClock {
    double currentTimeMs();

    boolean isPlaying();
}
