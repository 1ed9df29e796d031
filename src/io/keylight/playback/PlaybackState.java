package io.keylight.playback;

/**
 * Lifecycle of a {@link SyncScheduler}: {@code IDLE -> LOADING -> PLAYING <-> PAUSED -> STOPPED}.
 * A new load may start from STOPPED (or any other state) and begins a fresh session.
 */
public enum PlaybackState {
    IDLE,
    LOADING,
    PLAYING,
    PAUSED,
    STOPPED;

    public boolean isRunning() {
        return this == PLAYING || this == PAUSED;
    }
}
