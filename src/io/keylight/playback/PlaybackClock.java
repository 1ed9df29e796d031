package io.keylight.playback;

/**
 * Monotonic time source for the tick loop and for stamping live input
 */
@FunctionalInterface
public interface PlaybackClock {
    PlaybackClock SYSTEM = System::nanoTime;

    long nanoTime();
}
