package io.keylight.playback;

/**
 * The playback position. Only the {@link SyncScheduler} creates these; everyone else reads copies.
 * @param currentIndex index of the first timeline entry that has not been played yet
 * @param currentSeconds song time of the cursor
 * @param tempoScale playback speed in percent, 100 is the written tempo
 */
public record Cursor(int currentIndex, double currentSeconds, double tempoScale) {
    public static final Cursor START = new Cursor(0, 0.0, 100.0);
}
