package io.keylight.midi;

/**
 * A sounding note from its onset to its release. Notes that are never released get {@link #DEFAULT_DURATION}.
 * @param entryIndex the index of the onset in its timeline
 */
public record NoteSpan(int channel, int note, int velocity, double startSeconds, double durationSeconds, int entryIndex) {
    public static final double DEFAULT_DURATION = 1.0;

    public double endSeconds() {
        return startSeconds + durationSeconds;
    }
}
