package io.keylight.midi;

import io.keylight.midi.exceptions.InvalidConfigurationException;
import io.keylight.midi.exceptions.MalformedTimelineException;

/**
 * Pure tick/second conversions. Safe to call from any thread.
 */
public final class TimeConverter {
    /** 120 BPM */
    public static final int DEFAULT_TEMPO = 500_000;
    public static final double DEFAULT_TEMPO_SCALE = 100.0;

    private TimeConverter() {}

    /**
     * @param ticks a tick count, absolute or relative, measured under a single tempo
     * @param resolution ticks per quarter note
     * @param microsPerBeat the tempo in effect for those ticks
     * @return the duration of {@code ticks} in seconds
     * @throws MalformedTimelineException when resolution is not positive
     */
    public static double ticksToSeconds(long ticks, int resolution, int microsPerBeat) {
        assertValidResolution(resolution);
        return ticks * (double) microsPerBeat / (resolution * 1_000_000.0);
    }

    /** Inverse of {@link #ticksToSeconds(long, int, int)} before rounding */
    public static double secondsToTicks(double seconds, int resolution, int microsPerBeat) {
        assertValidResolution(resolution);
        return seconds * resolution * 1_000_000.0 / microsPerBeat;
    }

    /**
     * Stretches a song-time duration into wall-clock time. 50 percent plays at half speed and so doubles durations.
     * @throws InvalidConfigurationException when scalePercent is not positive
     */
    public static double applyTempoScale(double seconds, double scalePercent) {
        assertValidTempoScale(scalePercent);
        return seconds * 100.0 / scalePercent;
    }

    /** Inverse of {@link #applyTempoScale(double, double)}: wall-clock seconds elapsed to song seconds advanced */
    public static double removeTempoScale(double wallSeconds, double scalePercent) {
        assertValidTempoScale(scalePercent);
        return wallSeconds * scalePercent / 100.0;
    }

    public static void assertValidTempoScale(double scalePercent) {
        if (!(scalePercent > 0) || Double.isInfinite(scalePercent))
            throw new InvalidConfigurationException("Tempo scale must be a percentage greater than 0: tempoScale=" + scalePercent);
    }

    private static void assertValidResolution(int resolution) {
        if (resolution <= 0)
            throw new MalformedTimelineException("Resolution must be greater than 0 ticks per beat: resolution=" + resolution);
    }
}
