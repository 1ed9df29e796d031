package io.keylight.midi;

/**
 * An event placed on the merged timeline. {@code absoluteSeconds} is song time, before any tempo scaling.
 */
public record TimelineEntry(long absoluteTick, double absoluteSeconds, RawEvent event) {
    public TimelineEntry {
        if (absoluteTick < 0)
            throw new IllegalArgumentException("absoluteTick must not be negative: " + absoluteTick);
    }
}
