package io.keylight.render;

/**
 * @param x left edge of the key, in layout units
 */
public record PianoKey(int midiNote, double x, double width, boolean black) {}
