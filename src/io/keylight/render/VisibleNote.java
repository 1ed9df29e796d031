package io.keylight.render;

import io.keylight.learn.Hand;

/**
 * A falling note placed on the canvas
 * @param durationSeconds wall-clock length of the note at the current tempo scale
 */
public record VisibleNote(int midiNote, int channel, Hand hand, int velocity,
                          double x, double y, double width, double height,
                          boolean blackKey, double durationSeconds, ColorKey colorKey) {}
