package io.keylight.render;

/**
 * A key that should be lit on the LED strip, either held now or expected next
 */
public record LitKey(int midiNote, int channel, ColorKey colorKey) {}
