package io.keylight.render;

/**
 * Colour class of a piano key. C#, D#, F#, G# and A# are black.
 */
public enum KeyColor {
    WHITE,
    BLACK;

    public static KeyColor of(int midiNote) {
        return switch (Math.floorMod(midiNote, 12)) {
            case 1, 3, 6, 8, 10 -> BLACK;
            default -> WHITE;
        };
    }
}
