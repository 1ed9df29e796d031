package io.keylight.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Horizontal geometry of an 88-key piano, A0 (21) to C8 (108).
 * <p>
 * White keys tile left to right. Black keys sit half a white key past the preceding white key,
 * shifted by a per-pitch-class offset because the gaps inside an octave are uneven.
 */
public final class KeyboardLayout {
    public static final int FIRST_MIDI_NOTE = 21; // A0
    public static final int LAST_MIDI_NOTE = 108; // C8
    public static final int KEY_COUNT = LAST_MIDI_NOTE - FIRST_MIDI_NOTE + 1;
    public static final double DEFAULT_WHITE_KEY_WIDTH = 20;

    /** Width of a black key as a fraction of the white key width */
    static final double BLACK_KEY_WIDTH_RATIO = 0.6;
    /** Black key offsets by pitch class, in units of a 20-wide white key */
    private static final double[] BLACK_KEY_OFFSETS = new double[12];

    static {
        BLACK_KEY_OFFSETS[1] = -6;  // C#
        BLACK_KEY_OFFSETS[3] = 6;   // D#
        BLACK_KEY_OFFSETS[6] = -8;  // F#
        BLACK_KEY_OFFSETS[8] = 0;   // G#
        BLACK_KEY_OFFSETS[10] = 8;  // A#
    }

    private final double whiteKeyWidth;
    private final List<PianoKey> keys;
    private final double totalWidth;

    private KeyboardLayout(double whiteKeyWidth) {
        this.whiteKeyWidth = whiteKeyWidth;
        double scale = whiteKeyWidth / DEFAULT_WHITE_KEY_WIDTH;
        List<PianoKey> built = new ArrayList<>(KEY_COUNT);
        int whiteKeyCount = 0;
        for (int note = FIRST_MIDI_NOTE; note <= LAST_MIDI_NOTE; note++) {
            if (KeyColor.of(note) == KeyColor.WHITE) {
                built.add(new PianoKey(note, whiteKeyCount * whiteKeyWidth, whiteKeyWidth, false));
                whiteKeyCount++;
            } else {
                double x = (whiteKeyCount - 1) * whiteKeyWidth + whiteKeyWidth / 2 + BLACK_KEY_OFFSETS[Math.floorMod(note, 12)] * scale;
                built.add(new PianoKey(note, x, whiteKeyWidth * BLACK_KEY_WIDTH_RATIO, true));
            }
        }
        this.keys = List.copyOf(built);
        this.totalWidth = whiteKeyCount * whiteKeyWidth;
    }

    public static KeyboardLayout of(double whiteKeyWidth) {
        if (!(whiteKeyWidth > 0))
            throw new IllegalArgumentException("White key width must be greater than 0: " + whiteKeyWidth);
        return new KeyboardLayout(whiteKeyWidth);
    }

    public double whiteKeyWidth() {
        return whiteKeyWidth;
    }

    public double totalWidth() {
        return totalWidth;
    }

    /** Keys in pitch order */
    public List<PianoKey> keys() {
        return keys;
    }

    public Optional<PianoKey> keyFor(int midiNote) {
        if (midiNote < FIRST_MIDI_NOTE || midiNote > LAST_MIDI_NOTE)
            return Optional.empty();
        return Optional.of(keys.get(midiNote - FIRST_MIDI_NOTE));
    }

    @Override
    public String toString() {
        return "KeyboardLayout{" +
                "whiteKeyWidth=" + whiteKeyWidth +
                ", totalWidth=" + totalWidth +
                '}';
    }
}
