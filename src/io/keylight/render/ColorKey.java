package io.keylight.render;

import io.keylight.learn.Hand;

import java.util.Locale;

/**
 * Lookup key into a colour palette: which hand, which key colour, and whether the note is still to come.
 * Choosing the actual colour is up to the palette owner.
 */
public record ColorKey(Hand hand, KeyColor keyColor, boolean upcoming) {

    public static ColorKey of(int midiNote, Hand hand, boolean upcoming) {
        return new ColorKey(hand, KeyColor.of(midiNote), upcoming);
    }

    /** e.g. {@code learn_colors/left_hand/black_keys/upcoming} */
    public String settingPath() {
        return "learn_colors/"
                + hand.name().toLowerCase(Locale.ROOT) + "_hand/"
                + keyColor.name().toLowerCase(Locale.ROOT) + "_keys/"
                + (upcoming ? "upcoming" : "current");
    }
}
