package io.keylight.render;

import io.keylight.midi.exceptions.InvalidConfigurationException;

/**
 * Flying-notes canvas geometry. Notes fall {@code fallDistance} units and land on top of the keyboard.
 */
public record FrameSettings(double canvasHeight, double keyboardHeight, double fallDistance, double noteHeight, double whiteKeyWidth) {
    public static final FrameSettings DEFAULT = new FrameSettings(600, 80, 520, 20, KeyboardLayout.DEFAULT_WHITE_KEY_WIDTH);

    public FrameSettings {
        requirePositive("canvasHeight", canvasHeight);
        requirePositive("keyboardHeight", keyboardHeight);
        requirePositive("fallDistance", fallDistance);
        requirePositive("noteHeight", noteHeight);
        requirePositive("whiteKeyWidth", whiteKeyWidth);
        if (keyboardHeight + fallDistance > canvasHeight)
            throw new InvalidConfigurationException("Keyboard height plus fall distance must fit the canvas: "
                    + keyboardHeight + " + " + fallDistance + " > " + canvasHeight);
    }

    /** Where a note's top sits when it reaches the keyboard */
    public double landingY() {
        return canvasHeight - keyboardHeight;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0))
            throw new InvalidConfigurationException(name + " must be greater than 0: " + name + "=" + value);
    }
}
