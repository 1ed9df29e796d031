package io.keylight.midi.exceptions;

/**
 * Thrown when a tempo scale, lookahead parameter or other setting is out of range.
 * The value that was being replaced stays in effect.
 */
public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
