package io.keylight.midi.exceptions;

/**
 * Thrown when a timeline cannot be built: a non-positive resolution, a negative tick delta
 * or a source file whose timing cannot be expressed in ticks per beat.
 */
public class MalformedTimelineException extends RuntimeException {
    public MalformedTimelineException(String message) {
        super(message);
    }

    public MalformedTimelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
