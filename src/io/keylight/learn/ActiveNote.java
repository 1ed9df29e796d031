package io.keylight.learn;

/**
 * A key currently held down, with the velocity and song time of its onset
 */
public record ActiveNote(NoteKey key, int onVelocity, double onTimeSeconds, Hand hand) {}
