package io.keylight.learn;

/**
 * Which hand the learner practices. Only notes of the practiced hand are predicted.
 */
public enum PracticeHands {
    BOTH,
    RIGHT,
    LEFT;

    public boolean accepts(Hand hand) {
        return switch (this) {
            case BOTH -> true;
            case RIGHT -> hand == Hand.RIGHT;
            case LEFT -> hand == Hand.LEFT;
        };
    }
}
