package io.keylight.learn;

public enum Hand {
    LEFT,
    RIGHT
}
