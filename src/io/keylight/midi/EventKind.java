package io.keylight.midi;

/**
 * The closed set of event kinds the timeline engine understands
 */
public enum EventKind {
    NOTE_ON,
    NOTE_OFF,
    CONTROL_CHANGE,
    META
}
