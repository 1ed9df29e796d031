package io.keylight.playback;

/** Progress of a load, in the order they are reported */
public enum LoadingPhase {
    LOAD,
    PROCESS,
    MERGE,
    DONE,
    ERROR
}
