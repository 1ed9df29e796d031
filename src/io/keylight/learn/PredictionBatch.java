package io.keylight.learn;

import java.util.List;

/**
 * The next group of simultaneous notes the learner is expected to play. Recomputed every tick.
 */
public record PredictionBatch(List<PredictedNote> notes) {
    public static final PredictionBatch EMPTY = new PredictionBatch(List.of());

    public PredictionBatch {
        notes = List.copyOf(notes);
    }

    public boolean isEmpty() {
        return notes.isEmpty();
    }

    public int size() {
        return notes.size();
    }

    /** Delay of the first note, or NaN when empty */
    public double anchorDelaySeconds() {
        return notes.isEmpty() ? Double.NaN : notes.get(0).delaySeconds();
    }
}
