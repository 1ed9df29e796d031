package io.keylight.playback;

import io.keylight.learn.NoteKey;
import io.keylight.learn.PredictionBatch;
import io.keylight.render.Frame;

import java.util.List;

/**
 * The immutable state published once per tick for the broadcast side
 * @param sequence increases by one with every published snapshot
 */
public record PlaybackSnapshot(long sequence, PlaybackState state, double cursorSeconds, int cursorIndex,
                               List<NoteKey> activeNotes, PredictionBatch prediction, Frame frame) {
    public PlaybackSnapshot {
        activeNotes = List.copyOf(activeNotes);
    }
}
