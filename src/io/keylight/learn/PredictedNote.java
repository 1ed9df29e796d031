package io.keylight.learn;

/**
 * @param delaySeconds wall-clock seconds from the cursor to the note's onset at the current tempo scale
 * @param entryIndex the onset's index in the timeline
 */
public record PredictedNote(int channel, int note, int velocity, double delaySeconds, int entryIndex, Hand hand) {
    public NoteKey key() {
        return new NoteKey(channel, note);
    }
}
