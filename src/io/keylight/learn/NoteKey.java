package io.keylight.learn;

public record NoteKey(int channel, int note) implements Comparable<NoteKey> {
    public NoteKey {
        if (channel < 0 || channel > 15)
            throw new IllegalArgumentException("MIDI has channels 0 to 15: channel=" + channel);
        if (note < 0 || note > 127)
            throw new IllegalArgumentException("MIDI notes must be between 0 and 127: note=" + note);
    }

    @Override
    public int compareTo(NoteKey o) {
        return channel != o.channel ? Integer.compare(channel, o.channel) : Integer.compare(note, o.note);
    }
}
