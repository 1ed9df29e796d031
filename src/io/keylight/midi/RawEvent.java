package io.keylight.midi;

/**
 * A single MIDI event as produced by a file track or a live input device. Immutable.
 * <p>
 * The set of kinds is closed: every consumer switches over {@link #kind()} and handles all four.
 * {@code ticks} is the delta-time since the previous event of the same track; live events carry 0.
 */
public sealed interface RawEvent permits RawEvent.NoteOn, RawEvent.NoteOff, RawEvent.ControlChange, RawEvent.Meta {

    EventKind kind();

    long ticks();

    int sourceTrack();

    /**
     * Rewrites a Note-Off as a zero-velocity Note-On so that both forms are treated identically downstream
     * @return the same event for every other kind
     */
    static RawEvent normalize(RawEvent event) {
        if (event instanceof NoteOff off) {
            return new NoteOn(off.channel(), off.note(), 0, off.ticks(), off.sourceTrack());
        }
        return event;
    }

    /** True for Note-Off and for zero-velocity Note-On */
    static boolean isRelease(RawEvent event) {
        return switch (event.kind()) {
            case NOTE_OFF -> true;
            case NOTE_ON -> ((NoteOn) event).velocity() == 0;
            case CONTROL_CHANGE, META -> false;
        };
    }

    /** True for a Note-On that actually sounds */
    static boolean isOnset(RawEvent event) {
        return event instanceof NoteOn on && on.velocity() > 0;
    }

    record NoteOn(int channel, int note, int velocity, long ticks, int sourceTrack) implements RawEvent {
        public NoteOn {
            assertValidChannel(channel);
            assertValidData("note", note);
            assertValidData("velocity", velocity);
        }

        @Override
        public EventKind kind() {
            return EventKind.NOTE_ON;
        }
    }

    record NoteOff(int channel, int note, int velocity, long ticks, int sourceTrack) implements RawEvent {
        public NoteOff {
            assertValidChannel(channel);
            assertValidData("note", note);
            assertValidData("velocity", velocity);
        }

        @Override
        public EventKind kind() {
            return EventKind.NOTE_OFF;
        }
    }

    record ControlChange(int channel, int controller, int value, long ticks, int sourceTrack) implements RawEvent {
        public static final int SUSTAIN_PEDAL = 64;
        public static final int ALL_NOTES_OFF = 123;

        public ControlChange {
            assertValidChannel(channel);
            assertValidData("controller", controller);
            assertValidData("value", value);
        }

        @Override
        public EventKind kind() {
            return EventKind.CONTROL_CHANGE;
        }

        public boolean isSustain() {
            return controller == SUSTAIN_PEDAL;
        }
    }

    /**
     * A meta event. Only set-tempo carries a meaningful {@code value} (microseconds per quarter note).
     */
    record Meta(int type, int value, long ticks, int sourceTrack) implements RawEvent {
        public static final int SET_TEMPO = 0x51;
        public static final int END_OF_TRACK = 0x2F;

        public static Meta tempo(int microsPerBeat, long ticks, int sourceTrack) {
            if (microsPerBeat < 1) {
                throw new IllegalArgumentException("Tempo must be greater than 0: microsPerBeat=" + microsPerBeat);
            }
            return new Meta(SET_TEMPO, microsPerBeat, ticks, sourceTrack);
        }

        @Override
        public EventKind kind() {
            return EventKind.META;
        }

        public boolean isTempo() {
            return type == SET_TEMPO;
        }
    }

    private static void assertValidChannel(int channel) {
        if (channel < 0 || channel > 15)
            throw new IllegalArgumentException("MIDI has channels 0 to 15: channel=" + channel);
    }

    private static void assertValidData(String name, int value) {
        if (value < 0 || value > 127)
            throw new IllegalArgumentException("MIDI " + name + " must be between 0 and 127: " + name + "=" + value);
    }
}
