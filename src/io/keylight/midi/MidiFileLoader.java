package io.keylight.midi;

import io.keylight.midi.exceptions.MalformedTimelineException;

import javax.sound.midi.*;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a standard MIDI file through {@link MidiSystem} and turns each track into delta-timed {@link RawEvent}s.
 * <p>
 * The byte-level parsing is left to the Java Sound API. This class only keeps the events the timeline
 * engine cares about and, optionally, re-channels notes by track so that hands can be told apart.
 */
public class MidiFileLoader {
    private static final Logger LOGGER = Logger.getLogger(MidiFileLoader.class.getName());

    private final boolean assignChannelsByTrack;

    /** The per-track events and timing of a loaded file, ready for {@link Timeline#build} */
    public record LoadedSong(String name, List<List<RawEvent>> tracks, int resolution, int initialTempo) {
        public Timeline toTimeline() {
            return Timeline.build(tracks, resolution, initialTempo);
        }
    }

    public MidiFileLoader(boolean assignChannelsByTrack) {
        this.assignChannelsByTrack = assignChannelsByTrack;
    }

    public MidiFileLoader() {
        this(true);
    }

    /**
     * @throws MalformedTimelineException when the file is not valid MIDI or does not use ticks per beat
     * @throws IOException when the file cannot be read
     */
    public LoadedSong load(Path file) throws IOException {
        Sequence sequence;
        try {
            sequence = MidiSystem.getSequence(file.toFile());
        } catch (InvalidMidiDataException e) {
            throw new MalformedTimelineException("Not a valid MIDI file: " + file.toAbsolutePath(), e);
        }
        LOGGER.log(Level.FINE, "Parsed {0}: {1} tracks, resolution={2}",
                new Object[]{file.getFileName(), sequence.getTracks().length, sequence.getResolution()});
        return fromSequence(file.getFileName().toString(), sequence);
    }

    public LoadedSong fromSequence(String name, Sequence sequence) {
        if (sequence.getDivisionType() != Sequence.PPQ) {
            throw new MalformedTimelineException("Cannot schedule MIDIs with \"frames per second\" time division: " + name);
        }

        Track[] tracks = sequence.getTracks();
        // Two-track files are conventionally right hand then left hand: channels 1 and 2
        int offset = tracks.length == 2 ? 1 : 0;
        List<List<RawEvent>> converted = new ArrayList<>(tracks.length);
        int initialTempo = -1;
        for (int k = 0; k < tracks.length; ++k) {
            int channelOverride = assignChannelsByTrack ? Math.min(15, k + offset) : -1;
            List<RawEvent> events = convertTrack(tracks[k], k, channelOverride);
            if (initialTempo < 0) {
                initialTempo = events.stream()
                        .filter(e -> e instanceof RawEvent.Meta meta && meta.isTempo())
                        .mapToInt(e -> ((RawEvent.Meta) e).value())
                        .findFirst()
                        .orElse(-1);
            }
            converted.add(events);
        }

        if (initialTempo < 0)
            initialTempo = TimeConverter.DEFAULT_TEMPO;
        return new LoadedSong(name, converted, sequence.getResolution(), initialTempo);
    }

    private List<RawEvent> convertTrack(Track track, int trackNum, int channelOverride) {
        List<RawEvent> events = new ArrayList<>(track.size());
        long lastTick = 0;
        for (int i = 0; i < track.size(); ++i) {
            MidiEvent midiEvent = track.get(i);
            long tick = midiEvent.getTick();
            if (tick < lastTick) {
                throw new MalformedTimelineException("Events out of order in track " + trackNum + " at event " + i
                        + ": tick=" + tick + ", previous=" + lastTick);
            }

            RawEvent event = convert(midiEvent.getMessage(), tick - lastTick, trackNum, channelOverride);
            if (event != null) {
                events.add(event);
                lastTick = tick;
            }
        }
        return events;
    }

    /**
     * @param channelOverride channel for note events, or -1 to keep theirs; control changes always keep theirs
     * @return the event, or null for messages the timeline does not keep (their delta rolls into the next event)
     */
    public static RawEvent convert(MidiMessage message, long ticks, int trackNum, int channelOverride) {
        if (message instanceof ShortMessage sm) {
            int channel = channelOverride >= 0 ? channelOverride : sm.getChannel();
            return switch (sm.getCommand()) {
                case ShortMessage.NOTE_ON -> new RawEvent.NoteOn(channel, sm.getData1(), sm.getData2(), ticks, trackNum);
                case ShortMessage.NOTE_OFF -> new RawEvent.NoteOff(channel, sm.getData1(), sm.getData2(), ticks, trackNum);
                case ShortMessage.CONTROL_CHANGE -> new RawEvent.ControlChange(sm.getChannel(), sm.getData1(), sm.getData2(), ticks, trackNum);
                default -> null;
            };
        } else if (message instanceof MetaMessage meta) {
            if (meta.getType() == RawEvent.Meta.SET_TEMPO) {
                byte[] data = meta.getData();
                if (data.length < 3)
                    throw new MalformedTimelineException("Set-tempo meta event needs 3 data bytes, got " + data.length + " in track " + trackNum);
                int tempo = ((data[0] & 0xFF) << 16) | ((data[1] & 0xFF) << 8) | (data[2] & 0xFF);
                return RawEvent.Meta.tempo(tempo, ticks, trackNum);
            }
            return new RawEvent.Meta(meta.getType(), 0, ticks, trackNum);
        }
        return null;
    }
}
