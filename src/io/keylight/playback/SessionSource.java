package io.keylight.playback;

import io.keylight.cache.SourceIdentity;
import io.keylight.midi.MidiFileLoader;
import io.keylight.midi.MidiFileLoader.LoadedSong;
import io.keylight.midi.RawEvent;
import io.keylight.midi.TimeConverter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Where a session's timeline comes from. Only sources with an identity can be cached.
 */
public interface SessionSource {
    int LIVE_ONLY_RESOLUTION = 480;

    String name();

    Optional<SourceIdentity> identity() throws IOException;

    LoadedSong read() throws IOException;

    static SessionSource file(Path midiFile, MidiFileLoader loader) {
        return new SessionSource() {
            @Override
            public String name() {
                return midiFile.getFileName().toString();
            }

            @Override
            public Optional<SourceIdentity> identity() throws IOException {
                return Optional.of(SourceIdentity.of(midiFile));
            }

            @Override
            public LoadedSong read() throws IOException {
                return loader.load(midiFile);
            }
        };
    }

    /** Tracks that were parsed elsewhere, with relative tick deltas */
    static SessionSource tracks(String name, List<List<RawEvent>> tracks, int resolution, int initialTempo) {
        var song = new LoadedSong(name, tracks, resolution, initialTempo);
        return new SessionSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<SourceIdentity> identity() {
                return Optional.empty();
            }

            @Override
            public LoadedSong read() {
                return song;
            }
        };
    }

    /** An empty timeline; the session runs on live input alone */
    static SessionSource liveOnly() {
        return tracks("live", List.of(), LIVE_ONLY_RESOLUTION, TimeConverter.DEFAULT_TEMPO);
    }
}
