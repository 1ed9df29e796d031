package io.keylight.cache;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.keylight.midi.EventKind;
import io.keylight.midi.RawEvent;
import io.keylight.midi.TempoMap;
import io.keylight.midi.Timeline;
import io.keylight.midi.TimelineEntry;
import io.keylight.midi.exceptions.MalformedTimelineException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores processed timelines as JSON files, one per source, so that a song is only merged once.
 * <p>
 * A record is only trusted when it was written for the source's current modification time (or later)
 * and with the current {@link #FORMAT_VERSION}. Every other outcome, including an unreadable file,
 * is a miss. Nothing here throws on a cold or broken cache.
 */
public class TimelineCache {
    private static final Logger LOGGER = Logger.getLogger(TimelineCache.class.getName());
    /** Bump on any change to the stored layout */
    public static final int FORMAT_VERSION = 1;
    private static final String CACHE_EXT = ".json";

    private final Path directory;
    private final Gson gson = new GsonBuilder().create();

    public TimelineCache(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    /**
     * @return the cached record, or empty on a miss: missing, stale, from another format version or corrupt
     */
    public Optional<CacheRecord> load(SourceIdentity source) {
        return read(source).filter(record -> {
            if (record.source().modifiedMillis() < source.modifiedMillis()) {
                LOGGER.log(Level.FINE, "Cache is stale for {0}: cached={1}, source={2}",
                        new Object[]{source.path(), record.source().modifiedMillis(), source.modifiedMillis()});
                return false;
            }
            return true;
        });
    }

    /**
     * Like {@link #load(SourceIdentity)} but accepts a record older than the source. Used as a last resort
     * when the source itself no longer builds.
     */
    public Optional<CacheRecord> loadIgnoringAge(SourceIdentity source) {
        return read(source);
    }

    /**
     * Writes the record for source. Failures are logged and otherwise ignored.
     * @return true when the record was written
     */
    public boolean store(SourceIdentity source, Timeline timeline) {
        Path file = fileFor(source);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(directory);
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(StoredRecord.from(source, timeline), writer);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            LOGGER.log(Level.FINE, "Cached timeline for {0} in {1}", new Object[]{source.path(), file});
            return true;
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to cache timeline for {0}: {1}", new Object[]{source.path(), e.toString()});
            return false;
        }
    }

    Path fileFor(SourceIdentity source) {
        String name = source.path().getFileName() == null ? "source" : source.path().getFileName().toString();
        String safe = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return directory.resolve(safe + "-" + Integer.toHexString(source.path().toString().hashCode()) + CACHE_EXT);
    }

    private Optional<CacheRecord> read(SourceIdentity source) {
        Path file = fileFor(source);
        if (!Files.isRegularFile(file)) {
            LOGGER.log(Level.FINE, "Cache not found for {0}", source.path());
            return Optional.empty();
        }

        StoredRecord stored;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            stored = gson.fromJson(reader, StoredRecord.class);
        } catch (IOException | JsonParseException e) {
            LOGGER.log(Level.WARNING, "Cache file is corrupt, ignoring {0}: {1}", new Object[]{file, e.toString()});
            return Optional.empty();
        }

        if (stored == null || stored.formatVersion != FORMAT_VERSION) {
            LOGGER.log(Level.FINE, "Cache format version mismatch for {0}: {1}",
                    new Object[]{file, stored == null ? "empty" : stored.formatVersion});
            return Optional.empty();
        }
        if (!source.path().toString().equals(stored.sourcePath)) {
            LOGGER.log(Level.FINE, "Cache file {0} belongs to another source: {1}", new Object[]{file, stored.sourcePath});
            return Optional.empty();
        }

        try {
            return Optional.of(stored.toRecord());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cache file is corrupt, ignoring {0}: {1}", new Object[]{file, e.toString()});
            return Optional.empty();
        }
    }

    /** The JSON layout of a cache file */
    static final class StoredRecord {
        int formatVersion;
        String sourcePath;
        long sourceModifiedMillis;
        int resolution;
        List<StoredTempo> tempos;
        List<StoredEntry> entries;

        static StoredRecord from(SourceIdentity source, Timeline timeline) {
            var stored = new StoredRecord();
            stored.formatVersion = FORMAT_VERSION;
            stored.sourcePath = source.path().toString();
            stored.sourceModifiedMillis = source.modifiedMillis();
            stored.resolution = timeline.resolution();
            stored.tempos = new ArrayList<>();
            for (var change : timeline.tempoMap().changes()) {
                stored.tempos.add(new StoredTempo(change.tick(), change.microsPerBeat()));
            }
            stored.entries = new ArrayList<>(timeline.size());
            for (var entry : timeline.entries()) {
                stored.entries.add(StoredEntry.from(entry));
            }
            return stored;
        }

        CacheRecord toRecord() {
            if (tempos == null || tempos.isEmpty() || entries == null)
                throw new MalformedTimelineException("Cache record has no tempo map or entries");
            var builder = new TempoMap.Builder(resolution, tempos.get(0).microsPerBeat);
            for (int i = 1; i < tempos.size(); ++i) {
                builder.change(tempos.get(i).tick, tempos.get(i).microsPerBeat);
            }
            TempoMap tempoMap = builder.build();

            List<TimelineEntry> timelineEntries = new ArrayList<>(entries.size());
            TimelineEntry previous = null;
            for (var entry : entries) {
                TimelineEntry current = entry.toEntry();
                if (previous != null && (current.absoluteTick() < previous.absoluteTick()
                        || current.absoluteSeconds() < previous.absoluteSeconds())) {
                    throw new MalformedTimelineException("Cache entries out of order at index " + timelineEntries.size()
                            + ": tick=" + current.absoluteTick() + ", previous=" + previous.absoluteTick());
                }
                timelineEntries.add(current);
                previous = current;
            }
            var source = new SourceIdentity(Path.of(sourcePath), sourceModifiedMillis);
            return new CacheRecord(source, tempoMap, new Timeline(timelineEntries, tempoMap), formatVersion);
        }
    }

    static final class StoredTempo {
        long tick;
        int microsPerBeat;

        StoredTempo() {}

        StoredTempo(long tick, int microsPerBeat) {
            this.tick = tick;
            this.microsPerBeat = microsPerBeat;
        }
    }

    /** data1/data2 hold note/velocity, controller/value or meta type/value depending on kind */
    static final class StoredEntry {
        String kind;
        long tick;
        long delta;
        double seconds;
        int channel;
        int data1;
        int data2;
        int track;

        static StoredEntry from(TimelineEntry entry) {
            var stored = new StoredEntry();
            RawEvent event = entry.event();
            stored.kind = event.kind().name();
            stored.tick = entry.absoluteTick();
            stored.delta = event.ticks();
            stored.seconds = entry.absoluteSeconds();
            stored.track = event.sourceTrack();
            switch (event.kind()) {
                case NOTE_ON -> {
                    var on = (RawEvent.NoteOn) event;
                    stored.channel = on.channel();
                    stored.data1 = on.note();
                    stored.data2 = on.velocity();
                }
                case NOTE_OFF -> {
                    var off = (RawEvent.NoteOff) event;
                    stored.channel = off.channel();
                    stored.data1 = off.note();
                    stored.data2 = off.velocity();
                }
                case CONTROL_CHANGE -> {
                    var cc = (RawEvent.ControlChange) event;
                    stored.channel = cc.channel();
                    stored.data1 = cc.controller();
                    stored.data2 = cc.value();
                }
                case META -> {
                    var meta = (RawEvent.Meta) event;
                    stored.data1 = meta.type();
                    stored.data2 = meta.value();
                }
            }
            return stored;
        }

        TimelineEntry toEntry() {
            RawEvent event = switch (EventKind.valueOf(kind)) {
                case NOTE_ON -> new RawEvent.NoteOn(channel, data1, data2, delta, track);
                case NOTE_OFF -> new RawEvent.NoteOff(channel, data1, data2, delta, track);
                case CONTROL_CHANGE -> new RawEvent.ControlChange(channel, data1, data2, delta, track);
                case META -> new RawEvent.Meta(data1, data2, delta, track);
            };
            return new TimelineEntry(tick, seconds, event);
        }
    }
}
