package io.keylight.cache;

import io.keylight.midi.TempoMap;
import io.keylight.midi.Timeline;

/**
 * A processed timeline as stored for a source. {@code source.modifiedMillis()} is the modification time
 * the source had when the timeline was built.
 */
public record CacheRecord(SourceIdentity source, TempoMap tempoMap, Timeline timeline, int formatVersion) {}
