package io.keylight.learn;

import java.util.*;

/**
 * An immutable view of which notes are sounding and which channels hold the sustain pedal.
 * A new instance is published for every applied change, so readers never see half of an update.
 */
public final class NoteState {
    public static final NoteState EMPTY = new NoteState(new TreeMap<>(), new TreeSet<>());

    private final SortedMap<NoteKey, ActiveNote> active;
    private final SortedSet<NoteKey> activeKeys;
    private final SortedSet<Integer> sustainedChannels;

    NoteState(SortedMap<NoteKey, ActiveNote> active, SortedSet<Integer> sustainedChannels) {
        this.active = Collections.unmodifiableSortedMap(active);
        this.activeKeys = Collections.unmodifiableSortedSet(new TreeSet<>(active.keySet()));
        this.sustainedChannels = Collections.unmodifiableSortedSet(sustainedChannels);
    }

    public boolean isActive(int channel, int note) {
        return active.containsKey(new NoteKey(channel, note));
    }

    public boolean isActive(NoteKey key) {
        return active.containsKey(key);
    }

    public Optional<ActiveNote> get(NoteKey key) {
        return Optional.ofNullable(active.get(key));
    }

    /** Sorted by channel, then note */
    public SortedSet<NoteKey> activeSet() {
        return activeKeys;
    }

    public Collection<ActiveNote> activeNotes() {
        return active.values();
    }

    public boolean isSustained(int channel) {
        return sustainedChannels.contains(channel);
    }

    public boolean isEmpty() {
        return active.isEmpty();
    }

    SortedMap<NoteKey, ActiveNote> copyActive() {
        return new TreeMap<>(active);
    }

    SortedSet<Integer> copySustained() {
        return new TreeSet<>(sustainedChannels);
    }

    @Override
    public String toString() {
        return "NoteState{" +
                "active=" + active.keySet() +
                ", sustainedChannels=" + sustainedChannels +
                '}';
    }
}
