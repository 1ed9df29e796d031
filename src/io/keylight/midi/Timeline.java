package io.keylight.midi;

import io.keylight.midi.exceptions.MalformedTimelineException;

import java.util.*;

/**
 * All tracks of a song merged into one ordered, indexed sequence of events.
 * <p>
 * Entries are sorted by absolute tick; ties are broken by the track's position in the input, then
 * releases before onsets, then the event's position in its track. When a release and an onset of the
 * same channel and note from different tracks land on the same tick, the release still goes first.
 * Note-Off events are stored as zero-velocity Note-On.
 */
public final class Timeline {
    private final List<TimelineEntry> entries;
    private final List<NoteSpan> noteSpans;
    private final TempoMap tempoMap;

    public Timeline(List<TimelineEntry> entries, TempoMap tempoMap) {
        this.entries = List.copyOf(entries);
        this.tempoMap = Objects.requireNonNull(tempoMap, "tempoMap");
        this.noteSpans = pairNoteSpans(this.entries);
    }

    public static Timeline empty(int resolution) {
        return new Timeline(List.of(), TempoMap.constant(resolution, TimeConverter.DEFAULT_TEMPO));
    }

    /** An event waiting to be merged, with everything the ordering needs */
    private record Pending(long tick, int trackOrder, int releaseRank, int sequence, RawEvent event) {}

    private static final Comparator<Pending> MERGE_ORDER = Comparator
            .comparingLong(Pending::tick)
            .thenComparingInt(Pending::trackOrder)
            .thenComparingInt(Pending::releaseRank)
            .thenComparingInt(Pending::sequence);

    /**
     * Merges tracks of delta-timed events into one timeline.
     * @param tracks each track's events in file order, ticks relative to the previous event of the track
     * @param resolution ticks per quarter note
     * @param initialTempo microseconds per quarter note in effect from tick 0
     * @throws MalformedTimelineException on a negative delta or a non-positive resolution
     */
    public static Timeline build(List<? extends List<? extends RawEvent>> tracks, int resolution, int initialTempo) {
        TempoMap.Builder tempos = new TempoMap.Builder(resolution, initialTempo);
        if (tracks.isEmpty()) {
            return new Timeline(List.of(), tempos.build());
        }

        // i. normalize and place every event at its absolute tick
        List<Pending> pending = new ArrayList<>();
        for (int t = 0; t < tracks.size(); ++t) {
            long tick = 0;
            int sequence = 0;
            for (RawEvent event : tracks.get(t)) {
                if (event.ticks() < 0) {
                    throw new MalformedTimelineException("Negative delta-time in track " + t + " at event " + sequence + ": ticks=" + event.ticks());
                }
                tick += event.ticks();
                RawEvent normalized = RawEvent.normalize(event);
                pending.add(new Pending(tick, t, RawEvent.isRelease(normalized) ? 0 : 1, sequence++, normalized));
            }
        }

        // ii. stable merge
        pending.sort(MERGE_ORDER);
        releasesBeforeOnsetsAcrossTracks(pending);

        // iii. seconds, honoring tempo changes as they are passed
        List<TimelineEntry> entries = new ArrayList<>(pending.size());
        for (var p : pending) {
            entries.add(new TimelineEntry(p.tick(), tempos.secondsAt(p.tick()), p.event()));
            if (p.event() instanceof RawEvent.Meta meta && meta.isTempo()) {
                tempos.change(p.tick(), meta.value());
            }
        }

        return new Timeline(entries, tempos.build());
    }

    private static void releasesBeforeOnsetsAcrossTracks(List<Pending> sorted) {
        int groupStart = 0;
        while (groupStart < sorted.size()) {
            long tick = sorted.get(groupStart).tick();
            int groupEnd = groupStart;
            while (groupEnd < sorted.size() && sorted.get(groupEnd).tick() == tick)
                groupEnd++;

            for (int j = groupStart + 1; j < groupEnd; ++j) {
                Pending release = sorted.get(j);
                if (release.releaseRank() != 0 || !(release.event() instanceof RawEvent.NoteOn off))
                    continue;
                for (int i = groupStart; i < j; ++i) {
                    Pending candidate = sorted.get(i);
                    if (candidate.trackOrder() != release.trackOrder()
                            && candidate.event() instanceof RawEvent.NoteOn on
                            && on.velocity() > 0 && on.channel() == off.channel() && on.note() == off.note()) {
                        sorted.remove(j);
                        sorted.add(i, release);
                        break;
                    }
                }
            }
            groupStart = groupEnd;
        }
    }

    private static List<NoteSpan> pairNoteSpans(List<TimelineEntry> entries) {
        record Onset(int index, RawEvent.NoteOn event, double seconds) {}
        Map<Integer, Deque<Onset>> sounding = new HashMap<>();
        NoteSpan[] spans = new NoteSpan[entries.size()];

        for (int i = 0; i < entries.size(); ++i) {
            var entry = entries.get(i);
            if (!(entry.event() instanceof RawEvent.NoteOn on))
                continue;
            int key = on.channel() * 128 + on.note();
            if (on.velocity() > 0) {
                sounding.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(new Onset(i, on, entry.absoluteSeconds()));
            } else {
                var queue = sounding.get(key);
                if (queue == null || queue.isEmpty())
                    continue;
                var onset = queue.removeFirst();
                spans[onset.index()] = new NoteSpan(on.channel(), on.note(), onset.event().velocity(), onset.seconds(),
                        entry.absoluteSeconds() - onset.seconds(), onset.index());
            }
        }

        for (var queue : sounding.values()) {
            for (var onset : queue) {
                spans[onset.index()] = new NoteSpan(onset.event().channel(), onset.event().note(), onset.event().velocity(),
                        onset.seconds(), NoteSpan.DEFAULT_DURATION, onset.index());
            }
        }

        List<NoteSpan> result = new ArrayList<>();
        for (var span : spans) {
            if (span != null)
                result.add(span);
        }
        return Collections.unmodifiableList(result);
    }

    public List<TimelineEntry> entries() {
        return entries;
    }

    public TimelineEntry get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public TempoMap tempoMap() {
        return tempoMap;
    }

    public int resolution() {
        return tempoMap.resolution();
    }

    /** Sounding notes sorted by onset */
    public List<NoteSpan> noteSpans() {
        return noteSpans;
    }

    public double durationSeconds() {
        return entries.isEmpty() ? 0.0 : entries.get(entries.size() - 1).absoluteSeconds();
    }

    /**
     * @return the number of entries at or before {@code seconds}, which is also the index of the first entry after it
     */
    public int countAtOrBefore(double seconds) {
        int lo = 0, hi = entries.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (entries.get(mid).absoluteSeconds() <= seconds) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** The index of the first note span starting at or after {@code seconds} */
    public int firstSpanAtOrAfter(double seconds) {
        int lo = 0, hi = noteSpans.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (noteSpans.get(mid).startSeconds() < seconds) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** Index for a position given as a percentage of the entry count, the way practice ranges are set */
    public int indexAtPercent(double percent) {
        double clamped = Math.max(0.0, Math.min(100.0, percent));
        return (int) (clamped * entries.size() / 100);
    }

    @Override
    public String toString() {
        return "Timeline{" +
                "entries=" + entries.size() +
                ", notes=" + noteSpans.size() +
                ", durationSeconds=" + durationSeconds() +
                ", tempoMap=" + tempoMap +
                '}';
    }
}
