package io.keylight.midi;

import io.keylight.midi.exceptions.MalformedTimelineException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The tempo changes of a timeline, sorted by tick and always starting at tick 0.
 * <p>
 * Seconds are accumulated segment by segment, so a tick's time depends on every tempo before it
 * and the mapping stays monotonic across tempo changes.
 */
public final class TempoMap {
    public record TempoChange(long tick, int microsPerBeat, double seconds) {}

    private final int resolution;
    private final List<TempoChange> changes;

    private TempoMap(int resolution, List<TempoChange> changes) {
        this.resolution = resolution;
        this.changes = Collections.unmodifiableList(changes);
    }

    public static TempoMap constant(int resolution, int microsPerBeat) {
        return new Builder(resolution, microsPerBeat).build();
    }

    public int resolution() {
        return resolution;
    }

    public List<TempoChange> changes() {
        return changes;
    }

    /** The tempo of the last change at or before tick */
    public int tempoAt(long tick) {
        return changes.get(indexAt(tick)).microsPerBeat();
    }

    public double ticksToSeconds(long tick) {
        if (tick < 0)
            throw new IllegalArgumentException("tick must not be negative: tick=" + tick);
        TempoChange change = changes.get(indexAt(tick));
        return change.seconds() + TimeConverter.ticksToSeconds(tick - change.tick(), resolution, change.microsPerBeat());
    }

    /** The (fractional) tick reached after {@code seconds} of song time */
    public double secondsToTicks(double seconds) {
        TempoChange change = changes.get(0);
        for (TempoChange next : changes) {
            if (next.seconds() > seconds)
                break;
            change = next;
        }
        return change.tick() + TimeConverter.secondsToTicks(seconds - change.seconds(), resolution, change.microsPerBeat());
    }

    private int indexAt(long tick) {
        int lo = 0, hi = changes.size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (changes.get(mid).tick() <= tick) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    @Override
    public String toString() {
        return "TempoMap{" +
                "resolution=" + resolution +
                ", changes=" + changes +
                '}';
    }

    /**
     * Accumulates tempo changes in tick order, as they are passed while merging tracks.
     */
    public static final class Builder {
        private final int resolution;
        private final List<TempoChange> changes = new ArrayList<>();

        public Builder(int resolution, int initialMicrosPerBeat) {
            if (resolution <= 0)
                throw new MalformedTimelineException("Resolution must be greater than 0 ticks per beat: resolution=" + resolution);
            if (initialMicrosPerBeat < 1)
                throw new MalformedTimelineException("Tempo must be greater than 0: microsPerBeat=" + initialMicrosPerBeat);
            this.resolution = resolution;
            changes.add(new TempoChange(0, initialMicrosPerBeat, 0.0));
        }

        /** The seconds at tick under the changes added so far */
        public double secondsAt(long tick) {
            TempoChange last = changes.get(changes.size() - 1);
            return last.seconds() + TimeConverter.ticksToSeconds(tick - last.tick(), resolution, last.microsPerBeat());
        }

        public Builder change(long tick, int microsPerBeat) {
            TempoChange last = changes.get(changes.size() - 1);
            if (tick < last.tick())
                throw new MalformedTimelineException("Tempo changes must be added in tick order: tick=" + tick + ", last=" + last.tick());
            if (microsPerBeat < 1)
                throw new MalformedTimelineException("Tempo must be greater than 0: microsPerBeat=" + microsPerBeat);
            if (tick == last.tick()) {
                changes.set(changes.size() - 1, new TempoChange(tick, microsPerBeat, last.seconds()));
            } else {
                changes.add(new TempoChange(tick, microsPerBeat, secondsAt(tick)));
            }
            return this;
        }

        public TempoMap build() {
            return new TempoMap(resolution, new ArrayList<>(changes));
        }
    }
}
