package io.keylight.playback;

import io.keylight.cache.SourceIdentity;
import io.keylight.learn.NoteStateTracker;
import io.keylight.midi.Timeline;

import java.util.Optional;

/**
 * One loaded song: its timeline, its note state and the practice range being played.
 * Created when a load succeeds and dropped when the scheduler stops.
 */
public final class Session {
    private final String name;
    private final SourceIdentity identity;
    private final Timeline timeline;
    private final NoteStateTracker tracker;
    private final int startIndex;
    private final int endIndex;
    private final double startSeconds;

    /**
     * @param startPoint practice range start, percent of the timeline's entries
     * @param endPoint practice range end, percent of the timeline's entries
     */
    public Session(String name, SourceIdentity identity, Timeline timeline, NoteStateTracker tracker,
                   double startPoint, double endPoint) {
        this.name = name;
        this.identity = identity;
        this.timeline = timeline;
        this.tracker = tracker;
        this.startIndex = timeline.indexAtPercent(startPoint);
        this.endIndex = Math.max(startIndex, timeline.indexAtPercent(endPoint));
        this.startSeconds = startIndex == 0 || timeline.isEmpty() ? 0.0 : timeline.get(startIndex).absoluteSeconds();
    }

    public String name() {
        return name;
    }

    public Optional<SourceIdentity> identity() {
        return Optional.ofNullable(identity);
    }

    public Timeline timeline() {
        return timeline;
    }

    public NoteStateTracker tracker() {
        return tracker;
    }

    /** First timeline index of the practice range */
    public int startIndex() {
        return startIndex;
    }

    /** Timeline index one past the practice range */
    public int endIndex() {
        return endIndex;
    }

    public double startSeconds() {
        return startSeconds;
    }

    @Override
    public String toString() {
        return "Session{" +
                "name='" + name + '\'' +
                ", entries=" + timeline.size() +
                ", startIndex=" + startIndex +
                ", endIndex=" + endIndex +
                '}';
    }
}
