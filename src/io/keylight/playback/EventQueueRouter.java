package io.keylight.playback;

import io.keylight.learn.NoteStateTracker;
import io.keylight.learn.NoteStateTracker.TimedEvent;
import io.keylight.midi.RawEvent;
import io.keylight.midi.TimelineEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongToDoubleFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects events from the live input device and from file playback in two FIFO queues and
 * hands them to the note tracker once per tick, merged by time.
 * <p>
 * The live queue is bounded. A full queue drops its oldest event so the device thread never waits.
 */
public class EventQueueRouter {
    private static final Logger LOGGER = Logger.getLogger(EventQueueRouter.class.getName());
    public static final int DEFAULT_LIVE_CAPACITY = 32;

    /** A live event with its System.nanoTime()-based arrival stamp */
    public record LiveEvent(RawEvent event, long arrivalNanos) {}

    private final int liveCapacity;
    private final BlockingQueue<LiveEvent> liveQueue;
    private final BlockingQueue<TimedEvent> fileQueue = new LinkedBlockingQueue<>();
    private final AtomicInteger droppedSinceDrain = new AtomicInteger();
    private final PlaybackClock clock;
    private final PlaybackIssueListener issues;

    public EventQueueRouter(int liveCapacity, PlaybackClock clock, PlaybackIssueListener issues) {
        if (liveCapacity < 1)
            throw new IllegalArgumentException("Live queue capacity must be at least 1: capacity=" + liveCapacity);
        this.liveCapacity = liveCapacity;
        this.liveQueue = new ArrayBlockingQueue<>(liveCapacity);
        this.clock = clock;
        this.issues = issues;
    }

    public int liveCapacity() {
        return liveCapacity;
    }

    /** Called from the input device's thread. Never blocks. */
    public void pushLive(RawEvent event) {
        pushLive(event, clock.nanoTime());
    }

    public void pushLive(RawEvent event, long arrivalNanos) {
        var live = new LiveEvent(RawEvent.normalize(event), arrivalNanos);
        while (!liveQueue.offer(live)) {
            if (liveQueue.poll() != null)
                droppedSinceDrain.incrementAndGet();
        }
    }

    /** Queues a timeline entry passed by the cursor, at its song time */
    public void pushFile(TimelineEntry entry) {
        fileQueue.add(new TimedEvent(entry.event(), entry.absoluteSeconds()));
    }

    /**
     * Takes everything queued so far, merges the two queues by time and applies the result to the tracker.
     * Order within each queue is kept; at equal times file events go first.
     * @param toSongSeconds maps a live arrival stamp to song time
     * @return the events applied, in the order they were applied
     */
    public List<TimedEvent> drain(NoteStateTracker tracker, LongToDoubleFunction toSongSeconds) {
        List<LiveEvent> live = new ArrayList<>();
        liveQueue.drainTo(live);
        List<TimedEvent> file = new ArrayList<>();
        fileQueue.drainTo(file);

        int dropped = droppedSinceDrain.getAndSet(0);
        if (dropped > 0) {
            LOGGER.log(Level.WARNING, "Live input queue overflowed, dropped {0} oldest events (capacity={1})",
                    new Object[]{dropped, liveCapacity});
            issues.onIssue(new PlaybackIssue.QueueOverflow(dropped, liveCapacity));
        }

        List<TimedEvent> merged = new ArrayList<>(live.size() + file.size());
        int f = 0, l = 0;
        while (f < file.size() || l < live.size()) {
            if (l >= live.size()) {
                merged.add(file.get(f++));
                continue;
            }
            var liveEvent = live.get(l);
            var liveTimed = new TimedEvent(liveEvent.event(), toSongSeconds.applyAsDouble(liveEvent.arrivalNanos()));
            if (f < file.size() && file.get(f).timeSeconds() <= liveTimed.timeSeconds()) {
                merged.add(file.get(f++));
            } else {
                merged.add(liveTimed);
                l++;
            }
        }

        tracker.applyAll(merged);
        return merged;
    }

    /** Drops whatever is queued, e.g. when the cursor jumps */
    public void clear() {
        liveQueue.clear();
        fileQueue.clear();
        droppedSinceDrain.set(0);
    }
}
