package io.keylight.playback;

import io.keylight.learn.HandMapping;
import io.keylight.learn.NoteStateTracker;
import io.keylight.midi.RawEvent;
import io.keylight.midi.TimelineEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventQueueRouterTest {
    final ManualClock clock = new ManualClock();
    final List<PlaybackIssue> issues = new ArrayList<>();
    final NoteStateTracker tracker = new NoteStateTracker(HandMapping.DEFAULT);

    /** Live arrival nanos map straight to seconds */
    static double seconds(long nanos) {
        return nanos / 1e9;
    }

    static RawEvent.NoteOn note(int note) {
        return new RawEvent.NoteOn(0, note, 100, 0, -1);
    }

    @Test
    void fullQueueDropsOldestAndReportsOnce() {
        var router = new EventQueueRouter(32, clock, issues::add);
        for (int i = 0; i < 40; ++i) {
            router.pushLive(note(40 + i), i);
        }

        var drained = router.drain(tracker, EventQueueRouterTest::seconds);

        assertEquals(32, drained.size());
        assertEquals(48, ((RawEvent.NoteOn) drained.get(0).event()).note());
        assertEquals(79, ((RawEvent.NoteOn) drained.get(31).event()).note());
        assertEquals(List.of(new PlaybackIssue.QueueOverflow(8, 32)), issues);
        assertFalse(tracker.isActive(0, 47));
        assertTrue(tracker.isActive(0, 48));

        router.pushLive(note(90), 100);
        router.drain(tracker, EventQueueRouterTest::seconds);
        assertEquals(1, issues.size());
    }

    @Test
    void queuesMergeByTimeKeepingFifoOrder() {
        var router = new EventQueueRouter(8, clock, issues::add);
        router.pushFile(new TimelineEntry(0, 0.5, note(60)));
        router.pushFile(new TimelineEntry(480, 1.5, note(62)));
        router.pushLive(note(70), 1_000_000_000L);
        router.pushLive(note(71), 2_000_000_000L);

        var order = router.drain(tracker, EventQueueRouterTest::seconds).stream()
                .map(e -> ((RawEvent.NoteOn) e.event()).note())
                .toList();

        assertEquals(List.of(60, 70, 62, 71), order);
        assertTrue(issues.isEmpty());
    }

    @Test
    void fileEventGoesFirstOnEqualTime() {
        var router = new EventQueueRouter(8, clock, issues::add);
        router.pushLive(note(70), 1_000_000_000L);
        router.pushFile(new TimelineEntry(0, 1.0, note(60)));

        var drained = router.drain(tracker, EventQueueRouterTest::seconds);

        assertEquals(60, ((RawEvent.NoteOn) drained.get(0).event()).note());
        assertEquals(1.0, drained.get(1).timeSeconds());
    }

    @Test
    void liveNoteOffIsNormalized() {
        var router = new EventQueueRouter(8, clock, issues::add);
        router.pushLive(note(60));
        router.pushLive(new RawEvent.NoteOff(0, 60, 30, 0, -1));

        var drained = router.drain(tracker, EventQueueRouterTest::seconds);

        assertInstanceOf(RawEvent.NoteOn.class, drained.get(1).event());
        assertFalse(tracker.isActive(0, 60));
    }

    @Test
    void emptyDrainAppliesNothing() {
        var router = new EventQueueRouter(8, clock, issues::add);
        assertTrue(router.drain(tracker, EventQueueRouterTest::seconds).isEmpty());
        assertTrue(tracker.snapshot().isEmpty());
    }

    @Test
    void pushLiveNeverBlocksFromManyThreads() throws InterruptedException {
        var router = new EventQueueRouter(4, clock, issues::add);
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; ++t) {
            int base = t * 20;
            var thread = new Thread(() -> {
                for (int i = 0; i < 20; ++i) {
                    router.pushLive(note(base + i), base + i);
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (var thread : threads) {
            thread.join(5_000);
            assertFalse(thread.isAlive());
        }

        var drained = router.drain(tracker, EventQueueRouterTest::seconds);

        assertEquals(4, drained.size());
        assertEquals(1, issues.size());
        assertEquals(76, ((PlaybackIssue.QueueOverflow) issues.get(0)).dropped());
    }

    @Test
    void whenCapacityIsZero_thenThrows() {
        assertThrows(IllegalArgumentException.class, () -> new EventQueueRouter(0, clock, issues::add));
    }
}
