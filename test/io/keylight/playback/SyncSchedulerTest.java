package io.keylight.playback;

import io.keylight.cache.TimelineCache;
import io.keylight.config.LearnSettings;
import io.keylight.learn.NoteKey;
import io.keylight.learn.PredictedNote;
import io.keylight.midi.MidiFileLoader;
import io.keylight.midi.MidiFileLoader.LoadedSong;
import io.keylight.midi.RawEvent;
import io.keylight.midi.exceptions.InvalidConfigurationException;
import io.keylight.midi.exceptions.MalformedTimelineException;
import io.keylight.cache.SourceIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sound.midi.MidiEvent;
import javax.sound.midi.MidiSystem;
import javax.sound.midi.Sequence;
import javax.sound.midi.ShortMessage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SyncSchedulerTest {
    final ManualClock clock = new ManualClock();
    final List<PlaybackIssue> issues = new ArrayList<>();
    final List<LoadingPhase> phases = new ArrayList<>();

    @TempDir
    Path tempDir;

    /** C4+E4 at 0s released at 0.5s, G4 at 1s released at 1.5s, on channel 1 */
    static List<RawEvent> song() {
        return List.of(
                new RawEvent.NoteOn(1, 60, 80, 0, 0),
                new RawEvent.NoteOn(1, 64, 80, 0, 0),
                new RawEvent.NoteOff(1, 60, 0, 480, 0),
                new RawEvent.NoteOff(1, 64, 0, 0, 0),
                new RawEvent.NoteOn(1, 67, 80, 480, 0),
                new RawEvent.NoteOff(1, 67, 0, 480, 0));
    }

    static SessionSource songSource() {
        return SessionSource.tracks("song", List.of(song()), 480, 500_000);
    }

    SyncScheduler scheduler(LearnSettings settings) {
        return scheduler(settings, null);
    }

    SyncScheduler scheduler(LearnSettings settings, TimelineCache cache) {
        var scheduler = new SyncScheduler(settings, clock, cache);
        scheduler.addIssueListener(issues::add);
        scheduler.addLoadingListener(phases::add);
        return scheduler;
    }

    static SessionSource failing(Exception error) {
        return new SessionSource() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public Optional<SourceIdentity> identity() {
                return Optional.empty();
            }

            @Override
            public LoadedSong read() throws IOException {
                if (error instanceof IOException e)
                    throw e;
                throw (RuntimeException) error;
            }
        };
    }

    @Test
    void loadStartsPlayingAtTheBeginning() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        assertEquals(PlaybackState.IDLE, scheduler.state());

        var session = scheduler.load(songSource());

        assertEquals(PlaybackState.PLAYING, scheduler.state());
        assertEquals(6, session.timeline().size());
        assertEquals(List.of(LoadingPhase.LOAD, LoadingPhase.PROCESS, LoadingPhase.MERGE, LoadingPhase.DONE), phases);
        assertEquals(new Cursor(0, 0.0, 100.0), scheduler.cursor());
        var snapshot = scheduler.latestSnapshot().orElseThrow();
        assertEquals(List.of(60, 64), snapshot.prediction().notes().stream().map(PredictedNote::note).toList());
    }

    @Test
    void tickPlaysDueEntriesAndPredictsTheNextGroup() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        scheduler.load(songSource());

        clock.advanceMillis(250);
        scheduler.tick();

        var snapshot = scheduler.latestSnapshot().orElseThrow();
        assertEquals(0.25, snapshot.cursorSeconds(), 1e-9);
        assertEquals(2, snapshot.cursorIndex());
        assertEquals(List.of(new NoteKey(1, 60), new NoteKey(1, 64)), snapshot.activeNotes());
        assertEquals(1, snapshot.prediction().size());
        assertEquals(67, snapshot.prediction().notes().get(0).note());
        assertEquals(0.75, snapshot.prediction().anchorDelaySeconds(), 1e-9);
        assertEquals(2, snapshot.frame().litKeys().stream().filter(k -> !k.colorKey().upcoming()).count());
    }

    @Test
    void snapshotsAreNumberedInOrder() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        scheduler.load(songSource());
        long first = scheduler.latestSnapshot().orElseThrow().sequence();
        scheduler.tick();
        scheduler.tick();
        assertEquals(first + 2, scheduler.latestSnapshot().orElseThrow().sequence());
    }

    @Test
    void cursorFollowsTheClockWithoutDrift() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS.withTempoScale(75));
        scheduler.load(songSource());

        // ten thousand uneven ticks adding up to 1.25s
        for (int i = 0; i < 10_000; ++i) {
            clock.advanceNanos(i % 2 == 0 ? 100_000 : 150_000);
            scheduler.tick();
            if (scheduler.state() != PlaybackState.PLAYING)
                break;
        }

        assertEquals(1.25 * 0.75, scheduler.cursor().currentSeconds(), 1e-6);
    }

    @Test
    void tempoScaleChangesSpeedWithoutJumping() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        scheduler.load(songSource());
        clock.advanceMillis(200);
        scheduler.setTempoScale(50);

        clock.advanceMillis(400);
        scheduler.tick();

        assertEquals(0.2 + 0.2, scheduler.cursor().currentSeconds(), 1e-9);
        assertEquals(50, scheduler.cursor().tempoScale());
    }

    @Test
    void invalidTempoScaleIsRejectedAndPreviousKept() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS.withTempoScale(80));
        scheduler.load(songSource());

        assertThrows(InvalidConfigurationException.class, () -> scheduler.setTempoScale(0));
        assertThrows(InvalidConfigurationException.class, () -> scheduler.setTempoScale(-10));

        assertEquals(80, scheduler.cursor().tempoScale());
        assertEquals(80, scheduler.settings().tempoScale());
        clock.advanceMillis(500);
        scheduler.tick();
        assertEquals(0.4, scheduler.cursor().currentSeconds(), 1e-9);
    }

    @Test
    void invalidSkillOrDifficultyIsRejected() {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        scheduler.setSkillLevel(10);
        assertThrows(InvalidConfigurationException.class, () -> scheduler.setSkillLevel(-1));
        assertThrows(InvalidConfigurationException.class, () -> scheduler.setSongDifficulty(-1));
        assertEquals(10, scheduler.settings().skillLevel());
        assertEquals(4.0, scheduler.settings().lookaheadWindowSeconds(), 1e-12);
    }

    @Test
    void pauseFreezesTheCursorAndLiveInputStillCounts() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        scheduler.load(songSource());
        clock.advanceMillis(250);
        scheduler.tick();
        scheduler.pause();

        clock.advanceMillis(1_000);
        scheduler.router().pushLive(new RawEvent.NoteOn(2, 48, 90, 0, -1));
        scheduler.tick();

        assertEquals(PlaybackState.PAUSED, scheduler.state());
        var snapshot = scheduler.latestSnapshot().orElseThrow();
        assertEquals(PlaybackState.PAUSED, snapshot.state());
        assertEquals(0.25, snapshot.cursorSeconds(), 1e-9);
        assertTrue(snapshot.activeNotes().contains(new NoteKey(2, 48)));

        scheduler.resume();
        clock.advanceMillis(250);
        scheduler.tick();
        assertEquals(0.5, scheduler.cursor().currentSeconds(), 1e-9);
        assertEquals(PlaybackState.PLAYING, scheduler.state());
    }

    @Test
    void endOfTimelineStopsWithNothingHeld() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        scheduler.load(songSource());
        scheduler.router().pushLive(new RawEvent.NoteOn(2, 48, 90, 0, -1));

        clock.advanceMillis(2_000);
        scheduler.tick();

        assertEquals(PlaybackState.STOPPED, scheduler.state());
        assertTrue(scheduler.session().isEmpty());
        var last = scheduler.latestSnapshot().orElseThrow();
        assertEquals(PlaybackState.STOPPED, last.state());
        assertTrue(last.activeNotes().isEmpty());
        assertTrue(last.prediction().isEmpty());

        // stopped means the loop does nothing
        long sequence = last.sequence();
        scheduler.tick();
        assertEquals(sequence, scheduler.latestSnapshot().orElseThrow().sequence());
    }

    @Test
    void stopReleasesHeldNotes() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        var session = scheduler.load(songSource());
        clock.advanceMillis(100);
        scheduler.tick();
        assertFalse(session.tracker().snapshot().isEmpty());

        scheduler.stop();

        assertEquals(PlaybackState.STOPPED, scheduler.state());
        assertTrue(session.tracker().snapshot().isEmpty());
        assertTrue(scheduler.latestSnapshot().orElseThrow().activeNotes().isEmpty());
    }

    @Test
    void loopWrapsToPracticeStart() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS.withLoop(true));
        var session = scheduler.load(songSource());

        clock.advanceMillis(2_000);
        scheduler.tick();

        assertEquals(PlaybackState.PLAYING, scheduler.state());
        assertEquals(new Cursor(0, 0.0, 100.0), scheduler.cursor());
        assertTrue(session.tracker().snapshot().isEmpty());

        clock.advanceMillis(100);
        scheduler.tick();
        assertEquals(0.1, scheduler.cursor().currentSeconds(), 1e-9);
        assertEquals(2, scheduler.cursor().currentIndex());
    }

    @Test
    void practiceRangeStartsMidSong() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS.withPracticeRange(50, 100));
        var session = scheduler.load(songSource());

        assertEquals(3, session.startIndex());
        assertEquals(6, session.endIndex());
        assertEquals(new Cursor(3, 0.5, 100.0), scheduler.cursor());
    }

    @Test
    void practiceRangeEndStopsEarly() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS.withPracticeRange(0, 50));
        scheduler.load(songSource());

        clock.advanceMillis(600);
        scheduler.tick();

        assertEquals(PlaybackState.STOPPED, scheduler.state());
        assertEquals(3, scheduler.cursor().currentIndex());
    }

    @Test
    void predictionAndFrameStayInsidePracticeRange() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS.withPracticeRange(0, 50).withLoop(true));
        var session = scheduler.load(songSource());

        clock.advanceMillis(250);
        scheduler.tick();

        assertEquals(3, session.endIndex());
        var snapshot = scheduler.latestSnapshot().orElseThrow();
        assertTrue(snapshot.prediction().isEmpty());
        assertTrue(snapshot.frame().visibleNotes().isEmpty());
    }

    /** Calls stop() on the scheduler from inside read(), while the load is in progress */
    static SessionSource stoppingWhileRead(SyncScheduler[] scheduler) {
        return new SessionSource() {
            @Override
            public String name() {
                return "stopped";
            }

            @Override
            public Optional<SourceIdentity> identity() {
                return Optional.empty();
            }

            @Override
            public LoadedSong read() throws IOException {
                scheduler[0].stop();
                return songSource().read();
            }
        };
    }

    @Test
    void stopWhileLoadingEndsStopped() throws IOException {
        var holder = new SyncScheduler[]{scheduler(LearnSettings.DEFAULTS)};

        holder[0].load(stoppingWhileRead(holder));

        assertEquals(PlaybackState.STOPPED, holder[0].state());
        assertTrue(holder[0].session().isEmpty());
        assertEquals(PlaybackState.STOPPED, holder[0].latestSnapshot().orElseThrow().state());
        clock.advanceMillis(250);
        holder[0].tick();
        assertEquals(PlaybackState.STOPPED, holder[0].state());
    }

    @Test
    void stopWhileLoadingReplacementStopsPriorSessionToo() throws IOException {
        var holder = new SyncScheduler[]{scheduler(LearnSettings.DEFAULTS)};
        var prior = holder[0].load(songSource());
        clock.advanceMillis(250);
        holder[0].tick();
        assertEquals(2, prior.tracker().activeSet().size());

        holder[0].load(stoppingWhileRead(holder));

        assertEquals(PlaybackState.STOPPED, holder[0].state());
        assertTrue(holder[0].session().isEmpty());
        assertTrue(prior.tracker().snapshot().isEmpty());
    }

    @Test
    void failedLoadWithoutSessionStops() {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        var error = new IOException("disk gone");

        var thrown = assertThrows(IOException.class, () -> scheduler.load(failing(error)));

        assertSame(error, thrown);
        assertEquals(PlaybackState.STOPPED, scheduler.state());
        assertEquals(List.of(new PlaybackIssue.LoadFailed("broken", error)), issues);
        assertEquals(LoadingPhase.ERROR, phases.get(phases.size() - 1));
    }

    @Test
    void failedLoadLeavesPriorSessionPlaying() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        var session = scheduler.load(songSource());
        clock.advanceMillis(250);
        scheduler.tick();

        assertThrows(MalformedTimelineException.class,
                () -> scheduler.load(failing(new MalformedTimelineException("bad track"))));

        assertEquals(PlaybackState.PLAYING, scheduler.state());
        assertSame(session, scheduler.session().orElseThrow());
        assertEquals(2, session.tracker().activeSet().size());
        clock.advanceMillis(250);
        scheduler.tick();
        assertEquals(0.5, scheduler.cursor().currentSeconds(), 1e-9);
    }

    static void writeSong(Path file) throws Exception {
        var sequence = new Sequence(Sequence.PPQ, 480);
        var track = sequence.createTrack();
        track.add(new MidiEvent(new ShortMessage(ShortMessage.NOTE_ON, 0, 60, 80), 0));
        track.add(new MidiEvent(new ShortMessage(ShortMessage.NOTE_OFF, 0, 60, 0), 480));
        MidiSystem.write(sequence, 1, file.toFile());
    }

    @Test
    void unchangedFileIsLoadedFromCache() throws Exception {
        Path file = tempDir.resolve("song.mid");
        writeSong(file);
        var cache = new TimelineCache(tempDir.resolve("cache"));
        var scheduler = scheduler(LearnSettings.DEFAULTS, cache);
        var source = SessionSource.file(file, new MidiFileLoader());

        var first = scheduler.load(source);
        phases.clear();
        var second = scheduler.load(source);

        assertEquals(first.timeline().entries(), second.timeline().entries());
        assertEquals(List.of(LoadingPhase.LOAD, LoadingPhase.DONE), phases);
    }

    @Test
    void brokenFileFallsBackToStaleCache() throws Exception {
        Path file = tempDir.resolve("song.mid");
        writeSong(file);
        var cache = new TimelineCache(tempDir.resolve("cache"));
        var scheduler = scheduler(LearnSettings.DEFAULTS, cache);
        var source = SessionSource.file(file, new MidiFileLoader());
        var first = scheduler.load(source);
        scheduler.stop();

        FileTime written = Files.getLastModifiedTime(file);
        Files.writeString(file, "not midi any more");
        Files.setLastModifiedTime(file, FileTime.fromMillis(written.toMillis() + 60_000));
        var fallback = scheduler.load(source);

        assertEquals(PlaybackState.PLAYING, scheduler.state());
        assertEquals(first.timeline().entries(), fallback.timeline().entries());
        assertTrue(phases.contains(LoadingPhase.ERROR));
        assertTrue(issues.isEmpty());
    }

    @Test
    void disconnectContinuesWithFileTimeline() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        scheduler.load(songSource());

        scheduler.onDeviceDisconnected("keys");

        assertEquals(PlaybackState.PLAYING, scheduler.state());
        assertEquals(List.of(new PlaybackIssue.DeviceDisconnected("keys", true)), issues);
    }

    @Test
    void disconnectStopsLiveOnlySession() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        scheduler.load(SessionSource.liveOnly());
        scheduler.router().pushLive(new RawEvent.NoteOn(0, 60, 90, 0, -1));
        scheduler.tick();
        assertEquals(PlaybackState.PLAYING, scheduler.state());

        scheduler.onDeviceDisconnected("keys");

        assertEquals(PlaybackState.STOPPED, scheduler.state());
        assertEquals(List.of(new PlaybackIssue.DeviceDisconnected("keys", false)), issues);
        assertTrue(scheduler.latestSnapshot().orElseThrow().activeNotes().isEmpty());
    }

    @Test
    void failingTickIsReportedAndNextTickRuns() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS);
        scheduler.load(songSource());

        clock.failNextReading();
        scheduler.tick();
        clock.advanceMillis(100);
        scheduler.tick();

        assertEquals(1, issues.size());
        var failed = assertInstanceOf(PlaybackIssue.TickFailed.class, issues.get(0));
        assertEquals(1, failed.tickNumber());
        assertEquals(0.1, scheduler.cursor().currentSeconds(), 1e-9);
    }

    @Test
    void liveQueueOverflowIsReportedWhilePlaying() throws IOException {
        var scheduler = scheduler(LearnSettings.DEFAULTS.withLiveQueueCapacity(32));
        scheduler.load(SessionSource.liveOnly());
        for (int i = 0; i < 40; ++i) {
            scheduler.router().pushLive(new RawEvent.NoteOn(0, 40 + i, 90, 0, -1));
        }

        scheduler.tick();

        assertEquals(List.of(new PlaybackIssue.QueueOverflow(8, 32)), issues);
        assertEquals(32, scheduler.latestSnapshot().orElseThrow().activeNotes().size());
    }
}
