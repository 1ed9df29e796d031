package io.keylight.playback;

import io.keylight.cache.CacheRecord;
import io.keylight.cache.SourceIdentity;
import io.keylight.cache.TimelineCache;
import io.keylight.config.LearnSettings;
import io.keylight.learn.NoteKey;
import io.keylight.learn.NoteState;
import io.keylight.learn.NoteStateTracker;
import io.keylight.learn.PredictionBatch;
import io.keylight.learn.PredictionEngine;
import io.keylight.midi.MidiFileLoader.LoadedSong;
import io.keylight.midi.TimeConverter;
import io.keylight.midi.Timeline;
import io.keylight.render.Frame;
import io.keylight.render.FrameProjector;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives a session: advances the cursor from a reference clock, feeds due timeline entries and live input to the
 * note tracker, predicts the next notes, projects a frame and publishes one {@link PlaybackSnapshot} per tick.
 * <p>
 * Cursor time is always recomputed from the clock reading and an anchor, never accumulated, so long sessions do
 * not drift. The cursor, the session and the tracker writes all happen under one lock; readers only ever see
 * published snapshots or copies.
 */
public class SyncScheduler implements Closeable {
    private static final Logger LOGGER = Logger.getLogger(SyncScheduler.class.getName());
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final PlaybackClock clock;
    private final TimelineCache cache;
    private final EventQueueRouter router;
    private final FrameProjector projector;
    private final List<PlaybackIssueListener> issueListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<LoadingPhase>> loadingListeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<PlaybackSnapshot> latestSnapshot = new AtomicReference<>();
    private final AtomicLong snapshotSequence = new AtomicLong();
    private final Object tickLock = new Object();
    private final Object loadLock = new Object();

    private volatile PlaybackState state = PlaybackState.IDLE;
    private volatile LearnSettings settings;
    private final PredictionEngine predictionEngine;
    private ScheduledExecutorService executor;

    // guarded by tickLock
    private Session session;
    private long anchorNanos;
    private double anchorSeconds;
    private double tempoScale;
    private int cursorIndex;
    private double cursorSeconds;
    private long tickCount;
    private boolean stopRequested;

    /**
     * @param cache where parsed timelines are kept between runs, or null for no caching
     */
    public SyncScheduler(LearnSettings settings, PlaybackClock clock, TimelineCache cache) {
        this.settings = settings;
        this.clock = clock;
        this.cache = cache;
        this.tempoScale = settings.tempoScale();
        this.router = new EventQueueRouter(settings.liveQueueCapacity(), clock, this::report);
        this.projector = new FrameProjector(settings.hands(), settings.frame());
        this.predictionEngine = new PredictionEngine(settings.hands(), settings.practiceHands());
    }

    public SyncScheduler(LearnSettings settings) {
        this(settings, PlaybackClock.SYSTEM, settings.cache().map(TimelineCache::new).orElse(null));
    }

    public void addIssueListener(PlaybackIssueListener listener) {
        issueListeners.add(listener);
    }

    public void addLoadingListener(Consumer<LoadingPhase> listener) {
        loadingListeners.add(listener);
    }

    /**
     * Loads a new session and starts playing it from the start of the practice range. When {@link #stop()} is
     * called while loading, the new session ends stopped instead.
     * A cached timeline is used when it is still fresh. When reading fails, a stale cached timeline is used
     * if one exists; otherwise the error is reported, the previous session is left as it was and the error is
     * rethrown.
     * @throws IOException when the source cannot be read and there is no cached copy
     * @throws io.keylight.midi.exceptions.MalformedTimelineException when the source is malformed and there is no cached copy
     */
    public Session load(SessionSource source) throws IOException {
        synchronized (loadLock) {
            PlaybackState prior;
            synchronized (tickLock) {
                prior = state;
                if (prior == PlaybackState.PLAYING)
                    freezeCursor(clock.nanoTime());
                state = PlaybackState.LOADING;
                stopRequested = false;
            }
            LOGGER.log(Level.INFO, "Loading {0}", source.name());
            reportPhase(LoadingPhase.LOAD);

            SourceIdentity identity = null;
            Timeline timeline;
            try {
                identity = source.identity().orElse(null);
                timeline = readTimeline(source, identity);
            } catch (IOException | RuntimeException e) {
                reportPhase(LoadingPhase.ERROR);
                Optional<CacheRecord> fallback = cache == null || identity == null
                        ? Optional.empty()
                        : cache.loadIgnoringAge(identity);
                if (fallback.isEmpty()) {
                    LOGGER.log(Level.SEVERE, "Failed to load " + source.name(), e);
                    report(new PlaybackIssue.LoadFailed(source.name(), e));
                    synchronized (tickLock) {
                        stopRequested = false;
                        state = session == null ? PlaybackState.STOPPED : prior;
                        if (state == PlaybackState.PLAYING)
                            anchorNanos = clock.nanoTime();
                    }
                    throw e;
                }
                LOGGER.log(Level.WARNING, "Failed to load {0}, playing the last cached timeline instead: {1}",
                        new Object[]{source.name(), e.getMessage()});
                timeline = fallback.get().timeline();
            }

            var loaded = new Session(source.name(), identity, timeline, new NoteStateTracker(settings.hands()),
                    settings.startPoint(), settings.endPoint());
            synchronized (tickLock) {
                if (session != null)
                    session.tracker().allNotesOff();
                router.clear();
                session = loaded;
                cursorIndex = loaded.startIndex();
                cursorSeconds = loaded.startSeconds();
                anchorSeconds = cursorSeconds;
                anchorNanos = clock.nanoTime();
                if (stopRequested) {
                    stopRequested = false;
                    stopLocked();
                } else {
                    state = PlaybackState.PLAYING;
                    publishLocked();
                    LOGGER.log(Level.INFO, "Playing {0}", loaded);
                }
            }
            reportPhase(LoadingPhase.DONE);
            return loaded;
        }
    }

    private Timeline readTimeline(SessionSource source, SourceIdentity identity) throws IOException {
        if (cache != null && identity != null) {
            var cached = cache.load(identity);
            if (cached.isPresent()) {
                LOGGER.log(Level.INFO, "Using cached timeline for {0}", source.name());
                return cached.get().timeline();
            }
        }

        reportPhase(LoadingPhase.PROCESS);
        LoadedSong song = source.read();
        reportPhase(LoadingPhase.MERGE);
        Timeline timeline = song.toTimeline();
        if (cache != null && identity != null)
            cache.store(identity, timeline);
        return timeline;
    }

    /**
     * Runs a tick in a background thread every {@link LearnSettings#tickIntervalMillis()}
     */
    public synchronized void startTickLoop() {
        if (executor != null)
            return;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "keylight-tick");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleAtFixedRate(this::tick, 0, settings.tickIntervalMillis(), TimeUnit.MILLISECONDS);
        LOGGER.log(Level.FINE, "Tick loop started every {0} ms", settings.tickIntervalMillis());
    }

    /**
     * One pass of the loop. Does nothing unless a session is playing or paused.
     * Errors are reported as {@link PlaybackIssue.TickFailed} and never escape.
     */
    public void tick() {
        synchronized (tickLock) {
            if (!state.isRunning() || session == null)
                return;
            long tickNumber = ++tickCount;
            try {
                tickLocked();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Tick " + tickNumber + " failed", e);
                report(new PlaybackIssue.TickFailed(tickNumber, e));
            }
        }
    }

    private void tickLocked() {
        Timeline timeline = session.timeline();
        boolean reachedEnd = false;
        if (state == PlaybackState.PLAYING) {
            cursorSeconds = songSecondsAt(clock.nanoTime());
            int due = Math.min(timeline.countAtOrBefore(cursorSeconds), session.endIndex());
            while (cursorIndex < due) {
                router.pushFile(timeline.get(cursorIndex++));
            }
            reachedEnd = !timeline.isEmpty() && cursorIndex >= session.endIndex();
        }

        router.drain(session.tracker(), this::songSecondsAt);
        publishLocked();

        if (reachedEnd) {
            if (settings.loop()) {
                LOGGER.log(Level.FINE, "Looping back to entry {0}", session.startIndex());
                restartLocked();
            } else {
                LOGGER.log(Level.INFO, "Reached the end of {0}", session.name());
                stopLocked();
            }
        }
    }

    private void publishLocked() {
        Timeline timeline = session.timeline();
        NoteState noteState = session.tracker().snapshot();
        double window = settings.lookaheadWindowSeconds();
        int endIndex = session.endIndex();
        PredictionBatch prediction = predictionEngine.predict(cursorIndex, endIndex, cursorSeconds, tempoScale,
                timeline, noteState, window);
        Frame frame = projector.projectFrame(timeline, endIndex, cursorSeconds, tempoScale, window, noteState, prediction);
        latestSnapshot.set(new PlaybackSnapshot(snapshotSequence.incrementAndGet(), state, cursorSeconds, cursorIndex,
                List.copyOf(noteState.activeSet()), prediction, frame));
    }

    /** Song time at a clock reading, given the current anchor */
    private double songSecondsAt(long nanos) {
        if (state != PlaybackState.PLAYING)
            return cursorSeconds;
        return anchorSeconds + TimeConverter.removeTempoScale((nanos - anchorNanos) / NANOS_PER_SECOND, tempoScale);
    }

    /** Moves the anchor to {@code nanos} without moving the cursor */
    private void freezeCursor(long nanos) {
        cursorSeconds = songSecondsAt(nanos);
        anchorSeconds = cursorSeconds;
        anchorNanos = nanos;
    }

    public void pause() {
        synchronized (tickLock) {
            if (state != PlaybackState.PLAYING)
                return;
            freezeCursor(clock.nanoTime());
            state = PlaybackState.PAUSED;
            LOGGER.log(Level.INFO, "Paused at {0}s", cursorSeconds);
        }
    }

    public void resume() {
        synchronized (tickLock) {
            if (state != PlaybackState.PAUSED)
                return;
            anchorSeconds = cursorSeconds;
            anchorNanos = clock.nanoTime();
            state = PlaybackState.PLAYING;
            LOGGER.log(Level.INFO, "Resumed at {0}s", cursorSeconds);
        }
    }

    /**
     * Ends the session: every held note is released and a final snapshot with no notes is published.
     * A stop during loading ends the previous session now and the loading one as soon as it is ready.
     */
    public void stop() {
        synchronized (tickLock) {
            if (state == PlaybackState.LOADING) {
                stopRequested = true;
                if (session != null)
                    stopLocked();
                state = PlaybackState.LOADING;
                return;
            }
            if (session == null) {
                state = PlaybackState.STOPPED;
                return;
            }
            stopLocked();
        }
    }

    private void stopLocked() {
        Set<NoteKey> released = session.tracker().allNotesOff();
        router.clear();
        state = PlaybackState.STOPPED;
        latestSnapshot.set(new PlaybackSnapshot(snapshotSequence.incrementAndGet(), state, cursorSeconds, cursorIndex,
                List.of(), PredictionBatch.EMPTY, new Frame(List.of(), List.of(), projector.keyboardLayout())));
        LOGGER.log(Level.INFO, "Stopped {0}, released {1} notes", new Object[]{session.name(), released.size()});
        session = null;
    }

    /** Jumps back to the start of the practice range, releasing every held note */
    public void restartLoop() {
        synchronized (tickLock) {
            if (session != null && state.isRunning())
                restartLocked();
        }
    }

    private void restartLocked() {
        session.tracker().allNotesOff();
        router.clear();
        cursorIndex = session.startIndex();
        cursorSeconds = session.startSeconds();
        anchorSeconds = cursorSeconds;
        anchorNanos = clock.nanoTime();
    }

    /**
     * Changes the playback speed from now on. The cursor does not jump.
     * @throws io.keylight.midi.exceptions.InvalidConfigurationException when the scale is not positive; the previous scale stays
     */
    public void setTempoScale(double scalePercent) {
        var updated = settings.withTempoScale(scalePercent);
        synchronized (tickLock) {
            if (state == PlaybackState.PLAYING)
                freezeCursor(clock.nanoTime());
            tempoScale = scalePercent;
            settings = updated;
        }
        LOGGER.log(Level.INFO, "Tempo scale set to {0}%", scalePercent);
    }

    /** @throws io.keylight.midi.exceptions.InvalidConfigurationException when negative; the previous level stays */
    public void setSkillLevel(double skillLevel) {
        settings = settings.withSkillLevel(skillLevel);
    }

    /** @throws io.keylight.midi.exceptions.InvalidConfigurationException when negative; the previous difficulty stays */
    public void setSongDifficulty(double songDifficulty) {
        settings = settings.withSongDifficulty(songDifficulty);
    }

    public void setLoop(boolean loop) {
        settings = settings.withLoop(loop);
    }

    /**
     * The live input went away. Playback carries on when the session has a file timeline, otherwise it stops.
     */
    public void onDeviceDisconnected(String deviceName) {
        boolean continuing;
        synchronized (tickLock) {
            continuing = session != null && !session.timeline().isEmpty();
            if (!continuing && session != null)
                stopLocked();
        }
        LOGGER.log(Level.WARNING, "MIDI input {0} disconnected, continuing={1}", new Object[]{deviceName, continuing});
        report(new PlaybackIssue.DeviceDisconnected(deviceName, continuing));
    }

    public Cursor cursor() {
        synchronized (tickLock) {
            return new Cursor(cursorIndex, cursorSeconds, tempoScale);
        }
    }

    public PlaybackState state() {
        return state;
    }

    public LearnSettings settings() {
        return settings;
    }

    public Optional<Session> session() {
        synchronized (tickLock) {
            return Optional.ofNullable(session);
        }
    }

    /** The most recently published snapshot, if any */
    public Optional<PlaybackSnapshot> latestSnapshot() {
        return Optional.ofNullable(latestSnapshot.get());
    }

    /** Where live input is pushed */
    public EventQueueRouter router() {
        return router;
    }

    public FrameProjector projector() {
        return projector;
    }

    private void reportPhase(LoadingPhase phase) {
        LOGGER.log(Level.FINE, "Loading phase {0}", phase);
        for (var listener : loadingListeners) {
            listener.accept(phase);
        }
    }

    private void report(PlaybackIssue issue) {
        for (var listener : issueListeners) {
            try {
                listener.onIssue(issue);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Issue listener failed on " + issue, e);
            }
        }
    }

    @Override
    public void close() {
        stop();
        synchronized (this) {
            if (executor != null) {
                executor.shutdownNow();
                executor = null;
            }
        }
    }
}
