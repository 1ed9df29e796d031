package io.keylight.playback;

import io.keylight.render.KeyboardLayout;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends each new snapshot to every registered sink from its own thread.
 * It only reads published snapshots, so a slow sink delays the broadcast and never the tick loop.
 */
public class SnapshotBroadcaster implements Closeable {
    private static final Logger LOGGER = Logger.getLogger(SnapshotBroadcaster.class.getName());

    private final Supplier<Optional<PlaybackSnapshot>> snapshots;
    private final List<SnapshotSink> sinks = new CopyOnWriteArrayList<>();
    private final Map<SnapshotSink, KeyboardLayout> layoutSent = new ConcurrentHashMap<>();
    private long lastSequence = -1;
    private ScheduledExecutorService executor;

    public SnapshotBroadcaster(Supplier<Optional<PlaybackSnapshot>> snapshots) {
        this.snapshots = snapshots;
    }

    public void addSink(SnapshotSink sink) {
        sinks.add(sink);
    }

    public void removeSink(SnapshotSink sink) {
        sinks.remove(sink);
        layoutSent.remove(sink);
    }

    public List<SnapshotSink> sinks() {
        return List.copyOf(sinks);
    }

    public synchronized void start(long intervalMillis) {
        if (executor != null)
            return;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "keylight-broadcast");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleAtFixedRate(this::broadcastOnce, 0, intervalMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Sends the latest snapshot if it has not been sent yet
     * @return true when a snapshot was sent
     */
    public synchronized boolean broadcastOnce() {
        var latest = snapshots.get();
        if (latest.isEmpty() || latest.get().sequence() == lastSequence)
            return false;
        var snapshot = latest.get();
        lastSequence = snapshot.sequence();

        KeyboardLayout layout = snapshot.frame().keyboardLayout();
        String withLayout = null;
        String withoutLayout = null;
        for (var sink : sinks) {
            boolean includeLayout = layoutSent.get(sink) != layout;
            String json;
            if (includeLayout) {
                if (withLayout == null)
                    withLayout = SnapshotJson.toJson(snapshot, true);
                json = withLayout;
            } else {
                if (withoutLayout == null)
                    withoutLayout = SnapshotJson.toJson(snapshot, false);
                json = withoutLayout;
            }

            try {
                sink.publish(snapshot, json);
                layoutSent.put(sink, layout);
            } catch (IOException | RuntimeException e) {
                LOGGER.log(Level.WARNING, "Removing snapshot sink " + sink + " after it failed", e);
                removeSink(sink);
            }
        }
        return true;
    }

    @Override
    public synchronized void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }
}
