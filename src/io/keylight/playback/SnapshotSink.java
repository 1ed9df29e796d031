package io.keylight.playback;

import java.io.IOException;

/**
 * Receives every new snapshot from a {@link SnapshotBroadcaster}. A sink that throws is dropped.
 */
public interface SnapshotSink {
    /**
     * @param json the snapshot in the broadcast format, with the keyboard layout only when this sink has not seen it yet
     */
    void publish(PlaybackSnapshot snapshot, String json) throws IOException;
}
