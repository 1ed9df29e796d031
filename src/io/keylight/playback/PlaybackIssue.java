package io.keylight.playback;

/**
 * Recoverable conditions reported on the side while playback keeps running
 */
public sealed interface PlaybackIssue {

    /** The live queue was full and its oldest events were dropped since the previous drain */
    record QueueOverflow(int dropped, int capacity) implements PlaybackIssue {}

    /**
     * The live input went away
     * @param continuing true when playback carries on with the file timeline
     */
    record DeviceDisconnected(String deviceName, boolean continuing) implements PlaybackIssue {}

    /** A tick threw; the loop carries on with the next tick */
    record TickFailed(long tickNumber, RuntimeException error) implements PlaybackIssue {}

    /** A load failed and nothing could be recovered from the cache */
    record LoadFailed(String sourceName, Exception error) implements PlaybackIssue {}
}
