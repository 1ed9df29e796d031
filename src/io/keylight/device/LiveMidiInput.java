package io.keylight.device;

import io.keylight.midi.MidiFileLoader;
import io.keylight.midi.RawEvent;
import io.keylight.playback.EventQueueRouter;

import javax.sound.midi.MidiMessage;
import javax.sound.midi.Receiver;
import javax.sound.midi.ShortMessage;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives messages from a MIDI input device and pushes notes and control changes into the live queue.
 * Runs on the device's thread and never waits on playback.
 */
public class LiveMidiInput implements Receiver {
    private static final Logger LOGGER = Logger.getLogger(LiveMidiInput.class.getName());
    /** Source track of events that did not come from a file */
    public static final int LIVE_TRACK = -1;

    private final String deviceName;
    private final EventQueueRouter router;
    private final Consumer<String> onDisconnect;
    private volatile boolean open = true;

    /**
     * @param onDisconnect called once with the device name when this receiver is closed
     */
    public LiveMidiInput(String deviceName, EventQueueRouter router, Consumer<String> onDisconnect) {
        this.deviceName = deviceName;
        this.router = router;
        this.onDisconnect = onDisconnect;
    }

    public String deviceName() {
        return deviceName;
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(MidiMessage message, long timeStamp) {
        if (!open || !(message instanceof ShortMessage))
            return;
        RawEvent event;
        try {
            event = MidiFileLoader.convert(message, 0, LIVE_TRACK, -1);
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.FINE, "Ignoring malformed message from {0}: {1}", new Object[]{deviceName, e.getMessage()});
            return;
        }
        if (event != null)
            router.pushLive(event);
    }

    /**
     * Stops forwarding without reporting a disconnect, for a deliberate shutdown
     */
    public void detach() {
        if (!open)
            return;
        open = false;
        LOGGER.log(Level.FINE, "MIDI input {0} detached", deviceName);
    }

    @Override
    public void close() {
        if (!open)
            return;
        open = false;
        LOGGER.log(Level.INFO, "MIDI input {0} closed", deviceName);
        onDisconnect.accept(deviceName);
    }
}
