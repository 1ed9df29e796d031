package io.keylight.device;

import javax.sound.midi.MidiDevice;
import javax.sound.midi.MidiSystem;
import javax.sound.midi.MidiUnavailableException;
import javax.sound.midi.Transmitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finding and opening MIDI input devices
 */
public final class MidiDeviceUtils {
    private static final Logger LOGGER = Logger.getLogger(MidiDeviceUtils.class.getName());

    private MidiDeviceUtils() {}

    /** An opened input device with its transmitter wired to a receiver. Closing it is not a disconnect. */
    public record OpenInput(MidiDevice device, Transmitter transmitter, LiveMidiInput receiver) implements AutoCloseable {
        @Override
        public void close() {
            receiver.detach();
            transmitter.close();
            if (device.isOpen())
                device.close();
            receiver.close();
        }
    }

    /**
     * Devices that can transmit events, i.e. inputs
     */
    public static List<MidiDevice.Info> listInputDevices() {
        MidiDevice.Info[] infos = MidiSystem.getMidiDeviceInfo();
        List<MidiDevice.Info> inputs = new ArrayList<>(infos.length);
        for (MidiDevice.Info info : infos) {
            try {
                MidiDevice device = MidiSystem.getMidiDevice(info);
                if (device.getMaxTransmitters() != 0)
                    inputs.add(info);
            } catch (MidiUnavailableException e) {
                LOGGER.log(Level.FINE, "Skipping unavailable device {0}: {1}", new Object[]{info.getName(), e.getMessage()});
            }
        }
        return inputs;
    }

    /** First input whose name contains {@code name}, ignoring case */
    public static Optional<MidiDevice.Info> findInputDevice(String name) {
        String needle = name.toLowerCase(Locale.ROOT);
        return listInputDevices().stream()
                .filter(info -> info.getName().toLowerCase(Locale.ROOT).contains(needle))
                .findFirst();
    }

    /**
     * Opens the device and routes everything it transmits to {@code receiver}
     * @throws MidiUnavailableException when the device is busy or gone
     */
    public static OpenInput open(MidiDevice.Info info, LiveMidiInput receiver) throws MidiUnavailableException {
        MidiDevice device = MidiSystem.getMidiDevice(info);
        device.open();
        try {
            Transmitter transmitter = device.getTransmitter();
            transmitter.setReceiver(receiver);
            LOGGER.log(Level.INFO, "Listening to MIDI input {0}", info.getName());
            return new OpenInput(device, transmitter, receiver);
        } catch (MidiUnavailableException e) {
            device.close();
            throw e;
        }
    }
}
