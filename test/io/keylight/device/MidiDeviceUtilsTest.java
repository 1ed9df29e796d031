package io.keylight.device;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MidiDeviceUtilsTest {

    @Test
    void listInputDevicesDoesNotThrow() {
        assertDoesNotThrow(MidiDeviceUtils::listInputDevices);
    }

    @Test
    void unknownDeviceIsNotFound() {
        assertTrue(MidiDeviceUtils.findInputDevice("no such keyboard 9f3c1a").isEmpty());
    }
}
