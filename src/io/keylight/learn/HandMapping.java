package io.keylight.learn;

import java.util.Map;
import java.util.TreeMap;

/**
 * Channel to hand policy. Channels not listed fall back to {@code defaultHand}.
 */
public record HandMapping(Map<Integer, Hand> byChannel, Hand defaultHand) {
    /** Channel 1 is the right hand, everything else the left hand */
    public static final HandMapping DEFAULT = new HandMapping(Map.of(1, Hand.RIGHT, 2, Hand.LEFT), Hand.LEFT);

    public HandMapping {
        if (defaultHand == null)
            throw new IllegalArgumentException("defaultHand is required");
        for (var channel : byChannel.keySet()) {
            if (channel == null || channel < 0 || channel > 15)
                throw new IllegalArgumentException("MIDI has channels 0 to 15: channel=" + channel);
        }
        byChannel = Map.copyOf(byChannel);
    }

    public Hand handFor(int channel) {
        return byChannel.getOrDefault(channel, defaultHand);
    }

    @Override
    public String toString() {
        return "HandMapping{" +
                "byChannel=" + new TreeMap<>(byChannel) +
                ", defaultHand=" + defaultHand +
                '}';
    }
}
