package io.keylight.config;

import com.google.gson.JsonParseException;
import io.keylight.learn.Hand;
import io.keylight.learn.HandMapping;
import io.keylight.learn.PracticeHands;
import io.keylight.midi.exceptions.InvalidConfigurationException;
import io.keylight.render.FrameSettings;
import io.keylight.util.JsonFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads {@link LearnSettings} from the bundled defaults, optionally overridden by a user JSON file.
 * The override file may contain any subset of the keys in {@value #DEFAULT_SETTINGS_JSON}.
 */
public class SettingsLoader {
    private static final Logger LOGGER = Logger.getLogger(SettingsLoader.class.getName());
    public static final String DEFAULT_SETTINGS_JSON = "default_settings.json";

    public static LearnSettings defaults() {
        return fromMap(JsonFiles.getJsonStringMapFromResources(DEFAULT_SETTINGS_JSON));
    }

    /**
     * @param overrideFile user settings; a missing file leaves the defaults in place
     * @throws InvalidConfigurationException when the file is unreadable, not JSON, or holds invalid values
     */
    public static LearnSettings load(Path overrideFile) {
        var defaults = JsonFiles.getJsonStringMapFromResources(DEFAULT_SETTINGS_JSON);
        if (!Files.exists(overrideFile)) {
            LOGGER.log(Level.WARNING, "Settings file not found, using defaults: {0}", overrideFile.toAbsolutePath());
            return fromMap(defaults);
        }

        Map<String, Object> overrides;
        try {
            overrides = JsonFiles.getJsonStringMap(overrideFile);
        } catch (IOException | JsonParseException e) {
            throw new InvalidConfigurationException("Could not read settings file " + overrideFile + ": " + e.getMessage());
        }
        LOGGER.log(Level.INFO, "Encountered settings overrides: {0}", overrides.keySet());
        return fromMap(JsonFiles.merge(defaults, overrides));
    }

    static LearnSettings fromMap(Map<String, Object> json) {
        var frameJson = map(json, "flyingNotes");
        var frame = new FrameSettings(
                number(frameJson, "canvasHeight"),
                number(frameJson, "keyboardHeight"),
                number(frameJson, "fallDistance"),
                number(frameJson, "noteHeight"),
                number(frameJson, "whiteKeyWidth"));

        var channelHands = new HashMap<Integer, Hand>();
        for (var entry : map(json, "channelHands").entrySet()) {
            int channel;
            try {
                channel = Integer.parseInt(entry.getKey());
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("channelHands keys must be channel numbers: " + entry.getKey());
            }
            channelHands.put(channel, enumValue(Hand.class, "channelHands." + channel, entry.getValue()));
        }
        HandMapping hands;
        try {
            hands = new HandMapping(channelHands, enumValue(Hand.class, "defaultHand", json.get("defaultHand")));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(e.getMessage());
        }

        String cacheDirectory = string(json, "cacheDirectory");
        return new LearnSettings(
                number(json, "tempoScale"),
                number(json, "lookaheadBaseSeconds"),
                number(json, "skillLevel"),
                number(json, "songDifficulty"),
                number(json, "maxWindowSeconds"),
                hands,
                enumValue(PracticeHands.class, "practiceHands", json.get("practiceHands")),
                (int) number(json, "liveQueueCapacity"),
                (long) number(json, "tickIntervalMillis"),
                number(json, "startPoint"),
                number(json, "endPoint"),
                bool(json, "loop"),
                bool(json, "assignChannelsByTrack"),
                cacheDirectory.isBlank() ? null : expandHome(cacheDirectory),
                frame);
    }

    private static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/"))
            return Path.of(System.getProperty("user.home") + path.substring(1));
        return Path.of(path);
    }

    private static double number(Map<String, Object> json, String key) {
        if (json.get(key) instanceof Number n)
            return n.doubleValue();
        throw new InvalidConfigurationException("Setting '" + key + "' must be a number: " + json.get(key));
    }

    private static boolean bool(Map<String, Object> json, String key) {
        if (json.get(key) instanceof Boolean b)
            return b;
        throw new InvalidConfigurationException("Setting '" + key + "' must be true or false: " + json.get(key));
    }

    private static String string(Map<String, Object> json, String key) {
        var value = json.get(key);
        if (value == null)
            return "";
        if (value instanceof String s)
            return s;
        throw new InvalidConfigurationException("Setting '" + key + "' must be a string: " + value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Map<String, Object> json, String key) {
        if (json.get(key) instanceof Map m)
            return (Map<String, Object>) m;
        throw new InvalidConfigurationException("Setting '" + key + "' must be an object: " + json.get(key));
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String key, Object value) {
        if (value instanceof String s) {
            for (E constant : type.getEnumConstants()) {
                if (constant.name().equals(s.toUpperCase(Locale.ROOT)))
                    return constant;
            }
        }
        throw new InvalidConfigurationException("Setting '" + key + "' has an unknown value: " + value);
    }
}
