package io.keylight.config;

import io.keylight.learn.HandMapping;
import io.keylight.learn.PracticeHands;
import io.keylight.learn.PredictionEngine;
import io.keylight.midi.TimeConverter;
import io.keylight.midi.exceptions.InvalidConfigurationException;
import io.keylight.render.FrameSettings;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Everything a learning session can be configured with. Instances are validated on construction.
 * @param tempoScale playback speed in percent of the file's tempo
 * @param startPoint practice range start, percent of the timeline
 * @param endPoint practice range end, percent of the timeline
 * @param cacheDirectory where parsed timelines are cached, or null to disable the cache
 */
public record LearnSettings(double tempoScale,
                            double lookaheadBaseSeconds,
                            double skillLevel,
                            double songDifficulty,
                            double maxWindowSeconds,
                            HandMapping hands,
                            PracticeHands practiceHands,
                            int liveQueueCapacity,
                            long tickIntervalMillis,
                            double startPoint,
                            double endPoint,
                            boolean loop,
                            boolean assignChannelsByTrack,
                            Path cacheDirectory,
                            FrameSettings frame) {

    public static final LearnSettings DEFAULTS = new LearnSettings(TimeConverter.DEFAULT_TEMPO_SCALE,
            PredictionEngine.BASE_WINDOW_SECONDS, 0, 0, 10.0, HandMapping.DEFAULT, PracticeHands.BOTH,
            32, 16, 0, 100, false, true, null, FrameSettings.DEFAULT);

    public LearnSettings {
        TimeConverter.assertValidTempoScale(tempoScale);
        // throws on a bad base, skill or difficulty
        PredictionEngine.calculateWindow(lookaheadBaseSeconds, skillLevel, songDifficulty);
        if (!(maxWindowSeconds > 0))
            throw new InvalidConfigurationException("Max lookahead window must be greater than 0: maxWindowSeconds=" + maxWindowSeconds);
        if (hands == null || practiceHands == null || frame == null)
            throw new InvalidConfigurationException("Hand mapping, practice hands and frame settings are required");
        if (liveQueueCapacity < 1)
            throw new InvalidConfigurationException("Live queue capacity must be at least 1: liveQueueCapacity=" + liveQueueCapacity);
        if (tickIntervalMillis < 1)
            throw new InvalidConfigurationException("Tick interval must be at least 1 ms: tickIntervalMillis=" + tickIntervalMillis);
        if (!(startPoint >= 0 && startPoint < endPoint && endPoint <= 100))
            throw new InvalidConfigurationException("Practice range must satisfy 0 <= start < end <= 100: start="
                    + startPoint + ", end=" + endPoint);
    }

    /** The lookahead window for the current skill and difficulty, clamped to {@link #maxWindowSeconds()} */
    public double lookaheadWindowSeconds() {
        return PredictionEngine.clampWindow(
                PredictionEngine.calculateWindow(lookaheadBaseSeconds, skillLevel, songDifficulty), maxWindowSeconds);
    }

    public Optional<Path> cache() {
        return Optional.ofNullable(cacheDirectory);
    }

    public LearnSettings withTempoScale(double tempoScale) {
        return new LearnSettings(tempoScale, lookaheadBaseSeconds, skillLevel, songDifficulty, maxWindowSeconds, hands,
                practiceHands, liveQueueCapacity, tickIntervalMillis, startPoint, endPoint, loop, assignChannelsByTrack,
                cacheDirectory, frame);
    }

    public LearnSettings withSkillLevel(double skillLevel) {
        return new LearnSettings(tempoScale, lookaheadBaseSeconds, skillLevel, songDifficulty, maxWindowSeconds, hands,
                practiceHands, liveQueueCapacity, tickIntervalMillis, startPoint, endPoint, loop, assignChannelsByTrack,
                cacheDirectory, frame);
    }

    public LearnSettings withSongDifficulty(double songDifficulty) {
        return new LearnSettings(tempoScale, lookaheadBaseSeconds, skillLevel, songDifficulty, maxWindowSeconds, hands,
                practiceHands, liveQueueCapacity, tickIntervalMillis, startPoint, endPoint, loop, assignChannelsByTrack,
                cacheDirectory, frame);
    }

    public LearnSettings withPracticeHands(PracticeHands practiceHands) {
        return new LearnSettings(tempoScale, lookaheadBaseSeconds, skillLevel, songDifficulty, maxWindowSeconds, hands,
                practiceHands, liveQueueCapacity, tickIntervalMillis, startPoint, endPoint, loop, assignChannelsByTrack,
                cacheDirectory, frame);
    }

    public LearnSettings withPracticeRange(double startPoint, double endPoint) {
        return new LearnSettings(tempoScale, lookaheadBaseSeconds, skillLevel, songDifficulty, maxWindowSeconds, hands,
                practiceHands, liveQueueCapacity, tickIntervalMillis, startPoint, endPoint, loop, assignChannelsByTrack,
                cacheDirectory, frame);
    }

    public LearnSettings withLoop(boolean loop) {
        return new LearnSettings(tempoScale, lookaheadBaseSeconds, skillLevel, songDifficulty, maxWindowSeconds, hands,
                practiceHands, liveQueueCapacity, tickIntervalMillis, startPoint, endPoint, loop, assignChannelsByTrack,
                cacheDirectory, frame);
    }

    public LearnSettings withLiveQueueCapacity(int liveQueueCapacity) {
        return new LearnSettings(tempoScale, lookaheadBaseSeconds, skillLevel, songDifficulty, maxWindowSeconds, hands,
                practiceHands, liveQueueCapacity, tickIntervalMillis, startPoint, endPoint, loop, assignChannelsByTrack,
                cacheDirectory, frame);
    }

    public LearnSettings withCacheDirectory(Path cacheDirectory) {
        return new LearnSettings(tempoScale, lookaheadBaseSeconds, skillLevel, songDifficulty, maxWindowSeconds, hands,
                practiceHands, liveQueueCapacity, tickIntervalMillis, startPoint, endPoint, loop, assignChannelsByTrack,
                cacheDirectory, frame);
    }
}
