package io.keylight.learn;

import io.keylight.midi.RawEvent;
import io.keylight.midi.TimeConverter;
import io.keylight.midi.Timeline;
import io.keylight.midi.TimelineEntry;
import io.keylight.midi.exceptions.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Predicts the next group of notes to press, starting from a cursor position.
 * <p>
 * A prediction is a pure function of its inputs: the same cursor, timeline and note state always give the same batch.
 */
public final class PredictionEngine {
    public static final double BASE_WINDOW_SECONDS = 2.0;
    /** Onsets closer than this to the batch's first note count as simultaneous */
    public static final double SIMULTANEITY_EPSILON = 0.001;

    private final HandMapping hands;
    private final PracticeHands practiceHands;

    public PredictionEngine(HandMapping hands, PracticeHands practiceHands) {
        this.hands = hands;
        this.practiceHands = practiceHands;
    }

    public PredictionEngine(HandMapping hands) {
        this(hands, PracticeHands.BOTH);
    }

    /**
     * Predicts from the time of the entry at {@code cursorIndex}, at normal tempo
     */
    public PredictionBatch predict(int cursorIndex, Timeline timeline, NoteState noteState, double lookaheadWindowSeconds) {
        if (cursorIndex >= timeline.size())
            return PredictionBatch.EMPTY;
        double cursorSeconds = timeline.get(Math.max(0, cursorIndex)).absoluteSeconds();
        return predict(cursorIndex, cursorSeconds, TimeConverter.DEFAULT_TEMPO_SCALE, timeline, noteState, lookaheadWindowSeconds);
    }

    /**
     * Scans forward from {@code cursorIndex} and collects the first group of simultaneous onsets that are not
     * already sounding. Delays and the window are wall-clock seconds at {@code tempoScale}.
     * @param cursorSeconds song time of the cursor
     * @param tempoScale playback speed in percent
     */
    public PredictionBatch predict(int cursorIndex, double cursorSeconds, double tempoScale,
                                   Timeline timeline, NoteState noteState, double lookaheadWindowSeconds) {
        return predict(cursorIndex, timeline.size(), cursorSeconds, tempoScale, timeline, noteState, lookaheadWindowSeconds);
    }

    /**
     * Like {@link #predict(int, double, double, Timeline, NoteState, double)}, but never looks at or past
     * {@code endIndex}, the exclusive end of the practice range.
     */
    public PredictionBatch predict(int cursorIndex, int endIndex, double cursorSeconds, double tempoScale,
                                   Timeline timeline, NoteState noteState, double lookaheadWindowSeconds) {
        if (lookaheadWindowSeconds < 0 || Double.isNaN(lookaheadWindowSeconds))
            throw new InvalidConfigurationException("Lookahead window must not be negative: window=" + lookaheadWindowSeconds);

        List<PredictedNote> batch = new ArrayList<>();
        double anchorSeconds = Double.NaN;
        int end = Math.min(endIndex, timeline.size());
        for (int i = Math.max(0, cursorIndex); i < end; ++i) {
            TimelineEntry entry = timeline.get(i);
            double delay = TimeConverter.applyTempoScale(Math.max(0.0, entry.absoluteSeconds() - cursorSeconds), tempoScale);
            if (delay > lookaheadWindowSeconds)
                break;
            if (!batch.isEmpty()) {
                double sinceAnchor = TimeConverter.applyTempoScale(entry.absoluteSeconds() - anchorSeconds, tempoScale);
                if (sinceAnchor > SIMULTANEITY_EPSILON)
                    break;
            }

            if (!(entry.event() instanceof RawEvent.NoteOn on) || on.velocity() == 0)
                continue;
            if (noteState.isActive(on.channel(), on.note()))
                continue;
            Hand hand = hands.handFor(on.channel());
            if (!practiceHands.accepts(hand))
                continue;

            if (batch.isEmpty())
                anchorSeconds = entry.absoluteSeconds();
            batch.add(new PredictedNote(on.channel(), on.note(), on.velocity(), delay, i, hand));
        }
        return batch.isEmpty() ? PredictionBatch.EMPTY : new PredictionBatch(batch);
    }

    /**
     * Lookahead window for a learner: {@code 2.0 * (1 + skillLevel / 10) * (1 + songDifficulty / 5)} seconds.
     * The result is unbounded; see {@link #clampWindow(double, double)}.
     * @throws InvalidConfigurationException when either parameter is negative
     */
    public static double calculateWindow(double skillLevel, double songDifficulty) {
        return calculateWindow(BASE_WINDOW_SECONDS, skillLevel, songDifficulty);
    }

    public static double calculateWindow(double baseSeconds, double skillLevel, double songDifficulty) {
        if (!(baseSeconds > 0))
            throw new InvalidConfigurationException("Lookahead base must be greater than 0: base=" + baseSeconds);
        if (!(skillLevel >= 0))
            throw new InvalidConfigurationException("Skill level must not be negative: skillLevel=" + skillLevel);
        if (!(songDifficulty >= 0))
            throw new InvalidConfigurationException("Song difficulty must not be negative: songDifficulty=" + songDifficulty);
        return baseSeconds * (1 + skillLevel / 10) * (1 + songDifficulty / 5);
    }

    public static double clampWindow(double windowSeconds, double maxWindowSeconds) {
        return Math.min(windowSeconds, maxWindowSeconds);
    }
}
