package io.keylight.render;

import io.keylight.learn.ActiveNote;
import io.keylight.learn.HandMapping;
import io.keylight.learn.NoteState;
import io.keylight.learn.PredictedNote;
import io.keylight.learn.PredictionBatch;
import io.keylight.midi.NoteSpan;
import io.keylight.midi.TimeConverter;
import io.keylight.midi.Timeline;
import io.keylight.midi.exceptions.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Maps upcoming and held notes to canvas and keyboard positions. Holds no mutable state.
 */
public final class FrameProjector {
    private static final KeyboardLayout DEFAULT_LAYOUT = KeyboardLayout.of(KeyboardLayout.DEFAULT_WHITE_KEY_WIDTH);

    private final HandMapping hands;
    private final FrameSettings settings;
    private final KeyboardLayout layout;

    public FrameProjector(HandMapping hands, FrameSettings settings) {
        this.hands = hands;
        this.settings = settings;
        this.layout = settings.whiteKeyWidth() == KeyboardLayout.DEFAULT_WHITE_KEY_WIDTH
                ? DEFAULT_LAYOUT
                : KeyboardLayout.of(settings.whiteKeyWidth());
    }

    public FrameSettings settings() {
        return settings;
    }

    /**
     * How far along its fall a note is: {@code canvasExtent * (1 - (noteStart - cursor) / lookahead)}.
     * @return empty when the note is further away than the lookahead or already past the cursor
     */
    public static OptionalDouble projectNotePosition(double noteStartSeconds, double cursorSeconds,
                                                     double lookaheadSeconds, double canvasExtent) {
        if (!(lookaheadSeconds > 0))
            throw new InvalidConfigurationException("Lookahead must be greater than 0: lookahead=" + lookaheadSeconds);
        double progress = 1 - (noteStartSeconds - cursorSeconds) / lookaheadSeconds;
        if (progress < 0 || progress > 1)
            return OptionalDouble.empty();
        return OptionalDouble.of(canvasExtent * progress);
    }

    /** The standard 20-unit keyboard. Always the same instance. */
    public static KeyboardLayout layoutKeyboard() {
        return DEFAULT_LAYOUT;
    }

    public KeyboardLayout keyboardLayout() {
        return layout;
    }

    /**
     * @param cursorSeconds song time of the playback cursor
     * @param tempoScale playback speed in percent; times on the canvas are wall-clock
     * @param lookaheadSeconds wall-clock seconds a note takes to fall the whole distance
     */
    public Frame projectFrame(Timeline timeline, double cursorSeconds, double tempoScale, double lookaheadSeconds,
                              NoteState noteState, PredictionBatch prediction) {
        return projectFrame(timeline, timeline.size(), cursorSeconds, tempoScale, lookaheadSeconds, noteState, prediction);
    }

    /**
     * @param endIndex exclusive end of the practice range; notes whose onset is at or after it are not drawn
     */
    public Frame projectFrame(Timeline timeline, int endIndex, double cursorSeconds, double tempoScale,
                              double lookaheadSeconds, NoteState noteState, PredictionBatch prediction) {
        List<VisibleNote> visible = new ArrayList<>();
        List<NoteSpan> spans = timeline.noteSpans();
        for (int i = timeline.firstSpanAtOrAfter(cursorSeconds); i < spans.size(); ++i) {
            NoteSpan span = spans.get(i);
            double delay = TimeConverter.applyTempoScale(span.startSeconds() - cursorSeconds, tempoScale);
            if (delay > lookaheadSeconds)
                break;
            if (span.entryIndex() >= endIndex)
                continue;
            var fallen = projectNotePosition(delay, 0, lookaheadSeconds, settings.fallDistance());
            var key = layout.keyFor(span.note());
            if (fallen.isEmpty() || key.isEmpty())
                continue;

            var hand = hands.handFor(span.channel());
            double y = settings.landingY() - settings.fallDistance() + fallen.getAsDouble();
            visible.add(new VisibleNote(span.note(), span.channel(), hand, span.velocity(),
                    key.get().x(), y, key.get().width(), settings.noteHeight(), key.get().black(),
                    TimeConverter.applyTempoScale(span.durationSeconds(), tempoScale),
                    ColorKey.of(span.note(), hand, true)));
        }

        List<LitKey> lit = new ArrayList<>();
        for (ActiveNote active : noteState.activeNotes()) {
            int note = active.key().note();
            lit.add(new LitKey(note, active.key().channel(), ColorKey.of(note, active.hand(), false)));
        }
        for (PredictedNote predicted : prediction.notes()) {
            lit.add(new LitKey(predicted.note(), predicted.channel(), ColorKey.of(predicted.note(), predicted.hand(), true)));
        }

        return new Frame(visible, lit, layout);
    }
}
