package io.keylight.learn;

import io.keylight.midi.RawEvent;
import io.keylight.midi.Timeline;
import io.keylight.midi.exceptions.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PredictionEngineTest {
    static final int RES = 480;

    /** Notes at 0s, 0s and 1.5s at 120 BPM */
    static Timeline chordThenNote() {
        return Timeline.build(List.of(List.of(
                new RawEvent.NoteOn(1, 60, 80, 0, 0),
                new RawEvent.NoteOn(1, 64, 80, 0, 0),
                new RawEvent.NoteOn(1, 67, 80, 1440, 0))), RES, 500_000);
    }

    @Test
    void predictsOnlyTheFirstGroupOfSimultaneousNotes() {
        var engine = new PredictionEngine(HandMapping.DEFAULT);
        var batch = engine.predict(0, chordThenNote(), NoteState.EMPTY, 2.0);

        assertEquals(2, batch.size());
        assertEquals(List.of(60, 64), batch.notes().stream().map(PredictedNote::note).toList());
        assertEquals(0.0, batch.anchorDelaySeconds());
    }

    @Test
    void nextGroupIsPredictedOnceCursorPassesTheFirst() {
        var engine = new PredictionEngine(HandMapping.DEFAULT);
        var batch = engine.predict(2, 0.5, 100, chordThenNote(), NoteState.EMPTY, 2.0);

        assertEquals(1, batch.size());
        assertEquals(67, batch.notes().get(0).note());
        assertEquals(1.0, batch.notes().get(0).delaySeconds(), 1e-12);
        assertEquals(2, batch.notes().get(0).entryIndex());
    }

    @Test
    void entriesAtOrPastEndIndexAreNotPredicted() {
        var engine = new PredictionEngine(HandMapping.DEFAULT);
        assertTrue(engine.predict(2, 2, 0.5, 100, chordThenNote(), NoteState.EMPTY, 2.0).isEmpty());

        var batch = engine.predict(0, 1, 0.0, 100, chordThenNote(), NoteState.EMPTY, 2.0);
        assertEquals(List.of(60), batch.notes().stream().map(PredictedNote::note).toList());
    }

    @Test
    void predictIsIdempotent() {
        var engine = new PredictionEngine(HandMapping.DEFAULT);
        var timeline = chordThenNote();
        assertEquals(engine.predict(0, timeline, NoteState.EMPTY, 2.0), engine.predict(0, timeline, NoteState.EMPTY, 2.0));
    }

    @Test
    void notesBeyondWindowAreExcluded() {
        var engine = new PredictionEngine(HandMapping.DEFAULT);
        var batch = engine.predict(2, 0.0, 100, chordThenNote(), NoteState.EMPTY, 1.0);
        assertTrue(batch.isEmpty());
    }

    @Test
    void windowIsWallClockAtTheTempoScale() {
        var engine = new PredictionEngine(HandMapping.DEFAULT);
        // 1.5s of song time is 3s of wall time at half speed
        assertTrue(engine.predict(2, 0.0, 50, chordThenNote(), NoteState.EMPTY, 2.0).isEmpty());
        var batch = engine.predict(2, 0.0, 50, chordThenNote(), NoteState.EMPTY, 3.0);
        assertEquals(3.0, batch.anchorDelaySeconds(), 1e-12);
    }

    @Test
    void activeNotesAreSkipped() {
        var tracker = new NoteStateTracker(HandMapping.DEFAULT);
        tracker.apply(new RawEvent.NoteOn(1, 60, 80, 0, 0), 0);
        var batch = new PredictionEngine(HandMapping.DEFAULT).predict(0, chordThenNote(), tracker.snapshot(), 2.0);

        assertEquals(List.of(64), batch.notes().stream().map(PredictedNote::note).toList());
    }

    @Test
    void releasesAndControlChangesAreNotPredicted() {
        var timeline = Timeline.build(List.of(List.of(
                new RawEvent.NoteOn(1, 60, 0, 0, 0),
                new RawEvent.ControlChange(1, 64, 127, 0, 0),
                new RawEvent.NoteOn(1, 62, 80, 0, 0))), RES, 500_000);
        var batch = new PredictionEngine(HandMapping.DEFAULT).predict(0, timeline, NoteState.EMPTY, 2.0);
        assertEquals(List.of(62), batch.notes().stream().map(PredictedNote::note).toList());
    }

    @Test
    void practiceHandsFilterSkipsTheOtherHand() {
        var timeline = Timeline.build(List.of(
                List.of(new RawEvent.NoteOn(1, 72, 80, 0, 0)),
                List.of(new RawEvent.NoteOn(2, 48, 80, 0, 1))), RES, 500_000);

        var right = new PredictionEngine(HandMapping.DEFAULT, PracticeHands.RIGHT).predict(0, timeline, NoteState.EMPTY, 2.0);
        var left = new PredictionEngine(HandMapping.DEFAULT, PracticeHands.LEFT).predict(0, timeline, NoteState.EMPTY, 2.0);
        var both = new PredictionEngine(HandMapping.DEFAULT, PracticeHands.BOTH).predict(0, timeline, NoteState.EMPTY, 2.0);

        assertEquals(List.of(72), right.notes().stream().map(PredictedNote::note).toList());
        assertEquals(Hand.LEFT, left.notes().get(0).hand());
        assertEquals(2, both.size());
    }

    @Test
    void emptyTimelineOrCursorAtEndPredictsNothing() {
        var engine = new PredictionEngine(HandMapping.DEFAULT);
        assertTrue(engine.predict(0, Timeline.empty(RES), NoteState.EMPTY, 2.0).isEmpty());
        assertTrue(engine.predict(3, chordThenNote(), NoteState.EMPTY, 2.0).isEmpty());
    }

    @Test
    void whenWindowIsNegative_thenThrows() {
        var engine = new PredictionEngine(HandMapping.DEFAULT);
        assertThrows(InvalidConfigurationException.class,
                () -> engine.predict(0, 0.0, 100, chordThenNote(), NoteState.EMPTY, -1));
    }

    @Test
    void calculateWindowScalesWithSkillAndDifficulty() {
        assertEquals(2.0, PredictionEngine.calculateWindow(0, 0), 1e-12);
        assertEquals(4.0, PredictionEngine.calculateWindow(10, 0), 1e-12);
        assertEquals(4.0, PredictionEngine.calculateWindow(0, 5), 1e-12);
        assertEquals(6.0, PredictionEngine.calculateWindow(5, 5), 1e-12);
        assertEquals(3.0, PredictionEngine.clampWindow(PredictionEngine.calculateWindow(10, 5), 3.0));
    }

    @Test
    void whenSkillOrDifficultyIsNegative_thenThrows() {
        assertThrows(InvalidConfigurationException.class, () -> PredictionEngine.calculateWindow(-1, 0));
        assertThrows(InvalidConfigurationException.class, () -> PredictionEngine.calculateWindow(0, -0.5));
    }
}
