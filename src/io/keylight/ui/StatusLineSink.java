package io.keylight.ui;

import io.keylight.learn.PredictedNote;
import io.keylight.playback.PlaybackSnapshot;
import io.keylight.playback.PlaybackState;
import io.keylight.playback.SnapshotSink;

import java.io.PrintStream;
import java.util.stream.Collectors;

/**
 * Prints a one-line progress bar with the next notes to play, at most once per second of song time
 * and whenever the playback state changes.
 */
public class StatusLineSink implements SnapshotSink {
    private static final String BLOCK = " ";
    private static final int SEGMENTS = 30;
    private static final String[] NOTE_NAMES = {"C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"};

    private final TotalTime totalTime;
    private final PrintStream out;
    private int lastPrintedSecond = -1;
    private PlaybackState lastState;

    public StatusLineSink(TotalTime totalTime, PrintStream out) {
        this.totalTime = totalTime;
        this.out = out;
    }

    @Override
    public void publish(PlaybackSnapshot snapshot, String json) {
        int second = (int) snapshot.cursorSeconds();
        if (second == lastPrintedSecond && snapshot.state() == lastState)
            return;
        lastPrintedSecond = second;
        lastState = snapshot.state();

        Terminal.carriageReturn(out);
        Terminal.clearFromCursor(out);
        out.print(statusLine(snapshot));
        if (snapshot.state() == PlaybackState.STOPPED)
            out.println();
        out.flush();
    }

    String statusLine(PlaybackSnapshot snapshot) {
        int filled = totalTime.seconds() <= 0 ? 0
                : (int) Math.min(SEGMENTS, snapshot.cursorSeconds() / totalTime.seconds() * SEGMENTS);
        String next = snapshot.prediction().notes().stream()
                .map(StatusLineSink::noteName)
                .collect(Collectors.joining(" "));
        return String.format("%s %s%s%s%s%s%s %s %s%s", new TotalTime(snapshot.cursorSeconds()),
                Terminal.BG_GRN_ON, BLOCK.repeat(filled), Terminal.BG_OFF,
                Terminal.BG_WHITE_ON, BLOCK.repeat(SEGMENTS - filled), Terminal.BG_OFF, totalTime,
                snapshot.state() == PlaybackState.PAUSED ? "[paused] " : "",
                next.isEmpty() ? "" : "next: " + next);
    }

    /** e.g. 60 is C4 */
    static String noteName(PredictedNote note) {
        return NOTE_NAMES[note.note() % 12] + (note.note() / 12 - 1);
    }
}
