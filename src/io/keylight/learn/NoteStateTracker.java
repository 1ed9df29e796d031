package io.keylight.learn;

import io.keylight.midi.RawEvent;

import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks which notes are held per channel and which channels hold the sustain pedal.
 * <p>
 * Writers are serialized on an internal lock; every write publishes a fresh {@link NoteState},
 * so {@link #snapshot()} and the query methods never block and never observe a partially applied event.
 */
public class NoteStateTracker {
    private static final Logger LOGGER = Logger.getLogger(NoteStateTracker.class.getName());

    private final HandMapping hands;
    private final Object writeLock = new Object();
    private volatile NoteState state = NoteState.EMPTY;

    /** An event and the song time it takes effect at */
    public record TimedEvent(RawEvent event, double timeSeconds) {}

    public NoteStateTracker(HandMapping hands) {
        this.hands = hands;
    }

    public HandMapping hands() {
        return hands;
    }

    public void apply(RawEvent event, double timeSeconds) {
        synchronized (writeLock) {
            var active = state.copyActive();
            var sustained = state.copySustained();
            applyTo(active, sustained, event, timeSeconds);
            state = new NoteState(active, sustained);
        }
    }

    /** Applies the events in order and publishes the outcome once */
    public void applyAll(List<TimedEvent> events) {
        if (events.isEmpty())
            return;
        synchronized (writeLock) {
            var active = state.copyActive();
            var sustained = state.copySustained();
            for (var timed : events) {
                applyTo(active, sustained, timed.event(), timed.timeSeconds());
            }
            state = new NoteState(active, sustained);
        }
    }

    private void applyTo(SortedMap<NoteKey, ActiveNote> active, SortedSet<Integer> sustained, RawEvent event, double timeSeconds) {
        RawEvent normalized = RawEvent.normalize(event);
        switch (normalized.kind()) {
            case NOTE_ON -> {
                var on = (RawEvent.NoteOn) normalized;
                var key = new NoteKey(on.channel(), on.note());
                if (on.velocity() > 0) {
                    active.put(key, new ActiveNote(key, on.velocity(), timeSeconds, hands.handFor(on.channel())));
                } else {
                    active.remove(key);
                }
            }
            case CONTROL_CHANGE -> {
                var cc = (RawEvent.ControlChange) normalized;
                if (cc.isSustain()) {
                    if (cc.value() >= 64) {
                        sustained.add(cc.channel());
                    } else {
                        sustained.remove(cc.channel());
                    }
                } else if (cc.controller() == RawEvent.ControlChange.ALL_NOTES_OFF) {
                    active.keySet().removeIf(key -> key.channel() == cc.channel());
                }
            }
            case NOTE_OFF, META -> {
                // NOTE_OFF never survives normalize(); meta events do not touch note state
            }
        }
    }

    /**
     * Releases every held note and the sustain pedal on all channels
     * @return the notes that were held
     */
    public Set<NoteKey> allNotesOff() {
        synchronized (writeLock) {
            Set<NoteKey> released = state.activeSet();
            if (!released.isEmpty())
                LOGGER.log(Level.FINE, "All notes off, releasing {0} notes", released.size());
            state = NoteState.EMPTY;
            return released;
        }
    }

    public NoteState snapshot() {
        return state;
    }

    public boolean isActive(int channel, int note) {
        return state.isActive(channel, note);
    }

    public SortedSet<NoteKey> activeSet() {
        return state.activeSet();
    }
}
