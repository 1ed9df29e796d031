package io.keylight.playback;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.keylight.learn.NoteKey;
import io.keylight.learn.PredictedNote;
import io.keylight.render.KeyboardLayout;
import io.keylight.render.LitKey;
import io.keylight.render.PianoKey;
import io.keylight.render.VisibleNote;

import java.util.Locale;

/**
 * The broadcast format of a {@link PlaybackSnapshot}:
 * <pre>
 * {sequence, state, cursorSeconds, cursorIndex,
 *  activeNotes: [{channel, note}],
 *  predictedNotes: [{channel, note, velocity, delaySeconds, hand}],
 *  frame: {visibleNotes: [...], litKeys: [...], keyboardLayout?}}
 * </pre>
 */
public final class SnapshotJson {
    private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    private SnapshotJson() {}

    public static String toJson(PlaybackSnapshot snapshot, boolean includeLayout) {
        return GSON.toJson(toTree(snapshot, includeLayout));
    }

    static JsonObject toTree(PlaybackSnapshot snapshot, boolean includeLayout) {
        var json = new JsonObject();
        json.addProperty("sequence", snapshot.sequence());
        json.addProperty("state", snapshot.state().name());
        json.addProperty("cursorSeconds", snapshot.cursorSeconds());
        json.addProperty("cursorIndex", snapshot.cursorIndex());

        var active = new JsonArray();
        for (NoteKey key : snapshot.activeNotes()) {
            var note = new JsonObject();
            note.addProperty("channel", key.channel());
            note.addProperty("note", key.note());
            active.add(note);
        }
        json.add("activeNotes", active);

        var predicted = new JsonArray();
        for (PredictedNote p : snapshot.prediction().notes()) {
            var note = new JsonObject();
            note.addProperty("channel", p.channel());
            note.addProperty("note", p.note());
            note.addProperty("velocity", p.velocity());
            note.addProperty("delaySeconds", p.delaySeconds());
            note.addProperty("hand", lower(p.hand().name()));
            predicted.add(note);
        }
        json.add("predictedNotes", predicted);

        var frame = new JsonObject();
        var visible = new JsonArray();
        for (VisibleNote v : snapshot.frame().visibleNotes()) {
            var note = new JsonObject();
            note.addProperty("note", v.midiNote());
            note.addProperty("channel", v.channel());
            note.addProperty("hand", lower(v.hand().name()));
            note.addProperty("velocity", v.velocity());
            note.addProperty("x", v.x());
            note.addProperty("y", v.y());
            note.addProperty("width", v.width());
            note.addProperty("height", v.height());
            note.addProperty("blackKey", v.blackKey());
            note.addProperty("durationSeconds", v.durationSeconds());
            note.addProperty("color", v.colorKey().settingPath());
            visible.add(note);
        }
        frame.add("visibleNotes", visible);

        var lit = new JsonArray();
        for (LitKey key : snapshot.frame().litKeys()) {
            var litKey = new JsonObject();
            litKey.addProperty("note", key.midiNote());
            litKey.addProperty("channel", key.channel());
            litKey.addProperty("color", key.colorKey().settingPath());
            lit.add(litKey);
        }
        frame.add("litKeys", lit);

        if (includeLayout)
            frame.add("keyboardLayout", layout(snapshot.frame().keyboardLayout()));
        json.add("frame", frame);
        return json;
    }

    private static JsonObject layout(KeyboardLayout layout) {
        var json = new JsonObject();
        json.addProperty("whiteKeyWidth", layout.whiteKeyWidth());
        json.addProperty("totalWidth", layout.totalWidth());
        var keys = new JsonArray();
        for (PianoKey key : layout.keys()) {
            var k = new JsonObject();
            k.addProperty("note", key.midiNote());
            k.addProperty("x", key.x());
            k.addProperty("width", key.width());
            k.addProperty("black", key.black());
            keys.add(k);
        }
        json.add("keys", keys);
        return json;
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
