package io.keylight.render;

import java.util.List;

/**
 * Everything a renderer needs for one tick. The keyboard layout instance is shared between frames
 * until the geometry changes.
 */
public record Frame(List<VisibleNote> visibleNotes, List<LitKey> litKeys, KeyboardLayout keyboardLayout) {
    public Frame {
        visibleNotes = List.copyOf(visibleNotes);
        litKeys = List.copyOf(litKeys);
    }
}
