package com.g11macro.manager.model;

import java.util.List;
import java.util.Set;

/**
 * The closed vocabulary of non-unicode key names the macro daemon can inject.
 */
public final class NamedKeys {

    public static final List<String> ALL = List.of(
            "Alt", "CapsLock", "Control", "LControl", "RControl",
            "Shift", "LShift", "RShift", "Meta",
            "DownArrow", "LeftArrow", "RightArrow", "UpArrow",
            "End", "Home", "PageDown", "PageUp",
            "F1", "F2", "F3", "F4", "F5", "F6",
            "F7", "F8", "F9", "F10", "F11", "F12",
            "Backspace", "Delete", "Escape", "Insert", "Return", "Space", "Tab",
            "Numlock", "ScrollLock", "Pause", "PrintScr",
            "Numpad0", "Numpad1", "Numpad2", "Numpad3", "Numpad4",
            "Numpad5", "Numpad6", "Numpad7", "Numpad8", "Numpad9",
            "Add", "Decimal", "Divide", "Multiply", "Subtract",
            "LMenu");

    private static final Set<String> LOOKUP = Set.copyOf(ALL);

    private NamedKeys() {
    }

    public static boolean contains(String name) {
        return name != null && LOOKUP.contains(name);
    }
}
