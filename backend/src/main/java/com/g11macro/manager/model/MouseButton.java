package com.g11macro.manager.model;

import com.g11macro.manager.exception.InvalidEnumValueException;

public enum MouseButton {
    Left, Right, Middle, Back, Forward;

    public static MouseButton fromRon(String name) {
        for (MouseButton value : values()) {
            if (value.name().equals(name)) {
                return value;
            }
        }
        throw new InvalidEnumValueException("MouseButton", name);
    }
}
