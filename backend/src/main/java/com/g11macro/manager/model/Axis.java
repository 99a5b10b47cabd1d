package com.g11macro.manager.model;

import com.g11macro.manager.exception.InvalidEnumValueException;

public enum Axis {
    Vertical, Horizontal;

    public static Axis fromRon(String name) {
        for (Axis value : values()) {
            if (value.name().equals(name)) {
                return value;
            }
        }
        throw new InvalidEnumValueException("Axis", name);
    }
}
