package com.g11macro.manager.model;

import com.g11macro.manager.exception.InvalidEnumValueException;

public enum Coordinate {
    Abs, Rel;

    public static Coordinate fromRon(String name) {
        for (Coordinate value : values()) {
            if (value.name().equals(name)) {
                return value;
            }
        }
        throw new InvalidEnumValueException("Coordinate", name);
    }
}
