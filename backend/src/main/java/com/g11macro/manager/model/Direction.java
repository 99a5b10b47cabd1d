package com.g11macro.manager.model;

import com.g11macro.manager.exception.InvalidEnumValueException;

public enum Direction {
    Press, Release, Click;

    public static Direction fromRon(String name) {
        for (Direction value : values()) {
            if (value.name().equals(name)) {
                return value;
            }
        }
        throw new InvalidEnumValueException("Direction", name);
    }
}
