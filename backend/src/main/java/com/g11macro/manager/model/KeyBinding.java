package com.g11macro.manager.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Binds the script to G-key {@code g} (1-18) of bank {@code m} (1-3), fired on the {@code on} edge.
 *
 * <p>Ranges are not enforced here; see {@code BindingValidator}.
 */
public record KeyBinding(int m, int g, Direction on, List<Step> script) {

    @JsonCreator
    public KeyBinding {
        if (on == null) {
            throw new IllegalArgumentException("KeyBinding needs a trigger direction");
        }
        script = script == null ? new ArrayList<>() : script;
    }

    public KeyBinding(int m, int g, Direction on) {
        this(m, g, on, new ArrayList<>());
    }

    public KeyId keyId() {
        return new KeyId(m, g);
    }

    public String summary() {
        if (script.isEmpty()) {
            return "Empty macro";
        }
        List<String> parts = script.stream()
                .limit(2)
                .map(Step::display)
                .collect(Collectors.toCollection(ArrayList::new));
        if (script.size() > 2) {
            parts.add("+" + (script.size() - 2) + " more");
        }
        return String.join(" → ", parts);
    }

    public record KeyId(int m, int g) {
    }
}
