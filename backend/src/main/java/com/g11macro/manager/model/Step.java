package com.g11macro.manager.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * One action of a macro script.
 *
 * <p>The set of variants is closed. Code that has to handle every variant goes through
 * {@link Visitor}, so a new variant fails to compile until each visitor implements it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Step.Key.class, name = "Key"),
        @JsonSubTypes.Type(value = Step.Text.class, name = "Text"),
        @JsonSubTypes.Type(value = Step.Button.class, name = "Button"),
        @JsonSubTypes.Type(value = Step.MoveMouse.class, name = "MoveMouse"),
        @JsonSubTypes.Type(value = Step.Scroll.class, name = "Scroll"),
        @JsonSubTypes.Type(value = Step.Run.class, name = "Run")
})
public sealed interface Step permits Step.Key, Step.Text, Step.Button, Step.MoveMouse, Step.Scroll, Step.Run {

    int DISPLAY_TEXT_LIMIT = 28;

    <R> R accept(Visitor<R> visitor);

    /** Variant name as written in the config file. */
    String typeName();

    /** Label the editor shows for this kind of step. */
    String label();

    String display();

    interface Visitor<R> {
        R visitKey(Key step);

        R visitText(Text step);

        R visitButton(Button step);

        R visitMoveMouse(MoveMouse step);

        R visitScroll(Scroll step);

        R visitRun(Run step);
    }

    record Key(KeyValue key, Direction direction, int repeat) implements Step {

        public Key {
            if (key == null || direction == null) {
                throw new IllegalArgumentException("Key step needs a key and a direction");
            }
            if (repeat < 1) {
                throw new IllegalArgumentException("Key repeat must be at least 1, got " + repeat);
            }
        }

        public Key(KeyValue key, Direction direction) {
            this(key, direction, 1);
        }

        /**
         * JSON form; an absent {@code repeat} means a single stroke.
         */
        @JsonCreator
        public static Key fromJson(@JsonProperty("key") KeyValue key,
                            @JsonProperty("direction") Direction direction,
                            @JsonProperty("repeat") Integer repeat) {
            return new Key(key, direction, repeat == null ? 1 : repeat);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitKey(this);
        }

        @Override
        public String typeName() {
            return "Key";
        }

        @Override
        public String label() {
            return "Key Stroke";
        }

        @Override
        public String display() {
            String suffix = repeat > 1 ? " ×" + repeat : "";
            return "Key " + key.display() + " [" + direction + "]" + suffix;
        }
    }

    record Text(String text) implements Step {

        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        public Text {
            if (text == null) {
                throw new IllegalArgumentException("Text step needs a text");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitText(this);
        }

        @Override
        public String typeName() {
            return "Text";
        }

        @Override
        public String label() {
            return "Type Text";
        }

        @Override
        public String display() {
            String preview = text.length() > DISPLAY_TEXT_LIMIT
                    ? text.substring(0, DISPLAY_TEXT_LIMIT) + "…"
                    : text;
            return "Type \"" + preview + "\"";
        }
    }

    record Button(MouseButton button, Direction direction) implements Step {

        public Button {
            if (button == null || direction == null) {
                throw new IllegalArgumentException("Button step needs a button and a direction");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitButton(this);
        }

        @Override
        public String typeName() {
            return "Button";
        }

        @Override
        public String label() {
            return "Mouse Button";
        }

        @Override
        public String display() {
            return "Mouse " + button + " [" + direction + "]";
        }
    }

    record MoveMouse(int x, int y, Coordinate coordinate) implements Step {

        public MoveMouse {
            if (coordinate == null) {
                throw new IllegalArgumentException("MoveMouse step needs a coordinate mode");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMoveMouse(this);
        }

        @Override
        public String typeName() {
            return "MoveMouse";
        }

        @Override
        public String label() {
            return "Move Mouse";
        }

        @Override
        public String display() {
            return "Move Mouse (" + x + ", " + y + ") " + coordinate;
        }
    }

    /**
     * Positive magnitudes scroll up (vertical) or right (horizontal).
     */
    record Scroll(int magnitude, Axis axis) implements Step {

        public Scroll {
            if (axis == null) {
                throw new IllegalArgumentException("Scroll step needs an axis");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitScroll(this);
        }

        @Override
        public String typeName() {
            return "Scroll";
        }

        @Override
        public String label() {
            return "Scroll";
        }

        @Override
        public String display() {
            String direction;
            if (axis == Axis.Vertical) {
                direction = magnitude > 0 ? "Up" : "Down";
            } else {
                direction = magnitude > 0 ? "Right" : "Left";
            }
            return "Scroll " + direction + " ×" + Math.abs(magnitude);
        }
    }

    record Run(String program, List<String> args) implements Step {

        @JsonCreator
        public Run {
            if (program == null) {
                throw new IllegalArgumentException("Run step needs a program");
            }
            args = args == null ? new ArrayList<>() : args;
        }

        public Run(String program) {
            this(program, new ArrayList<>());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRun(this);
        }

        @Override
        public String typeName() {
            return "Run";
        }

        @Override
        public String label() {
            return "Run Program";
        }

        @Override
        public String display() {
            if (args.isEmpty()) {
                return "Run " + program;
            }
            String preview = String.join(" ", args.subList(0, Math.min(2, args.size())));
            String suffix = args.size() > 2 ? "…" : "";
            return "Run " + program + " " + preview + suffix;
        }
    }
}
