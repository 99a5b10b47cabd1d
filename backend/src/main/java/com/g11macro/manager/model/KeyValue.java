package com.g11macro.manager.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The key pressed by a {@link Step.Key}: either one of {@link NamedKeys} or a single unicode character.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = KeyValue.Named.class, name = "Named"),
        @JsonSubTypes.Type(value = KeyValue.Unicode.class, name = "Unicode")
})
public sealed interface KeyValue permits KeyValue.Named, KeyValue.Unicode {

    static KeyValue named(String name) {
        return new Named(name);
    }

    static KeyValue unicode(String character) {
        return new Unicode(character);
    }

    static KeyValue unicode(int codePoint) {
        return new Unicode(new String(Character.toChars(codePoint)));
    }

    String display();

    record Named(String name) implements KeyValue {

        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        public Named {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Key name cannot be empty");
            }
        }

        @Override
        public String display() {
            return name;
        }
    }

    record Unicode(String character) implements KeyValue {

        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        public Unicode {
            if (character == null || character.isEmpty()
                    || character.codePointCount(0, character.length()) != 1) {
                throw new IllegalArgumentException(
                        "Unicode key must hold exactly one character, got '" + character + "'");
            }
        }

        public int codePoint() {
            return character.codePointAt(0);
        }

        @Override
        public String display() {
            return switch (character) {
                case "\n" -> "'\\n'";
                case "\t" -> "'\\t'";
                default -> "'" + character + "'";
            };
        }
    }
}
