package com.g11macro.manager.ron;

/**
 * A lexical token. {@code text} is the decoded value for strings and chars, the literal
 * source text otherwise; {@code position} is the offset of the token's first character.
 */
public record RonToken(Type type, String text, int position) {

    public enum Type {
        IDENTIFIER,
        STRING,
        CHAR,
        NUMBER,
        LEFT_PAREN,
        RIGHT_PAREN,
        LEFT_BRACKET,
        RIGHT_BRACKET,
        COMMA,
        COLON
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean is(Type expected, String value) {
        return type == expected && text.equals(value);
    }
}
