package com.g11macro.manager.ron;

import com.g11macro.manager.ron.RonToken.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits RON text into tokens. Whitespace, comments and {@code #![...]} header directives are
 * dropped, as is any character that cannot start a token. Unterminated strings and comments run
 * to the end of input. Tokenizing never fails.
 */
public final class RonTokenizer {

    private RonTokenizer() {
    }

    public static List<RonToken> tokenize(String text) {
        List<RonToken> tokens = new ArrayList<>();
        int n = text.length();
        int pos = 0;

        while (pos < n) {
            char c = text.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            if (text.startsWith("//", pos)) {
                int end = text.indexOf('\n', pos);
                pos = end == -1 ? n : end;
                continue;
            }

            if (text.startsWith("/*", pos)) {
                int end = text.indexOf("*/", pos + 2);
                pos = end == -1 ? n : end + 2;
                continue;
            }

            if (text.startsWith("#![", pos)) {
                int end = text.indexOf(']', pos + 3);
                pos = end == -1 ? n : end + 1;
                continue;
            }

            if (c == '"') {
                pos = readString(text, pos, tokens);
                continue;
            }

            if (c == '\'') {
                pos = readChar(text, pos, tokens);
                continue;
            }

            if (isDigit(c) || (c == '-' && pos + 1 < n && isDigit(text.charAt(pos + 1)))) {
                int end = pos + 1;
                while (end < n && isDigit(text.charAt(end))) {
                    end++;
                }
                tokens.add(new RonToken(Type.NUMBER, text.substring(pos, end), pos));
                pos = end;
                continue;
            }

            if (isIdentifierStart(c)) {
                int end = pos + 1;
                while (end < n && isIdentifierPart(text.charAt(end))) {
                    end++;
                }
                tokens.add(new RonToken(Type.IDENTIFIER, text.substring(pos, end), pos));
                pos = end;
                continue;
            }

            Type punctuation = punctuation(c);
            if (punctuation != null) {
                tokens.add(new RonToken(punctuation, String.valueOf(c), pos));
            }
            pos++;
        }

        return tokens;
    }

    private static int readString(String text, int start, List<RonToken> tokens) {
        int n = text.length();
        StringBuilder value = new StringBuilder();
        int pos = start + 1;

        while (pos < n) {
            char c = text.charAt(pos);
            if (c == '"') {
                tokens.add(new RonToken(Type.STRING, value.toString(), start));
                return pos + 1;
            }
            if (c == '\\' && pos + 1 < n) {
                char escaped = text.charAt(pos + 1);
                switch (escaped) {
                    case '"' -> value.append('"');
                    case '\\' -> value.append('\\');
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(c).append(escaped);
                }
                pos += 2;
                continue;
            }
            value.append(c);
            pos++;
        }

        // unterminated: the rest of the input is the string
        tokens.add(new RonToken(Type.STRING, value.toString(), start));
        return n;
    }

    private static int readChar(String text, int start, List<RonToken> tokens) {
        int n = text.length();
        int pos = start + 1;
        String value;

        if (pos < n && text.charAt(pos) == '\\') {
            if (pos + 1 >= n) {
                return start + 1;
            }
            value = unescapeChar(text.charAt(pos + 1));
            pos += 2;
        } else if (pos < n) {
            int codePoint = text.codePointAt(pos);
            value = new String(Character.toChars(codePoint));
            pos += Character.charCount(codePoint);
        } else {
            return start + 1;
        }

        if (pos < n && text.charAt(pos) == '\'') {
            tokens.add(new RonToken(Type.CHAR, value, start));
            return pos + 1;
        }
        // not a char literal after all, drop the quote and rescan what followed it
        return start + 1;
    }

    private static String unescapeChar(char escaped) {
        return switch (escaped) {
            case 'n' -> "\n";
            case 't' -> "\t";
            case 'r' -> "\r";
            default -> String.valueOf(escaped);
        };
    }

    private static Type punctuation(char c) {
        return switch (c) {
            case '(' -> Type.LEFT_PAREN;
            case ')' -> Type.RIGHT_PAREN;
            case '[' -> Type.LEFT_BRACKET;
            case ']' -> Type.RIGHT_BRACKET;
            case ',' -> Type.COMMA;
            case ':' -> Type.COLON;
            default -> null;
        };
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
