package com.g11macro.manager.ron;

import com.g11macro.manager.exception.RonParseException;
import com.g11macro.manager.model.Axis;
import com.g11macro.manager.model.Coordinate;
import com.g11macro.manager.model.Direction;
import com.g11macro.manager.model.KeyBinding;
import com.g11macro.manager.model.KeyValue;
import com.g11macro.manager.model.MouseButton;
import com.g11macro.manager.model.Step;
import com.g11macro.manager.ron.RonToken.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for key binding documents.
 *
 * <p>A missing {@code m}, {@code g} or {@code on}, a token of the wrong kind where one kind is
 * required, and a malformed number raise {@link RonParseException}. Unknown enum members raise
 * {@link com.g11macro.manager.exception.InvalidEnumValueException}. Unknown top-level entries,
 * fields and steps are skipped without notice.
 *
 * <p>Instances hold a cursor and are single use.
 */
public class RonParser {

    private final List<RonToken> tokens;
    private int pos;

    public RonParser(List<RonToken> tokens) {
        this.tokens = tokens;
    }

    public static List<KeyBinding> parse(String text) throws RonParseException {
        return new RonParser(RonTokenizer.tokenize(text)).parseDocument();
    }

    public List<KeyBinding> parseDocument() throws RonParseException {
        boolean bracketed = tryConsume(Type.LEFT_BRACKET) != null;
        List<KeyBinding> bindings = parseBindingList();
        if (bracketed) {
            tryConsume(Type.RIGHT_BRACKET);
        }
        return bindings;
    }

    private List<KeyBinding> parseBindingList() throws RonParseException {
        List<KeyBinding> bindings = new ArrayList<>();
        while (peek() != null && !peek().is(Type.RIGHT_BRACKET)) {
            RonToken token = peek();
            if (token.is(Type.IDENTIFIER, "KeyBinding")) {
                bindings.add(parseBinding());
                tryConsume(Type.COMMA);
            } else if (token.is(Type.IDENTIFIER)) {
                pos++;
                skipGroup();
            } else {
                pos++;
            }
        }
        return bindings;
    }

    private KeyBinding parseBinding() throws RonParseException {
        RonToken start = consume(Type.IDENTIFIER, "KeyBinding");
        consume(Type.LEFT_PAREN);

        Integer m = null;
        Integer g = null;
        Direction on = null;
        List<Step> script = new ArrayList<>();

        while (peek() != null && !peek().is(Type.RIGHT_PAREN)) {
            if (!peek().is(Type.IDENTIFIER)) {
                pos++;
                continue;
            }
            RonToken field = consume(Type.IDENTIFIER);
            consume(Type.COLON);

            switch (field.text()) {
                case "m" -> m = parseInt();
                case "g" -> g = parseInt();
                case "on" -> on = Direction.fromRon(consume(Type.IDENTIFIER).text());
                case "script" -> script = parseScript();
                default -> skipValue();
            }

            tryConsume(Type.COMMA);
        }

        consume(Type.RIGHT_PAREN);

        if (m == null || g == null || on == null) {
            throw new RonParseException(
                    String.format("Incomplete KeyBinding at position %d: m=%s, g=%s, on=%s",
                            start.position(), m, g, on),
                    start.position());
        }

        return new KeyBinding(m, g, on, script);
    }

    private List<Step> parseScript() throws RonParseException {
        consume(Type.LEFT_BRACKET);
        List<Step> steps = new ArrayList<>();

        while (peek() != null && !peek().is(Type.RIGHT_BRACKET)) {
            if (peek().is(Type.IDENTIFIER)) {
                Step step = parseStep();
                if (step != null) {
                    steps.add(step);
                }
                tryConsume(Type.COMMA);
            } else {
                pos++;
            }
        }

        consume(Type.RIGHT_BRACKET);
        return steps;
    }

    /**
     * Returns {@code null} for a step this parser does not know; its body has been consumed.
     */
    private Step parseStep() throws RonParseException {
        RonToken name = consume(Type.IDENTIFIER);

        Step step;
        switch (name.text()) {
            case "Key" -> {
                consume(Type.LEFT_PAREN);
                KeyValue key = parseKeyValue();
                consume(Type.COMMA);
                Direction direction = Direction.fromRon(consume(Type.IDENTIFIER).text());
                step = new Step.Key(key, direction);
            }
            case "Text" -> {
                consume(Type.LEFT_PAREN);
                step = new Step.Text(consume(Type.STRING).text());
            }
            case "Button" -> {
                consume(Type.LEFT_PAREN);
                MouseButton button = MouseButton.fromRon(consume(Type.IDENTIFIER).text());
                consume(Type.COMMA);
                Direction direction = Direction.fromRon(consume(Type.IDENTIFIER).text());
                step = new Step.Button(button, direction);
            }
            case "MoveMouse" -> {
                consume(Type.LEFT_PAREN);
                int x = parseInt();
                consume(Type.COMMA);
                int y = parseInt();
                consume(Type.COMMA);
                Coordinate coordinate = Coordinate.fromRon(consume(Type.IDENTIFIER).text());
                step = new Step.MoveMouse(x, y, coordinate);
            }
            case "Scroll" -> {
                consume(Type.LEFT_PAREN);
                int magnitude = parseInt();
                consume(Type.COMMA);
                Axis axis = Axis.fromRon(consume(Type.IDENTIFIER).text());
                step = new Step.Scroll(magnitude, axis);
            }
            case "Run" -> {
                consume(Type.LEFT_PAREN);
                step = parseProgram();
            }
            default -> {
                skipGroup();
                return null;
            }
        }

        tryConsume(Type.COMMA);
        consume(Type.RIGHT_PAREN);
        return step;
    }

    private Step.Run parseProgram() throws RonParseException {
        consume(Type.IDENTIFIER, "Program");
        consume(Type.LEFT_PAREN);
        String program = consume(Type.STRING).text();
        List<String> args = new ArrayList<>();

        if (tryConsume(Type.COMMA) != null && peek() != null && peek().is(Type.LEFT_BRACKET)) {
            consume(Type.LEFT_BRACKET);
            while (peek() != null && !peek().is(Type.RIGHT_BRACKET)) {
                args.add(consume(Type.STRING).text());
                tryConsume(Type.COMMA);
            }
            consume(Type.RIGHT_BRACKET);
            tryConsume(Type.COMMA);
        }

        consume(Type.RIGHT_PAREN);
        return new Step.Run(program, args);
    }

    private KeyValue parseKeyValue() throws RonParseException {
        RonToken name = consume(Type.IDENTIFIER);
        if (name.text().equals("Unicode")) {
            consume(Type.LEFT_PAREN);
            String character = consume(Type.CHAR).text();
            consume(Type.RIGHT_PAREN);
            return KeyValue.unicode(character);
        }
        return KeyValue.named(name.text());
    }

    private int parseInt() throws RonParseException {
        RonToken token = consume(Type.NUMBER);
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            throw new RonParseException(
                    String.format("Invalid number '%s' at position %d", token.text(), token.position()),
                    token.position(), e);
        }
    }

    /**
     * Skips one value of unknown shape: a scalar, a bracketed group, or a name followed by a group.
     */
    private void skipValue() {
        RonToken token = peek();
        if (token == null) {
            return;
        }
        switch (token.type()) {
            case STRING, NUMBER, CHAR -> pos++;
            case IDENTIFIER -> {
                pos++;
                skipGroup();
            }
            case LEFT_PAREN, LEFT_BRACKET -> skipGroup();
            default -> {
                // separators are left for the caller
            }
        }
    }

    /**
     * If the cursor is on an opening paren or bracket, advances past its matching close.
     */
    private void skipGroup() {
        RonToken open = peek();
        if (open == null) {
            return;
        }
        if (open.is(Type.LEFT_PAREN)) {
            skipBalanced(Type.LEFT_PAREN, Type.RIGHT_PAREN);
        } else if (open.is(Type.LEFT_BRACKET)) {
            skipBalanced(Type.LEFT_BRACKET, Type.RIGHT_BRACKET);
        }
    }

    private void skipBalanced(Type open, Type close) {
        int depth = 0;
        while (pos < tokens.size()) {
            Type type = tokens.get(pos).type();
            pos++;
            if (type == open) {
                depth++;
            } else if (type == close) {
                depth--;
                if (depth == 0) {
                    return;
                }
            }
        }
    }

    private RonToken peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private RonToken consume(Type type) throws RonParseException {
        RonToken token = peek();
        if (token == null) {
            throw new RonParseException("Unexpected end of input, expected " + type, -1);
        }
        if (token.type() != type) {
            throw new RonParseException(
                    String.format("Expected %s, got %s ('%s') at position %d",
                            type, token.type(), token.text(), token.position()),
                    token.position());
        }
        pos++;
        return token;
    }

    private RonToken consume(Type type, String value) throws RonParseException {
        RonToken token = consume(type);
        if (!token.text().equals(value)) {
            pos--;
            throw new RonParseException(
                    String.format("Expected '%s', got '%s' at position %d", value, token.text(), token.position()),
                    token.position());
        }
        return token;
    }

    private RonToken tryConsume(Type type) {
        RonToken token = peek();
        if (token == null || token.type() != type) {
            return null;
        }
        pos++;
        return token;
    }
}
