package com.g11macro.manager.ron;

import com.g11macro.manager.ron.RonToken.Type;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RonTokenizerTest {

    private static List<Type> types(String text) {
        return RonTokenizer.tokenize(text).stream().map(RonToken::type).toList();
    }

    @Test
    void emptyInputHasNoTokens() {
        assertThat(RonTokenizer.tokenize("")).isEmpty();
        assertThat(RonTokenizer.tokenize("   \n\t ")).isEmpty();
    }

    @Test
    void punctuationAndIdentifiers() {
        List<RonToken> tokens = RonTokenizer.tokenize("KeyBinding(m: 1, g:[x_2])");

        assertThat(tokens).extracting(RonToken::type).containsExactly(
                Type.IDENTIFIER, Type.LEFT_PAREN, Type.IDENTIFIER, Type.COLON, Type.NUMBER, Type.COMMA,
                Type.IDENTIFIER, Type.COLON, Type.LEFT_BRACKET, Type.IDENTIFIER, Type.RIGHT_BRACKET,
                Type.RIGHT_PAREN);
        assertThat(tokens.get(0)).isEqualTo(new RonToken(Type.IDENTIFIER, "KeyBinding", 0));
        assertThat(tokens.get(9).text()).isEqualTo("x_2");
    }

    @Test
    void positionsPointAtTokenStart() {
        List<RonToken> tokens = RonTokenizer.tokenize("  on: Press");

        assertThat(tokens).extracting(RonToken::position).containsExactly(2, 4, 6);
    }

    @Test
    void skipsCommentsAndHeader() {
        String text = """
                #![enable(explicit_struct_names, implicit_some)]
                // line comment with KeyBinding(
                [ /* block
                   comment */ ]
                """;

        assertThat(types(text)).containsExactly(Type.LEFT_BRACKET, Type.RIGHT_BRACKET);
    }

    @Test
    void unterminatedBlockCommentRunsToEnd() {
        assertThat(types("[ /* never closed ]")).containsExactly(Type.LEFT_BRACKET);
    }

    @Test
    void unterminatedHeaderRunsToEnd() {
        assertThat(types("#![enable(x) ( ,")).isEmpty();
    }

    @Test
    void numbersKeepSignAndSourceText() {
        List<RonToken> tokens = RonTokenizer.tokenize("-120 007 - 5");

        assertThat(tokens).extracting(RonToken::text).containsExactly("-120", "007", "5");
        assertThat(tokens).extracting(RonToken::type).containsOnly(Type.NUMBER);
    }

    @Test
    void stringEscapesAreDecoded() {
        List<RonToken> tokens = RonTokenizer.tokenize("\"a\\nb\\tc \\\"q\\\" \\\\ \\r\"");

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).type()).isEqualTo(Type.STRING);
        assertThat(tokens.get(0).text()).isEqualTo("a\nb\tc \"q\" \\ \r");
    }

    @Test
    void escapedBackslashBeforeLetterIsNotANewline() {
        RonToken token = RonTokenizer.tokenize("\"C:\\\\new\"").get(0);

        assertThat(token.text()).isEqualTo("C:\\new");
    }

    @Test
    void unknownStringEscapeIsKeptVerbatim() {
        assertThat(RonTokenizer.tokenize("\"\\x\"").get(0).text()).isEqualTo("\\x");
    }

    @Test
    void unterminatedStringConsumesRestOfInput() {
        List<RonToken> tokens = RonTokenizer.tokenize("Text(\"hello ) ]");

        assertThat(tokens).extracting(RonToken::type)
                .containsExactly(Type.IDENTIFIER, Type.LEFT_PAREN, Type.STRING);
        assertThat(tokens.get(2).text()).isEqualTo("hello ) ]");
    }

    @Test
    void charLiterals() {
        List<RonToken> tokens = RonTokenizer.tokenize("'a' '\\'' '\\\\' '\\n' '\\t' '€' '😀'");

        assertThat(tokens).extracting(RonToken::type).containsOnly(Type.CHAR);
        assertThat(tokens).extracting(RonToken::text)
                .containsExactly("a", "'", "\\", "\n", "\t", "€", "😀");
    }

    @Test
    void brokenCharLiteralOnlyDropsTheQuote() {
        List<RonToken> tokens = RonTokenizer.tokenize("'ab)");

        assertThat(tokens).extracting(RonToken::type).containsExactly(Type.IDENTIFIER, Type.RIGHT_PAREN);
        assertThat(tokens.get(0).text()).isEqualTo("ab");
    }

    @Test
    void unknownCharactersAreDropped() {
        assertThat(types("@ { } = ; . Key")).containsExactly(Type.IDENTIFIER);
    }
}
