// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.test;

import java.util.List;
import java.util.stream.LongStream;
import java.util.stream.Stream;
import txxt.detokenizer.Detokenizer;
import txxt.lexer.Lexer;
import txxt.lexer.MarkerLexer;
import txxt.lexer.MicroLexer;
import txxt.lexer.MisalignedIndentationCondition;
import txxt.lexer.PunctuationLexer;
import txxt.lexer.ReferenceLexer;
import txxt.lexer.SequenceMarkerLexer;
import txxt.lexer.SkippedCharacterCondition;
import txxt.lexer.TextLexer;
import txxt.source.Cursor;
import txxt.source.Position;
import txxt.source.Span;
import txxt.token.ParameterForm;
import txxt.token.Token;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class LexerTest {
    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(16);
    }

    static Stream<Arguments> provideDecliningInputs() {
        return Stream.of(
            Arguments.of((MicroLexer) ReferenceLexer::readCitation, "[@bad key]"),
            Arguments.of((MicroLexer) ReferenceLexer::readPageReference, "[p.1-2-3]"),
            Arguments.of((MicroLexer) ReferenceLexer::readSessionReference, "[#1..2]"),
            Arguments.of((MicroLexer) ReferenceLexer::readFootnote, "[^]"),
            Arguments.of((MicroLexer) ReferenceLexer::readGenericReference, "[ -- ]"),
            Arguments.of((MicroLexer) MarkerLexer::readDefinitionMarker, ":: note ::"),
            Arguments.of((MicroLexer) MarkerLexer::readAnnotationMarker, ":::"),
            Arguments.of((MicroLexer) PunctuationLexer::readColon, "::"),
            Arguments.of((MicroLexer) TextLexer::read, "*bold*"),
            Arguments.of((MicroLexer) TextLexer::readIdentifier, "_ x"),
            Arguments.of((MicroLexer) cursor -> SequenceMarkerLexer.read(cursor, 0), "12x. item")
        );
    }

    @Test
    void tokenizesSimpleLine() {
        final var tokens = Lexer.tokenize("see [3] now\n");
        assertThat(tokens).containsExactly(
            new Token.Text("see", span(0, 0, 0, 3)),
            new Token.Whitespace(" ", span(0, 3, 0, 4)),
            new Token.FootnoteRef("3", span(0, 4, 0, 7)),
            new Token.Whitespace(" ", span(0, 7, 0, 8)),
            new Token.Text("now", span(0, 8, 0, 11)),
            new Token.Newline("\n", span(0, 11, 1, 0)),
            new Token.Eof(Span.at(new Position(1, 0)))
        );
    }

    @Test
    void emptyInputIsJustEof() {
        assertThat(Lexer.tokenize("")).containsExactly(new Token.Eof(Span.at(Position.origin())));
    }

    @Test
    void readsBlankLinesAsSingleTokens() {
        final var tokens = Lexer.tokenize("a\n\n  \r\nb");
        assertThat(tokens).extracting(token -> token.getClass().getSimpleName())
            .containsExactly("Text", "Newline", "BlankLine", "BlankLine", "Text", "Eof");
        final var secondBlank = (Token.BlankLine) tokens.get(3);
        assertThat(secondBlank.whitespace()).isEqualTo("  ");
        assertThat(secondBlank.lineBreak()).isEqualTo("\r\n");
    }

    @Test
    void emitsIndentationTokensBeforeLineContent() {
        final var tokens = Lexer.tokenize("a\n        b\n    c\n");
        assertThat(tokens).extracting(token -> token.getClass().getSimpleName()).containsExactly(
            "Text", "Newline",
            "Indent", "Whitespace", "Text", "Newline",
            "Dedent", "Indent", "Whitespace", "Text", "Newline",
            "Dedent", "Eof"
        );
    }

    @Test
    void sequenceMarkersCarryTheirLevel() {
        final var tokens = Lexer.tokenize("1. One\n    a) Nested\n");
        final var markers = tokens.stream()
            .filter(Token.SequenceMarker.class::isInstance)
            .map(Token.SequenceMarker.class::cast)
            .toList();
        assertThat(markers).extracting(Token.SequenceMarker::content).containsExactly("1.", "a)");
        assertThat(markers).extracting(Token.SequenceMarker::level).containsExactly(0, 1);
    }

    @Test
    void sequenceMarkerOnlyAtLineStart() {
        final var tokens = Lexer.tokenize("see 1. below\n");
        assertThat(tokens).noneMatch(Token.SequenceMarker.class::isInstance);
    }

    @Test
    void distinguishesDefinitionAndAnnotationMarkers() {
        final var definition = Lexer.tokenize("term ::\n");
        assertThat(definition).anyMatch(Token.DefinitionMarker.class::isInstance);
        assertThat(definition).noneMatch(Token.AnnotationMarker.class::isInstance);

        final var annotation = Lexer.tokenize(":: note :: text\n");
        assertThat(annotation).filteredOn(Token.AnnotationMarker.class::isInstance).hasSize(2);
        assertThat(annotation).noneMatch(Token.DefinitionMarker.class::isInstance);
    }

    @Test
    void integratesAnnotationParameters() {
        final var source = ":: python:version=3.11,mode=\"strict\" ::\n";
        final var tokens = Lexer.tokenize(source);
        assertThat(tokens).extracting(token -> token.getClass().getSimpleName()).containsExactly(
            "AnnotationMarker", "Whitespace", "Text", "Colon", "Parameter", "Text", "Parameter",
            "Whitespace", "AnnotationMarker", "Newline", "Eof"
        );
        assertThat(tokens.get(2)).isEqualTo(new Token.Text("python", span(0, 3, 0, 9)));
        assertThat(tokens.get(4)).isEqualTo(
            new Token.Parameter("version", "3.11", ParameterForm.UNQUOTED, "version=3.11", span(0, 10, 0, 22))
        );
        assertThat(tokens.get(5)).isEqualTo(new Token.Text(",", span(0, 22, 0, 23)));
        assertThat(tokens.get(6)).isEqualTo(
            new Token.Parameter("mode", "strict", ParameterForm.QUOTED, "mode=\"strict\"", span(0, 23, 0, 36))
        );
        assertThat(Detokenizer.detokenize(tokens)).isEqualTo(source);
    }

    @Test
    void quotedMarkerDoesNotCloseAnnotation() {
        final var tokens = Lexer.tokenize(":: note:msg=\"a :: b\" ::\n");
        final var parameters = tokens.stream()
            .filter(Token.Parameter.class::isInstance)
            .map(Token.Parameter.class::cast)
            .toList();
        assertThat(parameters).extracting(Token.Parameter::value).containsExactly("a :: b");
        assertThat(tokens).filteredOn(Token.AnnotationMarker.class::isInstance).hasSize(2);
    }

    @Test
    void quoteInsideUnquotedValueDoesNotHideClosingMarker() {
        final var source = ":: size:width=5\" ::  content\n";
        final var tokens = Lexer.tokenize(source);
        final var parameters = tokens.stream()
            .filter(Token.Parameter.class::isInstance)
            .map(Token.Parameter.class::cast)
            .toList();
        assertThat(parameters).extracting(Token.Parameter::value).containsExactly("5\"");
        assertThat(tokens).filteredOn(Token.AnnotationMarker.class::isInstance).hasSize(2);
        assertThat(tokens).extracting(Token::sourceText).contains("content");
        assertThat(Detokenizer.detokenize(tokens)).isEqualTo(source);
    }

    @Test
    void leavesColonsOutsideAnnotationsAlone() {
        final var tokens = Lexer.tokenize("time: 12:30\n");
        assertThat(tokens).noneMatch(Token.Parameter.class::isInstance);
        assertThat(tokens).filteredOn(Token.Colon.class::isInstance).hasSize(2);
    }

    @Test
    void readsVerbatimBlockOpaquely() {
        final var source = "Code:\n    let x = [1];\n:: rust\n";
        final var tokens = Lexer.tokenize(source);
        assertThat(tokens).extracting(token -> token.getClass().getSimpleName()).containsExactly(
            "VerbatimTitle", "Newline", "VerbatimContent", "AnnotationMarker", "Whitespace", "Text", "Newline", "Eof"
        );
        assertThat(((Token.VerbatimTitle) tokens.get(0)).title()).isEqualTo("Code");
        assertThat(tokens.get(2).sourceText()).isEqualTo("    let x = [1];\n");
        assertThat(Detokenizer.detokenize(tokens)).isEqualTo(source);
    }

    @Test
    void signalsMisalignedIndentation() {
        final var capture = ConditionCapture.<List<Token>>run(() -> Lexer.tokenize("a\n  b\n"));
        assertThat(capture.warningsOfType(MisalignedIndentationCondition.class)).hasSize(1);
        assertThat(capture.value()).filteredOn(Token.Indent.class::isInstance).hasSize(1);
        assertThat(capture.value()).filteredOn(Token.Dedent.class::isInstance).hasSize(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "plain", "a\r\nb\r\n", "\n\n\n", "    deep\n", "[#-1] \\*not bold\\*", "x :::: y",
        ":: note:a=1, b = 2 ::\n", ":: code:path=\"a\\q\\\\b\" , flag ::  body\n", ":: size:width=5\" ::  content\n",
    })
    void roundTripsSource(final String source) {
        assertThat(Detokenizer.detokenize(Lexer.tokenize(source))).isEqualTo(source);
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("provideDecliningInputs")
    void decliningLexersLeaveCursorAlone(final MicroLexer lexer, final String input) {
        final var cursor = new Cursor(input);
        assertThat(lexer.read(cursor)).isNull();
        assertThat(cursor.offset()).isZero();
        assertThat(cursor.position()).isEqualTo(Position.origin());
    }

    @Tag("random")
    @ParameterizedTest(name = seededTestDisplayName)
    @MethodSource("provideSeeds")
    void randomDocumentsAreBalancedAndRoundTrip(final long seed) {
        final var source = RandomUtils.generateDocument(seed, 200);
        final var capture = ConditionCapture.<List<Token>>run(() -> Lexer.tokenize(source));
        assertThat(capture.error()).isNull();
        assertThat(capture.warningsOfType(SkippedCharacterCondition.class)).isEmpty();
        final var tokens = capture.value();

        var depth = 0;
        for (final var token : tokens) {
            if (token instanceof Token.Indent) {
                depth += 1;
            } else if (token instanceof Token.Dedent) {
                depth -= 1;
                assertThat(depth).isNotNegative();
            }
        }
        assertThat(depth).isZero();
        assertThat(tokens).filteredOn(Token.Eof.class::isInstance).hasSize(1);
        assertThat(tokens.get(tokens.size() - 1)).isInstanceOf(Token.Eof.class);
        assertThat(Detokenizer.detokenize(tokens)).isEqualTo(source);
    }

    private static Span span(final int startRow, final int startColumn, final int endRow, final int endColumn) {
        return new Span(new Position(startRow, startColumn), new Position(endRow, endColumn));
    }

    private static final String seededTestDisplayName = "{displayName} [{index}] seed = {0}";
}
