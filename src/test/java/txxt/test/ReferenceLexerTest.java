// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.test;

import java.util.List;
import txxt.lexer.Lexer;
import txxt.lexer.ReferenceClassifier;
import txxt.lexer.ReferenceLexer;
import txxt.source.Cursor;
import txxt.token.ReferenceKind;
import txxt.token.Token;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

final class ReferenceLexerTest {
    @Test
    void readsCitation() {
        final var cursor = new Cursor("[@smith2020] rest");
        final var token = ReferenceLexer.readCitation(cursor);
        assertThat(token).isEqualTo(new Token.CitationRef("smith2020", token.span()));
        assertThat(cursor.column()).isEqualTo(12);
    }

    @Test
    void readsPageRange() {
        final var token = (Token.PageRef) ReferenceLexer.readPageReference(new Cursor("[p.12-15]"));
        assertThat(token).isNotNull();
        assertThat(token.pages()).isEqualTo("12-15");
        assertThat(token.firstPage()).isEqualTo(12);
        assertThat(token.lastPage()).isEqualTo(15);
    }

    @ParameterizedTest
    @ValueSource(strings = {"[p.12-]", "[p.-3]", "[p.]", "[p.1-2-3]", "[p.12", "[p.1\n2]", "[p.1234567890]"})
    void rejectsMalformedPageReference(final String input) {
        final var cursor = new Cursor(input);
        assertThat(ReferenceLexer.readPageReference(cursor)).isNull();
        assertThat(cursor.offset()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {"3", "2.1", "-1", "1.-1.2"})
    void readsSessionReference(final String target) {
        final var token = ReferenceLexer.readSessionReference(new Cursor("[#" + target + "]"));
        assertThat(token).isInstanceOf(Token.SessionRef.class);
        assertThat(((Token.SessionRef) token).target()).isEqualTo(target);
    }

    @ParameterizedTest
    @ValueSource(strings = {"[#]", "[#1.]", "[#.1]", "[#a]", "[#-2]"})
    void rejectsMalformedSessionReference(final String input) {
        final var cursor = new Cursor(input);
        assertThat(ReferenceLexer.readSessionReference(cursor)).isNull();
        assertThat(cursor.offset()).isZero();
    }

    @Test
    void readsNumberedAndLabeledFootnotes() {
        final var numbered = (Token.FootnoteRef) ReferenceLexer.readFootnote(new Cursor("[3]"));
        assertThat(numbered).isNotNull();
        assertThat(numbered.isLabeled()).isFalse();
        assertThat(numbered.target()).isEqualTo("3");

        final var labeled = (Token.FootnoteRef) ReferenceLexer.readFootnote(new Cursor("[^note-1]"));
        assertThat(labeled).isNotNull();
        assertThat(labeled.isLabeled()).isTrue();
        assertThat(labeled.target()).isEqualTo("note-1");

        assertThat(ReferenceLexer.readFootnote(new Cursor("[0]"))).isNull();
        assertThat(ReferenceLexer.readFootnote(new Cursor("[^1abc]"))).isNull();
    }

    @Test
    void genericReferenceNeedsAlphanumericContent() {
        assertThat(ReferenceLexer.readGenericReference(new Cursor("[...]"))).isNull();
        assertThat(ReferenceLexer.readGenericReference(new Cursor("[]"))).isNull();
        final var token = (Token.RefMarker) ReferenceLexer.readGenericReference(new Cursor("[Chapter One]"));
        assertThat(token).isNotNull();
        assertThat(token.content()).isEqualTo("Chapter One");
        assertThat(token.kind()).isEqualTo(ReferenceKind.UNRESOLVED);
    }

    @Test
    void invalidPageRangeFallsBackToGenericReference() {
        final var tokens = Lexer.tokenize("[p.12-]");
        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0)).isInstanceOf(Token.RefMarker.class);
        final var reference = (Token.RefMarker) tokens.get(0);
        assertThat(reference.content()).isEqualTo("p.12-");
        assertThat(tokens.get(1)).isInstanceOf(Token.Eof.class);
    }

    @Test
    void lexerPrefersSpecificReferenceForms() {
        final var tokens = Lexer.tokenize("[@key] [p.1] [#2] [4] [https://example.com]");
        final var kinds = tokens.stream()
            .filter(token -> !(token instanceof Token.Whitespace || token instanceof Token.Eof))
            .map(token -> token.getClass().getSimpleName())
            .toList();
        assertThat(kinds).isEqualTo(List.of("CitationRef", "PageRef", "SessionRef", "FootnoteRef", "RefMarker"));
        assertThat(((Token.RefMarker) tokens.get(8)).kind()).isEqualTo(ReferenceKind.URL);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
        "https://example.com/page|URL",
        "ftp://files.example.org|URL",
        "www.example.com|URL",
        "example.org/path|URL",
        "someone@example.com|URL",
        "#1.2|SECTION",
        "#-1|SECTION",
        "42|FOOTNOTE",
        "@smith2020|CITATION",
        "@smith2020, p.4|CITATION",
        "p.12-|CITATION",
        "TK|TO_COME",
        "tk-draft2|TO_COME",
        "./images/figure|FILE",
        "/etc/hosts|FILE",
        "Some Section Title|UNRESOLVED",
    })
    void classifiesReferenceContent(final String content, final ReferenceKind kind) {
        assertThat(ReferenceClassifier.classify(content)).isEqualTo(kind);
    }

    @Test
    void blankContentIsUnresolved() {
        assertThat(ReferenceClassifier.classify("   ")).isEqualTo(ReferenceKind.UNRESOLVED);
        assertThat(ReferenceClassifier.classify("  42  ")).isEqualTo(ReferenceKind.FOOTNOTE);
    }
}
