// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import txxt.source.Cursor;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * The micro-lexers tried at an ordinary position, in precedence order: the first one that accepts wins.
 * <p>
 * Markers come first so that {@code ::} is never read as two colons; the reference forms go from the most to the least
 * specific; text and identifiers come last.
 */
enum Recognizer {
    DEFINITION_MARKER(MarkerLexer::readDefinitionMarker),
    ANNOTATION_MARKER(MarkerLexer::readAnnotationMarker),
    CITATION_REF(ReferenceLexer::readCitation),
    PAGE_REF(ReferenceLexer::readPageReference),
    SESSION_REF(ReferenceLexer::readSessionReference),
    FOOTNOTE_REF(ReferenceLexer::readFootnote),
    GENERIC_REF(ReferenceLexer::readGenericReference),
    BRACKET_OR_PAREN(PunctuationLexer::readBracketOrParen),
    COLON(PunctuationLexer::readColon),
    EQUALS_OR_COMMA(PunctuationLexer::readEqualsOrComma),
    INLINE_DELIMITER(InlineDelimiterLexer::read),
    DASH(PunctuationLexer::readDash),
    PERIOD(PunctuationLexer::readPeriod),
    TEXT(TextLexer::read),
    IDENTIFIER(TextLexer::readIdentifier);

    Recognizer(final MicroLexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Runs the recognizer, restoring the cursor if it declines.
     */
    @Nullable Token attempt(final Cursor cursor) {
        final var mark = cursor.save();
        final var token = lexer.read(cursor);
        if (token == null) {
            cursor.restore(mark);
        }
        return token;
    }

    /**
     * Returns the first token any recognizer accepts at the cursor, or {@code null} if all of them decline.
     */
    static @Nullable Token readAny(final Cursor cursor) {
        for (final var recognizer : all) {
            final var token = recognizer.attempt(cursor);
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    private final MicroLexer lexer;

    private static final Recognizer[] all = values();
}
