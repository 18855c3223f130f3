// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.regex.Pattern;
import txxt.source.Cursor;
import txxt.source.Span;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * Recognizers for the {@code ::} markers.
 * <p>
 * The same two characters serve as a definition marker ({@code term ::}) and as an annotation marker
 * ({@code :: label :: content}); which one a given {@code ::} is depends on the shape of the whole line.
 */
public final class MarkerLexer {
    private MarkerLexer() {
    }

    /**
     * Reads a definition marker.
     * <p>
     * Declines on lines shaped like annotations. Accepts on lines ending in {@code ::} after a word. On any other line,
     * accepts only a {@code ::} followed by whitespace or the end of the line, with some text before it.
     */
    public static @Nullable Token readDefinitionMarker(final Cursor cursor) {
        if (!atDoubleColon(cursor)) {
            return null;
        }
        final var line = cursor.currentLine();
        final var accepted = switch (classifyLine(line)) {
            case ANNOTATION -> false;
            case DEFINITION -> true;
            case STANDALONE -> isFollowedByWhitespace(cursor) && hasContentBefore(cursor);
        };
        return accepted ? consumeMarker(cursor, true) : null;
    }

    /**
     * Reads an annotation marker: any {@code ::} that is not part of a longer run of colons.
     */
    public static @Nullable Token readAnnotationMarker(final Cursor cursor) {
        return atDoubleColon(cursor) ? consumeMarker(cursor, false) : null;
    }

    static LineShape classifyLine(final String line) {
        if (line.contains(":::")) {
            return LineShape.STANDALONE;
        }
        if (Patterns.annotationLine.matcher(line).find()) {
            return LineShape.ANNOTATION;
        }
        if (Patterns.definitionLine.matcher(line).find()) {
            return LineShape.DEFINITION;
        }
        return LineShape.STANDALONE;
    }

    private static boolean atDoubleColon(final Cursor cursor) {
        return cursor.peek() == ':' && cursor.peekAt(1) == ':' && cursor.peekAt(2) != ':' && cursor.previous() != ':';
    }

    private static boolean isFollowedByWhitespace(final Cursor cursor) {
        final var next = cursor.peekAt(2);
        return next == Cursor.endOfInput || CharClass.isWhitespace(next);
    }

    private static boolean hasContentBefore(final Cursor cursor) {
        for (int distance = 1; distance <= cursor.column(); distance += 1) {
            if (!CharClass.isWhitespace(cursor.peekAt(-distance))) {
                return true;
            }
        }
        return false;
    }

    private static Token consumeMarker(final Cursor cursor, final boolean definition) {
        final var start = cursor.position();
        cursor.advance(2);
        final var span = new Span(start, cursor.position());
        return definition ? new Token.DefinitionMarker(span) : new Token.AnnotationMarker(span);
    }

    enum LineShape {
        ANNOTATION,
        DEFINITION,
        STANDALONE,
    }

    private static final class Patterns {
        private static final Pattern annotationLine =
            Pattern.compile("::\\s*\\w+.*?\\s*::", Pattern.UNICODE_CHARACTER_CLASS);
        private static final Pattern definitionLine =
            Pattern.compile("\\w+.*?::\\s*$", Pattern.UNICODE_CHARACTER_CLASS);
    }
}
