// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.Arrays;
import java.util.function.IntPredicate;
import txxt.source.Cursor;
import txxt.source.Span;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * Recognizers for the bracketed reference forms.
 * <p>
 * All of them start with {@code [}, so the lexer tries them from the most to the least specific: citation, page,
 * session, footnote and finally the generic reference. Reference content is never empty and never spans lines.
 */
public final class ReferenceLexer {
    private ReferenceLexer() {
    }

    /**
     * Reads a citation: {@code [@key]}, the key made of ASCII letters, digits and {@code _ - . :}.
     */
    public static @Nullable Token readCitation(final Cursor cursor) {
        if (!cursor.lookingAt("[@")) {
            return null;
        }
        final var start = cursor.save();
        cursor.advance(2);
        final var key = readUntilClosingBracket(cursor, ReferenceLexer::isCitationKeyChar);
        if (key == null || key.isEmpty()) {
            cursor.restore(start);
            return null;
        }
        return new Token.CitationRef(key, new Span(start.position(), cursor.position()));
    }

    /**
     * Reads a page reference: {@code [p.12]} or {@code [p.12-15]}.
     */
    public static @Nullable Token readPageReference(final Cursor cursor) {
        if (!cursor.lookingAt("[p.")) {
            return null;
        }
        final var start = cursor.save();
        cursor.advance(3);
        final var pages = readUntilClosingBracket(cursor, ch -> CharClass.isAsciiDigit(ch) || ch == '-');
        if (pages == null || !isValidPageRange(pages)) {
            cursor.restore(start);
            return null;
        }
        return new Token.PageRef(pages, new Span(start.position(), cursor.position()));
    }

    /**
     * Reads a session reference: {@code [#3]}, {@code [#2.1]}, {@code [#-1.2]}.
     */
    public static @Nullable Token readSessionReference(final Cursor cursor) {
        if (!cursor.lookingAt("[#")) {
            return null;
        }
        final var start = cursor.save();
        cursor.advance(2);
        final var target = readUntilClosingBracket(cursor, ch -> CharClass.isAsciiDigit(ch) || ch == '.' || ch == '-');
        if (target == null || !isValidSessionTarget(target)) {
            cursor.restore(start);
            return null;
        }
        return new Token.SessionRef(target, new Span(start.position(), cursor.position()));
    }

    /**
     * Reads a footnote reference: a positive number {@code [3]} or a label {@code [^note-1]}.
     */
    public static @Nullable Token readFootnote(final Cursor cursor) {
        if (cursor.peek() != '[') {
            return null;
        }
        final var start = cursor.save();
        cursor.advance();
        final var content = readUntilClosingBracket(cursor, ch -> true);
        if (content == null || !(isPositiveNumber(content) || isFootnoteLabel(content))) {
            cursor.restore(start);
            return null;
        }
        return new Token.FootnoteRef(content, new Span(start.position(), cursor.position()));
    }

    /**
     * Reads any other bracketed reference containing at least one letter or digit, classifying its content with
     * {@link ReferenceClassifier}.
     */
    public static @Nullable Token readGenericReference(final Cursor cursor) {
        if (cursor.peek() != '[') {
            return null;
        }
        final var start = cursor.save();
        cursor.advance();
        final var content = readUntilClosingBracket(cursor, ch -> true);
        if (content == null || content.codePoints().noneMatch(Character::isLetterOrDigit)) {
            cursor.restore(start);
            return null;
        }
        return new Token.RefMarker(
            content,
            ReferenceClassifier.classify(content),
            new Span(start.position(), cursor.position())
        );
    }

    static boolean isValidPageRange(final String pages) {
        final var parts = pages.split("-", -1);
        return switch (parts.length) {
            case 1, 2 -> allDigitsNonEmpty(parts) && Arrays.stream(parts).allMatch(part -> part.length() <= 9);
            default -> false;
        };
    }

    static boolean isValidSessionTarget(final String target) {
        if (target.isEmpty()) {
            return false;
        }
        for (final var part : target.split("\\.", -1)) {
            if (!part.equals("-1") && !allDigitsNonEmpty(part)) {
                return false;
            }
        }
        return true;
    }

    // Consumes characters up to and including the next ']' on this line, provided every one of them satisfies
    // allowed. Returns the text before the bracket, or null, leaving the cursor wherever the scan stopped.
    private static @Nullable String readUntilClosingBracket(final Cursor cursor, final IntPredicate allowed) {
        final var contentStart = cursor.offset();
        while (true) {
            final var ch = cursor.peek();
            if (ch == ']') {
                final var content = cursor.sliceFrom(contentStart);
                cursor.advance();
                return content.isEmpty() ? null : content;
            }
            if (ch == Cursor.endOfInput || ch == '\n' || ch == '\r' || !allowed.test(ch)) {
                return null;
            }
            cursor.advance();
        }
    }

    private static boolean isCitationKeyChar(final int ch) {
        return CharClass.isAsciiAlphanumeric(ch) || ch == '_' || ch == '-' || ch == '.' || ch == ':';
    }

    private static boolean isPositiveNumber(final String content) {
        return allDigitsNonEmpty(content) && content.chars().anyMatch(ch -> ch != '0');
    }

    private static boolean isFootnoteLabel(final String content) {
        if (content.length() < 2 || content.charAt(0) != '^') {
            return false;
        }
        final var first = content.charAt(1);
        if (!CharClass.isAsciiLetter(first) && first != '_') {
            return false;
        }
        return content.substring(2).chars()
            .allMatch(ch -> CharClass.isAsciiAlphanumeric(ch) || ch == '_' || ch == '-');
    }

    private static boolean allDigitsNonEmpty(final String... parts) {
        for (final var part : parts) {
            if (part.isEmpty() || !part.chars().allMatch(CharClass::isAsciiDigit)) {
                return false;
            }
        }
        return true;
    }
}
