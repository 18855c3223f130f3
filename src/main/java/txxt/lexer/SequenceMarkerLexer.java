// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.List;
import txxt.source.Cursor;
import txxt.source.Span;
import txxt.token.SequenceStyle;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * Recognizes list and session numbering markers at the start of a line's content.
 * <p>
 * Four mutually exclusive shapes are accepted, each only when a space follows: a plain dash ({@code "- "}), a number
 * ({@code "12. "}, {@code "3) "}), a roman numeral up to 13 ({@code "iv. "}, {@code "XII) "}) and a single letter
 * ({@code "b. "}, {@code "C) "}). Roman numerals take precedence over letters, so {@code "i. "} is roman one. The space
 * itself is left for the whitespace scanner.
 */
public final class SequenceMarkerLexer {
    private SequenceMarkerLexer() {
    }

    /**
     * Reads a sequence marker, tagging it with the given indentation depth.
     */
    public static @Nullable Token read(final Cursor cursor, final int level) {
        final var start = cursor.save();
        final var token = readImpl(cursor, level);
        if (token == null) {
            cursor.restore(start);
        }
        return token;
    }

    private static @Nullable Token readImpl(final Cursor cursor, final int level) {
        final var start = cursor.save();
        final var first = cursor.peek();
        if (first == '-') {
            return (cursor.peekAt(1) == ' ') ? finish(cursor, start, 1, SequenceStyle.PLAIN, 0, level) : null;
        }
        if (CharClass.isAsciiDigit(first)) {
            return readNumeric(cursor, start, level);
        }
        final var roman = readRoman(cursor, start, level);
        if (roman != null) {
            return roman;
        }
        if (CharClass.isAsciiLetter(first) && isTerminated(cursor, 1)) {
            final var value = Character.toLowerCase(first) - 'a' + 1;
            return finish(cursor, start, 2, SequenceStyle.ALPHABETIC, value, level);
        }
        return null;
    }

    private static @Nullable Token readNumeric(final Cursor cursor, final Cursor.Mark start, final int level) {
        var digits = 0;
        while (CharClass.isAsciiDigit(cursor.peekAt(digits))) {
            digits += 1;
        }
        if (digits > maxNumericDigits || !isTerminated(cursor, digits)) {
            return null;
        }
        var value = 0;
        for (int i = 0; i < digits; i += 1) {
            value = value * 10 + (cursor.peekAt(i) - '0');
        }
        return finish(cursor, start, digits + 1, SequenceStyle.NUMERIC, value, level);
    }

    private static @Nullable Token readRoman(final Cursor cursor, final Cursor.Mark start, final int level) {
        for (final var numeral : romanNumerals) {
            final var length = numeral.text().length();
            if (isTerminated(cursor, length)
                && (cursor.lookingAt(numeral.text()) || cursor.lookingAt(numeral.text().toUpperCase()))) {
                return finish(cursor, start, length + 1, SequenceStyle.ROMAN, numeral.value(), level);
            }
        }
        return null;
    }

    // The marker body of the given length must be followed by '.' or ')' and then a space.
    private static boolean isTerminated(final Cursor cursor, final int bodyLength) {
        final var terminator = cursor.peekAt(bodyLength);
        return (terminator == '.' || terminator == ')') && cursor.peekAt(bodyLength + 1) == ' ';
    }

    private static Token finish(
        final Cursor cursor,
        final Cursor.Mark start,
        final int length,
        final SequenceStyle style,
        final int value,
        final int level
    ) {
        cursor.advance(length);
        return new Token.SequenceMarker(
            style,
            value,
            level,
            cursor.sliceFrom(start.offset()),
            new Span(start.position(), cursor.position())
        );
    }

    private record RomanNumeral(String text, int value) {
    }

    // Longest first, so that "iii" is never read as "i" followed by garbage.
    private static final List<RomanNumeral> romanNumerals = List.of(
        new RomanNumeral("xiii", 13),
        new RomanNumeral("xii", 12),
        new RomanNumeral("viii", 8),
        new RomanNumeral("vii", 7),
        new RomanNumeral("iii", 3),
        new RomanNumeral("xi", 11),
        new RomanNumeral("ii", 2),
        new RomanNumeral("iv", 4),
        new RomanNumeral("vi", 6),
        new RomanNumeral("ix", 9),
        new RomanNumeral("i", 1),
        new RomanNumeral("v", 5),
        new RomanNumeral("x", 10)
    );

    private static final int maxNumericDigits = 9;
}
