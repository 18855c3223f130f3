// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import txxt.source.Cursor;
import txxt.source.Span;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * Recognizers for single punctuation characters.
 */
public final class PunctuationLexer {
    private PunctuationLexer() {
    }

    /**
     * Reads a bracket, a parenthesis or an at-sign standing on its own.
     */
    public static @Nullable Token readBracketOrParen(final Cursor cursor) {
        final var ch = cursor.peek();
        if (ch != '[' && ch != ']' && ch != '(' && ch != ')' && ch != '@') {
            return null;
        }
        final var span = consumeOne(cursor);
        return switch (ch) {
            case '[' -> new Token.LeftBracket(span);
            case ']' -> new Token.RightBracket(span);
            case '(' -> new Token.LeftParen(span);
            case ')' -> new Token.RightParen(span);
            default -> new Token.AtSign(span);
        };
    }

    /**
     * Reads a single colon. A double colon is left to the marker recognizers, and a run of three or more colons is read
     * as one text token.
     */
    public static @Nullable Token readColon(final Cursor cursor) {
        var run = 0;
        while (cursor.peekAt(run) == ':') {
            run += 1;
        }
        if (run == 0 || run == 2) {
            return null;
        }
        final var start = cursor.save();
        cursor.advance(run);
        final var span = new Span(start.position(), cursor.position());
        return (run == 1) ? new Token.Colon(span) : new Token.Text(cursor.sliceFrom(start.offset()), span);
    }

    /**
     * Reads {@code =} or {@code ,} as a one-character text token.
     */
    public static @Nullable Token readEqualsOrComma(final Cursor cursor) {
        final var ch = cursor.peek();
        if (ch != '=' && ch != ',') {
            return null;
        }
        return new Token.Text(String.valueOf((char) ch), consumeOne(cursor));
    }

    public static @Nullable Token readDash(final Cursor cursor) {
        return (cursor.peek() == '-') ? new Token.Dash(consumeOne(cursor)) : null;
    }

    /**
     * Reads a period, unless it sits between two digits and so belongs to a number.
     */
    public static @Nullable Token readPeriod(final Cursor cursor) {
        if (cursor.peek() != '.') {
            return null;
        }
        if (CharClass.isAsciiDigit(cursor.previous()) && CharClass.isAsciiDigit(cursor.peekAt(1))) {
            return null;
        }
        return new Token.Period(consumeOne(cursor));
    }

    private static Span consumeOne(final Cursor cursor) {
        final var start = cursor.position();
        cursor.advance();
        return new Span(start, cursor.position());
    }
}
