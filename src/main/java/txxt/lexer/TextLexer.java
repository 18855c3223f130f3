// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import txxt.source.Cursor;
import txxt.source.Span;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * Recognizers for plain text runs and identifiers, the lowest-precedence micro-lexers.
 */
public final class TextLexer {
    private TextLexer() {
    }

    /**
     * Reads a run of text.
     * <p>
     * A run cannot start with a formatting delimiter or a dash, and stops at whitespace or at a special delimiter.
     * Backslash escapes of delimiters are kept verbatim, both characters included. A period belongs to the run only
     * between two digits, so {@code 3.14} is one token.
     */
    public static @Nullable Token read(final Cursor cursor) {
        final var first = cursor.peek();
        if (first == Cursor.endOfInput || cannotStartText(first) || CharClass.isWhitespace(first)) {
            return null;
        }
        final var start = cursor.save();
        while (!cursor.reachedEnd()) {
            final var ch = cursor.peek();
            if (ch == '\\') {
                cursor.advance(isEscapable(cursor.peekAt(1)) ? 2 : 1);
                continue;
            }
            if (ch == '.') {
                if (CharClass.isAsciiDigit(cursor.previous()) && CharClass.isAsciiDigit(cursor.peekAt(1))) {
                    cursor.advance();
                    continue;
                }
                break;
            }
            final var charClass = CharClass.of(ch);
            if (charClass != CharClass.REGULAR) {
                break;
            }
            cursor.advance();
        }
        if (cursor.offset() == start.offset()) {
            return null;
        }
        return new Token.Text(cursor.sliceFrom(start.offset()), new Span(start.position(), cursor.position()));
    }

    /**
     * Reads an identifier: a letter, or an underscore followed by a letter, digit or underscore, then any number of
     * letters, digits and underscores.
     */
    public static @Nullable Token readIdentifier(final Cursor cursor) {
        final var first = cursor.peek();
        final var second = cursor.peekAt(1);
        final var startsIdentifier = Character.isLetter(first)
            || (first == '_' && (Character.isLetterOrDigit(second) || second == '_'));
        if (!startsIdentifier) {
            return null;
        }
        final var start = cursor.save();
        cursor.advance();
        while (Character.isLetterOrDigit(cursor.peek()) || cursor.peek() == '_') {
            cursor.advance();
        }
        return new Token.Identifier(cursor.sliceFrom(start.offset()), new Span(start.position(), cursor.position()));
    }

    private static boolean cannotStartText(final int ch) {
        return ch == '*' || ch == '_' || ch == '`' || ch == '#' || ch == '-';
    }

    private static boolean isEscapable(final int ch) {
        return switch (ch) {
            case '*', '_', '`', '#', '-', '\\', '[', ']' -> true;
            default -> false;
        };
    }
}
