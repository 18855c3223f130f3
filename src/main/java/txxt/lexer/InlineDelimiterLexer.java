// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import txxt.source.Cursor;
import txxt.source.Span;
import txxt.token.DelimiterKind;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * Recognizes the single-character inline formatting delimiters {@code * _ ` #}.
 * <p>
 * Only the delimiter boundaries are recognized; pairing them into spans is left to later stages.
 */
public final class InlineDelimiterLexer {
    private InlineDelimiterLexer() {
    }

    public static @Nullable Token read(final Cursor cursor) {
        final var kind = DelimiterKind.of(cursor.peek());
        if (kind == null) {
            return null;
        }
        if (kind == DelimiterKind.ITALIC && looksLikeIdentifierUnderscore(cursor)) {
            return null;
        }
        final var start = cursor.position();
        cursor.advance();
        return new Token.InlineDelimiter(kind, new Span(start, cursor.position()));
    }

    // An underscore opening a name such as _private or __init is left to the identifier recognizer, as long as the
    // name doesn't run into another underscore, which would make the pair an italic span.
    private static boolean looksLikeIdentifierUnderscore(final Cursor cursor) {
        final var next = cursor.peekAt(1);
        if (next == '_') {
            return Character.isLetterOrDigit(cursor.peekAt(2));
        }
        if (!Character.isLetterOrDigit(next)) {
            return false;
        }
        for (int distance = 2; ; distance += 1) {
            final var ch = cursor.peekAt(distance);
            if (ch == '_') {
                return false;
            }
            if (!Character.isLetterOrDigit(ch)) {
                return true;
            }
        }
    }
}
