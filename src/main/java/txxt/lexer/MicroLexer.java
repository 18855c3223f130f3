// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import txxt.source.Cursor;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * A recognizer for one bounded pattern.
 * <p>
 * On success the cursor is left just past the pattern and the token is returned. On failure {@code null} is returned
 * and the cursor must be exactly where it was before the call.
 */
@FunctionalInterface
public interface MicroLexer {
    @Nullable Token read(Cursor cursor);
}
