// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.token;

import txxt.util.annotation.Nullable;

/**
 * The inline formatting span a delimiter opens or closes.
 */
public enum DelimiterKind {
    BOLD('*'),
    ITALIC('_'),
    CODE('`'),
    MATH('#');

    DelimiterKind(final char character) {
        this.character = character;
    }

    /**
     * Returns the delimiter kind written as {@code ch}, or {@code null}.
     */
    public static @Nullable DelimiterKind of(final int ch) {
        for (final var kind : values()) {
            if (kind.character == ch) {
                return kind;
            }
        }
        return null;
    }

    public char character() {
        return character;
    }

    private final char character;
}
