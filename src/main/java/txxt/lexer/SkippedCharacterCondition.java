// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.Locale;
import txxt.source.LocatedCondition;
import txxt.source.Position;

/**
 * A non-fatal condition signaled when the lexer drops a character no recognizer accepts.
 */
public final class SkippedCharacterCondition extends LocatedCondition {
    SkippedCharacterCondition(final Position position, final int codePoint) {
        super(String.format(Locale.ROOT, "Skipped unrecognized character U+%04X", codePoint), position);
        this.codePoint = codePoint;
    }

    public int codePoint() {
        return codePoint;
    }

    private final int codePoint;
}
