// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import txxt.source.LocatedCondition;
import txxt.source.Position;

/**
 * A non-fatal condition signaled for a line whose indentation is not a whole number of indentation steps. The line is
 * still used as indented to its actual width.
 */
public final class MisalignedIndentationCondition extends LocatedCondition {
    MisalignedIndentationCondition(final Position position, final int width) {
        super("Indentation width " + width + " is not a multiple of " + IndentationTracker.indentWidth, position);
        this.width = width;
    }

    public int width() {
        return width;
    }

    private final int width;
}
