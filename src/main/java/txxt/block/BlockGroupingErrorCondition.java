// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.block;

import txxt.source.Position;
import txxt.source.StructuralErrorCondition;

/**
 * A fatal condition indicating that the token stream's indents and dedents do not nest.
 */
public final class BlockGroupingErrorCondition extends StructuralErrorCondition {
    BlockGroupingErrorCondition(final Kind kind, final String message, final Position position) {
        super(message, position);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    private final Kind kind;

    /**
     * The ways the indentation structure can be broken.
     */
    public enum Kind {
        /**
         * A dedent with no open indentation level to close.
         */
        UNBALANCED_DEDENT,
        /**
         * Indentation levels still open at the end of input.
         */
        UNCLOSED_INDENT,
    }
}
