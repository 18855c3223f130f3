// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.block;

import java.util.List;
import txxt.source.Position;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * The tokens of one indentation level, with indent and dedent tokens removed, and the groups of the deeper levels
 * nested in it.
 *
 * @param tokens   The tokens at this level, in source order.
 * @param children The nested groups, in source order.
 * @param anchor   The number of the parent's tokens that precede this group; 0 for the root.
 */
public record BlockGroup(List<Token> tokens, List<BlockGroup> children, int anchor) {
    public BlockGroup {
        tokens = List.copyOf(tokens);
        children = List.copyOf(children);
    }

    /**
     * Returns where the group's first token starts, or {@code null} if it has no tokens.
     */
    public @Nullable Position start() {
        return tokens.isEmpty() ? null : tokens.get(0).span().start();
    }

    /**
     * Returns the row of the group's first line, or -1 if it has no tokens.
     */
    public int startRow() {
        final var start = start();
        return (start == null) ? -1 : start.row();
    }

    /**
     * Returns {@code true} iff the group holds neither tokens nor children.
     */
    public boolean isEmpty() {
        return tokens.isEmpty() && children.isEmpty();
    }
}
