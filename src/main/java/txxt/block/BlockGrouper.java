// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.block;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import txxt.source.Position;
import txxt.token.Token;
import txxt.util.Trace;
import txxt.util.condition.ConditionContext;

/**
 * Folds a flat token stream into a {@link BlockGroup} tree.
 * <p>
 * An indent opens a new group as the last child of the current one, and the matching dedent closes it. Any other token
 * belongs to the innermost open group. A dedent with no open group, or groups still open at the end, are fatal
 * {@link BlockGroupingErrorCondition}s: the stream was not produced by a working lexer, and no repair is attempted.
 */
public final class BlockGrouper {
    private BlockGrouper() {
    }

    /**
     * Groups {@code tokens}, returning the root group.
     */
    public static BlockGroup group(final List<Token> tokens) {
        try (final var trace = new Trace(() -> "Grouping " + tokens.size() + " tokens into blocks")) {
            trace.use();
            final var stack = new ArrayDeque<Builder>();
            stack.push(new Builder(0));
            var last = Position.origin();
            for (final var token : tokens) {
                last = token.span().end();
                if (token instanceof Token.Indent) {
                    stack.push(new Builder(stack.element().tokens.size()));
                } else if (token instanceof Token.Dedent) {
                    if (stack.size() <= 1) {
                        throw ConditionContext.error(new BlockGroupingErrorCondition(
                            BlockGroupingErrorCondition.Kind.UNBALANCED_DEDENT,
                            "Dedent without a matching indent",
                            token.span().start()
                        ));
                    }
                    closeInnermost(stack);
                } else {
                    stack.element().tokens.add(token);
                }
            }
            if (stack.size() != 1) {
                throw ConditionContext.error(new BlockGroupingErrorCondition(
                    BlockGroupingErrorCondition.Kind.UNCLOSED_INDENT,
                    (stack.size() - 1) + " indentation level(s) left open at end of input",
                    last
                ));
            }
            return stack.pop().build();
        }
    }

    private static void closeInnermost(final Deque<Builder> stack) {
        final var completed = stack.pop().build();
        stack.element().children.add(completed);
    }

    private static final class Builder {
        Builder(final int anchor) {
            this.anchor = anchor;
        }

        BlockGroup build() {
            return new BlockGroup(tokens, children, anchor);
        }

        private final int anchor;
        private final List<Token> tokens = new ArrayList<>();
        private final List<BlockGroup> children = new ArrayList<>();
    }
}
