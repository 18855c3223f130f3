// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.structure;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * Collapses runs of adjacent list items into {@link ClassifiedNode.ListGroup}s.
 * <p>
 * Runs only over one level's final node sequence, after sessions have been promoted, so items are never merged across
 * a session boundary. Any other node, a blank line included, ends a run.
 */
public final class ListCollapser {
    private ListCollapser() {
    }

    @CheckReturnValue
    public static List<ClassifiedNode> collapse(final List<ClassifiedNode> nodes) {
        final var result = new ArrayList<ClassifiedNode>(nodes.size());
        final var run = new ArrayList<ClassifiedNode>();
        for (final var node : nodes) {
            if (isListItem(node)) {
                run.add(node);
                continue;
            }
            flush(run, result);
            result.add(node);
        }
        flush(run, result);
        return result;
    }

    static boolean isListItem(final ClassifiedNode node) {
        if (node instanceof final ClassifiedNode.Plain plain) {
            return plain.element().kind() == ElementKind.LIST_ITEM;
        }
        if (node instanceof final ClassifiedNode.Container container) {
            return container.owner().kind() == ElementKind.LIST_ITEM;
        }
        return false;
    }

    private static void flush(final List<ClassifiedNode> run, final List<ClassifiedNode> result) {
        if (!run.isEmpty()) {
            result.add(new ClassifiedNode.ListGroup(run));
            run.clear();
        }
    }
}
