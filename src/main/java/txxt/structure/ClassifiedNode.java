// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.structure;

import java.util.List;
import txxt.source.Span;

/**
 * A node of the classified document structure.
 */
public sealed interface ClassifiedNode {
    /**
     * Returns the source range of the node, nested content included.
     */
    Span span();

    /**
     * An element with no indented body.
     */
    record Plain(Element element) implements ClassifiedNode {
        @Override
        public Span span() {
            return element.span();
        }
    }

    /**
     * A list item, definition or annotation together with the content container made of its indented body. The
     * content never holds a {@link Session}, at any depth.
     */
    record Container(Element owner, List<ClassifiedNode> content) implements ClassifiedNode {
        public Container {
            content = List.copyOf(content);
        }

        @Override
        public Span span() {
            return coverAll(owner.span(), content);
        }
    }

    /**
     * A session: a title line promoted together with its indented body, which may hold further sessions.
     */
    record Session(Element title, List<ClassifiedNode> content) implements ClassifiedNode {
        public Session {
            content = List.copyOf(content);
        }

        @Override
        public Span span() {
            return coverAll(title.span(), content);
        }
    }

    /**
     * A run of adjacent list items at the same level. Each item is either a {@link Plain} or a {@link Container} owned
     * by a list item element.
     */
    record ListGroup(List<ClassifiedNode> items) implements ClassifiedNode {
        public ListGroup {
            if (items.isEmpty()) {
                throw new IllegalArgumentException("Empty list");
            }
            items = List.copyOf(items);
        }

        @Override
        public Span span() {
            return coverAll(items.get(0).span(), items);
        }
    }

    private static Span coverAll(final Span first, final List<ClassifiedNode> nodes) {
        var result = first;
        for (final var node : nodes) {
            result = result.cover(node.span());
        }
        return result;
    }
}
