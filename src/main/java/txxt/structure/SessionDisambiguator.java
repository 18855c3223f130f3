// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.structure;

import java.util.ArrayList;
import java.util.List;
import txxt.block.BlockGroup;
import txxt.source.Position;
import txxt.token.Token;
import txxt.util.Trace;
import txxt.util.UnreachableCodeReachedError;
import txxt.util.condition.ConditionContext;

/**
 * Decides, for every indented block group, whether it is the body of a session or the content container of the element
 * that owns it.
 * <p>
 * A group's own tokens are read into elements, and each child group is resolved against its owner: the nearest
 * preceding non-blank node at the same level. Children are classified bottom-up as content containers first. The owner
 * is then promoted to a session title, and the child re-read as a session body, iff the group itself is read as a
 * session, the child holds some non-blank content, and the owner is either a paragraph or a list item separated from
 * the child by a blank line. An owner that is not promoted keeps the child as its content container if it is a list
 * item, definition or annotation; otherwise the child is dangling, reported with a {@link DanglingBlockCondition} and
 * left out. Blank lines between an owner and its child are consumed by the owner's node. Finally, runs of list items are
 * collapsed into lists.
 */
public final class SessionDisambiguator {
    private SessionDisambiguator() {
    }

    /**
     * Classifies the whole document rooted at {@code root}.
     */
    public static List<ClassifiedNode> classify(final BlockGroup root) {
        return classify(root, ParseContext.SESSION);
    }

    /**
     * Classifies {@code group} read as the given kind of body.
     */
    public static List<ClassifiedNode> classify(final BlockGroup group, final ParseContext context) {
        try (final var trace = new Trace("Classifying document structure")) {
            trace.use();
            final var classification = classifyGroup(group, context);
            for (final var dangling : classification.dangling()) {
                ConditionContext.signal(dangling);
            }
            return classification.nodes();
        }
    }

    // Dangling blocks are only reported once the parse they belong to is known to be kept.
    private static Classification classifyGroup(final BlockGroup group, final ParseContext context) {
        try (final var trace = new Trace(() -> "Classifying block group " + describe(group) + " as " + context)) {
            trace.use();
            final var nodes = new ArrayList<ClassifiedNode>();
            final var dangling = new ArrayList<DanglingBlockCondition>();
            final var tokens = group.tokens();
            var consumed = 0;
            for (final var child : group.children()) {
                appendElements(nodes, tokens.subList(consumed, child.anchor()));
                consumed = child.anchor();
                attachChild(nodes, dangling, child, context);
            }
            appendElements(nodes, tokens.subList(consumed, tokens.size()));
            return new Classification(ListCollapser.collapse(nodes), dangling);
        }
    }

    private static void appendElements(final List<ClassifiedNode> nodes, final List<Token> tokens) {
        for (final var element : ElementReader.read(tokens)) {
            nodes.add(new ClassifiedNode.Plain(element));
        }
    }

    private static void attachChild(
        final List<ClassifiedNode> nodes,
        final List<DanglingBlockCondition> dangling,
        final BlockGroup child,
        final ParseContext context
    ) {
        final var contentParse = classifyGroup(child, ParseContext.CONTENT);
        var ownerIndex = nodes.size() - 1;
        while (ownerIndex >= 0 && isBlank(nodes.get(ownerIndex))) {
            ownerIndex -= 1;
        }
        if (ownerIndex < 0) {
            dangling.add(new DanglingBlockCondition("Indented block with no preceding element", startOf(child)));
            return;
        }
        final var separatedByBlankLine = ownerIndex < nodes.size() - 1;
        final var owner = nodes.get(ownerIndex);
        final ClassifiedNode replacement;
        if (owner instanceof final ClassifiedNode.Session session) {
            final var body = classifyGroup(child, ParseContext.SESSION);
            dangling.addAll(body.dangling());
            replacement = new ClassifiedNode.Session(session.title(), concat(session.content(), body.nodes()));
        } else if (owner instanceof final ClassifiedNode.Container container) {
            dangling.addAll(contentParse.dangling());
            replacement = new ClassifiedNode.Container(
                container.owner(),
                concat(container.content(), contentParse.nodes())
            );
        } else if (owner instanceof final ClassifiedNode.Plain plain) {
            final var element = plain.element();
            if (context == ParseContext.SESSION
                && hasContent(contentParse.nodes())
                && isSessionTitle(element, separatedByBlankLine)) {
                final var body = classifyGroup(child, ParseContext.SESSION);
                dangling.addAll(body.dangling());
                replacement = new ClassifiedNode.Session(element, body.nodes());
            } else if (element.kind().ownsContent()) {
                dangling.addAll(contentParse.dangling());
                replacement = new ClassifiedNode.Container(element, contentParse.nodes());
            } else {
                dangling.add(new DanglingBlockCondition(
                    "Indented block after a " + element.kind() + " cannot be its content in a " + context,
                    startOf(child)
                ));
                return;
            }
        } else {
            throw new UnreachableCodeReachedError("List groups are formed only after every child is attached");
        }
        nodes.subList(ownerIndex, nodes.size()).clear();
        nodes.add(replacement);
    }

    private static boolean isSessionTitle(final Element element, final boolean separatedByBlankLine) {
        return switch (element.kind()) {
            case PARAGRAPH -> true;
            case LIST_ITEM -> separatedByBlankLine;
            default -> false;
        };
    }

    private static boolean hasContent(final List<ClassifiedNode> nodes) {
        for (final var node : nodes) {
            if (!isBlank(node)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(final ClassifiedNode node) {
        return node instanceof final ClassifiedNode.Plain plain && plain.element().isBlank();
    }

    private static List<ClassifiedNode> concat(final List<ClassifiedNode> first, final List<ClassifiedNode> second) {
        final var result = new ArrayList<ClassifiedNode>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return ListCollapser.collapse(unwrapLists(result));
    }

    // Lists are re-collapsed after concatenation, so that items from both bodies can join.
    private static List<ClassifiedNode> unwrapLists(final List<ClassifiedNode> nodes) {
        final var result = new ArrayList<ClassifiedNode>(nodes.size());
        for (final var node : nodes) {
            if (node instanceof final ClassifiedNode.ListGroup list) {
                result.addAll(list.items());
            } else {
                result.add(node);
            }
        }
        return result;
    }

    private static Position startOf(final BlockGroup group) {
        final var start = group.start();
        return (start == null) ? Position.origin() : start;
    }

    private static String describe(final BlockGroup group) {
        final var start = group.start();
        return (start == null) ? "with no tokens" : "starting at " + start.describe();
    }

    private record Classification(List<ClassifiedNode> nodes, List<DanglingBlockCondition> dangling) {
    }
}
