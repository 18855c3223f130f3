// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.cli;

import java.io.PrintStream;
import java.util.List;
import txxt.block.BlockGroup;
import txxt.source.Span;
import txxt.structure.ClassifiedNode;
import txxt.structure.Element;
import txxt.token.Token;

/**
 * Human-readable renderings of the pipeline's intermediate and final results, one item per line.
 */
final class Dumper {
    private Dumper() {
    }

    static void dumpTokens(final PrintStream out, final List<Token> tokens) {
        for (final var token : tokens) {
            out.println(describeSpan(token.span()) + ' ' + token.getClass().getSimpleName() + ' '
                + quote(token.sourceText()));
        }
    }

    static void dumpGroups(final PrintStream out, final BlockGroup root) {
        dumpGroup(out, root, 0);
    }

    static void dumpNodes(final PrintStream out, final List<ClassifiedNode> nodes) {
        for (final var node : nodes) {
            dumpNode(out, node, 0);
        }
    }

    private static void dumpGroup(final PrintStream out, final BlockGroup group, final int depth) {
        final var start = group.start();
        out.println(indent(depth) + "group" + ((start == null) ? "" : " at " + start.describe())
            + ", " + group.tokens().size() + " tokens");
        for (final var child : group.children()) {
            dumpGroup(out, child, depth + 1);
        }
    }

    private static void dumpNode(final PrintStream out, final ClassifiedNode node, final int depth) {
        if (node instanceof final ClassifiedNode.Plain plain) {
            out.println(indent(depth) + describe(plain.element()));
        } else if (node instanceof final ClassifiedNode.Session session) {
            out.println(indent(depth) + "session: " + session.title().text());
            dumpChildren(out, session.content(), depth);
        } else if (node instanceof final ClassifiedNode.Container container) {
            out.println(indent(depth) + describe(container.owner()));
            dumpChildren(out, container.content(), depth);
        } else if (node instanceof final ClassifiedNode.ListGroup list) {
            out.println(indent(depth) + "list of " + list.items().size());
            dumpChildren(out, list.items(), depth);
        }
    }

    private static void dumpChildren(final PrintStream out, final List<ClassifiedNode> nodes, final int depth) {
        for (final var child : nodes) {
            dumpNode(out, child, depth + 1);
        }
    }

    private static String describe(final Element element) {
        final var first = element.startRow() + 1;
        final var last = element.endRow() + 1;
        final var where = element.kind() + " [line " + first + ((last == first) ? "" : "-" + last) + ']';
        return element.isBlank() ? where : where + ": " + firstLine(element.text());
    }

    private static String firstLine(final String text) {
        final var lineBreak = text.indexOf('\n');
        return (lineBreak < 0) ? text : text.substring(0, lineBreak).stripTrailing() + " ...";
    }

    private static String describeSpan(final Span span) {
        return (span.start().row() + 1) + ":" + (span.start().column() + 1) + '-'
            + (span.end().row() + 1) + ":" + (span.end().column() + 1);
    }

    private static String indent(final int depth) {
        return "  ".repeat(depth);
    }

    private static String quote(final String text) {
        final var builder = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i += 1) {
            final var ch = text.charAt(i);
            switch (ch) {
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                default -> builder.append(ch);
            }
        }
        return builder.append('"').toString();
    }
}
