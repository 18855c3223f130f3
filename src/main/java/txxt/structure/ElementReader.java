// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.structure;

import java.util.ArrayList;
import java.util.List;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * Reads a run of same-level tokens into elements.
 * <p>
 * The run is split into lines at line-ending tokens. A line is read by its first token that is not whitespace: a
 * sequence marker makes a list item, an annotation marker an annotation, and a verbatim title starts a verbatim block
 * that also takes the content and terminator lines. A line holding a definition marker is a definition. A line with no
 * content is a blank line. Consecutive remaining lines form one paragraph. End-of-input tokens are dropped.
 */
public final class ElementReader {
    private ElementReader() {
    }

    public static List<Element> read(final List<Token> tokens) {
        final var lines = splitLines(tokens);
        final var result = new ArrayList<Element>();
        final var paragraph = new ArrayList<Token>();
        for (int i = 0; i < lines.size(); i += 1) {
            final var line = lines.get(i);
            final var kind = classify(line);
            if (kind == ElementKind.PARAGRAPH) {
                paragraph.addAll(line);
                continue;
            }
            flushParagraph(paragraph, result);
            if (kind == ElementKind.VERBATIM) {
                final var block = new ArrayList<>(line);
                if (i + 1 < lines.size() && firstContent(lines.get(i + 1)) instanceof Token.VerbatimContent) {
                    i += 1;
                    block.addAll(lines.get(i));
                }
                if (i + 1 < lines.size() && firstContent(lines.get(i + 1)) instanceof Token.AnnotationMarker) {
                    i += 1;
                    block.addAll(lines.get(i));
                }
                result.add(new Element(ElementKind.VERBATIM, block));
            } else {
                result.add(new Element(kind, line));
            }
        }
        flushParagraph(paragraph, result);
        return result;
    }

    static ElementKind classify(final List<Token> line) {
        final var first = firstContent(line);
        if (first == null) {
            return ElementKind.BLANK_LINE;
        }
        if (first instanceof Token.SequenceMarker) {
            return ElementKind.LIST_ITEM;
        }
        if (first instanceof Token.AnnotationMarker) {
            return ElementKind.ANNOTATION;
        }
        if (first instanceof Token.VerbatimTitle) {
            return ElementKind.VERBATIM;
        }
        for (final var token : line) {
            if (token instanceof Token.DefinitionMarker) {
                return ElementKind.DEFINITION;
            }
        }
        return ElementKind.PARAGRAPH;
    }

    private static @Nullable Token firstContent(final List<Token> line) {
        for (final var token : line) {
            if (!(token instanceof Token.Whitespace || token instanceof Token.Newline
                || token instanceof Token.BlankLine)) {
                return token;
            }
        }
        return null;
    }

    private static List<List<Token>> splitLines(final List<Token> tokens) {
        final var lines = new ArrayList<List<Token>>();
        var current = new ArrayList<Token>();
        for (final var token : tokens) {
            if (token instanceof Token.Eof) {
                continue;
            }
            current.add(token);
            if (token.endsLine()) {
                lines.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }
        return lines;
    }

    private static void flushParagraph(final List<Token> paragraph, final List<Element> result) {
        if (!paragraph.isEmpty()) {
            result.add(new Element(ElementKind.PARAGRAPH, paragraph));
            paragraph.clear();
        }
    }
}
