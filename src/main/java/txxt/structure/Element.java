// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.structure;

import java.util.List;
import txxt.source.Span;
import txxt.token.Token;

/**
 * One or more consecutive lines of a block group read as a unit.
 *
 * @param kind   The element's shape.
 * @param tokens The element's tokens, line breaks included; never empty.
 */
public record Element(ElementKind kind, List<Token> tokens) {
    public Element {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("Element without tokens");
        }
        tokens = List.copyOf(tokens);
    }

    public Span span() {
        return tokens.get(0).span().cover(tokens.get(tokens.size() - 1).span());
    }

    public int startRow() {
        return tokens.get(0).span().start().row();
    }

    /**
     * Returns the row of the element's last line.
     */
    public int endRow() {
        return tokens.get(tokens.size() - 1).span().start().row();
    }

    public boolean isBlank() {
        return kind == ElementKind.BLANK_LINE;
    }

    /**
     * Returns the element's source text with surrounding whitespace and line breaks removed.
     */
    public String text() {
        final var builder = new StringBuilder();
        for (final var token : tokens) {
            builder.append(token.sourceText());
        }
        return builder.toString().strip();
    }
}
