// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.structure;

import java.util.ArrayList;
import java.util.List;
import txxt.token.Token;
import txxt.util.annotation.Nullable;

/**
 * Locates the parts of every annotation line in a token stream, without attaching annotations to anything.
 */
public final class Annotations {
    private Annotations() {
    }

    /**
     * Returns one entry per line whose first content token is an annotation marker, in source order.
     * <p>
     * The label runs from the opening marker to the first colon, closing marker or end of line. Parameters are the
     * parameter tokens after the label's colon. Content is whatever follows the closing marker on the same line.
     */
    public static List<Annotation> extract(final List<Token> tokens) {
        final var result = new ArrayList<Annotation>();
        var lineStart = 0;
        for (int i = 0; i <= tokens.size(); i += 1) {
            if (i == tokens.size() || tokens.get(i).endsLine() || tokens.get(i) instanceof Token.Eof) {
                final var annotation = extractLine(tokens.subList(lineStart, i));
                if (annotation != null) {
                    result.add(annotation);
                }
                lineStart = i + 1;
            }
        }
        return result;
    }

    private static @Nullable Annotation extractLine(final List<Token> line) {
        var index = skipLayout(line, 0);
        if (index >= line.size() || !(line.get(index) instanceof final Token.AnnotationMarker opening)) {
            return null;
        }
        index += 1;
        final var label = new ArrayList<Token>();
        final var parameters = new ArrayList<Token>();
        Token.@Nullable AnnotationMarker closing = null;
        var inParameters = false;
        for (; index < line.size(); index += 1) {
            final var token = line.get(index);
            if (token instanceof final Token.AnnotationMarker marker) {
                closing = marker;
                index += 1;
                break;
            }
            if (!inParameters && token instanceof Token.Colon) {
                inParameters = true;
            } else if (inParameters) {
                if (token instanceof Token.Parameter) {
                    parameters.add(token);
                }
            } else if (!(token instanceof Token.Whitespace)) {
                label.add(token);
            }
        }
        final var content = new ArrayList<Token>();
        for (; index < line.size(); index += 1) {
            final var token = line.get(index);
            if (!(token instanceof Token.Dedent || token instanceof Token.Indent)) {
                content.add(token);
            }
        }
        return new Annotation(opening, closing, label, parameters, trimWhitespace(content));
    }

    private static int skipLayout(final List<Token> line, final int from) {
        var index = from;
        while (index < line.size() && (line.get(index) instanceof Token.Whitespace
            || line.get(index) instanceof Token.Indent || line.get(index) instanceof Token.Dedent)) {
            index += 1;
        }
        return index;
    }

    private static List<Token> trimWhitespace(final List<Token> tokens) {
        var from = 0;
        var to = tokens.size();
        while (from < to && tokens.get(from) instanceof Token.Whitespace) {
            from += 1;
        }
        while (to > from && tokens.get(to - 1) instanceof Token.Whitespace) {
            to -= 1;
        }
        return tokens.subList(from, to);
    }

    /**
     * The parts of one annotation line.
     *
     * @param opening    The opening marker.
     * @param closing    The closing marker, or {@code null} for a line such as a verbatim terminator that has none.
     * @param label      The label's tokens, whitespace excluded.
     * @param parameters The parameter tokens.
     * @param content    The tokens after the closing marker on the same line, surrounding whitespace excluded.
     */
    public record Annotation(
        Token.AnnotationMarker opening,
        Token.@Nullable AnnotationMarker closing,
        List<Token> label,
        List<Token> parameters,
        List<Token> content
    ) {
        public Annotation {
            label = List.copyOf(label);
            parameters = List.copyOf(parameters);
            content = List.copyOf(content);
        }

        /**
         * Returns the label as written.
         */
        public String labelText() {
            final var builder = new StringBuilder();
            for (final var token : label) {
                builder.append(token.sourceText());
            }
            return builder.toString();
        }
    }
}
