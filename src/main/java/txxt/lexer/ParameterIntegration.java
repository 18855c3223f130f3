// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import txxt.source.Span;
import txxt.token.Token;
import txxt.util.Trace;

/**
 * Post-pass folding the {@code label:params} part of annotation lines into a label, a colon and parameter tokens.
 * <p>
 * The micro-lexers read {@code :: python:version=3.11,mode="strict" ::} as unrelated text, identifiers and
 * punctuation. For every line whose first token is an annotation marker, this pass finds the first colon before the
 * closing marker; if the tokens before it spell a valid label and the parameter list starts right after it, the label
 * is folded into one text token and everything up to the closing marker, or the end of the line when there is none, is
 * re-parsed by {@link ParameterLexer}. A {@code ::} inside a quoted value does not close the annotation.
 */
public final class ParameterIntegration {
    private ParameterIntegration() {
    }

    /**
     * Returns the token stream with the parameters of every annotation line integrated.
     */
    public static List<Token> integrate(final List<Token> tokens) {
        try (final var trace = new Trace("Integrating annotation parameters")) {
            trace.use();
            final var result = new ArrayList<Token>(tokens.size());
            var lineStart = 0;
            for (int i = 0; i < tokens.size(); i += 1) {
                final var token = tokens.get(i);
                if (token.endsLine() || token instanceof Token.Eof) {
                    result.addAll(integrateLine(tokens.subList(lineStart, i)));
                    result.add(token);
                    lineStart = i + 1;
                }
            }
            result.addAll(integrateLine(tokens.subList(lineStart, tokens.size())));
            return result;
        }
    }

    private static List<Token> integrateLine(final List<Token> line) {
        final var marker = firstContentIndex(line);
        if (marker < 0 || !(line.get(marker) instanceof Token.AnnotationMarker)) {
            return line;
        }
        final var colon = findLabelColon(line, marker + 1);
        if (colon < 0 || colon + 1 >= line.size() || !startsParameters(line.get(colon + 1))) {
            return line;
        }
        var labelStart = marker + 1;
        while (labelStart < colon && line.get(labelStart) instanceof Token.Whitespace) {
            labelStart += 1;
        }
        if (labelStart == colon) {
            return line;
        }
        final var label = joinSourceText(line.subList(labelStart, colon));
        if (!Patterns.label.matcher(label).matches()) {
            return line;
        }
        final var regionEnd = findRegionEnd(line, colon + 1);
        final var region = line.subList(colon + 1, regionEnd);
        final var raw = joinSourceText(region);
        final var body = raw.stripTrailing();
        final var regionStart = region.get(0).span().start();

        final var result = new ArrayList<Token>(line.subList(0, labelStart));
        final var labelSpan = line.get(labelStart).span().cover(line.get(colon - 1).span());
        result.add(new Token.Text(label, labelSpan));
        result.add(line.get(colon));
        result.addAll(ParameterLexer.parse(body, regionStart));
        if (body.length() < raw.length()) {
            final var bodyEnd = regionStart.plusColumns(body.codePointCount(0, body.length()));
            final var regionEndPosition = region.get(region.size() - 1).span().end();
            result.add(new Token.Whitespace(raw.substring(body.length()), new Span(bodyEnd, regionEndPosition)));
        }
        result.addAll(line.subList(regionEnd, line.size()));
        return result;
    }

    private static int firstContentIndex(final List<Token> line) {
        for (int i = 0; i < line.size(); i += 1) {
            final var token = line.get(i);
            if (!(token instanceof Token.Whitespace || token instanceof Token.Indent || token instanceof Token.Dedent)) {
                return i;
            }
        }
        return -1;
    }

    // The first colon of the line, unless another annotation marker comes before it.
    private static int findLabelColon(final List<Token> line, final int from) {
        for (int i = from; i < line.size(); i += 1) {
            final var token = line.get(i);
            if (token instanceof Token.Colon) {
                return i;
            }
            if (token instanceof Token.AnnotationMarker) {
                return -1;
            }
        }
        return -1;
    }

    private static boolean startsParameters(final Token token) {
        final var text = token.sourceText();
        return !text.isEmpty() && ParameterLexer.isKeyStart(text.codePointAt(0));
    }

    // The index of the closing annotation marker outside any quoted value, of the first structural token, or the end.
    // A quoted value opens only at a quote right after a key's equals sign, blanks allowed between them; an unquoted
    // value runs to the next comma.
    private static int findRegionEnd(final List<Token> line, final int from) {
        var inQuotes = false;
        var escaped = false;
        var afterEquals = false;
        var inUnquotedValue = false;
        for (int i = from; i < line.size(); i += 1) {
            final var token = line.get(i);
            if (token instanceof Token.Indent || token instanceof Token.Dedent) {
                return i;
            }
            if (token instanceof Token.AnnotationMarker && !inQuotes) {
                return i;
            }
            final var text = token.sourceText();
            for (int j = 0; j < text.length(); j += 1) {
                final var ch = text.charAt(j);
                if (inQuotes) {
                    if (escaped) {
                        escaped = false;
                    } else if (ch == '\\') {
                        escaped = true;
                    } else if (ch == '"') {
                        inQuotes = false;
                    }
                } else if (inUnquotedValue) {
                    inUnquotedValue = ch != ',';
                } else if (afterEquals) {
                    if (!CharClass.isBlank(ch)) {
                        afterEquals = false;
                        inQuotes = ch == '"';
                        inUnquotedValue = !inQuotes && ch != ',';
                    }
                } else if (ch == '=') {
                    afterEquals = true;
                }
            }
        }
        return line.size();
    }

    private static String joinSourceText(final List<Token> tokens) {
        final var builder = new StringBuilder();
        for (final var token : tokens) {
            builder.append(token.sourceText());
        }
        return builder.toString();
    }

    private static final class Patterns {
        private static final Pattern label = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");
    }
}
