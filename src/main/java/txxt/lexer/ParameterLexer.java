// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.ArrayList;
import java.util.List;
import txxt.source.Position;
import txxt.source.Span;
import txxt.token.ParameterForm;
import txxt.token.Token;
import txxt.util.condition.ConditionContext;

/**
 * Parser for parameter lists: {@code key=value,key2="quoted value",flag}.
 * <p>
 * Keys start with an ASCII letter or underscore and continue with letters, digits, {@code _ - .}, so namespaced keys
 * such as {@code org.example.key} are accepted; a trailing period is not part of the key. A key with no {@code =}
 * stands for the boolean {@code true}. Quoted values understand the escapes {@code \" \\ \n \t \r} and keep any other
 * backslash pair literally. Unquoted values run up to the next comma, trailing blanks excluded.
 * <p>
 * Separator commas become one-character text tokens and blanks between parameters become whitespace tokens, so the
 * source text of the result is the input minus any skipped characters.
 */
public final class ParameterLexer {
    private ParameterLexer() {
    }

    /**
     * Parses {@code raw}, which starts at {@code start} in the source and lies within one line.
     * <p>
     * A character that cannot start a key is skipped with a {@link SkippedCharacterCondition}. A quoted value with no
     * closing quote is a fatal {@link ParameterErrorCondition}.
     */
    public static List<Token> parse(final String raw, final Position start) {
        return new State(raw, start).parseAll();
    }

    static boolean isKeyStart(final int ch) {
        return CharClass.isAsciiLetter(ch) || ch == '_';
    }

    static boolean isKeyPart(final int ch) {
        return CharClass.isAsciiAlphanumeric(ch) || ch == '_' || ch == '-' || ch == '.';
    }

    private static final class State {
        State(final String raw, final Position start) {
            chars = raw.codePoints().toArray();
            this.start = start;
        }

        List<Token> parseAll() {
            final var result = new ArrayList<Token>();
            while (true) {
                final var blankStart = index;
                skipBlanks();
                if (index > blankStart) {
                    result.add(new Token.Whitespace(textOf(blankStart, index), spanOf(blankStart, index)));
                }
                if (index >= chars.length) {
                    return result;
                }
                final var ch = chars[index];
                if (ch == ',') {
                    result.add(new Token.Text(",", spanOf(index, index + 1)));
                    index += 1;
                } else if (isKeyStart(ch)) {
                    result.add(parseParameter());
                } else {
                    ConditionContext.signal(new SkippedCharacterCondition(start.plusColumns(index), ch));
                    index += 1;
                }
            }
        }

        private Token parseParameter() {
            final var keyStart = index;
            final var key = parseKey();
            final var keyEnd = index;
            skipBlanks();
            if (index >= chars.length || chars[index] != '=') {
                index = keyEnd;
                return new Token.Parameter(key, "true", ParameterForm.BARE, key, spanOf(keyStart, keyEnd));
            }
            index += 1;
            skipBlanks();
            if (index < chars.length && chars[index] == '"') {
                final var value = parseQuotedValue(key);
                return new Token.Parameter(
                    key, value, ParameterForm.QUOTED, textOf(keyStart, index), spanOf(keyStart, index)
                );
            }
            final var valueStart = index;
            while (index < chars.length && chars[index] != ',') {
                index += 1;
            }
            var valueEnd = index;
            while (valueEnd > valueStart && CharClass.isBlank(chars[valueEnd - 1])) {
                valueEnd -= 1;
            }
            index = valueEnd;
            return new Token.Parameter(
                key, textOf(valueStart, valueEnd), ParameterForm.UNQUOTED, textOf(keyStart, valueEnd),
                spanOf(keyStart, valueEnd)
            );
        }

        private String parseKey() {
            final var keyStart = index;
            index += 1;
            while (index < chars.length && isKeyPart(chars[index])) {
                index += 1;
            }
            if (chars[index - 1] == '.') {
                index -= 1;
            }
            return textOf(keyStart, index);
        }

        private String parseQuotedValue(final String key) {
            final var quote = index;
            index += 1;
            final var builder = new StringBuilder();
            while (index < chars.length) {
                final var ch = chars[index];
                if (ch == '"') {
                    index += 1;
                    return builder.toString();
                }
                if (ch == '\\' && index + 1 < chars.length) {
                    final var escaped = chars[index + 1];
                    switch (escaped) {
                        case '"' -> builder.append('"');
                        case '\\' -> builder.append('\\');
                        case 'n' -> builder.append('\n');
                        case 't' -> builder.append('\t');
                        case 'r' -> builder.append('\r');
                        default -> builder.append('\\').appendCodePoint(escaped);
                    }
                    index += 2;
                    continue;
                }
                builder.appendCodePoint(ch);
                index += 1;
            }
            throw ConditionContext.error(new ParameterErrorCondition(
                "Unterminated quoted value for parameter \"" + key + '"',
                start.plusColumns(quote)
            ));
        }

        private void skipBlanks() {
            while (index < chars.length && CharClass.isBlank(chars[index])) {
                index += 1;
            }
        }

        private String textOf(final int from, final int to) {
            return new String(chars, from, to - from);
        }

        private Span spanOf(final int from, final int to) {
            return new Span(start.plusColumns(from), start.plusColumns(to));
        }

        private final int[] chars;
        private final Position start;
        private int index = 0;
    }
}
