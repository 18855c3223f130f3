// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.token;

import txxt.source.Span;

/**
 * The base interface for lexical tokens.
 * <p>
 * Tokens are immutable. Each one owns its span and the literal text it was read from, so that the token stream alone
 * is enough to reconstruct the source; {@link #sourceText()} returns that text. Structural tokens ({@link Indent},
 * {@link Dedent}, {@link Eof}) cover no characters and return an empty string.
 */
public sealed interface Token {
    Span span();

    /**
     * Returns the source text this token was read from.
     */
    String sourceText();

    /**
     * Returns {@code true} iff this token ends a physical line.
     */
    default boolean endsLine() {
        return this instanceof Newline || this instanceof BlankLine || this instanceof VerbatimContent;
    }

    /**
     * A run of ordinary text.
     */
    record Text(String content, Span span) implements Token {
        @Override
        public String sourceText() {
            return content;
        }
    }

    /**
     * A word starting with a letter or an underscore, like {@code _name}.
     */
    record Identifier(String content, Span span) implements Token {
        @Override
        public String sourceText() {
            return content;
        }
    }

    /**
     * A run of spaces and tabs.
     */
    record Whitespace(String content, Span span) implements Token {
        @Override
        public String sourceText() {
            return content;
        }
    }

    /**
     * A line break ending a non-blank line: {@code "\n"} or {@code "\r\n"}.
     */
    record Newline(String content, Span span) implements Token {
        @Override
        public String sourceText() {
            return content;
        }
    }

    /**
     * A line holding nothing but whitespace, including its line break. At the end of input the line break may be empty.
     */
    record BlankLine(String whitespace, String lineBreak, Span span) implements Token {
        @Override
        public String sourceText() {
            return whitespace + lineBreak;
        }
    }

    /**
     * The start of a deeper indentation level.
     */
    record Indent(Span span) implements Token {
        @Override
        public String sourceText() {
            return "";
        }
    }

    /**
     * The end of an indentation level.
     */
    record Dedent(Span span) implements Token {
        @Override
        public String sourceText() {
            return "";
        }
    }

    /**
     * A list or session numbering marker such as {@code "1."}, {@code "b)"}, {@code "iv."} or {@code "-"}.
     *
     * @param style   The numbering style.
     * @param value   The ordinal the marker denotes, or 0 for {@link SequenceStyle#PLAIN}.
     * @param level   The indentation depth of the line the marker starts, 0 at the outermost level.
     * @param content The marker text, without the space that must follow it.
     */
    record SequenceMarker(SequenceStyle style, int value, int level, String content, Span span) implements Token {
        @Override
        public String sourceText() {
            return content;
        }
    }

    /**
     * A {@code ::} opening or closing an annotation, or introducing a verbatim terminator label.
     */
    record AnnotationMarker(Span span) implements Token {
        @Override
        public String sourceText() {
            return "::";
        }
    }

    /**
     * A {@code ::} ending a definition term.
     */
    record DefinitionMarker(Span span) implements Token {
        @Override
        public String sourceText() {
            return "::";
        }
    }

    record Dash(Span span) implements Token {
        @Override
        public String sourceText() {
            return "-";
        }
    }

    record Period(Span span) implements Token {
        @Override
        public String sourceText() {
            return ".";
        }
    }

    record Colon(Span span) implements Token {
        @Override
        public String sourceText() {
            return ":";
        }
    }

    record LeftBracket(Span span) implements Token {
        @Override
        public String sourceText() {
            return "[";
        }
    }

    record RightBracket(Span span) implements Token {
        @Override
        public String sourceText() {
            return "]";
        }
    }

    record LeftParen(Span span) implements Token {
        @Override
        public String sourceText() {
            return "(";
        }
    }

    record RightParen(Span span) implements Token {
        @Override
        public String sourceText() {
            return ")";
        }
    }

    record AtSign(Span span) implements Token {
        @Override
        public String sourceText() {
            return "@";
        }
    }

    /**
     * A single inline formatting delimiter.
     */
    record InlineDelimiter(DelimiterKind kind, Span span) implements Token {
        @Override
        public String sourceText() {
            return String.valueOf(kind.character());
        }
    }

    /**
     * A footnote reference: {@code [3]} or {@code [^label]}.
     *
     * @param content The text between the brackets.
     */
    record FootnoteRef(String content, Span span) implements Token {
        public boolean isLabeled() {
            return content.startsWith("^");
        }

        /**
         * Returns the label of a labeled footnote, or the number of a naked one.
         */
        public String target() {
            return isLabeled() ? content.substring(1) : content;
        }

        @Override
        public String sourceText() {
            return "[" + content + "]";
        }
    }

    /**
     * A citation reference: {@code [@key]}.
     */
    record CitationRef(String key, Span span) implements Token {
        @Override
        public String sourceText() {
            return "[@" + key + "]";
        }
    }

    /**
     * A page reference: {@code [p.12]} or {@code [p.12-15]}.
     *
     * @param pages The page or page range after {@code "p."}.
     */
    record PageRef(String pages, Span span) implements Token {
        public int firstPage() {
            final var dash = pages.indexOf('-');
            return Integer.parseInt((dash < 0) ? pages : pages.substring(0, dash));
        }

        public int lastPage() {
            final var dash = pages.indexOf('-');
            return Integer.parseInt((dash < 0) ? pages : pages.substring(dash + 1));
        }

        @Override
        public String sourceText() {
            return "[p." + pages + "]";
        }
    }

    /**
     * A session reference: {@code [#2.1]}; {@code -1} addresses the last session at its level.
     */
    record SessionRef(String target, Span span) implements Token {
        @Override
        public String sourceText() {
            return "[#" + target + "]";
        }
    }

    /**
     * Any other bracketed reference, classified by its content.
     */
    record RefMarker(String content, ReferenceKind kind, Span span) implements Token {
        @Override
        public String sourceText() {
            return "[" + content + "]";
        }
    }

    /**
     * One {@code key=value} entry of an annotation parameter list.
     *
     * @param value The unescaped value; {@code "true"} for {@link ParameterForm#BARE} keys.
     * @param source The entry as written, from the key to the end of the value, blanks and escapes included.
     */
    record Parameter(String key, String value, ParameterForm form, String source, Span span) implements Token {
        @Override
        public String sourceText() {
            return source;
        }
    }

    /**
     * The title line of a verbatim block, from its first non-blank character to the end of the line.
     *
     * @param content The raw text, including the colon and any trailing blanks.
     */
    record VerbatimTitle(String content, Span span) implements Token {
        /**
         * Returns the title without its colon.
         */
        public String title() {
            final var stripped = content.stripTrailing();
            return stripped.substring(0, stripped.length() - 1).strip();
        }

        @Override
        public String sourceText() {
            return content;
        }
    }

    /**
     * The opaque lines of a verbatim block, line breaks included.
     */
    record VerbatimContent(String content, Span span) implements Token {
        @Override
        public String sourceText() {
            return content;
        }
    }

    /**
     * The end of input.
     */
    record Eof(Span span) implements Token {
        @Override
        public String sourceText() {
            return "";
        }
    }
}
