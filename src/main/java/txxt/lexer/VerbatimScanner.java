// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import txxt.util.Trace;
import txxt.util.annotation.Nullable;

/**
 * Line-level pre-scan that finds verbatim blocks before tokenization, so that their opaque content never reaches the
 * indentation tracker or the micro-lexers.
 * <p>
 * A verbatim block is a title line ending in a single colon, then its content, then a terminator line
 * {@code :: label} (optionally {@code :: label:params}) at exactly the title's indentation. The first non-blank line
 * after the title decides the mode: indented one step deeper than the title for a normal block, at column 0 for a
 * stretched block, or the terminator itself for an empty block. Any later content line breaking the mode abandons the
 * candidate, and scanning resumes on the line after its title.
 */
public final class VerbatimScanner {
    private VerbatimScanner() {
    }

    /**
     * Finds every verbatim block in {@code source}, in order.
     */
    public static List<VerbatimBlock> scan(final String source) {
        try (final var trace = new Trace("Scanning for verbatim blocks")) {
            trace.use();
            final var lines = splitLines(source);
            final var result = new ArrayList<VerbatimBlock>();
            var row = 0;
            while (row < lines.size()) {
                final var block = isTitle(lines.get(row)) ? tryBlockAt(lines, row) : null;
                if (block != null) {
                    result.add(block);
                    row = block.terminatorRow() + 1;
                } else {
                    row += 1;
                }
            }
            return result;
        }
    }

    static boolean isTitle(final String line) {
        final var stripped = line.strip();
        if (stripped.length() < 2 || !stripped.endsWith(":") || stripped.endsWith("::")) {
            return false;
        }
        return !Patterns.annotationLine.matcher(line).find();
    }

    static boolean isTerminator(final String line, final int titleIndent) {
        return indentOf(line) == titleIndent && Patterns.terminator.matcher(line).matches();
    }

    private static @Nullable VerbatimBlock tryBlockAt(final List<String> lines, final int titleRow) {
        final var titleIndent = indentOf(lines.get(titleRow));
        @Nullable VerbatimMode mode = null;
        for (int row = titleRow + 1; row < lines.size(); row += 1) {
            final var line = lines.get(row);
            if (line.isBlank()) {
                continue;
            }
            if (isTerminator(line, titleIndent)) {
                return new VerbatimBlock(titleRow, row, titleIndent, (mode == null) ? VerbatimMode.EMPTY : mode);
            }
            final var indent = indentOf(line);
            if (mode == null) {
                if (Patterns.annotationLine.matcher(line).find()) {
                    return null;
                }
                if (indent == 0) {
                    mode = VerbatimMode.STRETCHED;
                } else if (indent == titleIndent + IndentationTracker.indentWidth) {
                    mode = VerbatimMode.NORMAL;
                } else {
                    return null;
                }
            } else if (!fitsMode(mode, indent, titleIndent)) {
                return null;
            }
        }
        return null;
    }

    private static boolean fitsMode(final VerbatimMode mode, final int indent, final int titleIndent) {
        return (mode == VerbatimMode.STRETCHED) ? indent == 0 : indent >= titleIndent + IndentationTracker.indentWidth;
    }

    private static int indentOf(final String line) {
        return IndentationTracker.measure(line.substring(0, IndentationTracker.leadingLength(line)));
    }

    private static List<String> splitLines(final String source) {
        final var result = new ArrayList<String>();
        for (final var line : source.split("\n", -1)) {
            result.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return result;
    }

    /**
     * How a verbatim block's content is laid out.
     */
    public enum VerbatimMode {
        /**
         * Content indented one step deeper than the title.
         */
        NORMAL,
        /**
         * Content starting at column 0, whatever the title's indentation.
         */
        STRETCHED,
        /**
         * No content lines at all.
         */
        EMPTY,
    }

    /**
     * One verbatim block found by the scanner.
     *
     * @param titleRow      The row of the title line.
     * @param terminatorRow The row of the terminator line.
     * @param titleIndent   The indentation width shared by the title and the terminator.
     * @param mode          The content layout.
     */
    public record VerbatimBlock(int titleRow, int terminatorRow, int titleIndent, VerbatimMode mode) {
        /**
         * Returns {@code true} iff the block has at least one line between its title and its terminator.
         */
        public boolean hasContent() {
            return terminatorRow > titleRow + 1;
        }
    }

    private static final class Patterns {
        private static final Pattern annotationLine = Pattern.compile("::.*::");
        private static final Pattern terminator =
            Pattern.compile("^[ \\t]*::[ \\t]+[A-Za-z_][A-Za-z0-9._-]*(?::[^:\\s].*)?\\s*$");
    }
}
