// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.source;

/**
 * A random-access cursor over the source text, with unlimited lookahead and cheap backtracking.
 * <p>
 * The text is held as an array of code points, so positions count characters rather than UTF-16 units or bytes. Only
 * {@code '\n'} moves to the next row; in a {@code "\r\n"} pair the carriage return counts as one more column of the
 * line it ends, so the pair forms a single logical break.
 * <p>
 * Recognizers {@link #save()} the cursor before an attempt and {@link #restore(Mark)} it when they decline.
 */
public final class Cursor {
    /**
     * Initializes a new cursor at the start of {@code source}.
     */
    public Cursor(final String source) {
        codePoints = source.codePoints().toArray();
    }

    /**
     * Returns {@code true} iff every character has been consumed.
     */
    public boolean reachedEnd() {
        return offset >= codePoints.length;
    }

    /**
     * Returns the current character without consuming it, or {@link #endOfInput}.
     */
    public int peek() {
        return peekAt(0);
    }

    /**
     * Returns the character {@code distance} characters ahead of the current one, or {@link #endOfInput}.
     */
    public int peekAt(final int distance) {
        final var index = offset + distance;
        return (index >= 0 && index < codePoints.length) ? codePoints[index] : endOfInput;
    }

    /**
     * Returns the character just before the current one, or {@link #endOfInput} at the start of the text.
     */
    public int previous() {
        return peekAt(-1);
    }

    /**
     * Consumes and returns the current character, or returns {@link #endOfInput} without moving.
     */
    public int advance() {
        if (reachedEnd()) {
            return endOfInput;
        }
        final var ch = codePoints[offset];
        offset += 1;
        if (ch == '\n') {
            row += 1;
            column = 0;
        } else {
            column += 1;
        }
        return ch;
    }

    /**
     * Consumes {@code count} characters, stopping early at the end of input.
     */
    public void advance(final int count) {
        for (int i = 0; i < count && !reachedEnd(); i += 1) {
            advance();
        }
    }

    /**
     * Returns {@code true} iff the text at the cursor starts with {@code prefix}.
     */
    public boolean lookingAt(final String prefix) {
        final var prefixCodePoints = prefix.codePoints().toArray();
        for (int i = 0; i < prefixCodePoints.length; i += 1) {
            if (peekAt(i) != prefixCodePoints[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Captures the cursor state.
     */
    public Mark save() {
        return new Mark(offset, row, column);
    }

    /**
     * Returns the cursor to a state captured earlier by {@link #save()}.
     */
    public void restore(final Mark mark) {
        offset = mark.offset();
        row = mark.row();
        column = mark.column();
    }

    public Position position() {
        return new Position(row, column);
    }

    public int offset() {
        return offset;
    }

    public int row() {
        return row;
    }

    public int column() {
        return column;
    }

    public int length() {
        return codePoints.length;
    }

    /**
     * Returns the text between two offsets.
     */
    public String slice(final int from, final int to) {
        return new String(codePoints, from, to - from);
    }

    /**
     * Returns the text from {@code from} up to the cursor.
     */
    public String sliceFrom(final int from) {
        return slice(from, offset);
    }

    /**
     * Returns the rest of the current line, from the cursor up to but excluding its line break.
     */
    public String restOfLine() {
        return slice(offset, lineEnd(offset));
    }

    /**
     * Returns the whole current line, excluding its line break.
     */
    public String currentLine() {
        return slice(offset - column, lineEnd(offset));
    }

    private int lineEnd(final int from) {
        var end = from;
        while (end < codePoints.length && codePoints[end] != '\n') {
            end += 1;
        }
        if (end > from && codePoints[end - 1] == '\r' && end < codePoints.length) {
            end -= 1;
        }
        return end;
    }

    /**
     * The value returned by the peek operations past either end of the text.
     */
    public static final int endOfInput = -1;

    private final int[] codePoints;
    private int offset = 0;
    private int row = 0;
    private int column = 0;

    /**
     * A saved cursor state.
     *
     * @param offset The index of the current character.
     * @param row    The current row.
     * @param column The current column.
     */
    public record Mark(int offset, int row, int column) {
        public Position position() {
            return new Position(row, column);
        }
    }
}
