// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.source;

/**
 * A zero-based {@code (row, column)} location in the source, counted in Unicode code points.
 *
 * @param row    The line, starting at 0.
 * @param column The code point offset within the line, starting at 0.
 */
public record Position(int row, int column) implements Comparable<Position> {
    public Position {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Negative position (" + row + ", " + column + ")");
        }
    }

    /**
     * Returns the position of the first character of the source.
     */
    public static Position origin() {
        return origin;
    }

    /**
     * Returns this position moved {@code count} code points to the right on the same line.
     */
    public Position plusColumns(final int count) {
        return new Position(row, column + count);
    }

    /**
     * Describes this position for humans, with 1-based numbers.
     */
    public String describe() {
        return "line " + (row + 1) + ", column " + (column + 1);
    }

    @Override
    public int compareTo(final Position other) {
        return (row != other.row) ? Integer.compare(row, other.row) : Integer.compare(column, other.column);
    }

    private static final Position origin = new Position(0, 0);
}
