// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.source;

/**
 * A half-open source range {@code [start, end)}.
 *
 * @param start The first position covered.
 * @param end   The position just past the last one covered; never before {@code start}.
 */
public record Span(Position start, Position end) {
    public Span {
        if (end.compareTo(start) < 0) {
            throw new IllegalArgumentException("Span end " + end + " precedes its start " + start);
        }
    }

    /**
     * Returns the zero-width span at the given position.
     */
    public static Span at(final Position position) {
        return new Span(position, position);
    }

    /**
     * Returns {@code true} iff this span covers no characters.
     */
    public boolean isEmpty() {
        return start.equals(end);
    }

    /**
     * Returns the smallest span covering both this span and {@code other}.
     */
    public Span cover(final Span other) {
        final var first = (start.compareTo(other.start) <= 0) ? start : other.start;
        final var last = (end.compareTo(other.end) >= 0) ? end : other.end;
        return new Span(first, last);
    }
}
