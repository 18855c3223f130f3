// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import txxt.source.Position;
import txxt.source.Span;
import txxt.token.Token;
import txxt.util.condition.ConditionContext;

/**
 * Turns changes in leading whitespace into indent and dedent tokens, one physical line at a time.
 * <p>
 * The tracker keeps a stack of the indentation widths seen so far, strictly increasing from the bottom, which always
 * holds width 0. A space counts as one column and a tab as {@link #indentWidth} columns. Blank lines never change the
 * stack. The tracker never looks past a line's leading whitespace.
 */
public final class IndentationTracker {
    /**
     * Initializes a tracker at the outermost level.
     */
    public IndentationTracker() {
        levels.push(0);
    }

    /**
     * Returns the tokens that go before the content of the given line.
     * <p>
     * A deeper line pushes its width and produces one indent. A shallower line produces one dedent for each popped
     * level; if its width was never on the stack, the width is pushed and one indent follows the dedents, so that the
     * stream stays balanced. Indents and dedents are zero-width, at the start of the line.
     *
     * @param line The line's text, without its line break.
     * @param row  The line's row, used for the tokens' spans.
     */
    public List<Token> processLine(final String line, final int row) {
        if (line.isBlank()) {
            return List.of();
        }
        final var leading = leadingLength(line);
        final var width = measure(line.substring(0, leading));
        final var lineStart = new Position(row, 0);
        if (width % indentWidth != 0) {
            ConditionContext.signal(new MisalignedIndentationCondition(lineStart, width));
        }
        final var top = levels.peek();
        final var result = new ArrayList<Token>();
        if (width > top) {
            levels.push(width);
            result.add(new Token.Indent(Span.at(lineStart)));
        } else if (width < top) {
            while (levels.peek() > width) {
                levels.pop();
                result.add(new Token.Dedent(Span.at(lineStart)));
            }
            if (levels.peek() < width) {
                levels.push(width);
                result.add(new Token.Indent(Span.at(lineStart)));
            }
        }
        return result;
    }

    /**
     * Closes every level still open, returning one dedent per level, all at {@code end}.
     */
    public List<Token> finish(final Position end) {
        final var result = new ArrayList<Token>();
        while (levels.size() > 1) {
            levels.pop();
            result.add(new Token.Dedent(Span.at(end)));
        }
        return result;
    }

    /**
     * Returns the number of open levels above the outermost one.
     */
    public int depth() {
        return levels.size() - 1;
    }

    /**
     * Returns the column width of a run of blanks.
     */
    public static int measure(final String blanks) {
        var width = 0;
        for (int i = 0; i < blanks.length(); i += 1) {
            width += (blanks.charAt(i) == '\t') ? indentWidth : 1;
        }
        return width;
    }

    /**
     * Returns the number of leading space and tab characters of {@code line}.
     */
    public static int leadingLength(final String line) {
        var length = 0;
        while (length < line.length() && CharClass.isBlank(line.charAt(length))) {
            length += 1;
        }
        return length;
    }

    /**
     * The width of one indentation step, in columns.
     */
    public static final int indentWidth = 4;

    private final Deque<Integer> levels = new ArrayDeque<>();
}
