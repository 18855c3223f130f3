// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import txxt.source.Cursor;
import txxt.source.Span;
import txxt.token.Token;
import txxt.util.Trace;
import txxt.util.annotation.Nullable;
import txxt.util.condition.ConditionContext;

/**
 * The lexer orchestrator, turning source text into a flat token stream.
 * <p>
 * At the start of every physical line the indentation tracker runs first, so its indent and dedent tokens precede the
 * line's content. Then, at each position, the lexer tries in order: a blank line, a verbatim title or a sequence marker
 * at the start of a line's content, a line break, a whitespace run, and the {@link Recognizer} family. A character no
 * recognizer accepts is skipped with a {@link SkippedCharacterCondition}. The content lines of verbatim blocks become a
 * single opaque token and are hidden from the tracker.
 * <p>
 * The resulting stream is indentation-balanced, ends with exactly one {@link Token.Eof}, and has its annotation
 * parameters integrated by {@link ParameterIntegration}.
 */
public final class Lexer {
    private Lexer(final String source) {
        cursor = new Cursor(source);
        for (final var block : VerbatimScanner.scan(source)) {
            verbatimTitles.put(block.titleRow(), block);
            if (block.hasContent()) {
                verbatimContents.put(block.titleRow() + 1, block);
            }
        }
    }

    /**
     * Tokenizes {@code source}.
     * <p>
     * Signals {@link SkippedCharacterCondition} and {@link MisalignedIndentationCondition} as warnings; a malformed
     * parameter list is a fatal {@link ParameterErrorCondition}.
     */
    public static List<Token> tokenize(final String source) {
        try (final var trace = new Trace(() -> "Tokenizing source text of " + source.length() + " characters")) {
            trace.use();
            return new Lexer(source).run();
        }
    }

    private List<Token> run() {
        while (!cursor.reachedEnd()) {
            if (cursor.column() == 0) {
                final var verbatim = verbatimContents.get(cursor.row());
                if (verbatim != null) {
                    tokens.add(readVerbatimContent(verbatim));
                    continue;
                }
                tokens.addAll(tracker.processLine(cursor.currentLine(), cursor.row()));
                final var blankLine = readBlankLine();
                if (blankLine != null) {
                    tokens.add(blankLine);
                    continue;
                }
            }
            final var token = readToken();
            if (token != null) {
                tokens.add(token);
            } else {
                final var position = cursor.position();
                ConditionContext.signal(new SkippedCharacterCondition(position, cursor.advance()));
            }
        }
        final var end = cursor.position();
        tokens.addAll(tracker.finish(end));
        tokens.add(new Token.Eof(Span.at(end)));
        return ParameterIntegration.integrate(tokens);
    }

    private @Nullable Token readToken() {
        if (atLineContentStart()) {
            if (verbatimTitles.containsKey(cursor.row())) {
                return readVerbatimTitle();
            }
            final var marker = SequenceMarkerLexer.read(cursor, tracker.depth());
            if (marker != null) {
                return marker;
            }
        }
        final var lineBreak = readNewline();
        if (lineBreak != null) {
            return lineBreak;
        }
        final var whitespace = readWhitespace();
        if (whitespace != null) {
            return whitespace;
        }
        return Recognizer.readAny(cursor);
    }

    // Only blanks between the start of the line and the cursor, and something else at the cursor.
    private boolean atLineContentStart() {
        final var ch = cursor.peek();
        if (ch == Cursor.endOfInput || CharClass.isWhitespace(ch)) {
            return false;
        }
        for (int distance = 1; distance <= cursor.column(); distance += 1) {
            if (!CharClass.isBlank(cursor.peekAt(-distance))) {
                return false;
            }
        }
        return true;
    }

    private @Nullable Token readBlankLine() {
        final var start = cursor.save();
        while (CharClass.isBlank(cursor.peek())) {
            cursor.advance();
        }
        final var whitespace = cursor.sliceFrom(start.offset());
        final var lineBreak = lineBreakLength();
        if (lineBreak == 0 && !(cursor.reachedEnd() && !whitespace.isEmpty())) {
            cursor.restore(start);
            return null;
        }
        final var breakStart = cursor.offset();
        cursor.advance(lineBreak);
        return new Token.BlankLine(
            whitespace,
            cursor.sliceFrom(breakStart),
            new Span(start.position(), cursor.position())
        );
    }

    private @Nullable Token readNewline() {
        final var length = lineBreakLength();
        if (length == 0) {
            return null;
        }
        final var start = cursor.save();
        cursor.advance(length);
        return new Token.Newline(cursor.sliceFrom(start.offset()), new Span(start.position(), cursor.position()));
    }

    // A whitespace run never includes a line break.
    private @Nullable Token readWhitespace() {
        final var start = cursor.save();
        while (CharClass.isWhitespace(cursor.peek()) && lineBreakLength() == 0) {
            cursor.advance();
        }
        if (cursor.offset() == start.offset()) {
            return null;
        }
        return new Token.Whitespace(cursor.sliceFrom(start.offset()), new Span(start.position(), cursor.position()));
    }

    private int lineBreakLength() {
        if (cursor.peek() == '\n') {
            return 1;
        }
        return (cursor.peek() == '\r' && cursor.peekAt(1) == '\n') ? 2 : 0;
    }

    private Token readVerbatimTitle() {
        final var start = cursor.save();
        final var title = cursor.restOfLine();
        cursor.advance(title.codePointCount(0, title.length()));
        return new Token.VerbatimTitle(title, new Span(start.position(), cursor.position()));
    }

    private Token readVerbatimContent(final VerbatimScanner.VerbatimBlock block) {
        try (final var trace = new Trace(() -> "Reading verbatim block content at line " + (block.titleRow() + 2))) {
            trace.use();
            final var start = cursor.save();
            while (!cursor.reachedEnd() && cursor.row() < block.terminatorRow()) {
                cursor.advance();
            }
            return new Token.VerbatimContent(
                cursor.sliceFrom(start.offset()),
                new Span(start.position(), cursor.position())
            );
        }
    }

    private final Cursor cursor;
    private final IndentationTracker tracker = new IndentationTracker();
    private final List<Token> tokens = new ArrayList<>();
    private final Map<Integer, VerbatimScanner.VerbatimBlock> verbatimTitles = new HashMap<>();
    private final Map<Integer, VerbatimScanner.VerbatimBlock> verbatimContents = new HashMap<>();
}
