// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.test;

import java.util.List;
import txxt.lexer.IndentationTracker;
import txxt.lexer.MisalignedIndentationCondition;
import txxt.source.Position;
import txxt.source.Span;
import txxt.token.Token;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class IndentationTrackerTest {
    @Test
    void indentsAndDedentsOneLevelAtATime() {
        final var tracker = new IndentationTracker();
        assertThat(tracker.processLine("top", 0)).isEmpty();
        assertThat(tracker.processLine("    nested", 1)).containsExactly(new Token.Indent(at(1)));
        assertThat(tracker.depth()).isEqualTo(1);
        assertThat(tracker.processLine("        deeper", 2)).containsExactly(new Token.Indent(at(2)));
        assertThat(tracker.processLine("top again", 3)).containsExactly(new Token.Dedent(at(3)), new Token.Dedent(at(3)));
        assertThat(tracker.depth()).isZero();
    }

    @Test
    void blankLinesNeverChangeLevels() {
        final var tracker = new IndentationTracker();
        tracker.processLine("    nested", 0);
        assertThat(tracker.processLine("", 1)).isEmpty();
        assertThat(tracker.processLine("  \t ", 2)).isEmpty();
        assertThat(tracker.depth()).isEqualTo(1);
    }

    @Test
    void jumpingSeveralStepsOpensOneLevel() {
        final var tracker = new IndentationTracker();
        assertThat(tracker.processLine("            far", 0)).containsExactly(new Token.Indent(at(0)));
        assertThat(tracker.depth()).isEqualTo(1);
        assertThat(tracker.finish(new Position(1, 0))).containsExactly(new Token.Dedent(at(1)));
    }

    @Test
    void repairsDedentToUnknownLevel() {
        final var tracker = new IndentationTracker();
        tracker.processLine("a", 0);
        tracker.processLine("        b", 1);
        final var tokens = tracker.processLine("    c", 2);
        assertThat(tokens).containsExactly(new Token.Dedent(at(2)), new Token.Indent(at(2)));
        assertThat(tracker.depth()).isEqualTo(1);
    }

    @Test
    void signalsMisalignedIndentation() {
        final var tracker = new IndentationTracker();
        final var capture = ConditionCapture.<List<Token>>run(() -> tracker.processLine("  two", 5));
        assertThat(capture.value()).containsExactly(new Token.Indent(at(5)));
        final var warnings = capture.warningsOfType(MisalignedIndentationCondition.class);
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).width()).isEqualTo(2);
        assertThat(warnings.get(0).position()).isEqualTo(new Position(5, 0));
    }

    @Test
    void finishClosesEverything() {
        final var tracker = new IndentationTracker();
        tracker.processLine("    a", 0);
        tracker.processLine("        b", 1);
        final var end = new Position(2, 3);
        assertThat(tracker.finish(end)).containsExactly(new Token.Dedent(Span.at(end)), new Token.Dedent(Span.at(end)));
        assertThat(tracker.depth()).isZero();
        assertThat(tracker.finish(end)).isEmpty();
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', quoteCharacter = '\'', value = {
        "''|0",
        "' '|1",
        "'    '|4",
        "'\t'|4",
        "' \t'|5",
        "'\t\t  '|10",
    })
    void measuresLeadingBlanks(final String blanks, final int width) {
        assertThat(IndentationTracker.measure(blanks)).isEqualTo(width);
        assertThat(IndentationTracker.leadingLength(blanks + "x ")).isEqualTo(blanks.length());
    }

    private static Span at(final int row) {
        return Span.at(new Position(row, 0));
    }
}
