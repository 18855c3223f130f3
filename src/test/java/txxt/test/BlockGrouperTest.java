// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.test;

import java.util.List;
import java.util.stream.LongStream;
import txxt.block.BlockGroup;
import txxt.block.BlockGrouper;
import txxt.block.BlockGroupingErrorCondition;
import txxt.lexer.Lexer;
import txxt.source.Position;
import txxt.source.Span;
import txxt.token.Token;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class BlockGrouperTest {
    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(8);
    }

    @Test
    void flatInputIsOneGroup() {
        final var root = BlockGrouper.group(Lexer.tokenize("one\ntwo\n"));
        assertThat(root.children()).isEmpty();
        assertThat(root.tokens()).hasSize(5);
        assertThat(root.anchor()).isZero();
        assertThat(root.startRow()).isZero();
    }

    @Test
    void nestsGroupsAndRecordsAnchors() {
        final var root = BlockGrouper.group(Lexer.tokenize("a\n    b\n        c\nd\n"));
        assertThat(root.tokens()).extracting(Token::sourceText).containsExactly("a", "\n", "d", "\n", "");
        assertThat(root.children()).hasSize(1);

        final var child = root.children().get(0);
        assertThat(child.anchor()).isEqualTo(2);
        assertThat(child.startRow()).isEqualTo(1);
        assertThat(child.tokens()).extracting(Token::sourceText).containsExactly("    ", "b", "\n");

        final var grandchild = child.children().get(0);
        assertThat(grandchild.anchor()).isEqualTo(3);
        assertThat(grandchild.tokens()).extracting(Token::sourceText).containsExactly("        ", "c", "\n");
        assertThat(grandchild.children()).isEmpty();
    }

    @Test
    void siblingsKeepSourceOrder() {
        final var root = BlockGrouper.group(Lexer.tokenize("a\n    b\nc\n    d\n"));
        assertThat(root.children()).extracting(BlockGroup::startRow).containsExactly(1, 3);
        assertThat(root.children()).extracting(BlockGroup::anchor).containsExactly(2, 4);
    }

    @Test
    void emptyGroupHasNoStart() {
        final var group = new BlockGroup(List.of(), List.of(), 0);
        assertThat(group.isEmpty()).isTrue();
        assertThat(group.start()).isNull();
        assertThat(group.startRow()).isEqualTo(-1);
    }

    @Test
    void unmatchedDedentIsFatal() {
        final var tokens = List.<Token>of(
            new Token.Text("x", new Span(Position.origin(), new Position(0, 1))),
            new Token.Dedent(Span.at(new Position(0, 1))),
            new Token.Eof(Span.at(new Position(0, 1)))
        );
        final var capture = ConditionCapture.run(() -> BlockGrouper.group(tokens));
        assertThat(capture.value()).isNull();
        assertThat(capture.error()).isInstanceOf(BlockGroupingErrorCondition.class);
        final var error = (BlockGroupingErrorCondition) capture.error();
        assertThat(error.kind()).isEqualTo(BlockGroupingErrorCondition.Kind.UNBALANCED_DEDENT);
        assertThat(error.position()).isEqualTo(new Position(0, 1));
    }

    @Test
    void unclosedIndentIsFatal() {
        final var tokens = List.<Token>of(
            new Token.Indent(Span.at(Position.origin())),
            new Token.Indent(Span.at(Position.origin())),
            new Token.Text("x", new Span(Position.origin(), new Position(0, 1))),
            new Token.Eof(Span.at(new Position(0, 1)))
        );
        final var capture = ConditionCapture.run(() -> BlockGrouper.group(tokens));
        final var error = (BlockGroupingErrorCondition) capture.error();
        assertThat(error).isNotNull();
        assertThat(error.kind()).isEqualTo(BlockGroupingErrorCondition.Kind.UNCLOSED_INDENT);
        assertThat(error.message()).startsWith("2 indentation level(s)");
    }

    @ParameterizedTest(name = seededTestDisplayName)
    @MethodSource("provideSeeds")
    void groupingKeepsEveryContentToken(final long seed) {
        final var tokens = Lexer.tokenize(RandomUtils.generateDocument(seed, 150));
        final var root = BlockGrouper.group(tokens);
        final var expected = tokens.stream()
            .filter(token -> !(token instanceof Token.Indent || token instanceof Token.Dedent))
            .count();
        assertThat(countTokens(root)).isEqualTo(expected);
        assertThat(depth(root)).isEqualTo(maxDepth(tokens));
    }

    private static long countTokens(final BlockGroup group) {
        var count = (long) group.tokens().size();
        for (final var child : group.children()) {
            count += countTokens(child);
        }
        return count;
    }

    private static int depth(final BlockGroup group) {
        var deepest = 0;
        for (final var child : group.children()) {
            deepest = Math.max(deepest, 1 + depth(child));
        }
        return deepest;
    }

    private static int maxDepth(final List<Token> tokens) {
        var depth = 0;
        var deepest = 0;
        for (final var token : tokens) {
            if (token instanceof Token.Indent) {
                depth += 1;
                deepest = Math.max(deepest, depth);
            } else if (token instanceof Token.Dedent) {
                depth -= 1;
            }
        }
        return deepest;
    }

    private static final String seededTestDisplayName = "{displayName} [{index}] seed = {0}";
}
