// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.parser;

import java.util.ArrayList;
import java.util.List;
import txxt.block.BlockGrouper;
import txxt.lexer.Lexer;
import txxt.source.StructuralErrorCondition;
import txxt.structure.SessionDisambiguator;
import txxt.util.Trace;
import txxt.util.UnreachableCodeReachedError;
import txxt.util.annotation.Nullable;
import txxt.util.condition.Condition;
import txxt.util.condition.ConditionContext;
import txxt.util.condition.Handler;
import txxt.util.condition.HandlerProcedure;
import txxt.util.condition.Restart;
import txxt.util.condition.SignaledCondition;

/**
 * Runs the whole front end on one document: tokenizing, block grouping and classification.
 * <p>
 * Every non-fatal condition signaled during the parse is collected as a warning, and is still passed on to older
 * handlers. A fatal {@link StructuralErrorCondition} aborts the parse through the {@code abort-parse} restart and is
 * returned as a {@link ParseResult.Failure}; other fatal conditions are left to older handlers.
 */
public final class DocumentParser {
    private DocumentParser() {
    }

    /**
     * Parses {@code source}.
     */
    public static ParseResult parse(final String source) {
        try (final var trace = new Trace("Parsing document")) {
            trace.use();
            final var collector = new Collector();
            final var success = ConditionContext.withRestart("abort-parse", restart -> {
                collector.abortRestart = restart;
                try (final var handler = new Handler(collector)) {
                    handler.use();
                    final var tokens = Lexer.tokenize(source);
                    final var root = BlockGrouper.group(tokens);
                    final var nodes = SessionDisambiguator.classify(root);
                    return new ParseResult.Success(tokens, root, nodes, collector.warnings);
                }
            });
            if (success != null) {
                return success;
            }
            final var error = collector.error;
            if (error == null) {
                throw new UnreachableCodeReachedError("Parse aborted without a structural error");
            }
            return new ParseResult.Failure(error, collector.warnings);
        }
    }

    private static final class Collector implements HandlerProcedure {
        @Override
        public void handle(final SignaledCondition signaled) {
            final var condition = signaled.condition();
            if (!signaled.isFatal()) {
                warnings.add(condition);
                return;
            }
            final var restart = abortRestart;
            if (condition instanceof final StructuralErrorCondition structuralError && restart != null) {
                error = structuralError;
                restart.unwindTo();
            }
        }

        private final List<Condition> warnings = new ArrayList<>();
        private @Nullable StructuralErrorCondition error = null;
        private @Nullable Restart abortRestart = null;
    }
}
