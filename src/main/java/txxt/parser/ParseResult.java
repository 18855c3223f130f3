// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.parser;

import java.util.List;
import txxt.block.BlockGroup;
import txxt.source.StructuralErrorCondition;
import txxt.structure.ClassifiedNode;
import txxt.token.Token;
import txxt.util.condition.Condition;

/**
 * The outcome of parsing one document.
 */
public sealed interface ParseResult {
    /**
     * Returns the non-fatal conditions signaled while parsing, in order.
     */
    List<Condition> warnings();

    /**
     * A complete parse.
     *
     * @param tokens   The flat token stream.
     * @param root     The root block group.
     * @param nodes    The classified top-level nodes.
     * @param warnings The non-fatal conditions signaled while parsing.
     */
    record Success(
        List<Token> tokens,
        BlockGroup root,
        List<ClassifiedNode> nodes,
        List<Condition> warnings
    ) implements ParseResult {
        public Success {
            tokens = List.copyOf(tokens);
            nodes = List.copyOf(nodes);
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * A parse aborted by a structural error. No later stage ran after the failing one.
     *
     * @param error    The structural error.
     * @param warnings The non-fatal conditions signaled before the error.
     */
    record Failure(StructuralErrorCondition error, List<Condition> warnings) implements ParseResult {
        public Failure {
            warnings = List.copyOf(warnings);
        }
    }
}
