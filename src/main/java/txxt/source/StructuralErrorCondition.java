// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.source;

/**
 * Base type for the fatal conditions that abort a pipeline stage instead of guessing a repair: unbalanced
 * indentation structure and malformed parameter quoting.
 * <p>
 * {@link txxt.parser.DocumentParser} turns these into a failed parse result; any other fatal condition keeps
 * propagating.
 */
public abstract class StructuralErrorCondition extends LocatedCondition {
    protected StructuralErrorCondition(final String message, final Position position) {
        super(message, position);
    }
}
