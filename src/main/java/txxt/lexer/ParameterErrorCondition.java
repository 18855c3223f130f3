// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import txxt.source.Position;
import txxt.source.StructuralErrorCondition;

/**
 * A fatal condition indicating malformed annotation parameters, such as a quoted value missing its closing quote.
 */
public final class ParameterErrorCondition extends StructuralErrorCondition {
    ParameterErrorCondition(final String message, final Position position) {
        super(message, position);
    }
}
