// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.structure;

import txxt.source.LocatedCondition;
import txxt.source.Position;

/**
 * A non-fatal condition signaled for an indented block that no preceding element can own. The block is left out of
 * the classified structure.
 */
public final class DanglingBlockCondition extends LocatedCondition {
    DanglingBlockCondition(final String message, final Position position) {
        super(message, position);
    }
}
