// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.source;

import txxt.util.condition.Condition;

/**
 * Base type for conditions tied to a place in the source text.
 */
public abstract class LocatedCondition extends Condition {
    protected LocatedCondition(final String message, final Position position) {
        super(message);
        this.position = position;
    }

    /**
     * Returns where in the source the condition arose.
     */
    public final Position position() {
        return position;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nAt " + position.describe();
    }

    private final Position position;
}
