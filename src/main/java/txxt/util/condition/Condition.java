// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that happened, which code further up the call stack may want to react to. Handlers
 * run <em>before</em> the stack is unwound, so they can still see restart points established below them.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the short user-readable message of this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable message, including any location information the condition carries.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + message;
    }

    private final String message;
}
