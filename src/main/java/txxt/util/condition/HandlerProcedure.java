// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.util.condition;

/**
 * The procedure run by a {@link Handler} for every signaled condition.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Processes the given condition.
     * <p>
     * Returning normally declines the condition and lets older handlers see it. Handling it means transferring control
     * elsewhere, usually with {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition) throws Unwind;
}
