// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.util;

/**
 * Bypasses the checked exception mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} as if it were unchecked, whatever its type.
     * <p>
     * Reserved for throwables that every method could throw anyway, such as {@link txxt.util.condition.Unwind} or
     * {@link InterruptedException}. The return type lets call sites write {@code throw doThrow(...)}.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    // E erases to Throwable, so the cast vanishes from the bytecode while the compiler sees RuntimeException.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
