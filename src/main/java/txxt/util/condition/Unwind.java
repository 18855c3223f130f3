// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.util.condition;

/**
 * The throwable that carries control flow from {@link Restart#unwindTo()} to the restart point.
 * <p>
 * It extends {@link Throwable} directly: it is neither an error nor an exception, and user code should never catch
 * it. It is only exposed so that methods can declare it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to restart " + target.name(), null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
