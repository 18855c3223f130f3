// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.util.condition.exception;

import java.io.PrintWriter;
import java.io.StringWriter;
import txxt.util.condition.Condition;

/**
 * Base type for conditions that wrap a caught Java exception.
 */
abstract class ExceptionCondition<E extends Exception> extends Condition {
    ExceptionCondition(final E exception) {
        super(String.valueOf(exception.getMessage()));
        this.exception = exception;
    }

    /**
     * Returns the wrapped exception.
     */
    public final E exception() {
        return exception;
    }

    @Override
    public String detailedMessage() {
        final var writer = new StringWriter();
        try (final var printWriter = new PrintWriter(writer)) {
            exception.printStackTrace(printWriter);
        }
        return writer.toString();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + exception;
    }

    private final E exception;
}
