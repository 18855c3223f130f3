// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Condition and restart system modelled on Common Lisp.
 * <p>
 * The pipeline reports structural errors as fatal conditions and recoverable oddities (skipped characters, ignored
 * blocks) as non-fatal ones; callers decide what to do with them by installing {@link txxt.util.condition.Handler}s.
 */
@NonNullByDefault
package txxt.util.condition;

import txxt.util.annotation.NonNullByDefault;
