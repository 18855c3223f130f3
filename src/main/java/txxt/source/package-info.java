// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Source positions and the backtracking character cursor every recognizer scans with.
 */
@NonNullByDefault
package txxt.source;

import txxt.util.annotation.NonNullByDefault;
