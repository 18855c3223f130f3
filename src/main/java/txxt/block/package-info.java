// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Folding of the flat token stream into a tree of per-indentation-level block groups.
 */
@NonNullByDefault
package txxt.block;

import txxt.util.annotation.NonNullByDefault;
