// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The pipeline entry point, from source text to classified structure.
 */
@NonNullByDefault
package txxt.parser;

import txxt.util.annotation.NonNullByDefault;
