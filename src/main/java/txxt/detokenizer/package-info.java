// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Regeneration of source text from a token stream.
 */
@NonNullByDefault
package txxt.detokenizer;

import txxt.util.annotation.NonNullByDefault;
