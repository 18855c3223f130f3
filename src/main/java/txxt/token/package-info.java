// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The flat token vocabulary produced by the lexer.
 */
@NonNullByDefault
package txxt.token;

import txxt.util.annotation.NonNullByDefault;
