// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The lexer: a backtracking scanner that turns source text into a flat, position-tagged token stream with
 * indentation resolved into indent and dedent tokens.
 * <p>
 * {@link txxt.lexer.Lexer} drives a fixed-precedence family of micro-lexers, each of which either consumes one bounded
 * pattern or declines and leaves the cursor untouched.
 */
@NonNullByDefault
package txxt.lexer;

import txxt.util.annotation.NonNullByDefault;
