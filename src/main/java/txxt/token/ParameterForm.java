// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.token;

/**
 * How a parameter value was written.
 */
public enum ParameterForm {
    /** A key with no {@code =}, meaning {@code true}. */
    BARE,
    /** {@code key=value} */
    UNQUOTED,
    /** {@code key="value"}, with escape sequences. */
    QUOTED,
}
