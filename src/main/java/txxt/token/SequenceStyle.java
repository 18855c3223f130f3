// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.token;

/**
 * The numbering style of a list or session sequence marker.
 */
public enum SequenceStyle {
    /** {@code "- "} */
    PLAIN,
    /** {@code "1. "}, {@code "12) "} */
    NUMERIC,
    /** {@code "a. "}, {@code "B) "} */
    ALPHABETIC,
    /** {@code "iv. "}, {@code "XII) "} */
    ROMAN,
}
