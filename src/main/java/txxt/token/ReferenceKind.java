// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.token;

/**
 * What the content of a bracketed reference looks like it points to.
 * <p>
 * Constants are declared in classification precedence order: the first kind whose pattern accepts the content wins.
 */
public enum ReferenceKind {
    URL,
    SECTION,
    FOOTNOTE,
    CITATION,
    TO_COME,
    FILE,
    UNRESOLVED,
}
