// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.structure;

/**
 * The line-level shapes an element can take.
 */
public enum ElementKind {
    PARAGRAPH("paragraph"),
    LIST_ITEM("list item"),
    DEFINITION("definition"),
    ANNOTATION("annotation"),
    VERBATIM("verbatim block"),
    BLANK_LINE("blank line");

    ElementKind(final String readableName) {
        this.readableName = readableName;
    }

    /**
     * Returns {@code true} iff an element of this kind takes an indented body as its content container.
     */
    public boolean ownsContent() {
        return this == LIST_ITEM || this == DEFINITION || this == ANNOTATION;
    }

    @Override
    public String toString() {
        return readableName;
    }

    private final String readableName;
}
