// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.structure;

/**
 * What kind of body a block group is being read as.
 */
public enum ParseContext {
    /**
     * The document itself or a session's body: nested sessions are allowed.
     */
    SESSION("session"),
    /**
     * The body of a list item, definition or annotation: nested sessions are forbidden.
     */
    CONTENT("content container");

    ParseContext(final String readableName) {
        this.readableName = readableName;
    }

    @Override
    public String toString() {
        return readableName;
    }

    private final String readableName;
}
