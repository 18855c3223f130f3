// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.Arrays;

enum CharClass {
    REGULAR,
    BLANK,
    LINE_BREAK,
    OTHER_WHITESPACE,
    DELIMITER;

    static CharClass of(final int ch) {
        if (ch >= 0 && ch < asciiClasses.length) {
            return asciiClasses[ch];
        }
        return Character.isWhitespace(ch) ? OTHER_WHITESPACE : REGULAR;
    }

    static boolean isBlank(final int ch) {
        return ch == ' ' || ch == '\t';
    }

    static boolean isWhitespace(final int ch) {
        final var charClass = of(ch);
        return charClass == BLANK || charClass == LINE_BREAK || charClass == OTHER_WHITESPACE;
    }

    static boolean isAsciiDigit(final int ch) {
        return ch >= '0' && ch <= '9';
    }

    static boolean isAsciiLetter(final int ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    static boolean isAsciiAlphanumeric(final int ch) {
        return isAsciiLetter(ch) || isAsciiDigit(ch);
    }

    private static final CharClass[] asciiClasses;

    static {
        final var classes = new CharClass[128];
        Arrays.fill(classes, REGULAR);
        for (int ch = 0; ch < 0x20; ch += 1) {
            classes[ch] = Character.isWhitespace(ch) ? OTHER_WHITESPACE : REGULAR;
        }
        classes[' '] = BLANK;
        classes['\t'] = BLANK;
        classes['\n'] = LINE_BREAK;
        classes['\r'] = LINE_BREAK;
        for (final var ch : "*_`#-[]:()=,.\\".toCharArray()) {
            classes[ch] = DELIMITER;
        }
        asciiClasses = classes;
    }
}
