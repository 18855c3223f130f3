// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.lexer;

import java.util.List;
import java.util.regex.Pattern;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import txxt.token.ReferenceKind;

/**
 * Classifies the content of a bracketed reference by what it looks like it points to.
 * <p>
 * Classification is pure string matching against fixed patterns, tried in {@link ReferenceKind} declaration order.
 * The patterns are compiled once, on first use, and shared read-only between threads.
 */
public final class ReferenceClassifier {
    private ReferenceClassifier() {
    }

    /**
     * Classifies the given reference content. Surrounding whitespace is ignored; blank content is
     * {@link ReferenceKind#UNRESOLVED}.
     */
    @CheckReturnValue
    public static ReferenceKind classify(final String content) {
        final var trimmed = content.strip();
        if (trimmed.isEmpty()) {
            return ReferenceKind.UNRESOLVED;
        }
        for (final var rule : Rules.rules) {
            if (rule.pattern().matcher(trimmed).find()) {
                return rule.kind();
            }
        }
        return ReferenceKind.UNRESOLVED;
    }

    private record Rule(ReferenceKind kind, Pattern pattern) {
    }

    // Put the patterns in a separate class for lazy initialization.
    private static final class Rules {
        private static final List<Rule> rules = List.of(
            new Rule(ReferenceKind.URL, Pattern.compile("^(https?|ftp)://\\S+")),
            new Rule(ReferenceKind.URL, Pattern.compile(
                "(?i)^(www\\.[a-z0-9][a-z0-9.-]*\\.[a-z]{2,}"
                    + "|[a-z0-9][a-z0-9-]*(\\.[a-z0-9-]+)*"
                    + "\\.(com|org|net|edu|gov|mil|int|info|biz|name|pro|museum|coop|aero|co\\.uk|[a-z]{2}))"
                    + "(/.*)?$")),
            new Rule(ReferenceKind.URL, Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$")),
            new Rule(ReferenceKind.SECTION, Pattern.compile("^#(-1|[0-9]+)(\\.(-1|[0-9]+))*$")),
            new Rule(ReferenceKind.FOOTNOTE, Pattern.compile("^[0-9]+$")),
            new Rule(ReferenceKind.CITATION,
                Pattern.compile("^@[a-zA-Z0-9_-]+(,[a-zA-Z0-9_-]+)*([,\\s]+p\\.[0-9,\\s-]+)?$")),
            new Rule(ReferenceKind.CITATION, Pattern.compile("^pp?\\.[0-9,\\s-]+$")),
            new Rule(ReferenceKind.TO_COME, Pattern.compile("^(?i:tk)(-[a-z0-9]{1,20})?$")),
            new Rule(ReferenceKind.FILE, Pattern.compile("^[./]"))
        );
    }
}
