// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.detokenizer;

import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import txxt.token.Token;

/**
 * Turns a token stream back into source text.
 * <p>
 * Every token contributes its {@link Token#sourceText()}; indents, dedents and the end of input contribute nothing, as
 * indentation is carried by whitespace tokens. For a stream produced by the lexer from input with no skipped
 * characters, the result is the original input.
 */
public final class Detokenizer {
    private Detokenizer() {
    }

    @CheckReturnValue
    public static String detokenize(final List<Token> tokens) {
        final var builder = new StringBuilder();
        for (final var token : tokens) {
            builder.append(token.sourceText());
        }
        return builder.toString();
    }
}
