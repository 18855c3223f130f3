// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.test;

import java.util.List;
import txxt.detokenizer.Detokenizer;
import txxt.lexer.Lexer;
import txxt.source.Position;
import txxt.source.Span;
import txxt.token.ParameterForm;
import txxt.token.Token;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class DetokenizerTest {
    @Test
    void structuralTokensContributeNothing() {
        final var origin = Span.at(Position.origin());
        final var tokens = List.<Token>of(
            new Token.Indent(origin),
            new Token.Text("x", origin),
            new Token.Dedent(origin),
            new Token.Eof(origin)
        );
        assertThat(Detokenizer.detokenize(tokens)).isEqualTo("x");
    }

    @Test
    void writesParametersAsTheyWereWritten() {
        final var origin = Span.at(Position.origin());
        final var tokens = List.<Token>of(
            new Token.Parameter("a", "1", ParameterForm.UNQUOTED, "a = 1", origin),
            new Token.Text(",", origin),
            new Token.Parameter("flag", "true", ParameterForm.BARE, "flag", origin),
            new Token.Text(",", origin),
            new Token.Whitespace(" ", origin),
            new Token.Parameter("msg", "say \"hi\" \\q", ParameterForm.QUOTED, "msg=\"say \\\"hi\\\" \\q\"", origin)
        );
        assertThat(Detokenizer.detokenize(tokens)).isEqualTo("a = 1,flag, msg=\"say \\\"hi\\\" \\q\"");
    }

    @Test
    void keepsParameterSpacing() {
        final var source = ":: meta:a = 1 , b ::\n";
        assertThat(Detokenizer.detokenize(Lexer.tokenize(source))).isEqualTo(source);
    }

    @Test
    void reproducesDocumentWithEveryConstruct() {
        final var source = String.join("\n",
            "1. Introduction",
            "",
            "    See [@knuth84], [p.3-4] and [#2.1] or [https://example.org].",
            "",
            "    term ::",
            "        A *bold* _claim_ with `code` and #x^2#.",
            "",
            "Listing:",
            "    print(\"hi\")",
            ":: python",
            "",
            ":: note :: trailing words",
            ""
        );
        assertThat(Detokenizer.detokenize(Lexer.tokenize(source))).isEqualTo(source);
    }
}
