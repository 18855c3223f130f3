// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A front end for the txxt plain-text markup language: lexer, block grouper and session disambiguator.
 */
module txxt {
    requires static org.checkerframework.checker.qual;
    requires static com.github.spotbugs.annotations;
    requires static jsr305;

    exports txxt.block;
    exports txxt.detokenizer;
    exports txxt.lexer;
    exports txxt.parser;
    exports txxt.source;
    exports txxt.structure;
    exports txxt.token;
    exports txxt.util.condition;
}
