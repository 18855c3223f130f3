// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import txxt.parser.DocumentParser;
import txxt.parser.ParseResult;
import txxt.util.Trace;
import txxt.util.annotation.Nullable;
import txxt.util.condition.ConditionContext;
import txxt.util.condition.Handler;
import txxt.util.condition.exception.IOExceptionCondition;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        final var invocation = parseArguments(args);
        if (invocation == null) {
            try (final var streams = Streams.acquire()) {
                streams.err().println("Usage: txxt [--tokens | --groups | --tree] <file>");
                return ExitCode.USAGE;
            }
        }

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> run(invocation));
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static ExitCode run(final Invocation invocation) {
        final var source = readSource(invocation.path());
        final var result = DocumentParser.parse(source);
        if (result instanceof final ParseResult.Failure failure) {
            try (final var streams = Streams.acquire()) {
                FallbackHandler.showCondition(streams, failure.error(), "A structural error");
            }
            return ExitCode.ERROR;
        }
        final var success = (ParseResult.Success) result;
        try (final var streams = Streams.acquire()) {
            final var out = streams.out();
            switch (invocation.view()) {
                case TOKENS -> Dumper.dumpTokens(out, success.tokens());
                case GROUPS -> Dumper.dumpGroups(out, success.root());
                case TREE -> Dumper.dumpNodes(out, success.nodes());
            }
            out.flush();
        }
        return ExitCode.SUCCESS;
    }

    private static String readSource(final Path path) {
        try (final var trace = new Trace(() -> "Reading source text from " + path)) {
            trace.use();
            try {
                return Files.readString(path, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    static @Nullable Invocation parseArguments(final String[] args) {
        var view = View.TREE;
        @Nullable Path path = null;
        for (final var arg : args) {
            if (arg.startsWith("--")) {
                final var option = View.ofOption(arg);
                if (option == null) {
                    return null;
                }
                view = option;
            } else if (path == null) {
                path = Path.of(arg);
            } else {
                return null;
            }
        }
        return (path == null) ? null : new Invocation(view, path);
    }

    record Invocation(View view, Path path) {
    }

    enum View {
        TOKENS("--tokens"),
        GROUPS("--groups"),
        TREE("--tree");

        View(final String option) {
            this.option = option;
        }

        static @Nullable View ofOption(final String option) {
            for (final var view : values()) {
                if (view.option.equals(option)) {
                    return view;
                }
            }
            return null;
        }

        private final String option;
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
