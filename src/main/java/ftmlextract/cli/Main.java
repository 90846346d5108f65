// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.List;
import ftmlextract.html.Css;
import ftmlextract.html.ExtractionOptions;
import ftmlextract.html.HtmlExtractionResult;
import ftmlextract.html.HtmlExtractor;
import ftmlextract.narrative.DocumentElement;
import ftmlextract.uri.DocumentUri;
import ftmlextract.util.Trace;
import ftmlextract.util.condition.ConditionContext;
import ftmlextract.util.condition.Handler;
import ftmlextract.util.condition.IOExceptionCondition;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        if (args.length < 1 || args.length > 2) {
            try (final var streams = Streams.acquire()) {
                streams.err().println("Usage: ftmlextract <input.html> [document-uri]");
                return ExitCode.USAGE;
            }
        }
        final var inputPath = Path.of(args[0]);
        final var uriString = (args.length == 2) ? args[1] : defaultDocumentUri(inputPath);
        final var documentUri = DocumentUri.parse(uriString);
        if (documentUri == null) {
            try (final var streams = Streams.acquire()) {
                streams.err().println("Not a valid document URI: '" + uriString + "', give one explicitly");
                return ExitCode.USAGE;
            }
        }

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                final var html = readInput(inputPath);
                final var result = HtmlExtractor.extract(html, ExtractionOptions.builder(documentUri).build());
                try (final var streams = Streams.acquire()) {
                    printSummary(streams.out(), result);
                }
                return ExitCode.SUCCESS;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static String readInput(final Path path) {
        try (final var trace = new Trace(() -> "Reading " + path)) {
            trace.use();
            try {
                return Files.readString(path, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    private static String defaultDocumentUri(final Path path) {
        final var fileName = path.getFileName();
        final var name = (fileName != null) ? fileName.toString() : "";
        final var dot = name.lastIndexOf('.');
        return (dot > 0) ? name.substring(0, dot) : name;
    }

    private static void printSummary(final PrintStream out, final HtmlExtractionResult result) {
        final var document = result.result().document();
        out.println("Document: " + document.uri());
        out.println("Title: " + ((document.title() != null) ? document.title() : "(none)"));
        out.println("Elements: " + document.elements().size() + " top-level, " + countElements(document.elements())
            + " in total");
        out.println("Declarations: " + result.result().declarations().size());
        out.println("Notations: " + result.result().notations().size());

        out.println("Stylesheets: " + result.stylesheets().size());
        for (final var stylesheet : result.stylesheets()) {
            if (stylesheet instanceof final Css.Link link) {
                out.println(" - link " + link.href());
            } else if (stylesheet instanceof final Css.Inline inline) {
                out.println(" - inline, " + inline.content().length() + " characters");
            }
        }

        out.println("Errors: " + result.errors().size());
        for (final var diagnostic : result.errors()) {
            out.println(" - at byte " + diagnostic.position() + ": " + diagnostic.error());
        }
        out.println("Warnings: " + result.warnings().size());
        for (final var warning : result.warnings()) {
            out.println(" - at character " + warning.position() + ": " + warning.message());
        }
    }

    private static int countElements(final List<DocumentElement> elements) {
        var count = 0;
        final var pending = new ArrayDeque<List<DocumentElement>>();
        pending.push(elements);
        while (!pending.isEmpty()) {
            for (final var element : pending.pop()) {
                count += 1;
                pending.push(element.children());
            }
        }
        return count;
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
