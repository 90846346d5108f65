// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.html;

import java.nio.charset.StandardCharsets;
import java.util.List;
import ftmlextract.extraction.ExtractionResult;
import ftmlextract.narrative.DocumentRange;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Everything extracted from one HTML document.
 *
 * @param html             The serialized document, without FTML-only attributes, invisible content, comments and head
 *                         stylesheets.
 * @param stylesheets      The stylesheets taken out of the head, without duplicates, in document order.
 * @param bodyRange        The byte range of the {@code <body>} element in {@code html}.
 * @param bodyHeaderLength The byte length of the {@code <body>} start tag.
 * @param result           The semantic content.
 * @param errors           FTML annotations that were skipped.
 * @param warnings         Problems the HTML parser recovered from.
 */
public record HtmlExtractionResult(
    String html,
    List<Css> stylesheets,
    @Nullable DocumentRange bodyRange,
    int bodyHeaderLength,
    ExtractionResult result,
    List<SemanticDiagnostic> errors,
    List<ParseWarning> warnings
) {
    public HtmlExtractionResult {
        stylesheets = List.copyOf(stylesheets);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /**
     * Returns the part of {@link #html()} covered by the given byte range. The parts of the range past the end of the
     * output are ignored.
     */
    public String fragment(final DocumentRange range) {
        final var bytes = html.getBytes(StandardCharsets.UTF_8);
        final var start = Math.min(range.start(), bytes.length);
        final var end = Math.min(range.end(), bytes.length);
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }
}
