// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.html;

import java.util.Optional;
import java.util.function.Function;
import ftmlextract.uri.DocumentUri;

/**
 * Settings for one extraction.
 *
 * @param documentUri        The URI of the document being extracted.
 * @param imageResolver      Maps an image {@code src} to its replacement, if any.
 * @param stylesheetResolver Maps a stylesheet {@code href} to its resolved location, if any.
 * @param maxParseErrors     How many HTML parse errors to record at most.
 */
public record ExtractionOptions(
    DocumentUri documentUri,
    Function<String, Optional<String>> imageResolver,
    Function<String, Optional<String>> stylesheetResolver,
    int maxParseErrors
) {
    public ExtractionOptions {
        if (maxParseErrors < 0) {
            throw new IllegalArgumentException("Negative parse error limit " + maxParseErrors);
        }
    }

    /**
     * Returns a builder with no resolvers and the default parse error limit.
     */
    public static Builder builder(final DocumentUri documentUri) {
        return new Builder(documentUri);
    }

    public static final class Builder {
        private Builder(final DocumentUri documentUri) {
            this.documentUri = documentUri;
        }

        public Builder setImageResolver(final Function<String, Optional<String>> imageResolver) {
            this.imageResolver = imageResolver;
            return this;
        }

        public Builder setStylesheetResolver(final Function<String, Optional<String>> stylesheetResolver) {
            this.stylesheetResolver = stylesheetResolver;
            return this;
        }

        public Builder setMaxParseErrors(final int maxParseErrors) {
            this.maxParseErrors = maxParseErrors;
            return this;
        }

        public ExtractionOptions build() {
            return new ExtractionOptions(documentUri, imageResolver, stylesheetResolver, maxParseErrors);
        }

        private final DocumentUri documentUri;
        private Function<String, Optional<String>> imageResolver = unresolved -> Optional.empty();
        private Function<String, Optional<String>> stylesheetResolver = unresolved -> Optional.empty();
        private int maxParseErrors = defaultMaxParseErrors;
    }

    public static final int defaultMaxParseErrors = 100;
}
