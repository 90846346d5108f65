// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Semantic extraction: recognizing FTML attributes, applying their rules, and maintaining the open domain and
 * narrative frames until the annotated elements end.
 * <p>
 * This package knows nothing about HTML parsing. The front end in {@link ftmlextract.html} feeds it elements in
 * document order through {@link ftmlextract.extraction.RuleTable} and
 * {@link ftmlextract.extraction.ExtractorState#close(CloseElement, FtmlNode)}.
 */
@NonNullByDefault
package ftmlextract.extraction;

import ftmlextract.util.annotation.NonNullByDefault;
