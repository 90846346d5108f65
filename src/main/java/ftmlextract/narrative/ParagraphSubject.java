// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.narrative;

import ftmlextract.term.Term;
import ftmlextract.uri.SymbolUri;
import ftmlextract.util.annotation.Nullable;

/**
 * A symbol a paragraph is about, with the definiens the paragraph gives it, if any.
 */
public record ParagraphSubject(SymbolUri symbol, @Nullable Term definiens) {
}
