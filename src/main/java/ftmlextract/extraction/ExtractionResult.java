// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.List;
import ftmlextract.domain.Declaration;
import ftmlextract.narrative.Document;
import ftmlextract.narrative.DocumentElement;

/**
 * The semantic content of one document.
 *
 * @param document     The narrative tree.
 * @param declarations Top-level domain declarations, mostly modules, in the order they ended.
 * @param notations    Every notation defined in the document, in the order they ended.
 */
public record ExtractionResult(
    Document document,
    List<Declaration> declarations,
    List<DocumentElement.Notation> notations
) {
    public ExtractionResult {
        declarations = List.copyOf(declarations);
        notations = List.copyOf(notations);
    }
}
