// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.narrative;

/**
 * The kind of a logical paragraph.
 */
public enum ParagraphKind {
    DEFINITION,
    ASSERTION,
    PARAGRAPH,
    EXAMPLE,
    PROOF,
    SUBPROOF;

    /**
     * Returns whether a definiens found in a paragraph of this kind defines the paragraph's symbols.
     */
    public boolean isDefinitionLike() {
        return this == DEFINITION || this == ASSERTION;
    }
}
