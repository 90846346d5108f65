// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

/**
 * A marker recorded on an element when one of its rules opened something, run when the element ends.
 * <p>
 * Each marker names the frame it expects on top of its stack, and the key reported when closing fails.
 */
public enum CloseElement {
    MODULE(FtmlKey.MODULE),
    STRUCTURE(FtmlKey.STRUCTURE),
    MORPHISM(FtmlKey.MORPHISM),
    ASSIGNMENT(FtmlKey.ASSIGN),
    SYMBOL_DECLARATION(FtmlKey.SYMDECL),
    VARIABLE_DECLARATION(FtmlKey.VARDEF),
    SECTION(FtmlKey.SECTION),
    SKIP_SECTION(FtmlKey.SKIPSECTION),
    PARAGRAPH(FtmlKey.PARAGRAPH),
    SLIDE(FtmlKey.SLIDE),
    INVISIBLE(FtmlKey.INVISIBLE),
    SECTION_TITLE(FtmlKey.TITLE),
    PARAGRAPH_TITLE(FtmlKey.TITLE),
    SLIDE_TITLE(FtmlKey.TITLE),
    DOC_TITLE(FtmlKey.DOCTITLE),
    SYMBOL_REFERENCE(FtmlKey.TERM),
    VARIABLE_REFERENCE(FtmlKey.TERM),
    APPLICATION(FtmlKey.TERM),
    BINDING(FtmlKey.TERM),
    ARGUMENT(FtmlKey.ARG),
    HEAD_TERM(FtmlKey.HEADTERM),
    TYPE(FtmlKey.TYPE),
    DEFINIENS(FtmlKey.DEFINIENS),
    NOTATION(FtmlKey.NOTATION),
    DEFINIENDUM(FtmlKey.DEFINIENDUM),
    COMP(FtmlKey.COMP),
    DEF_COMP(FtmlKey.DEFCOMP);

    CloseElement(final FtmlKey key) {
        this.key = key;
    }

    /**
     * Returns the key errors raised while closing this marker are reported under.
     */
    public FtmlKey key() {
        return key;
    }

    private final FtmlKey key;
}
