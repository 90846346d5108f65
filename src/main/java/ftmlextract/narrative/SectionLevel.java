// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.narrative;

import ftmlextract.util.annotation.Nullable;

/**
 * Sectioning levels, outermost first. Attribute values denote them by their ordinal.
 */
public enum SectionLevel {
    PART,
    CHAPTER,
    SECTION,
    SUBSECTION,
    SUBSUBSECTION,
    PARAGRAPH,
    SUBPARAGRAPH;

    /**
     * Returns the level with the given ordinal, or {@code null} if there is none.
     */
    public static @Nullable SectionLevel fromNumber(final int number) {
        return (number >= 0 && number < levels.length) ? levels[number] : null;
    }

    private static final SectionLevel[] levels = values();
}
