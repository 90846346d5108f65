// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.narrative;

import java.util.List;
import ftmlextract.uri.DocumentUri;
import ftmlextract.util.annotation.Nullable;

/**
 * A finished document: the root of the narrative tree.
 *
 * @param title           The text of the element marked as document title, if any.
 * @param elements        The top-level narrative elements.
 * @param topSectionLevel The level of the outermost sections, {@link SectionLevel#SECTION} unless overridden.
 */
public record Document(
    DocumentUri uri,
    @Nullable String title,
    List<DocumentElement> elements,
    SectionLevel topSectionLevel,
    List<DocumentStyle> styles,
    List<DocumentCounter> counters
) {
    public Document {
        elements = List.copyOf(elements);
        styles = List.copyOf(styles);
        counters = List.copyOf(counters);
    }
}
