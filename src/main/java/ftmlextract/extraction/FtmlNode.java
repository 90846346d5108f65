// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import ftmlextract.narrative.DocumentRange;

/**
 * The view of an annotated element that close markers need.
 */
public interface FtmlNode {
    /**
     * Returns the byte range of the element's markup in the serialized output. Only valid once the element has ended.
     */
    DocumentRange range();

    /**
     * Returns the element's text content, whitespace-normalized.
     */
    String text();

    /**
     * Removes the element and its content from the serialized output.
     */
    void delete();
}
