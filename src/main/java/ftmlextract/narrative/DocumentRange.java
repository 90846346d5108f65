// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.narrative;

/**
 * A half-open range {@code [start, end)} of byte offsets into the serialized UTF-8 HTML output.
 */
public record DocumentRange(int start, int end) {
    public DocumentRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid document range [" + start + ", " + end + ')');
        }
    }

    public int length() {
        return end - start;
    }
}
