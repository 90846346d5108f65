// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.HashMap;
import java.util.Map;

/**
 * Generates element names unique within a document: the prefix itself on first use, then {@code prefix_1},
 * {@code prefix_2} and so on.
 */
final class IdCounter {
    String next(final String prefix) {
        final var count = counts.merge(prefix, 1, Integer::sum) - 1;
        return (count == 0) ? prefix : prefix + '_' + count;
    }

    private final Map<String, Integer> counts = new HashMap<>();
}
