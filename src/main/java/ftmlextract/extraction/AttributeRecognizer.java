// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Attributes;

/**
 * Finds the FTML attributes of an element.
 */
public final class AttributeRecognizer {
    private AttributeRecognizer() {
    }

    /**
     * Returns the keys of the recognized FTML attributes among {@code attributes}, in declaration order.
     * <p>
     * Attributes that don't carry the prefix, or carry it with an unknown suffix, are skipped; they stay on the
     * element and end up in the output unchanged.
     */
    public static List<FtmlKey> recognize(final Attributes attributes) {
        final var result = new ArrayList<FtmlKey>();
        for (final var attribute : attributes) {
            final var name = attribute.getKey();
            if (!name.startsWith(FtmlKey.PREFIX)) {
                continue;
            }
            final var key = FtmlKey.byAttributeName(name);
            if (key != null) {
                result.add(key);
            }
        }
        return result;
    }
}
