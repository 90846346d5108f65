// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.term;

import ftmlextract.util.annotation.Nullable;

/**
 * How a symbol with sequence arguments presents iterated application.
 */
public enum AssociativityType {
    BINARY_LEFT("bin"),
    BINARY_RIGHT("binr"),
    PREFIX("pre"),
    CONJUNCTIVE("conj"),
    PAIRWISE_CONJUNCTIVE("pwconj");

    AssociativityType(final String attributeValue) {
        this.attributeValue = attributeValue;
    }

    public String attributeValue() {
        return attributeValue;
    }

    public static @Nullable AssociativityType fromAttributeValue(final String value) {
        for (final var type : values()) {
            if (type.attributeValue.equals(value)) {
                return type;
            }
        }
        return null;
    }

    private final String attributeValue;
}
