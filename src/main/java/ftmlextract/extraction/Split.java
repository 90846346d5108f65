// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * What an {@link OpenElement} contributes to the extractor: frames for either stack, an immediate fact, or nothing.
 */
public sealed interface Split {
    /**
     * A fact applied immediately.
     */
    record Meta(MetaDatum datum) implements Split {
    }

    /**
     * Frames pushed onto the domain and narrative stacks. At least one is present.
     */
    record Open(@Nullable OpenDomainElement domain, @Nullable OpenNarrativeElement narrative) implements Split {
        public Open {
            assert domain != null || narrative != null : "Split opens no frame";
        }

        static Open domain(final OpenDomainElement domain) {
            return new Open(domain, null);
        }

        static Open narrative(final OpenNarrativeElement narrative) {
            return new Open(null, narrative);
        }
    }

    /**
     * Nothing to push; the close marker does all the work.
     */
    record None() implements Split {
    }
}
