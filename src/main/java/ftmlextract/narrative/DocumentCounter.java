// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.narrative;

import ftmlextract.util.annotation.Nullable;

/**
 * A counter declared by the document, reset at each element of the {@code parent} level if given.
 */
public record DocumentCounter(String name, @Nullable SectionLevel parent) {
}
