// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.narrative;

import ftmlextract.util.annotation.Nullable;

/**
 * A paragraph style declared by the document, optionally numbered with a counter.
 */
public record DocumentStyle(String name, @Nullable String counter) {
}
