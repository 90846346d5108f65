// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Identifiers of modules, symbols, documents and document elements.
 * <p>
 * These are opaque, comparable, hashable tokens. Parsing never throws: invalid input yields {@code null}, and the
 * caller decides which error to report.
 */
@NonNullByDefault
package ftmlextract.uri;

import ftmlextract.util.annotation.NonNullByDefault;
