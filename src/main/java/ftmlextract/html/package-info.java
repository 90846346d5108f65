// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Extraction from HTML text: parsing with jsoup, serializing the cleaned-up document while tracking byte offsets, and
 * feeding every annotated element through the extractor.
 */
@NonNullByDefault
package ftmlextract.html;

import ftmlextract.util.annotation.NonNullByDefault;
