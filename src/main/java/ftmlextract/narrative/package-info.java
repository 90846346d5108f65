// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The narrative tree: the human-facing structure of a document.
 */
@NonNullByDefault
package ftmlextract.narrative;

import ftmlextract.util.annotation.NonNullByDefault;
