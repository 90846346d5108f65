// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by the extraction packages.
 */
@NonNullByDefault
package ftmlextract.util;

import ftmlextract.util.annotation.NonNullByDefault;
