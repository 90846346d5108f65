// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The domain tree: modules and the declarations they contain.
 */
@NonNullByDefault
package ftmlextract.domain;

import ftmlextract.util.annotation.NonNullByDefault;
