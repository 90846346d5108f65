// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The term model: the formal expressions extracted from OMS, OMV, OMA and OMBIND annotations.
 */
@NonNullByDefault
package ftmlextract.term;

import ftmlextract.util.annotation.NonNullByDefault;
