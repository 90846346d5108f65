// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The command line front end.
 */
@NonNullByDefault
package ftmlextract.cli;

import ftmlextract.util.annotation.NonNullByDefault;
