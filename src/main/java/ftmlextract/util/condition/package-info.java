// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A condition and restart system modeled after Common Lisp's.
 * <p>
 * Extraction errors are signaled as conditions; the HTML front end handles them by recording a diagnostic and
 * restarting at the next attribute or close marker.
 */
@NonNullByDefault
package ftmlextract.util.condition;

import ftmlextract.util.annotation.NonNullByDefault;
