// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.html;

/**
 * A problem the HTML parser recovered from.
 *
 * @param position The character offset in the input where the problem was found.
 * @param message  The parser's description.
 */
public record ParseWarning(int position, String message) {
}
