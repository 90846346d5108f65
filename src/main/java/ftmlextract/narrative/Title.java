// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.narrative;

/**
 * The title of a section, paragraph or slide: its text and where its markup lives in the output.
 */
public record Title(String text, DocumentRange range) {
}
