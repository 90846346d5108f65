// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.html;

import java.util.List;
import ftmlextract.extraction.ExtractionError;

/**
 * An FTML annotation that was skipped because it couldn't be processed.
 *
 * @param error    What went wrong.
 * @param position The byte offset in the output where the offending element starts.
 * @param trace    The operation trace at the time of the error, innermost first.
 */
public record SemanticDiagnostic(ExtractionError error, int position, List<String> trace) {
    public SemanticDiagnostic {
        trace = List.copyOf(trace);
    }
}
