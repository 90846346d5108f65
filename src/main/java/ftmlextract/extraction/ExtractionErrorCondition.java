// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import ftmlextract.util.condition.Condition;
import ftmlextract.util.condition.ConditionContext;
import ftmlextract.util.condition.UnhandledErrorError;

/**
 * A condition type indicating that an FTML annotation couldn't be processed.
 * <p>
 * Always signaled as fatal. Handlers are expected to record {@link #error()} and unwind to a restart point that
 * skips the offending annotation.
 */
public final class ExtractionErrorCondition extends Condition {
    ExtractionErrorCondition(final ExtractionError error) {
        super(error.toString());
        this.error = error;
    }

    /**
     * Signals an {@link ExtractionErrorCondition} for the given key. Never returns normally.
     */
    static UnhandledErrorError signal(
        final FtmlKey key,
        final ExtractionError.Reason reason,
        final String message
    ) {
        return ConditionContext.error(new ExtractionErrorCondition(new ExtractionError(key, reason, message)));
    }

    /**
     * Retrieves the error this condition describes.
     */
    public ExtractionError error() {
        return error;
    }

    private final ExtractionError error;
}
