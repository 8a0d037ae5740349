package com.questrail.interactivity.api;

import java.util.Objects;
import java.util.Optional;

/**
 * NavigationResult
 * -----------------------------------------------------------------------------
 * Report returned by {@link PaginationSession#registerControl(ControlToken)}.
 *
 * @param page        page at {@code index} after the control was applied
 * @param index       current index after the control was applied
 * @param action      resolved action, if the token was recognized
 * @param outcome     what the control did
 * @param stillActive whether the session still accepts controls
 */
public record NavigationResult(Page page,
                               int index,
                               Optional<PaginationAction> action,
                               Outcome outcome,
                               boolean stillActive)
{
    /**
     * Effect of a single registered control.
     */
    public enum Outcome {
        /** The current index changed. */
        NAVIGATED,

        /** A navigation action was applied but the index did not move (clamped). */
        UNCHANGED,

        /** The stop control ended the session. */
        STOPPED,

        /** The token is of a supported kind but bound to no action. */
        UNRECOGNIZED,

        /** The token is of an input kind the session's binding set does not support. */
        UNSUPPORTED
    }

    public NavigationResult {
        Objects.requireNonNull(page, "page");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(outcome, "outcome");
    }

    /**
     * Returns {@code true} if the caller should (re-)render {@link #page()}.
     */
    public boolean shouldRender() {
        return outcome == Outcome.NAVIGATED || outcome == Outcome.UNCHANGED;
    }
}
