package com.questrail.interactivity.internal.state;

/**
 * NavigationState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of a session's position within its pages.
 *
 * <h2>Invariant</h2>
 * {@code 0 <= index < pageCount} and {@code pageCount >= 1}. The invariant is
 * checked on construction, so no reducer result can ever violate it.
 *
 * @param index     current page index
 * @param pageCount fixed number of pages in the session
 */
public record NavigationState(int index, int pageCount)
{
    public NavigationState {
        if (pageCount < 1) {
            throw new IllegalArgumentException("pageCount must be >= 1, was " + pageCount);
        }
        if (index < 0 || index >= pageCount) {
            throw new IllegalArgumentException(
                    "index " + index + " outside [0, " + (pageCount - 1) + "]");
        }
    }

    /**
     * Creates the initial state: first page selected.
     */
    public static NavigationState initial(int pageCount) {
        return new NavigationState(0, pageCount);
    }

    public int lastIndex() {
        return pageCount - 1;
    }

    public boolean isFirst() {
        return index == 0;
    }

    public boolean isLast() {
        return index == lastIndex();
    }

    public NavigationState withIndex(int newIndex) {
        return newIndex == index ? this : new NavigationState(newIndex, pageCount);
    }
}
