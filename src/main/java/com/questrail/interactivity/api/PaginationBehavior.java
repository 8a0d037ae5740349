package com.questrail.interactivity.api;

/**
 * PaginationBehavior
 * -----------------------------------------------------------------------------
 * Boundary policy applied when navigating past the first or last page.
 */
public enum PaginationBehavior
{
    /**
     * Moving past either end leaves the current page unchanged.
     */
    CLAMP,

    /**
     * Moving past the last page returns to the first, and moving before the
     * first page goes to the last.
     */
    WRAP_AROUND
}
