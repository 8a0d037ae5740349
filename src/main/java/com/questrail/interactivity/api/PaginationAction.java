package com.questrail.interactivity.api;

/**
 * The five logical controls a user can apply to a pagination session.
 *
 * <p>The declaration order is the order in which controls are attached to a
 * rendered message.</p>
 */
public enum PaginationAction
{
    SKIP_TO_FIRST,
    PREVIOUS,
    STOP,
    NEXT,
    SKIP_TO_LAST
}
