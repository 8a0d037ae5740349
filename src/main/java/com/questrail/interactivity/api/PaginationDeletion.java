package com.questrail.interactivity.api;

/**
 * PaginationDeletion
 * -----------------------------------------------------------------------------
 * Cleanup policy applied to the rendered message once a session ends.
 *
 * Exactly one policy is chosen when the session is created; it is consumed
 * once, during disposal.
 */
public enum PaginationDeletion
{
    /** Remove every control mark (reaction, button row) from the message. */
    DELETE_CONTROL_MARKS,

    /** Delete the rendered message itself. */
    DELETE_RENDERED_ARTIFACT,

    /** Leave the message and its controls untouched. */
    KEEP_CONTROL_MARKS
}
