package com.questrail.interactivity.api;

/**
 * Why a session's completion signal fired.
 */
public enum CompletionReason
{
    /** The session timeout elapsed. */
    TIMED_OUT,

    /** A stop control was registered, or {@link PaginationSession#stop()} was called. */
    STOPPED,

    /** The session was disposed (or its runtime stopped) while still active. */
    ABANDONED
}
