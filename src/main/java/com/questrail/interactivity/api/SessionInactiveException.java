package com.questrail.interactivity.api;

import java.util.Objects;

/**
 * Indicates that a control was registered against a session whose completion
 * signal has already fired.
 *
 * This is a recoverable condition: late input is normal when a timeout races
 * with a user. No session state is mutated when it is raised.
 */
public final class SessionInactiveException extends Exception
{
    private final SessionStatus status;

    public SessionInactiveException(SessionStatus status) {
        super("session inactive (" + Objects.requireNonNull(status, "status") + ")");
        this.status = status;
    }

    /**
     * Returns the session status observed when the control was rejected.
     */
    public SessionStatus status() {
        return status;
    }
}
