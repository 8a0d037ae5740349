package com.questrail.interactivity.observability;

import com.questrail.interactivity.api.RenderTarget;

import java.time.Instant;

/**
 * Record representing an error or anomaly in a pagination session.
 *
 * @param cause underlying failure; {@code null} for anomalies that carry no
 *              exception (e.g. an unsupported control)
 */
public record PaginationErrorEvent(
    Instant timestamp,
    RenderTarget target,
    Severity severity,
    String message,
    Throwable cause
) {
    public enum Severity {
        /** Recovered anomaly; the session carries on. */
        WARNING,
        /** A remote call or callback failed. */
        ERROR
    }
}
