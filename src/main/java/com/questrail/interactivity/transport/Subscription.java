package com.questrail.interactivity.transport;

/**
 * Handle returned by {@link InputEventSource#subscribe(InputEventListener)}.
 */
public interface Subscription
{
    /**
     * Stops delivery to the subscribed listener. Idempotent.
     *
     * <p>An event already being delivered when this is called may still
     * complete; no new event is delivered afterwards.</p>
     */
    void cancel();
}
