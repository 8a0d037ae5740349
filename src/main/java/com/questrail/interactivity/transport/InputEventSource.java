package com.questrail.interactivity.transport;

/**
 * InputEventSource
 * -----------------------------------------------------------------------------
 * Port for the transport that delivers reaction and button input.
 *
 * <p>The source delivers every input it sees. Filtering by message and by
 * user is the collector's job.</p>
 */
public interface InputEventSource
{
    /**
     * Registers a listener for all subsequent input events.
     *
     * @param listener receiver (must not be {@code null})
     * @return handle used to stop delivery
     */
    Subscription subscribe(InputEventListener listener);
}
