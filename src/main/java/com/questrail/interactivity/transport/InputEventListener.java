package com.questrail.interactivity.transport;

/**
 * Callback sink for {@link InputEventSource}.
 *
 * <p>Sources may deliver events from any thread; a single subscription must
 * receive its events one at a time.</p>
 */
@FunctionalInterface
public interface InputEventListener
{
    void onInput(InputEvent event);
}
