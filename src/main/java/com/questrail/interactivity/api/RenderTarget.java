package com.questrail.interactivity.api;

/**
 * RenderTarget
 * -----------------------------------------------------------------------------
 * Opaque handle to the externally owned message a session is attached to.
 *
 * <p>The handle carries identity only. The message itself is owned by the
 * rendering collaborator; sessions hold the handle solely to address render
 * and cleanup calls.</p>
 *
 * @param channelId snowflake of the channel holding the message
 * @param messageId snowflake of the message
 */
public record RenderTarget(long channelId, long messageId)
{
    public static RenderTarget of(long channelId, long messageId) {
        return new RenderTarget(channelId, messageId);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(channelId) + "/" + Long.toUnsignedString(messageId);
    }
}
