package com.questrail.interactivity.transport;

import com.questrail.interactivity.api.ControlToken;
import com.questrail.interactivity.api.RenderTarget;
import com.questrail.interactivity.api.UserId;

import java.util.Objects;

/**
 * One raw input event delivered by the transport: a user pressed a control on
 * a message.
 *
 * @param actor  user who produced the input
 * @param token  normalized control token
 * @param target message the input was applied to
 */
public record InputEvent(UserId actor, ControlToken token, RenderTarget target)
{
    public InputEvent {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(target, "target");
    }
}
