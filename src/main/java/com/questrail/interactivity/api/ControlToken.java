package com.questrail.interactivity.api;

import java.util.Objects;

/**
 * ControlToken
 * -----------------------------------------------------------------------------
 * Normalized identifier of one user input, as delivered by the transport.
 *
 * <p>For reactions the value is the emoji's unicode form (or its
 * {@code name:id} form for custom emojis); for buttons it is the component's
 * custom id.</p>
 *
 * @param kind  input kind the token originates from
 * @param value normalized, non-blank identifier
 */
public record ControlToken(InputKind kind, String value)
{
    public ControlToken {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    public static ControlToken reaction(String emoji) {
        return new ControlToken(InputKind.REACTION, emoji);
    }

    public static ControlToken button(String customId) {
        return new ControlToken(InputKind.BUTTON, customId);
    }
}
