package com.questrail.interactivity.bindings;

import com.questrail.interactivity.api.ControlToken;
import com.questrail.interactivity.api.InputKind;
import com.questrail.interactivity.api.PaginationAction;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reaction-driven control bindings.
 *
 * <p>Defaults: {@code ⏮} first, {@code ◀} previous, {@code ⏹} stop,
 * {@code ▶} next, {@code ⏭} last.</p>
 */
public final class EmojiControlBindings extends AbstractControlBindings
{
    private static final EmojiControlBindings DEFAULTS = builder().build();

    private EmojiControlBindings(Map<PaginationAction, ControlToken> bindings) {
        super(InputKind.REACTION, bindings);
    }

    public static EmojiControlBindings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumMap<PaginationAction, String> emojis = new EnumMap<>(PaginationAction.class);

        private Builder() {
            emojis.put(PaginationAction.SKIP_TO_FIRST, "⏮");
            emojis.put(PaginationAction.PREVIOUS, "◀");
            emojis.put(PaginationAction.STOP, "⏹");
            emojis.put(PaginationAction.NEXT, "▶");
            emojis.put(PaginationAction.SKIP_TO_LAST, "⏭");
        }

        public Builder withEmoji(PaginationAction action, String emoji) {
            emojis.put(Objects.requireNonNull(action, "action"), Objects.requireNonNull(emoji, "emoji"));
            return this;
        }

        public EmojiControlBindings build() {
            EnumMap<PaginationAction, ControlToken> tokens = new EnumMap<>(PaginationAction.class);
            emojis.forEach((action, emoji) -> tokens.put(action, ControlToken.reaction(emoji)));
            return new EmojiControlBindings(tokens);
        }
    }
}
