package com.questrail.interactivity.bindings;

import com.questrail.interactivity.api.ControlToken;
import com.questrail.interactivity.api.InputKind;
import com.questrail.interactivity.api.PaginationAction;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Button-driven control bindings.
 *
 * <p>Tokens are component custom ids. Defaults: {@code leftskip},
 * {@code left}, {@code stop}, {@code right}, {@code rightskip}. Each button
 * also carries a display label for the renderer.</p>
 */
public final class ButtonControlBindings extends AbstractControlBindings
{
    private static final ButtonControlBindings DEFAULTS = builder().build();

    private final Map<PaginationAction, String> labels;

    private ButtonControlBindings(Map<PaginationAction, ControlToken> bindings,
                                  Map<PaginationAction, String> labels) {
        super(InputKind.BUTTON, bindings);
        this.labels = Map.copyOf(labels);
    }

    public static ButtonControlBindings defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the display label of the button bound to {@code action}.
     */
    public String labelFor(PaginationAction action) {
        return labels.get(Objects.requireNonNull(action, "action"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumMap<PaginationAction, String> ids = new EnumMap<>(PaginationAction.class);
        private final EnumMap<PaginationAction, String> labels = new EnumMap<>(PaginationAction.class);

        private Builder() {
            button(PaginationAction.SKIP_TO_FIRST, "leftskip", "⏮");
            button(PaginationAction.PREVIOUS, "left", "◀");
            button(PaginationAction.STOP, "stop", "⏹");
            button(PaginationAction.NEXT, "right", "▶");
            button(PaginationAction.SKIP_TO_LAST, "rightskip", "⏭");
        }

        public Builder button(PaginationAction action, String customId, String label) {
            Objects.requireNonNull(action, "action");
            ids.put(action, Objects.requireNonNull(customId, "customId"));
            labels.put(action, Objects.requireNonNull(label, "label"));
            return this;
        }

        public ButtonControlBindings build() {
            EnumMap<PaginationAction, ControlToken> tokens = new EnumMap<>(PaginationAction.class);
            ids.forEach((action, id) -> tokens.put(action, ControlToken.button(id)));
            return new ButtonControlBindings(tokens, labels);
        }
    }
}
