package com.questrail.interactivity.bindings;

import com.questrail.interactivity.api.ControlBindingSet;
import com.questrail.interactivity.api.ControlToken;
import com.questrail.interactivity.api.InputKind;
import com.questrail.interactivity.api.PaginationAction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * AbstractControlBindings
 * -----------------------------------------------------------------------------
 * Input-kind-neutral base for {@link ControlBindingSet} implementations.
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Holds a complete action → token map (every action bound)</li>
 *   <li>Holds the reverse token → action map for resolution</li>
 *   <li>Rejects duplicate tokens and tokens of a foreign input kind</li>
 * </ul>
 *
 * Subclasses only decide which tokens to bind and which input kind they serve.
 */
public abstract class AbstractControlBindings implements ControlBindingSet
{
    private final InputKind inputKind;
    private final Map<PaginationAction, ControlToken> byAction;
    private final Map<ControlToken, PaginationAction> byToken;

    protected AbstractControlBindings(InputKind inputKind, Map<PaginationAction, ControlToken> bindings) {
        this.inputKind = Objects.requireNonNull(inputKind, "inputKind");
        Objects.requireNonNull(bindings, "bindings");

        EnumMap<PaginationAction, ControlToken> forward = new EnumMap<>(PaginationAction.class);
        Map<ControlToken, PaginationAction> reverse = new HashMap<>();

        for (PaginationAction action : PaginationAction.values()) {
            ControlToken token = bindings.get(action);
            if (token == null) {
                throw new IllegalArgumentException("No token bound to " + action);
            }
            if (token.kind() != inputKind) {
                throw new IllegalArgumentException(
                        "Token for " + action + " is a " + token.kind() + ", expected " + inputKind);
            }
            PaginationAction prior = reverse.putIfAbsent(token, action);
            if (prior != null) {
                throw new IllegalArgumentException(
                        "Token '" + token.value() + "' bound to both " + prior + " and " + action);
            }
            forward.put(action, token);
        }

        this.byAction = Collections.unmodifiableMap(forward);
        this.byToken = Collections.unmodifiableMap(reverse);
    }

    @Override
    public final InputKind inputKind() {
        return inputKind;
    }

    @Override
    public final ControlToken tokenFor(PaginationAction action) {
        Objects.requireNonNull(action, "action");
        return byAction.get(action);
    }

    @Override
    public final Optional<PaginationAction> resolve(ControlToken token) {
        Objects.requireNonNull(token, "token");
        return Optional.ofNullable(byToken.get(token));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + byAction;
    }
}
