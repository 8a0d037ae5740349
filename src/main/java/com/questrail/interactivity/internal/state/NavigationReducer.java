package com.questrail.interactivity.internal.state;

import com.questrail.interactivity.api.PaginationAction;
import com.questrail.interactivity.api.PaginationBehavior;

import java.util.Objects;

/**
 * NavigationReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition function for page navigation.
 *
 * <p>
 * It is intentionally:
 * <ul>
 *   <li>Pure (no I/O, no timers, no locking)</li>
 *   <li>Deterministic</li>
 *   <li>Unaware of session lifecycle</li>
 * </ul>
 *
 * Serialization of concurrent calls and the completion barrier are the
 * session's job; the reducer only maps {@code (state, action)} to the next
 * state.
 *
 * <h2>Boundary policy</h2>
 * <table>
 *   <tr><th>action</th><th>CLAMP</th><th>WRAP_AROUND</th></tr>
 *   <tr><td>NEXT at last</td><td>unchanged</td><td>0</td></tr>
 *   <tr><td>PREVIOUS at 0</td><td>unchanged</td><td>last</td></tr>
 *   <tr><td>SKIP_TO_FIRST</td><td>0</td><td>0</td></tr>
 *   <tr><td>SKIP_TO_LAST</td><td>last</td><td>last</td></tr>
 * </table>
 *
 * {@link PaginationAction#STOP} is a lifecycle action and leaves the state
 * unchanged here.
 */
public final class NavigationReducer
{
    /**
     * Result of applying an action.
     *
     * @param newState the resulting state
     * @param changed  whether the index moved
     */
    public record Result(NavigationState newState, boolean changed) {}

    private final PaginationBehavior behavior;

    public NavigationReducer(PaginationBehavior behavior) {
        this.behavior = Objects.requireNonNull(behavior, "behavior");
    }

    public PaginationBehavior behavior() {
        return behavior;
    }

    /**
     * Applies one action to the given state.
     *
     * @param state  the current state (must not be {@code null})
     * @param action the action to apply (must not be {@code null})
     * @return the resulting state
     */
    public Result apply(NavigationState state, PaginationAction action) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(action, "action");

        NavigationState next = switch (action) {
            case SKIP_TO_FIRST -> state.withIndex(0);
            case PREVIOUS -> retreat(state);
            case NEXT -> advance(state);
            case SKIP_TO_LAST -> state.withIndex(state.lastIndex());
            case STOP -> state;
        };
        return new Result(next, next.index() != state.index());
    }

    private NavigationState advance(NavigationState state) {
        if (!state.isLast()) {
            return state.withIndex(state.index() + 1);
        }
        return behavior == PaginationBehavior.WRAP_AROUND ? state.withIndex(0) : state;
    }

    private NavigationState retreat(NavigationState state) {
        if (!state.isFirst()) {
            return state.withIndex(state.index() - 1);
        }
        return behavior == PaginationBehavior.WRAP_AROUND ? state.withIndex(state.lastIndex()) : state;
    }
}
