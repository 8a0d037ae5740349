package com.questrail.interactivity.api;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * ControlBindingSet
 * -----------------------------------------------------------------------------
 * Fixed mapping between the five {@link PaginationAction}s and the
 * {@link ControlToken}s a transport delivers for them.
 *
 * <h2>Capability</h2>
 * A binding set recognizes tokens of exactly one {@link InputKind}. Emoji
 * bindings and button bindings are alternative implementations behind the
 * same session contract; sessions never branch on the concrete type.
 *
 * <h2>Immutability</h2>
 * Implementations must be immutable. A binding set is built once per session
 * and only read afterwards, possibly from several threads.
 */
public interface ControlBindingSet
{
    /**
     * Returns the input kind this binding set recognizes.
     */
    InputKind inputKind();

    /**
     * Returns the token bound to the given action.
     *
     * @param action action to look up (must not be {@code null})
     * @return the bound token, never {@code null}
     */
    ControlToken tokenFor(PaginationAction action);

    /**
     * Resolves a token to the action bound to it.
     *
     * @param token token to resolve (must not be {@code null})
     * @return the bound action, or {@link Optional#empty()} if the token is not
     *         bound or is of another input kind
     */
    Optional<PaginationAction> resolve(ControlToken token);

    /**
     * Returns {@code true} if tokens of the given kind can be resolved by this
     * binding set.
     */
    default boolean supports(InputKind kind) {
        return inputKind() == kind;
    }

    /**
     * Returns every bound token in {@link PaginationAction} declaration order,
     * which is the order controls are attached to a rendered message.
     */
    default List<ControlToken> orderedTokens() {
        return Arrays.stream(PaginationAction.values())
                .map(this::tokenFor)
                .toList();
    }
}
