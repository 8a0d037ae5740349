package com.questrail.interactivity.api;

/**
 * The kind of user input a {@link ControlToken} originates from.
 *
 * A {@link ControlBindingSet} recognizes exactly one kind. Tokens of any other
 * kind are a capability mismatch for that session.
 */
public enum InputKind
{
    /** An emoji reaction added to (or removed from) the rendered message. */
    REACTION,

    /** A press on a message component button. */
    BUTTON
}
