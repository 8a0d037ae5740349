package com.questrail.interactivity.bindings;

import com.questrail.interactivity.api.ControlToken;
import com.questrail.interactivity.api.InputKind;
import com.questrail.interactivity.api.PaginationAction;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ControlBindingsTest {

    @Test
    void defaultEmojisResolveToTheirActions() {
        EmojiControlBindings emojis = EmojiControlBindings.defaults();

        assertEquals(InputKind.REACTION, emojis.inputKind());
        assertEquals(Optional.of(PaginationAction.SKIP_TO_FIRST), emojis.resolve(ControlToken.reaction("⏮")));
        assertEquals(Optional.of(PaginationAction.PREVIOUS), emojis.resolve(ControlToken.reaction("◀")));
        assertEquals(Optional.of(PaginationAction.STOP), emojis.resolve(ControlToken.reaction("⏹")));
        assertEquals(Optional.of(PaginationAction.NEXT), emojis.resolve(ControlToken.reaction("▶")));
        assertEquals(Optional.of(PaginationAction.SKIP_TO_LAST), emojis.resolve(ControlToken.reaction("⏭")));
    }

    @Test
    void defaultButtonsResolveByCustomId() {
        ButtonControlBindings buttons = ButtonControlBindings.defaults();

        assertEquals(InputKind.BUTTON, buttons.inputKind());
        assertEquals(Optional.of(PaginationAction.NEXT), buttons.resolve(ControlToken.button("right")));
        assertEquals(Optional.of(PaginationAction.SKIP_TO_FIRST), buttons.resolve(ControlToken.button("leftskip")));
        assertEquals("⏹", buttons.labelFor(PaginationAction.STOP));
    }

    @Test
    void tokensOfAnotherKindDoNotResolve() {
        // Same value, different input kind.
        assertTrue(EmojiControlBindings.defaults().resolve(ControlToken.button("▶")).isEmpty());
        assertFalse(EmojiControlBindings.defaults().supports(InputKind.BUTTON));
        assertTrue(ButtonControlBindings.defaults().supports(InputKind.BUTTON));
    }

    @Test
    void unknownTokenResolvesToEmpty() {
        assertTrue(EmojiControlBindings.defaults().resolve(ControlToken.reaction("👍")).isEmpty());
    }

    @Test
    void orderedTokensFollowActionOrder() {
        List<ControlToken> tokens = EmojiControlBindings.defaults().orderedTokens();

        assertEquals(List.of(
                ControlToken.reaction("⏮"),
                ControlToken.reaction("◀"),
                ControlToken.reaction("⏹"),
                ControlToken.reaction("▶"),
                ControlToken.reaction("⏭")), tokens);
    }

    @Test
    void customEmojiReplacesDefault() {
        EmojiControlBindings custom = EmojiControlBindings.builder()
                .withEmoji(PaginationAction.STOP, "❌")
                .build();

        assertEquals(Optional.of(PaginationAction.STOP), custom.resolve(ControlToken.reaction("❌")));
        assertTrue(custom.resolve(ControlToken.reaction("⏹")).isEmpty());
    }

    @Test
    void duplicateTokensAreRejected() {
        EmojiControlBindings.Builder builder = EmojiControlBindings.builder()
                .withEmoji(PaginationAction.NEXT, "◀");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(e.getMessage().contains("◀"));
    }

    @Test
    void blankTokensAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ControlToken.button(" "));
    }
}
