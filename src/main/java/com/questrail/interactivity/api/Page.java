package com.questrail.interactivity.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Page
 * -----------------------------------------------------------------------------
 * One unit of displayable content: a text body (possibly empty) and an
 * optional {@link Embed}.
 *
 * <p>Pages are immutable. Sessions only ever read them.</p>
 */
public record Page(String content, Optional<Embed> embed)
{
    public Page {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(embed, "embed");
    }

    public static Page of(String content) {
        return new Page(content, Optional.empty());
    }

    public static Page of(Embed embed) {
        return new Page("", Optional.of(embed));
    }

    public static Page of(String content, Embed embed) {
        return new Page(content, Optional.of(embed));
    }
}
