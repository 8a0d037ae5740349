package com.questrail.interactivity.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Embed
 * -----------------------------------------------------------------------------
 * Immutable structured attachment carried by a {@link Page}.
 *
 * <p>Only the fields pages are generated from are modelled here. The wire
 * representation of embeds belongs to the rendering collaborator.</p>
 */
public final class Embed
{
    private final String title;
    private final String description;
    private final String footer;
    private final Integer color;

    private Embed(Builder b) {
        this.title = b.title;
        this.description = b.description;
        this.footer = b.footer;
        this.color = b.color;
    }

    public Optional<String> title() {
        return Optional.ofNullable(title);
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public Optional<String> footer() {
        return Optional.ofNullable(footer);
    }

    /**
     * Returns the RGB colour of the embed's side bar, if set.
     */
    public Optional<Integer> color() {
        return Optional.ofNullable(color);
    }

    /**
     * Returns a builder pre-populated with this embed's fields.
     */
    public Builder toBuilder() {
        return new Builder()
                .title(title)
                .description(description)
                .footer(footer)
                .color(color);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Embed other)) return false;
        return Objects.equals(title, other.title)
                && Objects.equals(description, other.description)
                && Objects.equals(footer, other.footer)
                && Objects.equals(color, other.color);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, description, footer, color);
    }

    @Override
    public String toString() {
        return "Embed[title=" + title + ", footer=" + footer + "]";
    }

    public static final class Builder {
        private String title;
        private String description;
        private String footer;
        private Integer color;

        private Builder() {}

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder footer(String footer) {
            this.footer = footer;
            return this;
        }

        public Builder color(Integer rgb) {
            if (rgb != null && (rgb < 0 || rgb > 0xFFFFFF)) {
                throw new IllegalArgumentException("color must be a 24-bit RGB value");
            }
            this.color = rgb;
            return this;
        }

        public Embed build() {
            return new Embed(this);
        }
    }
}
