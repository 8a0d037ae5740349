package com.questrail.interactivity.core;

import com.questrail.interactivity.api.Page;

import java.util.List;
import java.util.Objects;

/**
 * PageStore
 * -----------------------------------------------------------------------------
 * Immutable, non-empty, ordered sequence of pages for one session.
 *
 * <p>{@link #pageAt(int)} is only defined for {@code 0 <= i < pageCount()}.
 * The navigation state guarantees that bound, so an out-of-range index is a
 * programming error and fails fast.</p>
 */
public final class PageStore
{
    private final List<Page> pages;

    public PageStore(List<Page> pages) {
        Objects.requireNonNull(pages, "pages");
        if (pages.isEmpty()) {
            throw new IllegalArgumentException("At least one page required");
        }
        // List.copyOf rejects null elements.
        this.pages = List.copyOf(pages);
    }

    public static PageStore of(Page... pages) {
        return new PageStore(List.of(pages));
    }

    public int pageCount() {
        return pages.size();
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, pageCount())}
     */
    public Page pageAt(int index) {
        Objects.checkIndex(index, pages.size());
        return pages.get(index);
    }

    public List<Page> pages() {
        return pages;
    }
}
