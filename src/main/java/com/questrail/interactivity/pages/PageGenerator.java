package com.questrail.interactivity.pages;

import com.questrail.interactivity.api.Embed;
import com.questrail.interactivity.api.Page;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * PageGenerator
 * -----------------------------------------------------------------------------
 * Builds page lists from a long text.
 *
 * <ul>
 *   <li>{@link SplitType#CHARACTER}: chunks of at most {@value #CHARACTERS_PER_PAGE}
 *       characters; a surrogate pair is never cut in half</li>
 *   <li>{@link SplitType#LINE}: {@value #LINES_PER_PAGE} lines per page</li>
 * </ul>
 *
 * Page numbers in generated titles are 1-based.
 */
public final class PageGenerator
{
    public static final int CHARACTERS_PER_PAGE = 1990;
    public static final int LINES_PER_PAGE = 15;

    private PageGenerator() {}

    /**
     * Generates pages whose content is {@code "**Page n:**\n\n"} followed by the chunk.
     *
     * @throws IllegalArgumentException if {@code text} is blank
     */
    public static List<Page> inContent(String text, SplitType splitType) {
        List<String> chunks = split(text, splitType);
        List<Page> pages = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            pages.add(Page.of("**Page " + (i + 1) + ":**\n\n" + chunks.get(i)));
        }
        return List.copyOf(pages);
    }

    /**
     * Generates pages whose embed copies {@code base} with the chunk as
     * description and {@code "Page n"} as title.
     *
     * @param base embed to copy colour and footer from; may be {@code null}
     * @throws IllegalArgumentException if {@code text} is blank
     */
    public static List<Page> inEmbed(String text, SplitType splitType, Embed base) {
        List<String> chunks = split(text, splitType);
        Embed template = base != null ? base : Embed.builder().build();

        List<Page> pages = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            pages.add(Page.of(template.toBuilder()
                    .title("Page " + (i + 1))
                    .description(chunks.get(i))
                    .build()));
        }
        return List.copyOf(pages);
    }

    static List<String> split(String text, SplitType splitType) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(splitType, "splitType");
        if (text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }

        return switch (splitType) {
            case CHARACTER -> splitByCharacter(text);
            case LINE -> splitByLine(text);
        };
    }

    private static List<String> splitByCharacter(String text) {
        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + CHARACTERS_PER_PAGE, text.length());
            if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            chunks.add(text.substring(start, end));
            start = end;
        }
        return chunks;
    }

    private static List<String> splitByLine(String text) {
        List<String> lines = Arrays.asList(text.split("\n", -1));
        List<String> chunks = new ArrayList<>();
        for (int i = 0; i < lines.size(); i += LINES_PER_PAGE) {
            chunks.add(String.join("\n", lines.subList(i, Math.min(i + LINES_PER_PAGE, lines.size()))));
        }
        return chunks;
    }
}
