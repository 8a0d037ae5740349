package com.questrail.interactivity.pages;

import com.questrail.interactivity.api.Embed;
import com.questrail.interactivity.api.Page;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PageGeneratorTest {

    @Test
    void shortTextIsOnePage() {
        List<Page> pages = PageGenerator.inContent("hello", SplitType.CHARACTER);

        assertEquals(1, pages.size());
        assertEquals("**Page 1:**\n\nhello", pages.get(0).content());
        assertTrue(pages.get(0).embed().isEmpty());
    }

    @Test
    void characterSplitCutsAtPageSize() {
        String text = "x".repeat(PageGenerator.CHARACTERS_PER_PAGE * 2 + 5);

        List<String> chunks = PageGenerator.split(text, SplitType.CHARACTER);

        assertEquals(3, chunks.size());
        assertEquals(PageGenerator.CHARACTERS_PER_PAGE, chunks.get(0).length());
        assertEquals(PageGenerator.CHARACTERS_PER_PAGE, chunks.get(1).length());
        assertEquals(5, chunks.get(2).length());
        assertEquals(text, String.join("", chunks));
    }

    @Test
    void characterSplitKeepsSurrogatePairsTogether() {
        String text = "a".repeat(PageGenerator.CHARACTERS_PER_PAGE - 1) + "😀" + "b";

        List<String> chunks = PageGenerator.split(text, SplitType.CHARACTER);

        assertEquals(2, chunks.size());
        assertEquals(PageGenerator.CHARACTERS_PER_PAGE - 1, chunks.get(0).length());
        assertEquals("😀b", chunks.get(1));
    }

    @Test
    void lineSplitGroupsFifteenLines() {
        String text = IntStream.rangeClosed(1, 31)
                .mapToObj(i -> "line " + i)
                .collect(Collectors.joining("\n"));

        List<String> chunks = PageGenerator.split(text, SplitType.LINE);

        assertEquals(3, chunks.size());
        assertTrue(chunks.get(0).startsWith("line 1\n"));
        assertTrue(chunks.get(0).endsWith("line 15"));
        assertEquals("line 31", chunks.get(2));
    }

    @Test
    void contentPagesAreNumberedFromOne() {
        String text = IntStream.rangeClosed(1, 16)
                .mapToObj(Integer::toString)
                .collect(Collectors.joining("\n"));

        List<Page> pages = PageGenerator.inContent(text, SplitType.LINE);

        assertEquals(2, pages.size());
        assertTrue(pages.get(1).content().startsWith("**Page 2:**\n\n"));
        assertTrue(pages.get(1).content().endsWith("16"));
    }

    @Test
    void embedPagesCopyBaseAndSetTitle() {
        Embed base = Embed.builder().color(0x00FF00).footer("footer").build();
        String text = "y".repeat(PageGenerator.CHARACTERS_PER_PAGE + 1);

        List<Page> pages = PageGenerator.inEmbed(text, SplitType.CHARACTER, base);

        assertEquals(2, pages.size());
        Embed second = pages.get(1).embed().orElseThrow();
        assertEquals(Optional.of("Page 2"), second.title());
        assertEquals(Optional.of("y"), second.description());
        assertEquals(Optional.of(0x00FF00), second.color());
        assertEquals(Optional.of("footer"), second.footer());
        assertTrue(base.title().isEmpty());
    }

    @Test
    void embedPagesWithoutBase() {
        List<Page> pages = PageGenerator.inEmbed("text", SplitType.LINE, null);

        Embed embed = pages.get(0).embed().orElseThrow();
        assertEquals(Optional.of("Page 1"), embed.title());
        assertTrue(embed.color().isEmpty());
    }

    @Test
    void blankTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PageGenerator.inContent("  \n ", SplitType.LINE));
        assertThrows(IllegalArgumentException.class, () -> PageGenerator.inEmbed("", SplitType.CHARACTER, null));
    }
}
