package com.spsync.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

class TextChunkerTest {

    @Test
    void shouldKeepShortTextAsSingleChunk() {
        List<String> chunks = new TextChunker(100, 10).split("hello world");
        assertEquals(List.of("hello world"), chunks);
    }

    @Test
    void shouldPreferParagraphBoundaries() {
        String text = "first paragraph here\n\nsecond paragraph here\n\nthird paragraph here";
        List<String> chunks = new TextChunker(30, 0).split(text);

        assertEquals(List.of("first paragraph here", "second paragraph here", "third paragraph here"), chunks);
    }

    @Test
    void shouldBoundChunkSizeAndOverlapNeighbours() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            text.append("word").append(i).append(' ');
        }
        List<String> chunks = new TextChunker(100, 30).split(text.toString());

        assertTrue(chunks.size() > 1);
        for (String chunk : chunks) {
            assertTrue(chunk.length() <= 100, "chunk too long: " + chunk.length());
        }
        String firstTail = chunks.get(0).substring(chunks.get(0).lastIndexOf(' ') + 1);
        assertTrue(chunks.get(1).startsWith(firstTail) || chunks.get(1).contains(firstTail));
    }

    @Test
    void shouldSplitUnbrokenTextByCharacters() {
        String text = "x".repeat(25);
        List<String> chunks = new TextChunker(10, 0).split(text);
        assertEquals(List.of("x".repeat(10), "x".repeat(10), "x".repeat(5)), chunks);
    }

    @Test
    void shouldBeDeterministicAndIgnoreBlankInput() {
        TextChunker chunker = new TextChunker(50, 5);
        byte[] content = "alpha beta\ngamma delta\n\nepsilon".getBytes(StandardCharsets.UTF_8);

        assertEquals(chunker.chunk(content, "text/plain"), chunker.chunk(content, "text/plain"));
        assertTrue(chunker.chunk("  \n ".getBytes(StandardCharsets.UTF_8), "text/plain").isEmpty());
    }

    @Test
    void shouldRejectOverlapNotSmallerThanSize() {
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(10, 10));
    }
}
