package me.personabot.domain.text;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseSplitterTest {

    private static final int LIMIT = 2000;

    // ===== Trivial input =====

    @Test
    void shouldReturnSingleEmptyChunkForEmptyText() {
        assertEquals(List.of(""), ResponseSplitter.segment("", LIMIT));
        assertEquals(List.of(""), ResponseSplitter.segment(null, LIMIT));
    }

    @Test
    void shouldReturnShortTextUnchanged() {
        assertEquals(List.of("Hello there."), ResponseSplitter.segment("Hello there.", LIMIT));
    }

    @Test
    void shouldKeepTextOfExactlyLimitLength() {
        String text = "x".repeat(LIMIT);

        assertEquals(List.of(text), ResponseSplitter.segment(text, LIMIT));
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> ResponseSplitter.segment("text", 0));
    }

    // ===== Soft boundaries =====

    @Test
    void shouldSplitAtParagraphBreakInsteadOfHardCut() {
        String text = "a".repeat(1800) + "\n\n" + "b".repeat(3198);

        List<String> chunks = ResponseSplitter.segment(text, LIMIT);

        assertEquals(1802, chunks.get(0).length());
        assertTrue(chunks.get(0).endsWith("\n\n"));
        assertAllWithinLimit(chunks, LIMIT);
        assertEquals(text, String.join("", chunks));
    }

    @Test
    void shouldPreferParagraphOverLaterLineBreak() {
        String text = "alpha\n\nbeta\ngamma delta";

        List<String> chunks = ResponseSplitter.segment(text, 15);

        assertEquals("alpha\n\n", chunks.get(0));
        assertEquals(text, String.join("", chunks));
    }

    @Test
    void shouldSplitAtLineBreakWhenNoParagraph() {
        String text = "first line\nsecond line is long";

        List<String> chunks = ResponseSplitter.segment(text, 20);

        assertEquals("first line\n", chunks.get(0));
        assertEquals("second line is long", chunks.get(1));
    }

    @Test
    void shouldSplitAfterSentenceTerminator() {
        String text = "One sentence here. Another one follows";

        List<String> chunks = ResponseSplitter.segment(text, 25);

        assertEquals("One sentence here. ", chunks.get(0));
        assertEquals("Another one follows", chunks.get(1));
    }

    @Test
    void shouldSplitAtLastWhitespaceWithoutSentence() {
        String text = "lorem ipsum dolor sit amet";

        List<String> chunks = ResponseSplitter.segment(text, 14);

        assertEquals("lorem ipsum ", chunks.get(0));
        assertEquals(text, String.join("", chunks));
        assertAllWithinLimit(chunks, 14);
    }

    @Test
    void shouldHardCutTextWithoutBoundaries() {
        String text = "z".repeat(4500);

        List<String> chunks = ResponseSplitter.segment(text, LIMIT);

        assertEquals(3, chunks.size());
        assertEquals(2000, chunks.get(0).length());
        assertEquals(2000, chunks.get(1).length());
        assertEquals(500, chunks.get(2).length());
    }

    @Test
    void shouldNotSplitSurrogatePair() {
        String text = "abcd" + "😀" + "efgh";

        List<String> chunks = ResponseSplitter.segment(text, 5);

        for (String chunk : chunks) {
            assertFalse(Character.isHighSurrogate(chunk.charAt(chunk.length() - 1)), chunk);
        }
        assertEquals(text, String.join("", chunks));
    }

    @Test
    void shouldNeverProduceBlankChunkFromLeadingWhitespace() {
        String text = "\n\n\n" + "word ".repeat(30);

        List<String> chunks = ResponseSplitter.segment(text, 20);

        for (String chunk : chunks) {
            assertFalse(chunk.isEmpty());
        }
        assertEquals(text, String.join("", chunks));
        assertAllWithinLimit(chunks, 20);
    }

    // ===== Fenced blocks =====

    @Test
    void shouldEmitOversizedFencedBlockAsSingleChunk() {
        String block = "```java\n" + "x".repeat(2500 - 12) + "\n```";
        assertEquals(2500, block.length());

        List<String> chunks = ResponseSplitter.segment(block, LIMIT);

        assertEquals(List.of(block), chunks);
    }

    @Test
    void shouldMoveFencedBlockToNextChunkWhenItDoesNotFit() {
        String intro = "Here is the code:\n";
        String block = "```\n" + "y".repeat(30) + "\n```";
        String text = intro + block;

        List<String> chunks = ResponseSplitter.segment(text, 40);

        assertEquals(List.of(intro, block), chunks);
    }

    @Test
    void shouldNeverCutInsideFencedBlock() {
        String block = "```\nline one\nline two\nline three\n```";
        String text = "Intro text goes here. " + block + " Outro text follows after the block.";

        List<String> chunks = ResponseSplitter.segment(text, 45);

        assertTrue(chunks.contains(block) || chunks.stream().anyMatch(c -> c.contains(block)));
        for (String chunk : chunks) {
            int fences = chunk.split("```", -1).length - 1;
            assertEquals(0, fences % 2, "unbalanced fences in: " + chunk);
        }
        assertEquals(text, String.join("", chunks));
    }

    @Test
    void shouldTreatUnclosedFenceAsBlockToEnd() {
        List<ResponseSplitter.Segment> segments = ResponseSplitter.parse("before ```code without end");

        assertEquals(2, segments.size());
        assertFalse(segments.get(0).fenced());
        assertTrue(segments.get(1).fenced());
        assertEquals("```code without end", segments.get(1).text());
    }

    @Test
    void shouldParseAlternatingSegments() {
        List<ResponseSplitter.Segment> segments = ResponseSplitter.parse("a```b```c```d```");

        assertEquals(4, segments.size());
        assertEquals("a", segments.get(0).text());
        assertEquals("```b```", segments.get(1).text());
        assertEquals("c", segments.get(2).text());
        assertEquals("```d```", segments.get(3).text());
    }

    // ===== Cut search =====

    @Test
    void shouldReturnMinusOneWhenNoSoftBoundary() {
        assertEquals(-1, ResponseSplitter.findSoftCut("abcdefghij", 5));
        assertEquals(-1, ResponseSplitter.findSoftCut("abc", 0));
    }

    private static void assertAllWithinLimit(List<String> chunks, int limit) {
        for (String chunk : chunks) {
            assertTrue(chunk.length() <= limit, "chunk too long: " + chunk.length());
        }
    }
}
