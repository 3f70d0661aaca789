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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits model output into chunks that fit the platform message limit.
 *
 * <p>
 * The text is first parsed into plain spans and fenced code blocks
 * ({@code ```...```}). Fenced blocks are atomic: a block that does not fit in
 * the current chunk starts the next one, and a block longer than the limit is
 * emitted alone as one oversized chunk. Plain spans are cut at the last
 * boundary that fits, preferring in order:
 * <ol>
 * <li>paragraph break ({@code \n\n})</li>
 * <li>line break</li>
 * <li>sentence terminator followed by whitespace</li>
 * <li>last whitespace</li>
 * <li>hard cut at the limit</li>
 * </ol>
 *
 * <p>
 * No characters are added or dropped: concatenating the chunks yields the
 * input exactly. Break characters stay at the end of the chunk they close.
 */
public final class ResponseSplitter {

    static final String FENCE = "```";

    private ResponseSplitter() {
    }

    /**
     * Segment {@code text} into ordered chunks of at most {@code maxChunkSize}
     * characters, except for a single fenced block longer than the limit.
     *
     * @return non-empty list; a single empty chunk for empty input
     */
    public static List<String> segment(String text, int maxChunkSize) {
        if (maxChunkSize < 1) {
            throw new IllegalArgumentException("maxChunkSize must be positive: " + maxChunkSize);
        }
        if (text == null || text.isEmpty()) {
            return List.of("");
        }
        if (text.length() <= maxChunkSize) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (Segment segment : parse(text)) {
            if (segment.fenced()) {
                appendFenced(segment.text(), maxChunkSize, current, chunks);
            } else {
                appendPlain(segment.text(), maxChunkSize, current, chunks);
            }
        }
        flush(current, chunks);
        return chunks;
    }

    /**
     * Parse text into alternating plain and fenced segments. An unclosed fence
     * extends to the end of the text.
     */
    static List<Segment> parse(String text) {
        List<Segment> segments = new ArrayList<>();
        int position = 0;
        while (position < text.length()) {
            int open = text.indexOf(FENCE, position);
            if (open < 0) {
                segments.add(new Segment(text.substring(position), false));
                break;
            }
            if (open > position) {
                segments.add(new Segment(text.substring(position, open), false));
            }
            int close = text.indexOf(FENCE, open + FENCE.length());
            int end = close < 0 ? text.length() : close + FENCE.length();
            segments.add(new Segment(text.substring(open, end), true));
            position = end;
        }
        return segments;
    }

    private static void appendFenced(String block, int maxChunkSize, StringBuilder current, List<String> chunks) {
        if (current.length() + block.length() <= maxChunkSize) {
            current.append(block);
            return;
        }
        flush(current, chunks);
        if (block.length() <= maxChunkSize) {
            current.append(block);
        } else {
            chunks.add(block);
        }
    }

    private static void appendPlain(String plain, int maxChunkSize, StringBuilder current, List<String> chunks) {
        String remaining = plain;
        while (!remaining.isEmpty()) {
            int room = maxChunkSize - current.length();
            if (remaining.length() <= room) {
                current.append(remaining);
                return;
            }

            int cut = findSoftCut(remaining, room);
            if (cut <= 0) {
                if (current.length() > 0) {
                    // Retry against an empty chunk before resorting to a hard cut
                    flush(current, chunks);
                    continue;
                }
                cut = hardCut(remaining, room);
            }

            current.append(remaining, 0, cut);
            flush(current, chunks);
            remaining = remaining.substring(cut);
        }
    }

    /**
     * Position to cut {@code text} at so that the head is at most
     * {@code limit} characters and not blank, or {@code -1} if no soft boundary
     * exists. Break characters stay with the head.
     */
    static int findSoftCut(String text, int limit) {
        if (limit <= 0) {
            return -1;
        }

        int paragraph = text.lastIndexOf("\n\n", limit - 2);
        if (paragraph >= 0 && hasContent(text, paragraph)) {
            return paragraph + 2;
        }

        int line = text.lastIndexOf('\n', limit - 1);
        if (line >= 0 && hasContent(text, line)) {
            return line + 1;
        }

        for (int i = limit - 2; i >= 0; i--) {
            if (isSentenceTerminator(text.charAt(i)) && Character.isWhitespace(text.charAt(i + 1))) {
                return i + 2;
            }
        }

        for (int i = limit - 1; i > 0; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                if (!hasContent(text, i)) {
                    break;
                }
                return i + 1;
            }
        }
        return -1;
    }

    private static int hardCut(String text, int limit) {
        int cut = Math.min(limit, text.length());
        // Keep surrogate pairs together
        if (cut > 1 && cut < text.length() && Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return cut;
    }

    private static boolean hasContent(String text, int end) {
        for (int i = 0; i < end; i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSentenceTerminator(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    private static void flush(StringBuilder current, List<String> chunks) {
        if (current.length() > 0) {
            chunks.add(current.toString());
            current.setLength(0);
        }
    }

    record Segment(String text, boolean fenced) {
    }
}
