package me.personabot.domain.service;

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

import java.nio.charset.StandardCharsets;

/**
 * Turns platform ids into safe storage path segments.
 *
 * <p>
 * Letters, digits, {@code _} and {@code -} are kept as is; every other byte of
 * the UTF-8 form is written as {@code %XX}. The mapping is reversible, so
 * distinct ids always land on distinct paths and no segment can contain a
 * path separator or start with a dot.
 */
public final class StorageKeys {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private StorageKeys() {
    }

    public static String segment(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        StringBuilder sb = new StringBuilder(id.length());
        for (byte b : id.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (isSafe(c)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    /**
     * Inverse of {@link #segment(String)}.
     */
    public static String id(String segment) {
        if (segment == null || segment.isEmpty()) {
            throw new IllegalArgumentException("segment must not be empty");
        }
        byte[] out = new byte[segment.length()];
        int length = 0;
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '%') {
                if (i + 2 >= segment.length()) {
                    throw new IllegalArgumentException("Truncated escape in segment: " + segment);
                }
                int hi = Character.digit(segment.charAt(i + 1), 16);
                int lo = Character.digit(segment.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    throw new IllegalArgumentException("Invalid escape in segment: " + segment);
                }
                out[length++] = (byte) ((hi << 4) | lo);
                i += 2;
            } else if (isSafe(c)) {
                out[length++] = (byte) c;
            } else {
                throw new IllegalArgumentException("Unescaped character in segment: " + segment);
            }
        }
        return new String(out, 0, length, StandardCharsets.UTF_8);
    }

    private static boolean isSafe(int c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }
}
