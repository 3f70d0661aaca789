package me.personabot.domain.model;

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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Output dimensions offered by {@code /imagine}.
 */
public enum ImageSize {

    SQUARE("square", "1024x1024", Set.of()),

    LANDSCAPE("landscape", "1792x1024", Set.of("wide")),

    PORTRAIT("portrait", "1024x1792", Set.of("tall"));

    private final String id;
    private final String dimensions;
    private final Set<String> aliases;

    ImageSize(String id, String dimensions, Set<String> aliases) {
        this.id = id;
        this.dimensions = dimensions;
        this.aliases = aliases;
    }

    public String getId() {
        return id;
    }

    public String getDimensions() {
        return dimensions;
    }

    public static Optional<ImageSize> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(size -> size.id.equals(normalized) || size.aliases.contains(normalized))
                .findFirst();
    }
}
