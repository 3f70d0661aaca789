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

import java.util.Locale;
import java.util.Optional;

public enum ImageStyle {

    /** Hyper-real, dramatic images. */
    VIVID,

    /** Plainer, less saturated images. */
    NATURAL;

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ImageStyle> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ImageStyle style : values()) {
            if (style.name().equals(normalized)) {
                return Optional.of(style);
            }
        }
        return Optional.empty();
    }
}
