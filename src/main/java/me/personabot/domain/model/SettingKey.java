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
 * Settings recognized by the cascade. Every key carries a static system
 * default, so resolution can never come back empty.
 */
public enum SettingKey {

    VERBOSITY("verbosity", "normal", Set.of("default_verbosity")),

    PERSONA("persona", "obi", Set.of("default_persona")),

    MAX_CONTEXT_MESSAGES("max_context_messages", "40", Set.of()),

    /** Whether plain channel messages that mention the bot are answered. */
    MENTION_RESPONSES("mention_responses", SettingKey.ENABLED, Set.of()),

    REMINDERS("reminders", SettingKey.ENABLED, Set.of()),

    IMAGE_GENERATION("image_generation", SettingKey.ENABLED, Set.of());

    public static final String ENABLED = "enabled";
    public static final String DISABLED = "disabled";
    public static final Set<String> VERBOSITY_LEVELS = Set.of("concise", "normal", "detailed");
    public static final int MAX_CONTEXT_MESSAGES_LIMIT = 100;

    private final String key;
    private final String defaultValue;
    private final Set<String> aliases;

    SettingKey(String key, String defaultValue, Set<String> aliases) {
        this.key = key;
        this.defaultValue = defaultValue;
        this.aliases = aliases;
    }

    public String getKey() {
        return key;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    /**
     * Whether the value is one of {@link #ENABLED} or {@link #DISABLED}.
     */
    public boolean isToggle() {
        return ENABLED.equals(defaultValue) || DISABLED.equals(defaultValue);
    }

    /**
     * Look up a key by its name or one of its command aliases
     * ({@code default_verbosity} for {@code verbosity}).
     */
    public static Optional<SettingKey> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.key.equals(normalized) || k.aliases.contains(normalized))
                .findFirst();
    }
}
