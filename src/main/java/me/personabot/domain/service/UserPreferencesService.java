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

import me.personabot.domain.model.UserPreferences;
import me.personabot.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for per-user preferences, keyed by (bot, user). Preferences are
 * stored as {@code preferences/<botId>/<userId>.json} and cached in memory
 * after the first read.
 */
@Service
@Slf4j
public class UserPreferencesService {

    private static final String PREFERENCES_DIR = "preferences";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<PreferencesKey, UserPreferences> cache = new ConcurrentHashMap<>();

    public UserPreferencesService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Get preferences of a user, empty preferences if none were saved.
     */
    public UserPreferences getPreferences(String botId, String userId) {
        return cache.computeIfAbsent(new PreferencesKey(botId, userId), key -> load(botId, userId));
    }

    /**
     * Preferred persona of a user, if any.
     */
    public Optional<String> getPersona(String botId, String userId) {
        return Optional.ofNullable(getPreferences(botId, userId).getPersona());
    }

    /**
     * Save the preferred persona of a user.
     *
     * @throws IllegalStateException
     *             if persistence fails (in-memory state is left unchanged)
     */
    public void setPersona(String botId, String userId, String persona) {
        UserPreferences updated = UserPreferences.builder()
                .persona(persona)
                .updatedAt(Instant.now(clock))
                .build();
        try {
            String json = objectMapper.writeValueAsString(updated);
            storagePort.putTextAtomic(PREFERENCES_DIR, path(botId, userId), json).join();
            cache.put(new PreferencesKey(botId, userId), updated);
            log.debug("Saved preferences: bot={}, user={}, persona={}", botId, userId, persona);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to save preferences: bot={}, user={}", botId, userId, e);
            throw new IllegalStateException("Failed to persist preferences", e);
        }
    }

    private UserPreferences load(String botId, String userId) {
        try {
            String json = storagePort.getText(PREFERENCES_DIR, path(botId, userId)).join();
            if (json != null && !json.isBlank()) {
                return objectMapper.readValue(json, UserPreferences.class);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - unreadable preferences fall back to defaults
            log.debug("No saved preferences or failed to parse for bot={}, user={}: {}", botId, userId,
                    e.getMessage());
        }
        return new UserPreferences();
    }

    private static String path(String botId, String userId) {
        return StorageKeys.segment(botId) + "/" + StorageKeys.segment(userId) + ".json";
    }

    private record PreferencesKey(String botId, String userId) {
    }
}
