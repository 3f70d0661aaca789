package me.personabot.adapter.outbound.storage;

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

import me.personabot.domain.model.SettingKey;
import me.personabot.domain.model.SettingScope;
import me.personabot.domain.service.StorageKeys;
import me.personabot.port.outbound.ConfigurationStorePort;
import me.personabot.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scoped setting overrides stored as one JSON document per scope:
 * {@code settings/<botId>/<channel|guild>/<scopeId>.json}. Documents are cached
 * after the first read and rewritten atomically on every change.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileConfigurationStore implements ConfigurationStorePort {

    private static final String SETTINGS_DIR = "settings";
    private static final TypeReference<LinkedHashMap<String, String>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, Map<SettingKey, String>> cache = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String botId, SettingScope scope, String scopeId, SettingKey key) {
        return Optional.ofNullable(document(botId, scope, scopeId).get(key));
    }

    @Override
    public void put(String botId, SettingScope scope, String scopeId, SettingKey key, String value) {
        requireStoredScope(scope);
        String path = path(botId, scope, scopeId);
        cache.compute(path, (p, current) -> {
            Map<SettingKey, String> updated = new EnumMap<>(SettingKey.class);
            updated.putAll(current != null ? current : load(p));
            updated.put(key, value);
            storagePort.putTextAtomic(SETTINGS_DIR, p, serialize(updated)).join();
            return Collections.unmodifiableMap(updated);
        });
    }

    @Override
    public Map<SettingKey, String> getAll(String botId, SettingScope scope, String scopeId) {
        return document(botId, scope, scopeId);
    }

    private Map<SettingKey, String> document(String botId, SettingScope scope, String scopeId) {
        requireStoredScope(scope);
        return cache.computeIfAbsent(path(botId, scope, scopeId), this::load);
    }

    private Map<SettingKey, String> load(String path) {
        String json = storagePort.getText(SETTINGS_DIR, path).join();
        Map<SettingKey, String> values = new EnumMap<>(SettingKey.class);
        if (json == null || json.isBlank()) {
            return Collections.unmodifiableMap(values);
        }

        Map<String, String> raw;
        try {
            raw = objectMapper.readValue(json, DOCUMENT_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted settings document: " + path, e);
        }
        raw.forEach((name, value) -> SettingKey.fromName(name).ifPresentOrElse(
                key -> values.put(key, value),
                () -> log.warn("[Settings] Ignoring unknown setting '{}' in {}", name, path)));
        return Collections.unmodifiableMap(values);
    }

    private String serialize(Map<SettingKey, String> values) {
        Map<String, String> raw = new LinkedHashMap<>();
        values.forEach((key, value) -> raw.put(key.getKey(), value));
        try {
            return objectMapper.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settings", e);
        }
    }

    private static void requireStoredScope(SettingScope scope) {
        if (scope == SettingScope.SYSTEM_DEFAULT) {
            throw new IllegalArgumentException("System defaults are not stored");
        }
    }

    private static String path(String botId, SettingScope scope, String scopeId) {
        return StorageKeys.segment(botId) + "/" + scope.getLabel() + "/" + StorageKeys.segment(scopeId) + ".json";
    }
}
