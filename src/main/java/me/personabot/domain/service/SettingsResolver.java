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

import me.personabot.domain.exception.SettingsResolutionException;
import me.personabot.domain.model.ResolvedSetting;
import me.personabot.domain.model.SettingKey;
import me.personabot.domain.model.SettingScope;
import me.personabot.infrastructure.config.BotProperties;
import me.personabot.port.outbound.ConfigurationStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves effective settings through the channel → guild → system-default
 * cascade.
 *
 * <p>
 * Each scope lookup yields an optional value and resolution stops at the first
 * scope that defines one; values are never merged across scopes. System
 * defaults are static per {@link SettingKey} and may be overridden with
 * {@code bot.settings.defaults.<key>}, so resolution always yields a value.
 *
 * <p>
 * Store read failures surface as {@link SettingsResolutionException};
 * {@link #resolveOrDefault} and {@link #describe} recover from them with the
 * system default.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettingsResolver {

    private final ConfigurationStorePort configurationStore;
    private final PersonaService personaService;
    private final BotProperties properties;

    /**
     * Resolve the effective value of a setting.
     *
     * @param botId
     *            bot whose overrides are consulted
     * @param channelId
     *            channel scope id, {@code null} skips the channel scope
     * @param guildId
     *            guild scope id, {@code null} (direct messages) skips the guild
     *            scope
     * @throws SettingsResolutionException
     *             if the configuration store cannot be read
     */
    public String resolve(String botId, SettingKey key, String channelId, String guildId) {
        return resolveWithScope(botId, key, channelId, guildId).value();
    }

    /**
     * Resolve a setting by name.
     *
     * @throws IllegalArgumentException
     *             if the name is not a recognized setting
     */
    public String resolve(String botId, String keyName, String channelId, String guildId) {
        SettingKey key = SettingKey.fromName(keyName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown setting: " + keyName));
        return resolve(botId, key, channelId, guildId);
    }

    public ResolvedSetting resolveWithScope(String botId, SettingKey key, String channelId, String guildId) {
        for (ScopeRef scope : scopeChain(channelId, guildId)) {
            Optional<String> value = lookup(botId, scope, key);
            if (value.isPresent()) {
                return new ResolvedSetting(key, value.get(), scope.scope());
            }
        }
        return new ResolvedSetting(key, systemDefault(key), SettingScope.SYSTEM_DEFAULT);
    }

    /**
     * Resolve a setting, falling back to the system default when the store is
     * unavailable.
     */
    public String resolveOrDefault(String botId, SettingKey key, String channelId, String guildId) {
        try {
            return resolve(botId, key, channelId, guildId);
        } catch (SettingsResolutionException e) {
            log.warn("[Settings] {} unavailable, using system default: {}", key.getKey(), e.getMessage());
            return systemDefault(key);
        }
    }

    /**
     * Effective value and originating scope of every recognized setting. A key
     * whose overrides cannot be read is reported with its system default and
     * flagged {@link ResolvedSetting#unavailable()}.
     */
    public Map<SettingKey, ResolvedSetting> describe(String botId, String channelId, String guildId) {
        Map<SettingKey, ResolvedSetting> result = new EnumMap<>(SettingKey.class);
        for (SettingKey key : SettingKey.values()) {
            try {
                result.put(key, resolveWithScope(botId, key, channelId, guildId));
            } catch (SettingsResolutionException e) {
                log.warn("[Settings] {} unavailable, reporting system default: {}", key.getKey(), e.getMessage());
                result.put(key, new ResolvedSetting(key, systemDefault(key), SettingScope.SYSTEM_DEFAULT, true));
            }
        }
        return result;
    }

    /**
     * Validate and store a scoped override.
     *
     * @return the normalized value that was stored
     * @throws IllegalArgumentException
     *             if the value is not valid for the key or the scope is the
     *             system default
     */
    public String set(String botId, SettingScope scope, String scopeId, SettingKey key, String value) {
        if (scope == SettingScope.SYSTEM_DEFAULT) {
            throw new IllegalArgumentException("System defaults are read-only");
        }
        if (scopeId == null || scopeId.isBlank()) {
            throw new IllegalArgumentException("Missing " + scope.getLabel() + " id");
        }
        String normalized = validate(key, value);
        configurationStore.put(botId, scope, scopeId, key, normalized);
        log.info("[Settings] Set {}={}: bot={}, {}={}", key.getKey(), normalized, botId, scope.getLabel(), scopeId);
        return normalized;
    }

    public String systemDefault(SettingKey key) {
        String override = properties.getSettings().getDefaults().get(key.getKey());
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        return key.getDefaultValue();
    }

    String validate(SettingKey key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Value for " + key.getKey() + " must not be empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (key) {
        case MENTION_RESPONSES, REMINDERS, IMAGE_GENERATION -> normalized = normalizeToggle(key, normalized);
        case VERBOSITY -> {
            if (!SettingKey.VERBOSITY_LEVELS.contains(normalized)) {
                throw new IllegalArgumentException("Verbosity must be one of concise, normal, detailed");
            }
        }
        case PERSONA -> {
            if (!personaService.exists(normalized)) {
                throw new IllegalArgumentException("Unknown persona: " + normalized);
            }
        }
        case MAX_CONTEXT_MESSAGES -> {
            int parsed;
            try {
                parsed = Integer.parseInt(normalized);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("max_context_messages must be a number", e);
            }
            if (parsed < 0 || parsed > SettingKey.MAX_CONTEXT_MESSAGES_LIMIT) {
                throw new IllegalArgumentException("max_context_messages must be between 0 and "
                        + SettingKey.MAX_CONTEXT_MESSAGES_LIMIT);
            }
        }
        }
        return normalized;
    }

    private static String normalizeToggle(SettingKey key, String value) {
        return switch (value) {
        case SettingKey.ENABLED, "on", "true", "yes" -> SettingKey.ENABLED;
        case SettingKey.DISABLED, "off", "false", "no" -> SettingKey.DISABLED;
        default -> throw new IllegalArgumentException(key.getKey() + " must be enabled or disabled");
        };
    }

    private Optional<String> lookup(String botId, ScopeRef scope, SettingKey key) {
        try {
            return configurationStore.get(botId, scope.scope(), scope.id(), key)
                    .filter(value -> !value.isBlank());
        } catch (RuntimeException e) {
            throw new SettingsResolutionException("Failed to read " + scope.scope().getLabel()
                    + " setting " + key.getKey() + " for " + scope.id(), e);
        }
    }

    private List<ScopeRef> scopeChain(String channelId, String guildId) {
        List<ScopeRef> chain = new ArrayList<>(2);
        if (channelId != null && !channelId.isBlank()) {
            chain.add(new ScopeRef(SettingScope.CHANNEL, channelId));
        }
        if (guildId != null && !guildId.isBlank()) {
            chain.add(new ScopeRef(SettingScope.GUILD, guildId));
        }
        return chain;
    }

    private record ScopeRef(SettingScope scope, String id) {
    }
}
