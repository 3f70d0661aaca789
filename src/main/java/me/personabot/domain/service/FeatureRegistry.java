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

import me.personabot.domain.model.Feature;
import me.personabot.domain.model.SettingKey;
import me.personabot.domain.model.SettingScope;
import me.personabot.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Catalog of bot capabilities and their per-server switches.
 *
 * <p>
 * Toggleable features are backed by a setting of the cascade, so a channel or
 * guild override disables them and direct messages always see the system
 * default.
 */
@Service
@Slf4j
public class FeatureRegistry {

    private final SettingsResolver settingsResolver;
    private final BotProperties properties;
    private final List<Feature> features;

    public FeatureRegistry(SettingsResolver settingsResolver, BotProperties properties) {
        this.settingsResolver = settingsResolver;
        this.properties = properties;
        this.features = List.of(
                new Feature("personas", "Persona System",
                        "Chat with distinct characters, chosen per user or per server", null),
                new Feature("reminders", "Reminders",
                        "Persona-flavored reminders delivered back to the channel", SettingKey.REMINDERS),
                new Feature("image_generation", "Image Generation",
                        "Create images from a text prompt with /imagine", SettingKey.IMAGE_GENERATION),
                new Feature("mention_responses", "Mention Responses",
                        "Answer channel messages that mention the bot", SettingKey.MENTION_RESPONSES),
                new Feature("introspection", "Introspection",
                        "The bot explains its own implementation", null),
                new Feature("rate_limiting", "Rate Limiting",
                        "Per-user sliding window request quota", null),
                new Feature("verbosity_control", "Verbosity Control",
                        "Concise, normal or detailed answers per channel or server", null),
                new Feature("guild_settings", "Server Settings",
                        "Server-wide defaults managed by administrators", null));
    }

    public List<Feature> listFeatures() {
        return features;
    }

    public List<Feature> toggleableFeatures() {
        return features.stream().filter(Feature::isToggleable).toList();
    }

    public Optional<Feature> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return features.stream().filter(feature -> feature.id().equals(normalized)).findFirst();
    }

    public String getVersion() {
        return properties.getVersion();
    }

    /**
     * Whether the feature is on for the channel. Features that cannot be
     * toggled are always on; unknown features are off.
     */
    public boolean isEnabled(String botId, String featureId, String channelId, String guildId) {
        return find(featureId).map(feature -> isEnabled(botId, feature, channelId, guildId)).orElse(false);
    }

    public boolean isEnabled(String botId, Feature feature, String channelId, String guildId) {
        if (!feature.isToggleable()) {
            return true;
        }
        return SettingKey.ENABLED.equals(
                settingsResolver.resolveOrDefault(botId, feature.toggle(), channelId, guildId));
    }

    /**
     * Flip a toggleable feature for a whole guild.
     *
     * @return {@code true} if the feature is now enabled
     * @throws IllegalArgumentException
     *             if the feature cannot be toggled
     */
    public boolean toggle(String botId, Feature feature, String guildId) {
        if (!feature.isToggleable()) {
            throw new IllegalArgumentException("Feature is not toggleable: " + feature.id());
        }
        boolean enabled = SettingKey.ENABLED.equals(
                settingsResolver.resolve(botId, feature.toggle(), null, guildId));
        String next = enabled ? SettingKey.DISABLED : SettingKey.ENABLED;
        settingsResolver.set(botId, SettingScope.GUILD, guildId, feature.toggle(), next);
        log.info("[Features] {} {} for guild {}", feature.id(), next, guildId);
        return !enabled;
    }
}
