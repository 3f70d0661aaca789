package me.personabot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix. This class
 * contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link RateLimitProperties} - per-user sliding window quota</li>
 * <li>{@link InteractionProperties} - acknowledgment and completion
 * deadlines, reply splitting</li>
 * <li>{@link SettingsProperties} - system defaults of the settings
 * cascade</li>
 * <li>{@link PersonaProperties} - personas the bot can speak as</li>
 * <li>{@link DiscordProperties} - platform credentials and endpoints</li>
 * <li>{@link LlmProperties} - language model provider</li>
 * <li>{@link ImageProperties} - image generation model</li>
 * <li>{@link RemindersProperties} - reminder limits and delivery schedule</li>
 * <li>{@link StorageProperties} - persistence configuration</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    /** Identity of this bot instance; separates state of bots sharing storage. */
    private String botId = "default";

    /** Build version shown by {@code /features}. */
    private String version = "dev";

    private RateLimitProperties rateLimit = new RateLimitProperties();
    private InteractionProperties interaction = new InteractionProperties();
    private SettingsProperties settings = new SettingsProperties();
    private Map<String, PersonaProperties> personas = new LinkedHashMap<>();
    private DiscordProperties discord = new DiscordProperties();
    private LlmProperties llm = new LlmProperties();
    private ImageProperties image = new ImageProperties();
    private RemindersProperties reminders = new RemindersProperties();
    private StorageProperties storage = new StorageProperties();
    private UsageProperties usage = new UsageProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== RATE LIMIT ====================

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private int quota = 10;
        private Duration window = Duration.ofSeconds(60);
        private Duration evictionInterval = Duration.ofMinutes(5);
    }

    // ==================== INTERACTION LIFECYCLE ====================

    @Data
    public static class InteractionProperties {
        /** Hard platform deadline for the first response, measured from arrival. */
        private Duration ackDeadline = Duration.ofSeconds(3);
        /** Budget for the whole completion, measured from acknowledgment. */
        private Duration completionDeadline = Duration.ofMinutes(15);
        /** Budget for settings and history lookups before falling back to defaults. */
        private Duration configBudget = Duration.ofMillis(750);
        /** Timeout of a single send to the reply transport. */
        private Duration sendTimeout = Duration.ofSeconds(10);
        private int maxChunkSize = 2000;
        private int workerThreads = 32;
    }

    // ==================== SETTINGS CASCADE ====================

    @Data
    public static class SettingsProperties {
        /**
         * Overrides of the built-in system defaults, keyed by setting name
         * ({@code verbosity}, {@code persona}, {@code max_context_messages}).
         */
        private Map<String, String> defaults = new LinkedHashMap<>();
    }

    // ==================== PERSONAS ====================

    @Data
    public static class PersonaProperties {
        private String name;
        private String description;
        private String systemPrompt;
    }

    // ==================== DISCORD ====================

    @Data
    public static class DiscordProperties {
        private String applicationId;
        private String botToken;
        /** Hex-encoded Ed25519 public key used to verify interaction signatures. */
        private String publicKey;
        private String apiBaseUrl = "https://discord.com/api/v10";
        private boolean verifySignatures = true;
        /** Overwrite the application commands on startup. */
        private boolean registerCommands = false;
        /** Register to one guild instead of globally; global updates propagate slowly. */
        private String commandGuildId;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** {@code openai} or {@code anthropic}. */
        private String provider = "openai";
        private String apiKey;
        private String model = "gpt-5.1";
        private String baseUrl;
        private Double temperature;
        private Duration timeout = Duration.ofSeconds(45);
        private int threads = 8;
    }

    @Data
    public static class ImageProperties {
        /** OpenAI key; image generation is unavailable without one. */
        private String apiKey;
        private String model = "dall-e-3";
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(120);
        private int threads = 2;
    }

    // ==================== REMINDERS ====================

    @Data
    public static class RemindersProperties {
        /** How often due reminders are looked for. */
        private Duration checkInterval = Duration.ofSeconds(60);
        private Duration minDelay = Duration.ofMinutes(1);
        private Duration maxDelay = Duration.ofDays(365);
        private int maxPendingPerUser = 25;
        private int maxMessageLength = 1000;
        /** Budget for the in-character wording before the plain fallback is used. */
        private Duration wordingTimeout = Duration.ofSeconds(30);
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.persona-bot/workspace";
    }

    @Data
    public static class UsageProperties {
        private boolean enabled = true;
        private Duration retention = Duration.ofDays(30);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
