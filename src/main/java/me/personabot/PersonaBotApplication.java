package me.personabot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Persona Bot.
 *
 * <p>
 * Persona Bot is a Discord assistant that answers as a configurable persona,
 * built with Spring Boot and langchain4j.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>HTTP Interactions</b> - slash commands, buttons, modals and context
 * menus received over signed webhooks</li>
 * <li><b>Deferred Replies</b> - fast acknowledgment within the platform
 * deadline, content delivered later by editing the placeholder</li>
 * <li><b>Personas</b> - per-user persona preference with channel and guild
 * defaults</li>
 * <li><b>Settings Cascade</b> - channel, guild and system-default
 * settings</li>
 * <li><b>Rate Limiting</b> - per-user sliding window quota</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → DiscordInteractionController
 * Domain Layer       → InteractionOrchestrator, SettingsResolver, ConversationContextService
 * Infrastructure     → LLM/Storage/Discord REST Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PersonaBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(PersonaBotApplication.class, args);
    }

}
