package me.personabot.adapter.outbound.discord;

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

import me.personabot.infrastructure.config.BotProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Publishes the slash and context-menu command definitions from
 * {@code discord/commands.json} with a bulk overwrite, either globally or to a
 * single guild. Disabled unless {@code bot.discord.register-commands} is set.
 */
@Component
@Slf4j
public class DiscordCommandRegistrar {

    static final String COMMANDS_RESOURCE = "discord/commands.json";

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient okHttpClient;
    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    public DiscordCommandRegistrar(OkHttpClient okHttpClient, BotProperties properties, ObjectMapper objectMapper) {
        this.okHttpClient = okHttpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getDiscord().isRegisterCommands()) {
            log.debug("[Discord] Command registration disabled");
            return;
        }
        try {
            int count = register();
            log.info("[Discord] Registered {} application commands", count);
        } catch (IOException e) {
            log.error("[Discord] Command registration failed: {}", e.getMessage());
        }
    }

    /**
     * Overwrites the registered commands.
     *
     * @return number of commands Discord reports as registered
     */
    public int register() throws IOException {
        BotProperties.DiscordProperties discord = properties.getDiscord();
        if (isBlank(discord.getApplicationId()) || isBlank(discord.getBotToken())) {
            throw new IOException("application id and bot token are required to register commands");
        }

        JsonNode commands = loadCommands();
        Request request = new Request.Builder()
                .url(getApiBaseUrl() + commandsPath(discord))
                .header("Authorization", "Bot " + discord.getBotToken())
                .put(RequestBody.create(objectMapper.writeValueAsString(commands), JSON))
                .build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new IOException("Discord returned HTTP " + response.code() + ": " + text);
            }
            JsonNode registered = text.isBlank() ? null : objectMapper.readTree(text);
            return registered != null && registered.isArray() ? registered.size() : commands.size();
        }
    }

    JsonNode loadCommands() throws IOException {
        ClassPathResource resource = new ClassPathResource(COMMANDS_RESOURCE);
        try (InputStream is = resource.getInputStream()) {
            JsonNode commands = objectMapper.readTree(is);
            if (commands == null || !commands.isArray()) {
                throw new IOException(COMMANDS_RESOURCE + " must contain a JSON array");
            }
            return commands;
        }
    }

    private String commandsPath(BotProperties.DiscordProperties discord) {
        String base = "/applications/" + discord.getApplicationId();
        if (isBlank(discord.getCommandGuildId())) {
            return base + "/commands";
        }
        return base + "/guilds/" + discord.getCommandGuildId() + "/commands";
    }

    protected String getApiBaseUrl() {
        String base = properties.getDiscord().getApiBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
