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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.personabot.domain.model.SettingKey;
import me.personabot.domain.model.SettingScope;
import me.personabot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileConfigurationStoreTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private FileConfigurationStore store;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = new ObjectMapper();
        store = new FileConfigurationStore(storage, objectMapper);
    }

    @Test
    void shouldReturnEmptyForUnsetScope() {
        assertEquals(Optional.empty(), store.get("bot-1", SettingScope.GUILD, "g1", SettingKey.VERBOSITY));
    }

    @Test
    void shouldPersistValuesPerScope() throws Exception {
        store.put("bot-1", SettingScope.GUILD, "g1", SettingKey.VERBOSITY, "detailed");
        store.put("bot-1", SettingScope.GUILD, "g1", SettingKey.PERSONA, "chef");

        String json = Files.readString(tempDir.resolve("settings/bot-1/guild/g1.json"));
        assertEquals(Map.of("verbosity", "detailed", "persona", "chef"), objectMapper.readValue(json, Map.class));
    }

    @Test
    void shouldReloadFromDisk() {
        store.put("bot-1", SettingScope.CHANNEL, "c1", SettingKey.VERBOSITY, "concise");

        FileConfigurationStore reopened = new FileConfigurationStore(storage, objectMapper);

        assertEquals("concise", reopened.get("bot-1", SettingScope.CHANNEL, "c1", SettingKey.VERBOSITY).orElseThrow());
        assertEquals(Map.of(SettingKey.VERBOSITY, "concise"), reopened.getAll("bot-1", SettingScope.CHANNEL, "c1"));
    }

    @Test
    void shouldNotCollideOnBotIdsThatOnlyDifferInSeparators() {
        store.put("bot:1", SettingScope.GUILD, "g1", SettingKey.PERSONA, "chef");
        store.put("bot_1", SettingScope.GUILD, "g1", SettingKey.PERSONA, "muppet");

        FileConfigurationStore reopened = new FileConfigurationStore(storage, objectMapper);

        assertEquals("chef", reopened.get("bot:1", SettingScope.GUILD, "g1", SettingKey.PERSONA).orElseThrow());
        assertEquals("muppet", reopened.get("bot_1", SettingScope.GUILD, "g1", SettingKey.PERSONA).orElseThrow());
        assertTrue(Files.exists(tempDir.resolve("settings/bot%3A1/guild/g1.json")));
    }

    @Test
    void shouldIsolateBotsAndScopes() {
        store.put("bot-1", SettingScope.GUILD, "same", SettingKey.VERBOSITY, "concise");

        assertTrue(store.get("bot-2", SettingScope.GUILD, "same", SettingKey.VERBOSITY).isEmpty());
        assertTrue(store.get("bot-1", SettingScope.CHANNEL, "same", SettingKey.VERBOSITY).isEmpty());
    }

    @Test
    void shouldIgnoreUnknownKeysInDocument() {
        storage.putText("settings", "bot-1/guild/g1.json", "{\"colour\":\"blue\",\"verbosity\":\"concise\"}").join();

        assertEquals(Map.of(SettingKey.VERBOSITY, "concise"), store.getAll("bot-1", SettingScope.GUILD, "g1"));
    }

    @Test
    void shouldFailOnCorruptedDocument() {
        storage.putText("settings", "bot-1/guild/g1.json", "{oops").join();

        assertThrows(IllegalStateException.class,
                () -> store.get("bot-1", SettingScope.GUILD, "g1", SettingKey.VERBOSITY));
    }

    @Test
    void shouldRejectSystemDefaultScope() {
        assertThrows(IllegalArgumentException.class,
                () -> store.put("bot-1", SettingScope.SYSTEM_DEFAULT, "x", SettingKey.VERBOSITY, "concise"));
    }
}
