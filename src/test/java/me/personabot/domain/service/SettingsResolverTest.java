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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SettingsResolverTest {

    private static final String BOT = "bot-1";
    private static final String CHANNEL = "channel-1";
    private static final String GUILD = "guild-1";

    private ConfigurationStorePort store;
    private BotProperties properties;
    private SettingsResolver resolver;

    @BeforeEach
    void setUp() {
        store = mock(ConfigurationStorePort.class);
        when(store.get(anyString(), any(), anyString(), any())).thenReturn(Optional.empty());

        properties = new BotProperties();
        BotProperties.PersonaProperties obi = new BotProperties.PersonaProperties();
        obi.setName("Obi-Wan Kenobi");
        obi.setSystemPrompt("You are Obi-Wan Kenobi.");
        BotProperties.PersonaProperties chef = new BotProperties.PersonaProperties();
        chef.setName("Chef");
        chef.setSystemPrompt("You are a chef.");
        properties.getPersonas().put("obi", obi);
        properties.getPersonas().put("chef", chef);

        resolver = new SettingsResolver(store, new PersonaService(properties), properties);
    }

    // ===== Cascade =====

    @Test
    void shouldUseGuildValueWhenChannelHasNoOverride() {
        when(store.get(BOT, SettingScope.GUILD, GUILD, SettingKey.VERBOSITY)).thenReturn(Optional.of("detailed"));

        assertEquals("detailed", resolver.resolve(BOT, "verbosity", CHANNEL, GUILD));
    }

    @Test
    void shouldPreferChannelOverGuild() {
        when(store.get(BOT, SettingScope.CHANNEL, CHANNEL, SettingKey.VERBOSITY)).thenReturn(Optional.of("concise"));
        when(store.get(BOT, SettingScope.GUILD, GUILD, SettingKey.VERBOSITY)).thenReturn(Optional.of("detailed"));

        ResolvedSetting resolved = resolver.resolveWithScope(BOT, SettingKey.VERBOSITY, CHANNEL, GUILD);

        assertEquals("concise", resolved.value());
        assertEquals(SettingScope.CHANNEL, resolved.scope());
        verify(store, never()).get(BOT, SettingScope.GUILD, GUILD, SettingKey.VERBOSITY);
    }

    @Test
    void shouldFallBackToSystemDefault() {
        ResolvedSetting resolved = resolver.resolveWithScope(BOT, SettingKey.VERBOSITY, CHANNEL, GUILD);

        assertEquals("normal", resolved.value());
        assertEquals(SettingScope.SYSTEM_DEFAULT, resolved.scope());
    }

    @Test
    void shouldUseConfiguredSystemDefaultOverride() {
        properties.getSettings().getDefaults().put("persona", "chef");

        assertEquals("chef", resolver.resolve(BOT, SettingKey.PERSONA, CHANNEL, GUILD));
    }

    @Test
    void shouldSkipGuildScopeInDirectMessages() {
        assertEquals("normal", resolver.resolve(BOT, SettingKey.VERBOSITY, CHANNEL, null));

        verify(store, never()).get(eq(BOT), eq(SettingScope.GUILD), any(), any());
    }

    @Test
    void shouldIgnoreBlankStoredValue() {
        when(store.get(BOT, SettingScope.CHANNEL, CHANNEL, SettingKey.VERBOSITY)).thenReturn(Optional.of("  "));
        when(store.get(BOT, SettingScope.GUILD, GUILD, SettingKey.VERBOSITY)).thenReturn(Optional.of("concise"));

        assertEquals("concise", resolver.resolve(BOT, SettingKey.VERBOSITY, CHANNEL, GUILD));
    }

    @Test
    void shouldAcceptAliasName() {
        when(store.get(BOT, SettingScope.GUILD, GUILD, SettingKey.VERBOSITY)).thenReturn(Optional.of("detailed"));

        assertEquals("detailed", resolver.resolve(BOT, "default_verbosity", CHANNEL, GUILD));
    }

    @Test
    void shouldRejectUnknownSettingName() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(BOT, "colour", CHANNEL, GUILD));
    }

    @Test
    void shouldDescribeEverySetting() {
        when(store.get(BOT, SettingScope.GUILD, GUILD, SettingKey.PERSONA)).thenReturn(Optional.of("chef"));

        Map<SettingKey, ResolvedSetting> settings = resolver.describe(BOT, CHANNEL, GUILD);

        assertEquals(SettingKey.values().length, settings.size());
        assertEquals(SettingScope.GUILD, settings.get(SettingKey.PERSONA).scope());
        assertEquals("40", settings.get(SettingKey.MAX_CONTEXT_MESSAGES).value());
    }

    // ===== Store failures =====

    @Test
    void shouldRaiseResolutionErrorWhenStoreFails() {
        when(store.get(BOT, SettingScope.CHANNEL, CHANNEL, SettingKey.VERBOSITY))
                .thenThrow(new IllegalStateException("disk gone"));

        SettingsResolutionException error = assertThrows(SettingsResolutionException.class,
                () -> resolver.resolve(BOT, SettingKey.VERBOSITY, CHANNEL, GUILD));
        assertTrue(error.getMessage().contains("verbosity"));
    }

    @Test
    void shouldUseSystemDefaultWhenStoreFailsInResolveOrDefault() {
        when(store.get(BOT, SettingScope.CHANNEL, CHANNEL, SettingKey.VERBOSITY))
                .thenThrow(new IllegalStateException("disk gone"));

        assertEquals("normal", resolver.resolveOrDefault(BOT, SettingKey.VERBOSITY, CHANNEL, GUILD));
    }

    @Test
    void shouldDescribeWithDefaultsWhenStoreFails() {
        when(store.get(anyString(), any(), anyString(), any())).thenThrow(new IllegalStateException("disk gone"));

        Map<SettingKey, ResolvedSetting> settings = assertDoesNotThrow(() -> resolver.describe(BOT, CHANNEL, GUILD));

        assertEquals(SettingKey.values().length, settings.size());
        ResolvedSetting verbosity = settings.get(SettingKey.VERBOSITY);
        assertEquals("normal", verbosity.value());
        assertEquals(SettingScope.SYSTEM_DEFAULT, verbosity.scope());
        assertTrue(verbosity.unavailable());
    }

    @Test
    void shouldOnlyFlagKeysWhoseLookupFailed() {
        when(store.get(BOT, SettingScope.CHANNEL, CHANNEL, SettingKey.PERSONA))
                .thenThrow(new IllegalStateException("corrupted"));
        when(store.get(BOT, SettingScope.GUILD, GUILD, SettingKey.VERBOSITY)).thenReturn(Optional.of("concise"));

        Map<SettingKey, ResolvedSetting> settings = resolver.describe(BOT, CHANNEL, GUILD);

        assertTrue(settings.get(SettingKey.PERSONA).unavailable());
        assertEquals("obi", settings.get(SettingKey.PERSONA).value());
        assertFalse(settings.get(SettingKey.VERBOSITY).unavailable());
        assertEquals("concise", settings.get(SettingKey.VERBOSITY).value());
    }

    // ===== Updates =====

    @Test
    void shouldNormalizeToggleValues() {
        assertEquals("disabled", resolver.set(BOT, SettingScope.GUILD, GUILD, SettingKey.MENTION_RESPONSES, "Off"));
        assertEquals("enabled", resolver.set(BOT, SettingScope.GUILD, GUILD, SettingKey.REMINDERS, "true"));

        verify(store).put(BOT, SettingScope.GUILD, GUILD, SettingKey.MENTION_RESPONSES, "disabled");
        assertThrows(IllegalArgumentException.class,
                () -> resolver.set(BOT, SettingScope.GUILD, GUILD, SettingKey.IMAGE_GENERATION, "sometimes"));
    }

    @Test
    void shouldDefaultTogglesToEnabled() {
        assertEquals("enabled", resolver.resolve(BOT, "mention_responses", CHANNEL, GUILD));
        assertTrue(SettingKey.MENTION_RESPONSES.isToggle());
        assertFalse(SettingKey.VERBOSITY.isToggle());
    }

    @Test
    void shouldNormalizeAndStoreValidValue() {
        String stored = resolver.set(BOT, SettingScope.CHANNEL, CHANNEL, SettingKey.VERBOSITY, " Detailed ");

        assertEquals("detailed", stored);
        verify(store).put(BOT, SettingScope.CHANNEL, CHANNEL, SettingKey.VERBOSITY, "detailed");
    }

    @Test
    void shouldRejectInvalidVerbosity() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.set(BOT, SettingScope.GUILD, GUILD, SettingKey.VERBOSITY, "chatty"));
        verify(store, never()).put(any(), any(), any(), any(), any());
    }

    @Test
    void shouldRejectUnknownPersona() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.set(BOT, SettingScope.GUILD, GUILD, SettingKey.PERSONA, "pirate"));
    }

    @Test
    void shouldRejectOutOfRangeContextSize() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.set(BOT, SettingScope.GUILD, GUILD, SettingKey.MAX_CONTEXT_MESSAGES, "101"));
        assertThrows(IllegalArgumentException.class,
                () -> resolver.set(BOT, SettingScope.GUILD, GUILD, SettingKey.MAX_CONTEXT_MESSAGES, "many"));
        assertEquals("0", resolver.set(BOT, SettingScope.GUILD, GUILD, SettingKey.MAX_CONTEXT_MESSAGES, "0"));
    }

    @Test
    void shouldRejectWritesToSystemDefaultScope() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.set(BOT, SettingScope.SYSTEM_DEFAULT, "x", SettingKey.VERBOSITY, "concise"));
    }

    @Test
    void shouldRejectMissingScopeId() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.set(BOT, SettingScope.GUILD, null, SettingKey.VERBOSITY, "concise"));
    }
}
