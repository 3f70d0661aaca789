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

import me.personabot.domain.model.Persona;
import me.personabot.domain.model.PromptModifier;
import me.personabot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PersonaServiceTest {

    private PersonaService personaService;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        BotProperties.PersonaProperties chef = new BotProperties.PersonaProperties();
        chef.setName("Chef");
        chef.setDescription("Cooking expert");
        chef.setSystemPrompt("You are a chef.");
        properties.getPersonas().put("Chef", chef);
        properties.getPersonas().put("bare", new BotProperties.PersonaProperties());
        personaService = new PersonaService(properties);
    }

    @Test
    void shouldLookUpPersonasCaseInsensitively() {
        assertTrue(personaService.exists("chef"));
        assertTrue(personaService.exists("CHEF"));
        assertFalse(personaService.exists("pirate"));
        assertFalse(personaService.exists(null));
    }

    @Test
    void shouldFillMissingPersonaFields() {
        Persona bare = personaService.getPersona("bare").orElseThrow();

        assertEquals("bare", bare.getName());
        assertEquals("", bare.getDescription());
        assertEquals(PersonaService.FALLBACK_PROMPT, bare.getSystemPrompt());
    }

    @Test
    void shouldListPersonasInConfiguredOrder() {
        List<Persona> personas = personaService.listPersonas();

        assertEquals(2, personas.size());
        assertEquals("chef", personas.get(0).getId());
    }

    @Test
    void shouldUseIdAsDisplayNameForUnknownPersona() {
        assertEquals("Chef", personaService.displayName("chef"));
        assertEquals("pirate", personaService.displayName("pirate"));
    }

    // ===== System prompt =====

    @Test
    void shouldBuildPromptWithModifierAndVerbosity() {
        String prompt = personaService.buildSystemPrompt("chef", PromptModifier.STEPS, "concise");

        assertTrue(prompt.startsWith("You are a chef. " + PromptModifier.STEPS.getInstruction()));
        assertTrue(prompt.endsWith("Keep responses brief: 2-3 sentences."));
    }

    @Test
    void shouldAddNothingForNormalVerbosity() {
        assertEquals("You are a chef.", personaService.buildSystemPrompt("chef", null, "normal"));
    }

    @Test
    void shouldAskForDetailWhenDetailed() {
        assertTrue(personaService.buildSystemPrompt("chef", null, "detailed").contains("comprehensive"));
    }

    @Test
    void shouldUseFallbackPromptForUnknownPersona() {
        assertEquals(PersonaService.FALLBACK_PROMPT, personaService.buildSystemPrompt("pirate", null, "normal"));
    }
}
