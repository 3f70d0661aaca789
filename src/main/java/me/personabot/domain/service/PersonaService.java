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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of configured personas and builder of the system prompt.
 *
 * <p>
 * The system prompt is the persona prompt, followed by the optional command
 * modifier and the verbosity instruction:
 *
 * <pre>
 * {persona prompt}[ {modifier instruction}][\n\n{verbosity instruction}]
 * </pre>
 *
 * Personas are bound from {@code bot.personas.<id>.*}. An unknown persona id
 * falls back to a neutral assistant prompt.
 */
@Service
@Slf4j
public class PersonaService {

    public static final String FALLBACK_PROMPT = "You are a helpful assistant.";

    private static final String CONCISE_SUFFIX = "\n\nKeep responses brief: 2-3 sentences.";
    private static final String DETAILED_SUFFIX = "\n\nProvide comprehensive, thorough responses.";

    private final Map<String, Persona> personas;

    public PersonaService(BotProperties properties) {
        Map<String, Persona> loaded = new LinkedHashMap<>();
        properties.getPersonas().forEach((id, config) -> {
            String normalizedId = id.toLowerCase(Locale.ROOT);
            loaded.put(normalizedId, Persona.builder()
                    .id(normalizedId)
                    .name(config.getName() != null ? config.getName() : id)
                    .description(config.getDescription() != null ? config.getDescription() : "")
                    .systemPrompt(config.getSystemPrompt() != null ? config.getSystemPrompt() : FALLBACK_PROMPT)
                    .build());
        });
        if (loaded.isEmpty()) {
            log.warn("[Persona] No personas configured under bot.personas.*, every reply uses the fallback prompt");
        }
        this.personas = Collections.unmodifiableMap(loaded);
    }

    public Optional<Persona> getPersona(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(personas.get(id.toLowerCase(Locale.ROOT)));
    }

    public boolean exists(String id) {
        return getPersona(id).isPresent();
    }

    public List<Persona> listPersonas() {
        return new ArrayList<>(personas.values());
    }

    /**
     * Display name of the persona, or the id itself when unknown.
     */
    public String displayName(String id) {
        return getPersona(id).map(Persona::getName).orElse(id);
    }

    /**
     * Build the system prompt for a persona.
     *
     * @param personaId
     *            persona id, unknown ids use {@link #FALLBACK_PROMPT}
     * @param modifier
     *            optional command modifier, may be {@code null}
     * @param verbosity
     *            resolved verbosity level
     */
    public String buildSystemPrompt(String personaId, PromptModifier modifier, String verbosity) {
        StringBuilder prompt = new StringBuilder(getPersona(personaId)
                .map(Persona::getSystemPrompt)
                .orElse(FALLBACK_PROMPT));

        if (modifier != null) {
            prompt.append(' ').append(modifier.getInstruction());
        }

        if ("concise".equals(verbosity)) {
            prompt.append(CONCISE_SUFFIX);
        } else if ("detailed".equals(verbosity)) {
            prompt.append(DETAILED_SUFFIX);
        }
        return prompt.toString();
    }
}
