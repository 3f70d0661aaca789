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

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Curated snippets of the bot's own code, explained by the current persona
 * through {@code /introspect}.
 *
 * <p>
 * Snippets live on the classpath under {@code introspection/<component>.txt}
 * and are read once on first use.
 */
@Service
@Slf4j
public class IntrospectionService {

    private static final String RESOURCE_DIR = "introspection/";

    private static final Map<String, String> TITLES = new LinkedHashMap<>();

    static {
        TITLES.put("overview", "Bot Architecture Overview");
        TITLES.put("personas", "Persona System");
        TITLES.put("reminders", "Reminder Scheduler");
        TITLES.put("commands", "Command Processing");
        TITLES.put("settings", "Settings Cascade");
        TITLES.put("storage", "How I Remember Things");
    }

    private static final Map<String, String> ALIASES = Map.of("database", "storage", "architecture", "overview");

    private final Map<String, Snippet> cache = new LinkedHashMap<>();

    public record Snippet(String component, String title, String code) {
    }

    public List<String> components() {
        return List.copyOf(TITLES.keySet());
    }

    public synchronized Optional<Snippet> snippet(String component) {
        if (component == null) {
            return Optional.empty();
        }
        String normalized = component.trim().toLowerCase(Locale.ROOT);
        String id = ALIASES.getOrDefault(normalized, normalized);
        String title = TITLES.get(id);
        if (title == null) {
            return Optional.empty();
        }
        Snippet cached = cache.get(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> code = read(RESOURCE_DIR + id + ".txt");
        code.ifPresent(text -> cache.put(id, new Snippet(id, title, text)));
        return code.map(text -> new Snippet(id, title, text));
    }

    private Optional<String> read(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("[Introspection] Missing snippet resource: {}", path);
            return Optional.empty();
        }
        try (InputStream is = resource.getInputStream()) {
            return Optional.of(new String(is.readAllBytes(), StandardCharsets.UTF_8).strip());
        } catch (IOException e) {
            log.warn("[Introspection] Failed to read {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
