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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntrospectionServiceTest {

    private IntrospectionService service;

    @BeforeEach
    void setUp() {
        service = new IntrospectionService();
    }

    @Test
    void shouldListComponentsInDisplayOrder() {
        assertEquals(List.of("overview", "personas", "reminders", "commands", "settings", "storage"),
                service.components());
    }

    @Test
    void shouldLoadSnippetForEveryComponent() {
        for (String component : service.components()) {
            IntrospectionService.Snippet snippet = service.snippet(component).orElseThrow();
            assertEquals(component, snippet.component());
            assertFalse(snippet.code().isBlank(), component);
            assertFalse(snippet.title().isBlank(), component);
        }
    }

    @Test
    void shouldResolveAliasesAndIgnoreCase() {
        assertEquals("storage", service.snippet("Database").orElseThrow().component());
        assertEquals("overview", service.snippet(" architecture ").orElseThrow().component());
        assertEquals("How I Remember Things", service.snippet("STORAGE").orElseThrow().title());
    }

    @Test
    void shouldReturnEmptyForUnknownComponent() {
        assertTrue(service.snippet("kernel").isEmpty());
        assertTrue(service.snippet(null).isEmpty());
    }

    @Test
    void shouldServeCachedSnippet() {
        IntrospectionService.Snippet first = service.snippet("personas").orElseThrow();

        assertSame(first, service.snippet("personas").orElseThrow());
    }
}
