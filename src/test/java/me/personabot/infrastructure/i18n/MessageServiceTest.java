package me.personabot.infrastructure.i18n;

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

import static org.junit.jupiter.api.Assertions.*;

class MessageServiceTest {

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService();
    }

    @Test
    void shouldFormatArguments() {
        assertEquals("Unknown command: `dance`.", messageService.getMessage("command.unknown", "dance"));
    }

    @Test
    void shouldUnescapeQuotesWithoutArguments() {
        assertTrue(messageService.getMessage("reply.empty").startsWith("I don't"));
    }

    @Test
    void shouldReturnKeyWhenMissing() {
        assertEquals("no.such.key", messageService.getMessage("no.such.key"));
    }

    @Test
    void shouldReportWhetherKeyExists() {
        assertTrue(messageService.hasMessage("reminder.fallback.chef"));
        assertFalse(messageService.hasMessage("reminder.fallback.pirate"));
    }

    @Test
    void shouldKeepApostrophesInFallbackReminder() {
        assertEquals("*taps spoon on counter* Just like checking on a dish in the oven, "
                + "here's your reminder: **Stretch**", messageService.getMessage("reminder.fallback.chef", "Stretch"));
    }
}
