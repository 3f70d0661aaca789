package me.personabot.reminder;

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

import me.personabot.domain.model.LlmRequest;
import me.personabot.domain.model.LlmResponse;
import me.personabot.domain.model.Reminder;
import me.personabot.domain.model.SettingKey;
import me.personabot.domain.service.PersonaService;
import me.personabot.domain.service.ReminderService;
import me.personabot.domain.service.SettingsResolver;
import me.personabot.domain.service.UserPreferencesService;
import me.personabot.infrastructure.config.BotProperties;
import me.personabot.infrastructure.i18n.MessageService;
import me.personabot.port.outbound.LlmPort;
import me.personabot.port.outbound.ReplyTransportPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReminderSchedulerTest {

    private ReminderService reminderService;
    private UserPreferencesService userPreferencesService;
    private SettingsResolver settingsResolver;
    private LlmPort llmPort;
    private ReplyTransportPort replyTransport;
    private MessageService messages;
    private BotProperties properties;
    private ReminderScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getReminders().setWordingTimeout(Duration.ofMillis(200));
        BotProperties.PersonaProperties chef = new BotProperties.PersonaProperties();
        chef.setName("Chef");
        chef.setSystemPrompt("You are a chef.");
        BotProperties.PersonaProperties pirate = new BotProperties.PersonaProperties();
        pirate.setName("Pirate");
        pirate.setSystemPrompt("You are a pirate.");
        properties.getPersonas().put("chef", chef);
        properties.getPersonas().put("pirate", pirate);

        reminderService = mock(ReminderService.class);
        userPreferencesService = mock(UserPreferencesService.class);
        when(userPreferencesService.getPersona(anyString(), anyString())).thenReturn(Optional.of("chef"));
        settingsResolver = mock(SettingsResolver.class);
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        replyTransport = mock(ReplyTransportPort.class);
        when(replyTransport.sendChannelMessage(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        messages = new MessageService();

        scheduler = new ReminderScheduler(reminderService, userPreferencesService, settingsResolver,
                new PersonaService(properties), llmPort, replyTransport, messages, properties);
    }

    // ===== Delivery =====

    @Test
    void shouldPostPersonaWordingMentioningUserAndComplete() {
        Reminder reminder = reminder(1, "Take the bread out");
        when(reminderService.dueReminders()).thenReturn(List.of(reminder));
        givenWording("Chef here! Your bread is ready, take it out now.");

        scheduler.tick();

        verify(replyTransport).sendChannelMessage("chan-1",
                "<@user-1>\n\nChef here! Your bread is ready, take it out now.");
        verify(reminderService).complete(reminder);
    }

    @Test
    void shouldPromptWithPersonaAndReminderText() {
        givenWording("ok");

        scheduler.wording(reminder(1, "Call mom"));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).complete(captor.capture(), any());
        LlmRequest request = captor.getValue();
        assertTrue(request.getSystemPrompt().startsWith("You are a chef."));
        assertTrue(request.getSystemPrompt().contains("The reminder message is: \"Call mom\""));
        assertEquals(messages.getMessage("prompt.reminder_request"), request.getUserMessage());
        assertTrue(request.getHistory().isEmpty());
    }

    @Test
    void shouldUseServerPersonaWhenUserHasNone() {
        when(userPreferencesService.getPersona(anyString(), anyString())).thenReturn(Optional.empty());
        when(settingsResolver.resolveOrDefault("bot-1", SettingKey.PERSONA, "chan-1", "guild-1"))
                .thenReturn("pirate");
        givenWording("Arr");

        scheduler.wording(reminder(1, "Swab the deck"));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).complete(captor.capture(), any());
        assertTrue(captor.getValue().getSystemPrompt().startsWith("You are a pirate."));
    }

    @Test
    void shouldCompleteEvenWhenPostFails() {
        Reminder reminder = reminder(4, "Stretch");
        when(reminderService.dueReminders()).thenReturn(List.of(reminder));
        givenWording("Stretch now");
        when(replyTransport.sendChannelMessage(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("missing access")));

        assertDoesNotThrow(() -> scheduler.tick());

        verify(reminderService).complete(reminder);
    }

    @Test
    void shouldContinueWithNextReminderWhenCompletionFails() {
        Reminder first = reminder(1, "one");
        Reminder second = reminder(2, "two");
        when(reminderService.dueReminders()).thenReturn(List.of(first, second));
        givenWording("ding");
        doThrow(new IllegalStateException("disk full")).when(reminderService).complete(first);

        scheduler.tick();

        verify(reminderService).complete(second);
    }

    @Test
    void shouldSurviveUnreadableReminderStorage() {
        when(reminderService.dueReminders()).thenThrow(new IllegalStateException("disk gone"));

        assertDoesNotThrow(() -> scheduler.tick());
        verify(replyTransport, never()).sendChannelMessage(anyString(), anyString());
    }

    // ===== Fallback wording =====

    @Test
    void shouldUsePersonaFallbackWhenModelUnavailable() {
        when(llmPort.isAvailable()).thenReturn(false);

        String text = scheduler.wording(reminder(1, "Stretch"));

        assertEquals(messages.getMessage("reminder.fallback.chef", "Stretch"), text);
        verify(llmPort, never()).complete(any(), any());
    }

    @Test
    void shouldUseGenericFallbackForPersonaWithoutOwnText() {
        when(userPreferencesService.getPersona(anyString(), anyString())).thenReturn(Optional.of("pirate"));
        givenWording("   ");

        String text = scheduler.wording(reminder(1, "Stretch"));

        assertEquals("⏰ Reminder: **Stretch**", text);
    }

    @Test
    void shouldFallBackWhenWordingTimesOut() {
        when(llmPort.complete(any(), any())).thenReturn(new CompletableFuture<>());

        String text = scheduler.wording(reminder(1, "Stretch"));

        assertEquals(messages.getMessage("reminder.fallback.chef", "Stretch"), text);
    }

    @Test
    void shouldFallBackWhenWordingFails() {
        when(llmPort.complete(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("quota")));

        String text = scheduler.wording(reminder(1, "Stretch"));

        assertTrue(text.contains("**Stretch**"));
    }

    // ===== Scheduling =====

    @Test
    void shouldDoNothingWithoutDueReminders() {
        when(reminderService.dueReminders()).thenReturn(List.of());

        scheduler.tick();

        verify(llmPort, never()).complete(any(), any());
        verify(reminderService, never()).complete(any());
    }

    @Test
    void shouldStartAndStopScheduler() {
        properties.getReminders().setCheckInterval(Duration.ofHours(1));

        assertDoesNotThrow(() -> {
            scheduler.init();
            scheduler.shutdown();
        });
    }

    private void givenWording(String content) {
        when(llmPort.complete(any(), any())).thenReturn(
                CompletableFuture.completedFuture(LlmResponse.builder().content(content).build()));
    }

    private static Reminder reminder(long id, String message) {
        return Reminder.builder()
                .id(id)
                .botId("bot-1")
                .userId("user-1")
                .channelId("chan-1")
                .guildId("guild-1")
                .message(message)
                .createdAt(Instant.parse("2026-03-10T12:00:00Z"))
                .dueAt(Instant.parse("2026-03-10T12:30:00Z"))
                .build();
    }
}
