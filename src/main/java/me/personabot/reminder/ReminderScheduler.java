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

import me.personabot.domain.model.CancellationToken;
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
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivers due reminders to the channel they were created in.
 *
 * <p>
 * Every {@code bot.reminders.check-interval} the scheduler asks
 * {@link ReminderService} for due reminders and posts each one as
 * {@code <@user>} followed by a short in-character text from the user's
 * persona. When the model is unavailable or slow a fixed per-persona text is
 * used instead. A reminder is completed once handled, even if the post fails,
 * so a broken channel never blocks the queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReminderScheduler {

    private final ReminderService reminderService;
    private final UserPreferencesService userPreferencesService;
    private final SettingsResolver settingsResolver;
    private final PersonaService personaService;
    private final LlmPort llmPort;
    private final ReplyTransportPort replyTransport;
    private final MessageService messages;
    private final BotProperties properties;

    private final AtomicBoolean executing = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    @PostConstruct
    public void init() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reminder-scheduler");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = properties.getReminders().getCheckInterval().toMillis();
        tickTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Reminders] Scheduler started with check interval: {}s", intervalMs / 1000);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Reminders] Scheduler shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Reminders] Tick skipped: previous delivery still in progress");
            return;
        }
        try {
            List<Reminder> due = reminderService.dueReminders();
            if (due.isEmpty()) {
                return;
            }
            log.info("[Reminders] Tick: {} due reminders", due.size());
            for (Reminder reminder : due) {
                deliver(reminder);
                try {
                    reminderService.complete(reminder);
                } catch (RuntimeException e) {
                    log.error("[Reminders] Failed to complete #{}: {}", reminder.getId(), e.getMessage());
                }
            }
        } catch (Exception e) { // NOSONAR - must not kill the scheduler thread
            log.error("[Reminders] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    private void deliver(Reminder reminder) {
        String text = "<@" + reminder.getUserId() + ">\n\n" + wording(reminder);
        long timeoutMs = properties.getInteraction().getSendTimeout().toMillis();
        try {
            replyTransport.sendChannelMessage(reminder.getChannelId(), text).get(timeoutMs, TimeUnit.MILLISECONDS);
            log.info("[Reminders] Delivered #{} to channel {}", reminder.getId(), reminder.getChannelId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[Reminders] Interrupted while delivering #{}", reminder.getId());
        } catch (ExecutionException | TimeoutException e) {
            log.error("[Reminders] Failed to deliver #{} to channel {}: {}", reminder.getId(),
                    reminder.getChannelId(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
    }

    String wording(Reminder reminder) {
        String persona = persona(reminder);
        if (!llmPort.isAvailable()) {
            return fallback(persona, reminder.getMessage());
        }

        String basePrompt = personaService.buildSystemPrompt(persona, null, null);
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(basePrompt + "\n\n"
                        + messages.getMessage("prompt.reminder_instruction", reminder.getMessage()))
                .history(List.of())
                .userMessage(messages.getMessage("prompt.reminder_request"))
                .build();
        CancellationToken token = new CancellationToken();
        CompletableFuture<LlmResponse> future = llmPort.complete(request, token);
        long timeoutMs = properties.getReminders().getWordingTimeout().toMillis();
        try {
            LlmResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            String content = response != null ? response.getContent() : null;
            if (content != null && !content.isBlank()) {
                return content.trim();
            }
            log.warn("[Reminders] Empty wording for #{}, using fallback", reminder.getId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
        } catch (TimeoutException e) {
            token.cancel();
            log.warn("[Reminders] Wording for #{} timed out after {}ms, using fallback", reminder.getId(),
                    timeoutMs);
        } catch (ExecutionException e) {
            log.warn("[Reminders] Wording for #{} failed, using fallback: {}", reminder.getId(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
        return fallback(persona, reminder.getMessage());
    }

    private String persona(Reminder reminder) {
        try {
            return userPreferencesService.getPersona(reminder.getBotId(), reminder.getUserId())
                    .filter(personaService::exists)
                    .orElseGet(() -> settingsResolver.resolveOrDefault(reminder.getBotId(), SettingKey.PERSONA,
                            reminder.getChannelId(), reminder.getGuildId()));
        } catch (RuntimeException e) {
            log.warn("[Reminders] Persona lookup failed for #{}: {}", reminder.getId(), e.getMessage());
            return settingsResolver.systemDefault(SettingKey.PERSONA);
        }
    }

    private String fallback(String persona, String message) {
        String key = "reminder.fallback." + persona;
        return messages.hasMessage(key)
                ? messages.getMessage(key, message)
                : messages.getMessage("reminder.fallback", message);
    }
}
