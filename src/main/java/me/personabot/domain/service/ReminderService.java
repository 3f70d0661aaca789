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

import me.personabot.domain.model.Reminder;
import me.personabot.infrastructure.config.BotProperties;
import me.personabot.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pending reminders, one JSON document per bot:
 * {@code reminders/<botId>.json}.
 *
 * <p>
 * Documents are cached after the first read. Every change is written
 * atomically before the cache is updated, so a failed write leaves both the
 * cache and the file unchanged. A document that cannot be read is not cached,
 * so storage failures surface to the caller instead of hiding reminders. Ids
 * are sequential per bot and never reused.
 */
@Service
@Slf4j
public class ReminderService {

    private static final String REMINDERS_DIR = "reminders";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;
    private final Clock clock;

    private final Map<String, ReminderBook> books = new ConcurrentHashMap<>();
    private volatile boolean discovered = false;

    public ReminderService(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Parse a delay such as {@code 30m}, {@code 2h}, {@code 1d} or
     * {@code 1h30m}. Units are {@code d}, {@code h} and {@code m}; every number
     * must be followed by a unit.
     */
    public static Optional<Duration> parseDelay(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        long seconds = 0;
        long value = 0;
        boolean digits = false;
        for (char c : text.trim().toLowerCase(Locale.ROOT).toCharArray()) {
            if (Character.isDigit(c)) {
                value = value * 10 + (c - '0');
                digits = true;
                if (value > Integer.MAX_VALUE) {
                    return Optional.empty();
                }
                continue;
            }
            if (!digits) {
                return Optional.empty();
            }
            switch (c) {
            case 'm' -> seconds += value * 60;
            case 'h' -> seconds += value * 3600;
            case 'd' -> seconds += value * 86400;
            default -> {
                return Optional.empty();
            }
            }
            value = 0;
            digits = false;
        }
        if (digits || seconds <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofSeconds(seconds));
    }

    /**
     * Create and persist a reminder.
     *
     * @throws IllegalArgumentException
     *             if the message or delay is out of bounds or the user already
     *             has the maximum number of pending reminders
     */
    public synchronized Reminder create(String botId, String userId, String channelId, String guildId,
            String message, Duration delay) {
        BotProperties.RemindersProperties config = properties.getReminders();
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Reminder message must not be empty");
        }
        if (message.length() > config.getMaxMessageLength()) {
            throw new IllegalArgumentException("Reminder message must be at most "
                    + config.getMaxMessageLength() + " characters");
        }
        if (delay.compareTo(config.getMinDelay()) < 0) {
            throw new IllegalArgumentException("Reminders must be at least "
                    + config.getMinDelay().toMinutes() + " minute(s) away");
        }
        if (delay.compareTo(config.getMaxDelay()) > 0) {
            throw new IllegalArgumentException("Reminders can be at most "
                    + config.getMaxDelay().toDays() + " days away");
        }
        ReminderBook book = book(botId);
        long pending = book.getReminders().stream().filter(r -> r.getUserId().equals(userId)).count();
        if (pending >= config.getMaxPendingPerUser()) {
            throw new IllegalArgumentException("You already have " + pending
                    + " pending reminders; cancel one first");
        }

        Instant now = clock.instant();
        Reminder reminder = Reminder.builder()
                .id(book.getNextId())
                .botId(botId)
                .userId(userId)
                .channelId(channelId)
                .guildId(guildId)
                .message(message.trim())
                .createdAt(now)
                .dueAt(now.plus(delay))
                .build();

        List<Reminder> updated = new ArrayList<>(book.getReminders());
        updated.add(reminder);
        save(botId, new ReminderBook(book.getNextId() + 1, updated));
        log.info("[Reminders] Created #{} for user {} due at {}", reminder.getId(), userId, reminder.getDueAt());
        return reminder;
    }

    /**
     * Pending reminders of a user, soonest first.
     */
    public synchronized List<Reminder> listPending(String botId, String userId) {
        return book(botId).getReminders().stream()
                .filter(r -> r.getUserId().equals(userId))
                .sorted(Comparator.comparing(Reminder::getDueAt))
                .toList();
    }

    /**
     * Cancel a reminder owned by the user.
     *
     * @return {@code false} if the user has no pending reminder with that id
     */
    public synchronized boolean cancel(String botId, String userId, long id) {
        ReminderBook book = book(botId);
        List<Reminder> updated = new ArrayList<>(book.getReminders());
        if (!updated.removeIf(r -> r.getId() == id && r.getUserId().equals(userId))) {
            return false;
        }
        save(botId, new ReminderBook(book.getNextId(), updated));
        log.info("[Reminders] Cancelled #{} for user {}", id, userId);
        return true;
    }

    /**
     * Reminders of every bot whose due time has passed.
     */
    public synchronized List<Reminder> dueReminders() {
        discoverBooks();
        Instant now = clock.instant();
        List<Reminder> due = new ArrayList<>();
        for (String botId : books.keySet()) {
            book(botId).getReminders().stream().filter(r -> r.isDue(now)).forEach(due::add);
        }
        due.sort(Comparator.comparing(Reminder::getDueAt));
        return due;
    }

    /**
     * Remove a reminder once it has been handled, delivered or not.
     */
    public synchronized void complete(Reminder reminder) {
        ReminderBook book = book(reminder.getBotId());
        List<Reminder> updated = new ArrayList<>(book.getReminders());
        if (updated.removeIf(r -> r.getId() == reminder.getId())) {
            save(reminder.getBotId(), new ReminderBook(book.getNextId(), updated));
        }
    }

    private ReminderBook book(String botId) {
        return books.computeIfAbsent(botId, this::load);
    }

    private void discoverBooks() {
        if (discovered) {
            return;
        }
        try {
            for (String file : storagePort.listObjects(REMINDERS_DIR, "").join()) {
                if (file.endsWith(JSON_EXTENSION) && !file.contains("/")) {
                    book(StorageKeys.id(file.substring(0, file.length() - JSON_EXTENSION.length())));
                }
            }
            discovered = true;
        } catch (RuntimeException e) {
            log.warn("[Reminders] Failed to list stored reminders: {}", e.getMessage());
        }
    }

    private ReminderBook load(String botId) {
        try {
            String json = storagePort.getText(REMINDERS_DIR, path(botId)).join();
            if (json != null && !json.isBlank()) {
                ReminderBook book = objectMapper.readValue(json, ReminderBook.class);
                List<Reminder> reminders = book.getReminders() != null ? book.getReminders() : List.of();
                long nextId = Math.max(book.getNextId(),
                        reminders.stream().mapToLong(Reminder::getId).max().orElse(0) + 1);
                return new ReminderBook(nextId, List.copyOf(reminders));
            }
        } catch (IOException e) {
            log.warn("[Reminders] Corrupted reminders for bot {}, starting empty: {}", botId, e.getMessage());
        }
        return new ReminderBook(1, List.of());
    }

    private void save(String botId, ReminderBook book) {
        String json;
        try {
            json = objectMapper.writeValueAsString(book);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reminders", e);
        }
        storagePort.putTextAtomic(REMINDERS_DIR, path(botId), json).join();
        books.put(botId, new ReminderBook(book.getNextId(), List.copyOf(book.getReminders())));
    }

    private static String path(String botId) {
        return StorageKeys.segment(botId) + JSON_EXTENSION;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ReminderBook {
        private long nextId = 1;
        private List<Reminder> reminders = new ArrayList<>();
    }
}
