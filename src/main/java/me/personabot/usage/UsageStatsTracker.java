package me.personabot.usage;

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

import me.personabot.domain.model.InteractionOutcome;
import me.personabot.domain.model.UsageRecord;
import me.personabot.domain.service.StorageKeys;
import me.personabot.infrastructure.config.BotProperties;
import me.personabot.port.outbound.StoragePort;
import me.personabot.port.outbound.UsageStatsPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Usage sink persisting one JSONL line per processed interaction to
 * {@code usage/<botId>/<yyyy-MM-dd>.jsonl} and keeping recent records in
 * memory for aggregation.
 *
 * <p>
 * Recording never throws: persistence failures are logged and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UsageStatsTracker implements UsageStatsPort {

    private static final String USAGE_DIR = "usage";
    private static final String LOG_PREFIX = "[Usage]";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";
    private static final String UNKNOWN = "unknown";
    private static final int EVICTION_INTERVAL_HOURS = 1;
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;
    private final Clock clock;

    private final List<UsageRecord> records = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "usage-eviction");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        loadPersistedUsage();
        evictionExecutor.scheduleAtFixedRate(this::evictOldRecords,
                EVICTION_INTERVAL_HOURS, EVICTION_INTERVAL_HOURS, TimeUnit.HOURS);
    }

    @PreDestroy
    void destroy() {
        evictionExecutor.shutdownNow();
        try {
            evictionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void record(UsageRecord usageRecord) {
        if (!properties.getUsage().isEnabled() || usageRecord == null) {
            return;
        }
        if (usageRecord.getTimestamp() == null) {
            usageRecord.setTimestamp(clock.instant());
        }
        records.add(usageRecord);
        persist(usageRecord);

        log.debug("{} Recorded: bot={}, user={}, command={}, outcome={}, latency={}ms", LOG_PREFIX,
                usageRecord.getBotId(), usageRecord.getUserId(), usageRecord.getCommand(),
                usageRecord.getOutcome(),
                usageRecord.getLatency() != null ? usageRecord.getLatency().toMillis() : "N/A");
    }

    /**
     * Aggregate the records of the last {@code period}.
     */
    public UsageSummary summarize(Duration period) {
        Instant cutoff = clock.instant().minus(period);
        List<UsageRecord> recent = records.stream()
                .filter(r -> r.getTimestamp() != null && r.getTimestamp().isAfter(cutoff))
                .toList();
        if (recent.isEmpty()) {
            return UsageSummary.empty();
        }

        Map<InteractionOutcome, Long> byOutcome = recent.stream()
                .filter(r -> r.getOutcome() != null)
                .collect(Collectors.groupingBy(UsageRecord::getOutcome, Collectors.counting()));
        Map<String, Long> byCommand = recent.stream()
                .collect(Collectors.groupingBy(r -> r.getCommand() != null ? r.getCommand() : UNKNOWN,
                        Collectors.counting()));
        long avgLatencyMs = (long) recent.stream()
                .filter(r -> r.getLatency() != null)
                .mapToLong(r -> r.getLatency().toMillis())
                .average()
                .orElse(0);

        return UsageSummary.builder()
                .totalInteractions(recent.size())
                .byOutcome(byOutcome)
                .byCommand(byCommand)
                .avgLatency(Duration.ofMillis(avgLatencyMs))
                .build();
    }

    private void persist(UsageRecord usageRecord) {
        try {
            String botId = usageRecord.getBotId() != null ? usageRecord.getBotId() : properties.getBotId();
            LocalDate day = LocalDate.ofInstant(usageRecord.getTimestamp(), ZoneOffset.UTC);
            String key = StorageKeys.segment(botId) + "/" + day + JSONL_EXTENSION;
            String json = objectMapper.writeValueAsString(usageRecord) + NEWLINE;
            storagePort.appendText(USAGE_DIR, key, json).whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("{} Failed to persist usage record: {}", LOG_PREFIX, error.getMessage());
                }
            });
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to persist usage record", LOG_PREFIX, e);
        }
    }

    private void loadPersistedUsage() {
        if (!properties.getUsage().isEnabled()) {
            return;
        }
        Instant cutoff = clock.instant().minus(properties.getUsage().getRetention());
        String prefix = StorageKeys.segment(properties.getBotId());
        try {
            List<String> files = storagePort.listObjects(USAGE_DIR, prefix).join();
            int loaded = 0;
            for (String file : files) {
                if (!file.endsWith(JSONL_EXTENSION)) {
                    continue;
                }
                String content = storagePort.getText(USAGE_DIR, file).join();
                for (UsageRecord usageRecord : parseLines(file, content)) {
                    if (usageRecord.getTimestamp() != null && usageRecord.getTimestamp().isAfter(cutoff)) {
                        records.add(usageRecord);
                        loaded++;
                    }
                }
            }
            log.info("{} Loaded {} usage records from storage", LOG_PREFIX, loaded);
        } catch (RuntimeException e) {
            log.warn("{} Failed to load persisted usage", LOG_PREFIX, e);
        }
    }

    private List<UsageRecord> parseLines(String file, String content) {
        List<UsageRecord> parsed = new ArrayList<>();
        if (content == null) {
            return parsed;
        }
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                parsed.add(objectMapper.readValue(line, UsageRecord.class));
            } catch (JsonProcessingException e) {
                log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }
        return parsed;
    }

    void evictOldRecords() {
        Instant cutoff = clock.instant().minus(properties.getUsage().getRetention());
        if (records.removeIf(r -> r.getTimestamp() != null && r.getTimestamp().isBefore(cutoff))) {
            log.debug("{} Evicted records beyond {}d retention", LOG_PREFIX,
                    properties.getUsage().getRetention().toDays());
        }
    }

    int size() {
        return records.size();
    }
}
