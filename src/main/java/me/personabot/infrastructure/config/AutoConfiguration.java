package me.personabot.infrastructure.config;

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

import me.personabot.domain.service.PersonaService;
import me.personabot.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans and startup logging.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} and {@link ObjectMapper} used across the
 * bot</li>
 * <li>Provides the worker pool running one task per interaction and the pool
 * running the bounded settings and history lookup of each interaction</li>
 * <li>Logs startup information (bot id, model, storage location)</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final PersonaService personaService;
    private final LlmPort llmPort;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService interactionExecutor(BotProperties botProperties) {
        int threads = botProperties.getInteraction().getWorkerThreads();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), namedDaemonThreads("interaction-"));
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService configurationExecutor(BotProperties botProperties) {
        int threads = botProperties.getInteraction().getWorkerThreads();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), namedDaemonThreads("config-"));
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @PostConstruct
    public void init() {
        log.info("Persona bot '{}' starting...", properties.getBotId());
        log.info("LLM: provider={}, model={}, available={}", properties.getLlm().getProvider(),
                properties.getLlm().getModel(), llmPort.isAvailable());
        log.info("Personas: {}", personaService.listPersonas().size());
        log.info("Rate limit: {} requests / {}s", properties.getRateLimit().getQuota(),
                properties.getRateLimit().getWindow().toSeconds());
        log.info("Image model: {}, reminders checked every {}s", properties.getImage().getModel(),
                properties.getReminders().getCheckInterval().toSeconds());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
