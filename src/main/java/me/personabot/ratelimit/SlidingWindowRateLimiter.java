package me.personabot.ratelimit;

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

import me.personabot.domain.model.RateLimitResult;
import me.personabot.infrastructure.config.BotProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sliding window rate limiter keyed by the (bot, user) pair.
 *
 * <p>
 * On each check the user's {@link RateWindow} drops timestamps older than
 * {@code now - window}; if fewer than {@code quota} remain the request is
 * recorded and allowed, otherwise it is denied with
 * {@code retryAfter = window - (now - oldest)}. Denied checks are not recorded.
 *
 * <p>
 * Windows live in a concurrent map and are only touched inside per-key
 * {@code compute} calls, so unrelated users never contend and eviction of an
 * idle window cannot race with a check of the same user. Windows whose
 * requests have all expired are evicted periodically.
 *
 * <p>
 * Configured via {@code bot.rate-limit.*}; can be disabled with
 * {@code bot.rate-limit.enabled=false}.
 *
 * @since 1.0
 * @see RateWindow
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlidingWindowRateLimiter implements RateLimiter {

    private final BotProperties properties;
    private final Clock clock;

    private final Map<WindowKey, RateWindow> windows = new ConcurrentHashMap<>();
    private ScheduledExecutorService evictionExecutor;

    @PostConstruct
    void init() {
        long intervalMs = properties.getRateLimit().getEvictionInterval().toMillis();
        evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rate-limit-eviction");
            t.setDaemon(true);
            return t;
        });
        evictionExecutor.scheduleAtFixedRate(this::evictIdle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void shutdown() {
        if (evictionExecutor != null) {
            evictionExecutor.shutdownNow();
        }
    }

    @Override
    public RateLimitResult check(String botId, String userId) {
        BotProperties.RateLimitProperties config = properties.getRateLimit();
        if (!config.isEnabled()) {
            return RateLimitResult.allowed(Integer.MAX_VALUE);
        }

        WindowKey key = new WindowKey(botId, userId);
        Instant now = Instant.now(clock);
        RateLimitResult[] result = new RateLimitResult[1];
        windows.compute(key, (windowKey, existing) -> {
            RateWindow window = existing;
            if (window == null || window.getQuota() != config.getQuota()
                    || !window.getWindow().equals(config.getWindow())) {
                window = new RateWindow(config.getQuota(), config.getWindow());
            }
            result[0] = window.tryAcquire(now);
            return window;
        });

        if (!result[0].isAllowed()) {
            log.debug("[RateLimit] Denied: bot={}, user={}, retryAfter={}ms",
                    botId, userId, result[0].getRetryAfter().toMillis());
        }
        return result[0];
    }

    /**
     * Remove windows with no request left inside them.
     *
     * @return number of evicted windows
     */
    public int evictIdle() {
        Instant now = Instant.now(clock);
        int evicted = 0;
        for (WindowKey key : windows.keySet()) {
            boolean[] removed = new boolean[1];
            windows.computeIfPresent(key, (windowKey, window) -> {
                removed[0] = window.isIdle(now);
                return removed[0] ? null : window;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("[RateLimit] Evicted {} idle windows", evicted);
        }
        return evicted;
    }

    int trackedWindows() {
        return windows.size();
    }

    private record WindowKey(String botId, String userId) {
    }
}
