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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Timestamps of recent allowed requests for one (bot, user) pair, oldest
 * first.
 *
 * <p>
 * Expired timestamps are pruned lazily on each {@code tryAcquire()} call. All
 * methods are synchronized on the window itself, so concurrent checks of the
 * same user are serialized while different users never contend.
 *
 * @since 1.0
 */
public class RateWindow {

    private final int quota;
    private final Duration window;
    private final Deque<Instant> timestamps = new ArrayDeque<>();

    public RateWindow(int quota, Duration window) {
        if (quota < 1) {
            throw new IllegalArgumentException("quota must be positive: " + quota);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.quota = quota;
        this.window = window;
    }

    /**
     * Try to record a request at {@code now}.
     */
    public synchronized RateLimitResult tryAcquire(Instant now) {
        prune(now);

        if (timestamps.size() < quota) {
            timestamps.addLast(now);
            return RateLimitResult.allowed(quota - timestamps.size());
        }

        Duration sinceOldest = Duration.between(timestamps.peekFirst(), now);
        Duration retryAfter = window.minus(sinceOldest);
        if (retryAfter.isNegative() || retryAfter.isZero()) {
            retryAfter = Duration.ofMillis(1);
        }
        return RateLimitResult.denied(retryAfter);
    }

    /**
     * Whether every recorded request has left the window.
     */
    public synchronized boolean isIdle(Instant now) {
        prune(now);
        return timestamps.isEmpty();
    }

    public synchronized int size() {
        return timestamps.size();
    }

    int getQuota() {
        return quota;
    }

    Duration getWindow() {
        return window;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }
}
