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

/**
 * Per-user request quota over a rolling time window.
 *
 * <p>
 * Each {@code check()} both evaluates and records the request atomically for
 * the (bot, user) pair. A denied check is not recorded, so retrying while
 * limited never extends the wait.
 *
 * @since 1.0
 * @see SlidingWindowRateLimiter
 */
public interface RateLimiter {

    /**
     * Check and, if allowed, record one request for the user of the given bot.
     */
    RateLimitResult check(String botId, String userId);
}
