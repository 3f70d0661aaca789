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
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RateWindowTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new RateWindow(0, Duration.ofSeconds(60)));
        assertThrows(IllegalArgumentException.class, () -> new RateWindow(5, Duration.ZERO));
    }

    @Test
    void shouldCountDownRemainingRequests() {
        RateWindow window = new RateWindow(3, Duration.ofSeconds(60));

        assertEquals(2, window.tryAcquire(START).getRemaining());
        assertEquals(1, window.tryAcquire(START.plusSeconds(1)).getRemaining());
        assertEquals(0, window.tryAcquire(START.plusSeconds(2)).getRemaining());
        assertEquals(3, window.size());
    }

    @Test
    void shouldReportRetryAfterUntilOldestRequestExpires() {
        RateWindow window = new RateWindow(2, Duration.ofSeconds(60));
        window.tryAcquire(START);
        window.tryAcquire(START.plusSeconds(10));

        RateLimitResult denied = window.tryAcquire(START.plusSeconds(15));

        assertFalse(denied.isAllowed());
        assertEquals(Duration.ofSeconds(45), denied.getRetryAfter());
    }

    @Test
    void shouldNotRecordDeniedRequests() {
        RateWindow window = new RateWindow(1, Duration.ofSeconds(60));
        window.tryAcquire(START);

        for (int i = 1; i <= 5; i++) {
            assertFalse(window.tryAcquire(START.plusSeconds(i)).isAllowed());
        }

        assertEquals(1, window.size());
        assertTrue(window.tryAcquire(START.plusSeconds(60)).isAllowed());
    }

    @Test
    void shouldExpireTimestampAtExactWindowBoundary() {
        RateWindow window = new RateWindow(1, Duration.ofSeconds(60));
        window.tryAcquire(START);

        assertFalse(window.tryAcquire(START.plusSeconds(59)).isAllowed());
        assertTrue(window.tryAcquire(START.plusSeconds(60)).isAllowed());
    }

    @Test
    void shouldBecomeIdleWhenAllRequestsExpire() {
        RateWindow window = new RateWindow(5, Duration.ofSeconds(30));
        window.tryAcquire(START);

        assertFalse(window.isIdle(START.plusSeconds(29)));
        assertTrue(window.isIdle(START.plusSeconds(30)));
    }
}
