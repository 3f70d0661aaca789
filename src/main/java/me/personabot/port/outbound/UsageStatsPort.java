package me.personabot.port.outbound;

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

import me.personabot.domain.model.Identity;
import me.personabot.domain.model.InteractionKind;
import me.personabot.domain.model.InteractionOutcome;
import me.personabot.domain.model.UsageRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * Fire-and-forget sink for per-interaction usage statistics. Implementations
 * must never throw into the caller.
 */
public interface UsageStatsPort {

    void record(UsageRecord usageRecord);

    default void record(Identity identity, InteractionKind kind, InteractionOutcome outcome, Duration latency) {
        record(UsageRecord.builder()
                .botId(identity.botId())
                .userId(identity.userId())
                .channelId(identity.channelId())
                .kind(kind)
                .outcome(outcome)
                .latency(latency)
                .timestamp(Instant.now())
                .build());
    }
}
