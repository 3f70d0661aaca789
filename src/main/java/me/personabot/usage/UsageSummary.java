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
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Aggregated interaction statistics over a period.
 */
@Value
@Builder
public class UsageSummary {

    long totalInteractions;
    Map<InteractionOutcome, Long> byOutcome;
    Map<String, Long> byCommand;
    Duration avgLatency;

    public static UsageSummary empty() {
        return UsageSummary.builder()
                .totalInteractions(0)
                .byOutcome(Map.of())
                .byCommand(Map.of())
                .avgLatency(Duration.ZERO)
                .build();
    }
}
