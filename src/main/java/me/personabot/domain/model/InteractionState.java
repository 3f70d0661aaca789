package me.personabot.domain.model;

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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single interaction.
 *
 * <pre>
 * RECEIVED → RATE_CHECKED → CONFIGURED → ACKNOWLEDGED → COMPLETING → DELIVERED | FAILED | EXPIRED
 * </pre>
 *
 * A rate-limited request goes straight from {@code RECEIVED} to
 * {@code DELIVERED}; a request whose acknowledgment already carries the final
 * content goes from {@code ACKNOWLEDGED} to {@code DELIVERED}. Any non-terminal
 * state may fall to {@code FAILED}. Terminal states accept no transition.
 */
public enum InteractionState {

    RECEIVED,
    RATE_CHECKED,
    CONFIGURED,
    ACKNOWLEDGED,
    COMPLETING,
    DELIVERED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED || this == EXPIRED;
    }

    public boolean canTransitionTo(InteractionState target) {
        return successors().contains(target);
    }

    private Set<InteractionState> successors() {
        return switch (this) {
        case RECEIVED -> EnumSet.of(RATE_CHECKED, DELIVERED, FAILED);
        case RATE_CHECKED -> EnumSet.of(CONFIGURED, FAILED);
        case CONFIGURED -> EnumSet.of(ACKNOWLEDGED, FAILED);
        case ACKNOWLEDGED -> EnumSet.of(COMPLETING, DELIVERED, FAILED);
        case COMPLETING -> EnumSet.of(DELIVERED, FAILED, EXPIRED);
        case DELIVERED, FAILED, EXPIRED -> EnumSet.noneOf(InteractionState.class);
        };
    }
}
