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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One inbound event requiring a reply.
 *
 * <p>
 * Immutable once built. The orchestrator task that receives it is its only
 * owner.
 */
@Value
@Builder
public class InteractionRequest {

    /** Platform id of the interaction (or message id for plain messages). */
    String id;

    InteractionKind kind;

    Identity identity;

    /** Guild the event originated in, {@code null} for direct messages. */
    String guildId;

    /**
     * Command name, component custom id or modal custom id, depending on
     * {@link #kind}.
     */
    String name;

    /** Free text carried by the event (message body, prompt option, target text). */
    String text;

    /** Named command options and modal fields. */
    @Singular
    Map<String, String> options;

    /** Continuation token used to edit the reply or post follow-ups. */
    String token;

    /** Application id the continuation token belongs to. */
    String applicationId;

    Instant receivedAt;

    /** Whether the invoking member may manage the guild (admin commands). */
    boolean manageGuild;

    public String option(String key) {
        return options.get(key);
    }

    public boolean isDirectMessage() {
        return guildId == null || guildId.isBlank();
    }
}
