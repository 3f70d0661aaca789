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

import java.util.Objects;

/**
 * Isolation key for every stateful lookup: the bot instance, the user and the
 * channel the interaction arrived in.
 *
 * <p>
 * {@code botId} separates independently configured bot instances sharing one
 * deployment. State keyed by one bot is never visible to another.
 *
 * <p>
 * In-memory state is keyed by the record itself, so equality is component-wise
 * and ids containing separators such as {@code :} or {@code /} never collide.
 */
public record Identity(String botId, String userId, String channelId) {

    public Identity {
        Objects.requireNonNull(botId, "botId must not be null");
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(channelId, "channelId must not be null");
    }
}
