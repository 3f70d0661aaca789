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

import me.personabot.domain.model.ConversationTurn;
import me.personabot.domain.model.Identity;

import java.util.List;

/**
 * Port for durable, append-only conversation history.
 */
public interface ConversationStorePort {

    void append(Identity identity, ConversationTurn turn);

    /**
     * Read at most {@code limit} most recent turns, oldest first.
     */
    List<ConversationTurn> read(Identity identity, int limit);

    void clear(Identity identity);
}
