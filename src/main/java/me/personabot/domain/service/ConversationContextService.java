package me.personabot.domain.service;

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
import me.personabot.domain.model.TurnRole;
import me.personabot.port.outbound.ConversationStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded, ordered conversation history per (bot, user, channel).
 *
 * <p>
 * Appends for one identity are serialized and numbered with a monotonic
 * sequence; appends for different identities proceed independently. Reads
 * return a suffix of the stored history and never modify it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationContextService {

    private final ConversationStorePort conversationStore;
    private final Clock clock;

    private final Map<Identity, SequenceState> sequences = new ConcurrentHashMap<>();

    /**
     * Durably append a turn.
     *
     * @return the stored turn with its assigned sequence number
     */
    public ConversationTurn append(Identity identity, TurnRole role, String content) {
        SequenceState state = sequences.computeIfAbsent(identity, key -> new SequenceState());
        synchronized (state) {
            if (!state.initialized) {
                List<ConversationTurn> last = conversationStore.read(identity, 1);
                state.lastSequence = last.isEmpty() ? 0 : last.get(last.size() - 1).getSequence();
                state.initialized = true;
            }

            ConversationTurn turn = ConversationTurn.builder()
                    .sequence(state.lastSequence + 1)
                    .role(role)
                    .content(content)
                    .timestamp(Instant.now(clock))
                    .build();
            conversationStore.append(identity, turn);
            state.lastSequence = turn.getSequence();
            return turn;
        }
    }

    /**
     * The last {@code maxTurns} turns, oldest first.
     */
    public List<ConversationTurn> window(Identity identity, int maxTurns) {
        if (maxTurns <= 0) {
            return List.of();
        }
        List<ConversationTurn> turns = conversationStore.read(identity, maxTurns);
        if (turns.size() > maxTurns) {
            turns = turns.subList(turns.size() - maxTurns, turns.size());
        }
        return List.copyOf(turns);
    }

    /**
     * Forget the whole history of an identity. Sequence numbers keep growing.
     */
    public void clear(Identity identity) {
        SequenceState state = sequences.computeIfAbsent(identity, key -> new SequenceState());
        synchronized (state) {
            conversationStore.clear(identity);
            log.info("[Context] Cleared history: bot={}, user={}, channel={}",
                    identity.botId(), identity.userId(), identity.channelId());
        }
    }

    private static final class SequenceState {
        private boolean initialized;
        private long lastSequence;
    }
}
