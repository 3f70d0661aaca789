package me.personabot.adapter.outbound.storage;

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
import me.personabot.domain.service.StorageKeys;
import me.personabot.port.outbound.ConversationStorePort;
import me.personabot.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation history as one JSONL file per identity:
 * {@code conversations/<botId>/<userId>/<channelId>.jsonl}. Each line is one
 * turn; malformed lines are skipped on read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileConversationStore implements ConversationStorePort {

    private static final String CONVERSATIONS_DIR = "conversations";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public void append(Identity identity, ConversationTurn turn) {
        String line;
        try {
            line = objectMapper.writeValueAsString(turn);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversation turn", e);
        }
        storagePort.appendText(CONVERSATIONS_DIR, path(identity), line + "\n").join();
    }

    @Override
    public List<ConversationTurn> read(Identity identity, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String content = storagePort.getText(CONVERSATIONS_DIR, path(identity)).join();
        if (content == null || content.isBlank()) {
            return List.of();
        }

        List<ConversationTurn> turns = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                turns.add(objectMapper.readValue(line, ConversationTurn.class));
            } catch (JsonProcessingException e) {
                log.warn("[Context] Skipping malformed history line for {}: {}", identity,
                        e.getOriginalMessage());
            }
        }
        if (turns.size() > limit) {
            return new ArrayList<>(turns.subList(turns.size() - limit, turns.size()));
        }
        return turns;
    }

    @Override
    public void clear(Identity identity) {
        storagePort.deleteObject(CONVERSATIONS_DIR, path(identity)).join();
    }

    private static String path(Identity identity) {
        return StorageKeys.segment(identity.botId()) + "/"
                + StorageKeys.segment(identity.userId()) + "/"
                + StorageKeys.segment(identity.channelId()) + ".jsonl";
    }
}
