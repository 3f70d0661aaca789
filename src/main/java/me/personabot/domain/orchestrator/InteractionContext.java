package me.personabot.domain.orchestrator;

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
import me.personabot.domain.model.SettingKey;

import java.util.List;

/**
 * Settings and history resolved for one interaction before it is routed.
 *
 * @param persona
 *            effective persona id (user preference, then settings cascade)
 * @param verbosity
 *            effective verbosity level
 * @param maxContextMessages
 *            history budget
 * @param history
 *            recent turns, oldest first
 * @param degraded
 *            whether any lookup fell back to defaults
 */
public record InteractionContext(
        String persona,
        String verbosity,
        int maxContextMessages,
        List<ConversationTurn> history,
        boolean degraded) {

    public static InteractionContext defaults(String persona, String verbosity, int maxContextMessages) {
        return new InteractionContext(persona, verbosity, maxContextMessages, List.of(), true);
    }

    static int parseMaxContext(String value) {
        try {
            return Math.max(0, Integer.parseInt(value.trim()));
        } catch (NumberFormatException | NullPointerException e) {
            return Integer.parseInt(SettingKey.MAX_CONTEXT_MESSAGES.getDefaultValue());
        }
    }
}
