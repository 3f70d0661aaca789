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
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to the language model: system prompt, prior turns oldest first, and
 * the new user message.
 */
@Data
@Builder
public class LlmRequest {

    private String systemPrompt;

    @Builder.Default
    private List<ConversationTurn> history = new ArrayList<>();

    private String userMessage;

    /** Optional model override, {@code null} uses the configured model. */
    private String model;

    private Double temperature;
}
