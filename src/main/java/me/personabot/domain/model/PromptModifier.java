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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Instruction appended to the persona prompt by the task-specific commands.
 */
public enum PromptModifier {

    EXPLAIN("explain", "Focus on providing clear explanations."),

    SIMPLE("simple", "Explain in a simple and concise way. Give analogies a beginner might understand."),

    STEPS("steps", "Break this out into clear, actionable steps."),

    RECIPE("recipe", "Respond with a recipe if this prompt has food. "
            + "If it does not have food, return 'Give me some food to work with'.");

    private final String id;
    private final String instruction;

    PromptModifier(String id, String instruction) {
        this.id = id;
        this.instruction = instruction;
    }

    public String getId() {
        return id;
    }

    public String getInstruction() {
        return instruction;
    }

    public static Optional<PromptModifier> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(m -> m.id.equals(normalized)).findFirst();
    }
}
