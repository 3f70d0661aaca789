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

import me.personabot.domain.model.Acknowledgment;
import me.personabot.domain.model.ImageRequest;
import me.personabot.domain.model.PromptModifier;

/**
 * What the orchestrator does with a routed interaction: answer locally with a
 * final acknowledgment, or defer and complete with the language model or the
 * image model.
 */
public final class InteractionPlan {

    private final Acknowledgment localReply;
    private final Completion completion;
    private final ImageRequest image;
    private final String label;

    private InteractionPlan(Acknowledgment localReply, Completion completion, ImageRequest image, String label) {
        this.localReply = localReply;
        this.completion = completion;
        this.image = image;
        this.label = label;
    }

    /**
     * Answer immediately; the acknowledgment is the final reply.
     */
    public static InteractionPlan reply(String label, Acknowledgment acknowledgment) {
        if (!acknowledgment.isFinal()) {
            throw new IllegalArgumentException("Local reply must carry final content");
        }
        return new InteractionPlan(acknowledgment, null, null, label);
    }

    /**
     * Defer and complete with the language model.
     */
    public static InteractionPlan complete(String label, Completion completion) {
        return new InteractionPlan(null, completion, null, label);
    }

    /**
     * Defer and generate an image.
     */
    public static InteractionPlan image(String label, ImageRequest request) {
        return new InteractionPlan(null, null, request, label);
    }

    public boolean isLocal() {
        return localReply != null;
    }

    public boolean isImage() {
        return image != null;
    }

    public ImageRequest getImage() {
        return image;
    }

    public Acknowledgment getLocalReply() {
        return localReply;
    }

    public Completion getCompletion() {
        return completion;
    }

    /** Command or component name, used for logs and usage stats. */
    public String getLabel() {
        return label;
    }

    /**
     * Language model work for a deferred interaction.
     *
     * @param userMessage
     *            message sent to the model
     * @param modifier
     *            optional prompt modifier
     * @param systemPrompt
     *            system prompt replacing the persona prompt, {@code null} to
     *            use the persona
     * @param replyPrefix
     *            text prepended to the model reply, empty for none
     * @param conversational
     *            whether history is sent and both turns are recorded
     */
    public record Completion(String userMessage, PromptModifier modifier, String systemPrompt,
            String replyPrefix, boolean conversational) {

        public Completion {
            replyPrefix = replyPrefix != null ? replyPrefix : "";
        }

        public static Completion chat(String userMessage) {
            return new Completion(userMessage, null, null, "", true);
        }

        public static Completion task(String userMessage, PromptModifier modifier, String replyPrefix) {
            return new Completion(userMessage, modifier, null, replyPrefix, false);
        }
    }
}
