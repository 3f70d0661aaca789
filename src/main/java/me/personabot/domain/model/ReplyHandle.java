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

/**
 * Reference to an acknowledgment already sent to the platform, used to edit
 * it and to post follow-ups after it.
 *
 * @param requestId
 *            id of the interaction the acknowledgment belongs to
 * @param kind
 *            kind of the originating interaction
 * @param applicationId
 *            application owning the interaction token, {@code null} for plain
 *            messages
 * @param token
 *            interaction continuation token, {@code null} for plain messages
 * @param channelId
 *            channel the reply lives in
 * @param messageId
 *            id of the placeholder message, when the platform returned one
 */
public record ReplyHandle(
        String requestId,
        InteractionKind kind,
        String applicationId,
        String token,
        String channelId,
        String messageId) {

    public static ReplyHandle forInteraction(InteractionRequest request) {
        return new ReplyHandle(request.getId(), request.getKind(), request.getApplicationId(),
                request.getToken(), request.getIdentity().channelId(), null);
    }

    public ReplyHandle withMessageId(String newMessageId) {
        return new ReplyHandle(requestId, kind, applicationId, token, channelId, newMessageId);
    }
}
