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

import me.personabot.domain.model.Acknowledgment;
import me.personabot.domain.model.InteractionRequest;
import me.personabot.domain.model.ReplyHandle;

import java.util.concurrent.CompletableFuture;

/**
 * Port for sending replies back to the chat platform.
 *
 * <p>
 * All operations are asynchronous I/O and complete exceptionally with
 * {@link me.personabot.domain.exception.TransportException} on delivery
 * failure.
 */
public interface ReplyTransportPort {

    /**
     * Send the first response to an interaction.
     *
     * @return handle used for the later edit and follow-ups
     */
    CompletableFuture<ReplyHandle> acknowledge(InteractionRequest request, Acknowledgment acknowledgment);

    /**
     * Replace the content of a deferred acknowledgment.
     */
    CompletableFuture<Void> editAcknowledgment(ReplyHandle handle, String text);

    /**
     * Post an additional message after the acknowledgment.
     */
    CompletableFuture<Void> sendFollowup(ReplyHandle handle, String text);

    /**
     * Post a standalone message to a channel, outside of any interaction.
     */
    CompletableFuture<Void> sendChannelMessage(String channelId, String text);
}
