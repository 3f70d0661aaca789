package me.personabot.adapter.outbound.discord;

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Acknowledgments awaited by open HTTP interaction requests.
 *
 * <p>
 * The webhook controller registers an interaction before handing it to the
 * orchestrator and answers the HTTP request with whatever acknowledgment is
 * offered here. An acknowledgment offered after the controller gave up is
 * refused. When the controller had to answer with its own deferred response,
 * the interaction is remembered as auto-deferred so the late acknowledgment is
 * applied as an edit instead of a second callback.
 */
@Component
@Slf4j
public class PendingAcknowledgments {

    private final Map<String, CompletableFuture<Acknowledgment>> pending = new ConcurrentHashMap<>();
    private final Set<String> autoDeferred = ConcurrentHashMap.newKeySet();

    public CompletableFuture<Acknowledgment> register(String interactionId) {
        CompletableFuture<Acknowledgment> future = new CompletableFuture<>();
        pending.put(interactionId, future);
        return future;
    }

    /**
     * Hand an acknowledgment to the waiting HTTP request.
     *
     * @return {@code true} if a request was still waiting for it
     */
    public boolean offer(String interactionId, Acknowledgment acknowledgment) {
        CompletableFuture<Acknowledgment> future = pending.remove(interactionId);
        return future != null && future.complete(acknowledgment);
    }

    /**
     * Stop waiting; a later offer is refused.
     *
     * @return {@code false} if the acknowledgment arrived first and is
     *         available from the future
     */
    public boolean abandon(String interactionId, CompletableFuture<Acknowledgment> future) {
        pending.remove(interactionId, future);
        // Marked before cancelling so a refused offer always finds the mark
        autoDeferred.add(interactionId);
        if (future.cancel(false)) {
            log.debug("[Discord] Stopped waiting for acknowledgment of {}", interactionId);
            return true;
        }
        autoDeferred.remove(interactionId);
        return false;
    }

    /**
     * Whether the interaction was already answered with a deferred response by
     * the controller. Consumes the mark.
     */
    public boolean consumeAutoDeferred(String interactionId) {
        return autoDeferred.remove(interactionId);
    }

    int size() {
        return pending.size();
    }
}
