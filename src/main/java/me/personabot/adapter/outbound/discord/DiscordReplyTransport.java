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

import me.personabot.domain.exception.TransportException;
import me.personabot.domain.model.Acknowledgment;
import me.personabot.domain.model.InteractionKind;
import me.personabot.domain.model.InteractionRequest;
import me.personabot.domain.model.ReplyHandle;
import me.personabot.infrastructure.config.BotProperties;
import me.personabot.port.outbound.ReplyTransportPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Discord REST implementation of {@link ReplyTransportPort}.
 *
 * <p>
 * Interactions are acknowledged through the waiting webhook request when
 * possible, otherwise through the interaction callback endpoint. The reply is
 * edited via the {@code @original} webhook message and continued with
 * follow-up messages. Plain channel messages have no interaction token; they
 * are answered with bot-authenticated channel messages instead.
 *
 * <p>
 * HTTP 429 and 5xx responses and network errors are reported as retryable
 * {@link TransportException}s; other 4xx responses are permanent.
 */
@Component
@Slf4j
@SuppressWarnings("PMD.CloseResource")
public class DiscordReplyTransport implements ReplyTransportPort {

    private static final MediaType JSON = MediaType.parse("application/json");

    private static final ExecutorService DISCORD_EXECUTOR = Executors.newCachedThreadPool(new DaemonThreads());

    private final OkHttpClient okHttpClient;
    private final BotProperties properties;
    private final ObjectMapper objectMapper;
    private final PendingAcknowledgments pendingAcknowledgments;
    private final DiscordResponseRenderer renderer;

    public DiscordReplyTransport(OkHttpClient okHttpClient, BotProperties properties, ObjectMapper objectMapper,
            PendingAcknowledgments pendingAcknowledgments, DiscordResponseRenderer renderer) {
        this.okHttpClient = okHttpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.pendingAcknowledgments = pendingAcknowledgments;
        this.renderer = renderer;
    }

    @Override
    public CompletableFuture<ReplyHandle> acknowledge(InteractionRequest request, Acknowledgment acknowledgment) {
        ReplyHandle handle = ReplyHandle.forInteraction(request);
        if (request.getKind() != InteractionKind.MESSAGE
                && pendingAcknowledgments.offer(request.getId(), acknowledgment)) {
            log.debug("[Discord] Acknowledged {} in webhook response", request.getId());
            return CompletableFuture.completedFuture(handle);
        }

        if (pendingAcknowledgments.consumeAutoDeferred(request.getId())) {
            return CompletableFuture.supplyAsync(() -> applyLateAcknowledgment(handle, acknowledgment),
                    DISCORD_EXECUTOR);
        }

        return CompletableFuture.supplyAsync(() -> {
            if (request.getKind() == InteractionKind.MESSAGE) {
                ObjectNode body = renderer.message(acknowledgment.getContent(), acknowledgment.getButtons(), false);
                body.putObject("message_reference").put("message_id", request.getId());
                JsonNode created = execute("POST", "/channels/" + handle.channelId() + "/messages", body, true);
                return handle.withMessageId(created.path("id").asText(null));
            }
            execute("POST", "/interactions/" + request.getId() + "/" + request.getToken() + "/callback",
                    renderer.callback(acknowledgment), false);
            return handle;
        }, DISCORD_EXECUTOR);
    }

    /**
     * The webhook already answered with a deferred response: a placeholder
     * needs nothing more, final content replaces the deferred message.
     */
    private ReplyHandle applyLateAcknowledgment(ReplyHandle handle, Acknowledgment acknowledgment) {
        switch (acknowledgment.getType()) {
        case DEFERRED -> log.debug("[Discord] Interaction {} already deferred", handle.requestId());
        case MESSAGE, UPDATE -> execute("PATCH", "/webhooks/" + handle.applicationId() + "/" + handle.token()
                + "/messages/@original",
                renderer.message(acknowledgment.getContent(), acknowledgment.getButtons(), false), false);
        case MODAL -> throw new TransportException("Cannot open a modal after the interaction was deferred", 0,
                false);
        }
        return handle;
    }

    @Override
    public CompletableFuture<Void> editAcknowledgment(ReplyHandle handle, String content) {
        return CompletableFuture.runAsync(() -> {
            if (handle.kind() == InteractionKind.MESSAGE) {
                if (handle.messageId() == null) {
                    throw new TransportException("No placeholder message to edit for " + handle.requestId(), 0,
                            false);
                }
                execute("PATCH", "/channels/" + handle.channelId() + "/messages/" + handle.messageId(),
                        renderer.content(content), true);
            } else {
                execute("PATCH", "/webhooks/" + handle.applicationId() + "/" + handle.token()
                        + "/messages/@original", renderer.message(content, List.of(), false), false);
            }
        }, DISCORD_EXECUTOR);
    }

    @Override
    public CompletableFuture<Void> sendFollowup(ReplyHandle handle, String content) {
        return CompletableFuture.runAsync(() -> {
            if (handle.kind() == InteractionKind.MESSAGE) {
                execute("POST", "/channels/" + handle.channelId() + "/messages", renderer.content(content), true);
            } else {
                execute("POST", "/webhooks/" + handle.applicationId() + "/" + handle.token(),
                        renderer.content(content), false);
            }
        }, DISCORD_EXECUTOR);
    }

    @Override
    public CompletableFuture<Void> sendChannelMessage(String channelId, String content) {
        return CompletableFuture.runAsync(
                () -> execute("POST", "/channels/" + channelId + "/messages", renderer.content(content), true),
                DISCORD_EXECUTOR);
    }

    private JsonNode execute(String method, String path, ObjectNode body, boolean botAuth) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Discord payload", e);
        }

        Request.Builder builder = new Request.Builder()
                .url(getApiBaseUrl() + path)
                .method(method, RequestBody.create(json, JSON));
        if (botAuth) {
            builder.header("Authorization", "Bot " + properties.getDiscord().getBotToken());
        }

        try (Response response = okHttpClient.newCall(builder.build()).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                int code = response.code();
                boolean retryable = isRetryableError(code);
                log.warn("[Discord] {} {} failed: status={}, retryable={}", method, path(path), code, retryable);
                throw new TransportException("Discord " + method + " " + path(path) + " returned " + code,
                        code, retryable);
            }
            return text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        } catch (IOException e) {
            log.warn("[Discord] {} {} network error: {}", method, path(path), e.getMessage());
            throw new TransportException("Discord " + method + " " + path(path) + " failed: " + e.getMessage(), e);
        }
    }

    private static boolean isRetryableError(int code) {
        return code == 429 || code >= 500;
    }

    /** Path with interaction tokens masked for logs. */
    private static String path(String path) {
        return path.replaceAll("/([A-Za-z0-9_-]{40,})", "/***");
    }

    protected String getApiBaseUrl() {
        String base = properties.getDiscord().getApiBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static final class DaemonThreads implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "discord-rest-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
