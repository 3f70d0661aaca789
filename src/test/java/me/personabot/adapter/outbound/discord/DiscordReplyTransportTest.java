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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.personabot.domain.exception.TransportException;
import me.personabot.domain.model.Acknowledgment;
import me.personabot.domain.model.Identity;
import me.personabot.domain.model.InteractionKind;
import me.personabot.domain.model.InteractionRequest;
import me.personabot.domain.model.ModalForm;
import me.personabot.domain.model.ReplyHandle;
import me.personabot.infrastructure.config.BotProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DiscordReplyTransportTest {

    private MockWebServer mockServer;
    private ObjectMapper objectMapper;
    private PendingAcknowledgments pendingAcknowledgments;
    private DiscordReplyTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(5, TimeUnit.SECONDS)
                .build();

        BotProperties properties = new BotProperties();
        properties.getDiscord().setBotToken("bot-token");
        properties.getDiscord().setApplicationId("app-1");

        objectMapper = new ObjectMapper();
        pendingAcknowledgments = new PendingAcknowledgments();
        transport = new TestableDiscordReplyTransport(client, properties, objectMapper, pendingAcknowledgments,
                new DiscordResponseRenderer(objectMapper), mockServer.url("/").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    // ===== Acknowledgment =====

    @Test
    void shouldHandAcknowledgmentToWaitingWebhook() throws Exception {
        CompletableFuture<Acknowledgment> waiting = pendingAcknowledgments.register("i-1");

        ReplyHandle handle = transport.acknowledge(command(), Acknowledgment.deferred()).get(5, TimeUnit.SECONDS);

        assertEquals(Acknowledgment.Type.DEFERRED, waiting.get(1, TimeUnit.SECONDS).getType());
        assertEquals("tok", handle.token());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldPostCallbackWhenWebhookIsNotWaiting() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(204));

        transport.acknowledge(command(), Acknowledgment.ephemeral("slow down")).get(5, TimeUnit.SECONDS);

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("POST", request.getMethod());
        assertEquals("/interactions/i-1/tok/callback", request.getPath());
        assertNull(request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals(DiscordResponseRenderer.CALLBACK_MESSAGE, body.get("type").asInt());
        assertEquals(DiscordResponseRenderer.FLAG_EPHEMERAL, body.path("data").path("flags").asInt());
    }

    @Test
    void shouldReplaceAutoDeferredResponseWithFinalContent() throws Exception {
        CompletableFuture<Acknowledgment> waiting = pendingAcknowledgments.register("i-1");
        assertTrue(pendingAcknowledgments.abandon("i-1", waiting));
        mockServer.enqueue(new MockResponse().setBody("{}"));

        transport.acknowledge(command(), Acknowledgment.message("Pong")).get(5, TimeUnit.SECONDS);

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("PATCH", request.getMethod());
        assertEquals("/webhooks/app-1/tok/messages/@original", request.getPath());
    }

    @Test
    void shouldSkipSecondDeferralAfterAutoDeferredResponse() throws Exception {
        CompletableFuture<Acknowledgment> waiting = pendingAcknowledgments.register("i-1");
        pendingAcknowledgments.abandon("i-1", waiting);

        transport.acknowledge(command(), Acknowledgment.deferred()).get(5, TimeUnit.SECONDS);

        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldRefuseModalAfterAutoDeferredResponse() {
        CompletableFuture<Acknowledgment> waiting = pendingAcknowledgments.register("i-1");
        pendingAcknowledgments.abandon("i-1", waiting);
        Acknowledgment modal = Acknowledgment.modal(ModalForm.builder().customId("m").title("t").build());

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> transport.acknowledge(command(), modal).get(5, TimeUnit.SECONDS));
        assertFalse(((TransportException) error.getCause()).isRetryable());
    }

    @Test
    void shouldReplyToPlainMessageWithBotAuthentication() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("{\"id\":\"m-42\"}"));

        ReplyHandle handle = transport.acknowledge(message(), Acknowledgment.deferred("Thinking..."))
                .get(5, TimeUnit.SECONDS);

        assertEquals("m-42", handle.messageId());
        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/channels/channel-1/messages", request.getPath());
        assertEquals("Bot bot-token", request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("Thinking...", body.get("content").asText());
        assertEquals("msg-1", body.path("message_reference").path("message_id").asText());
    }

    // ===== Edits and follow-ups =====

    @Test
    void shouldEditOriginalInteractionResponse() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("{}"));

        transport.editAcknowledgment(ReplyHandle.forInteraction(command()), "Answer").get(5, TimeUnit.SECONDS);

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("PATCH", request.getMethod());
        assertEquals("/webhooks/app-1/tok/messages/@original", request.getPath());
        assertEquals("Answer", objectMapper.readTree(request.getBody().readUtf8()).get("content").asText());
    }

    @Test
    void shouldEditPlaceholderMessageOfPlainMessage() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("{}"));
        ReplyHandle handle = ReplyHandle.forInteraction(message()).withMessageId("m-42");

        transport.editAcknowledgment(handle, "Answer").get(5, TimeUnit.SECONDS);

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/channels/channel-1/messages/m-42", request.getPath());
    }

    @Test
    void shouldFailEditWithoutPlaceholderMessage() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> transport.editAcknowledgment(ReplyHandle.forInteraction(message()), "Answer")
                        .get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, error.getCause());
    }

    @Test
    void shouldPostFollowupToWebhook() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("{\"id\":\"f-1\"}"));

        transport.sendFollowup(ReplyHandle.forInteraction(command()), "part 2").get(5, TimeUnit.SECONDS);

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("POST", request.getMethod());
        assertEquals("/webhooks/app-1/tok", request.getPath());
    }

    @Test
    void shouldPostStandaloneChannelMessageWithBotAuthentication() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("{\"id\":\"m-9\"}"));

        transport.sendChannelMessage("channel-7", "<@user-1> reminder").get(5, TimeUnit.SECONDS);

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("POST", request.getMethod());
        assertEquals("/channels/channel-7/messages", request.getPath());
        assertEquals("Bot bot-token", request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("<@user-1> reminder", body.get("content").asText());
    }

    // ===== Errors =====

    @Test
    void shouldMarkServerErrorsRetryable() {
        mockServer.enqueue(new MockResponse().setResponseCode(503));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> transport.editAcknowledgment(ReplyHandle.forInteraction(command()), "x")
                        .get(5, TimeUnit.SECONDS));
        TransportException transportError = (TransportException) error.getCause();
        assertEquals(503, transportError.getStatus());
        assertTrue(transportError.isRetryable());
    }

    @Test
    void shouldMarkClientErrorsPermanent() {
        mockServer.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"Unknown Webhook\"}"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> transport.sendFollowup(ReplyHandle.forInteraction(command()), "x").get(5, TimeUnit.SECONDS));
        assertFalse(((TransportException) error.getCause()).isRetryable());
    }

    private static InteractionRequest command() {
        return InteractionRequest.builder()
                .id("i-1")
                .kind(InteractionKind.COMMAND)
                .identity(new Identity("bot-1", "user-1", "channel-1"))
                .name("hey")
                .token("tok")
                .applicationId("app-1")
                .receivedAt(Instant.now())
                .build();
    }

    private static InteractionRequest message() {
        return InteractionRequest.builder()
                .id("msg-1")
                .kind(InteractionKind.MESSAGE)
                .identity(new Identity("bot-1", "user-1", "channel-1"))
                .text("hello")
                .receivedAt(Instant.now())
                .build();
    }

    private static class TestableDiscordReplyTransport extends DiscordReplyTransport {

        private final String baseUrl;

        TestableDiscordReplyTransport(OkHttpClient client, BotProperties properties, ObjectMapper objectMapper,
                PendingAcknowledgments pendingAcknowledgments, DiscordResponseRenderer renderer, String baseUrl) {
            super(client, properties, objectMapper, pendingAcknowledgments, renderer);
            this.baseUrl = baseUrl;
        }

        @Override
        protected String getApiBaseUrl() {
            return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        }
    }
}
