package me.personabot.adapter.inbound.discord;

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
import me.personabot.MutableClock;
import me.personabot.adapter.outbound.discord.DiscordResponseRenderer;
import me.personabot.adapter.outbound.discord.PendingAcknowledgments;
import me.personabot.domain.model.Acknowledgment;
import me.personabot.domain.model.InteractionRequest;
import me.personabot.domain.service.FeatureRegistry;
import me.personabot.domain.service.IntrospectionService;
import me.personabot.domain.service.PersonaService;
import me.personabot.domain.service.SettingsResolver;
import me.personabot.infrastructure.config.BotProperties;
import me.personabot.port.inbound.InteractionPort;
import me.personabot.port.outbound.LlmPort;
import me.personabot.usage.UsageStatsTracker;
import me.personabot.usage.UsageSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DiscordInteractionControllerTest {

    private static final String COMMAND = """
            {"id":"i-1","type":2,"token":"tok","channel_id":"c-1","guild_id":"g-1",
             "member":{"user":{"id":"u-1"}},"data":{"name":"ping","type":1}}
            """;

    private BotProperties properties;
    private PendingAcknowledgments pendingAcknowledgments;
    private List<InteractionRequest> dispatched;
    private Consumer<InteractionRequest> onEvent;
    private UsageStatsTracker usageStatsTracker;
    private LlmPort llmPort;
    private FeatureRegistry featureRegistry;
    private DiscordInteractionController controller;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.setBotId("bot-1");
        properties.getDiscord().setVerifySignatures(false);
        BotProperties.PersonaProperties chef = new BotProperties.PersonaProperties();
        chef.setName("Chef");
        BotProperties.PersonaProperties obi = new BotProperties.PersonaProperties();
        obi.setName("Obi");
        properties.getPersonas().put("chef", chef);
        properties.getPersonas().put("obi", obi);

        ObjectMapper objectMapper = new ObjectMapper();
        pendingAcknowledgments = new PendingAcknowledgments();
        dispatched = new CopyOnWriteArrayList<>();
        onEvent = request -> pendingAcknowledgments.offer(request.getId(), Acknowledgment.message("Pong"));
        InteractionPort interactionPort = request -> {
            dispatched.add(request);
            onEvent.accept(request);
        };
        usageStatsTracker = mock(UsageStatsTracker.class);
        llmPort = mock(LlmPort.class);
        featureRegistry = new FeatureRegistry(mock(SettingsResolver.class), properties);

        controller = new DiscordInteractionController(
                new DiscordSignatureVerifier(properties),
                new DiscordInteractionMapper(properties, MutableClock.startingAt("2026-01-01T00:00:00Z")),
                interactionPort,
                pendingAcknowledgments,
                new DiscordResponseRenderer(objectMapper),
                new PersonaService(properties),
                featureRegistry,
                new IntrospectionService(),
                usageStatsTracker,
                llmPort,
                properties,
                objectMapper);
    }

    // ===== Webhook =====

    @Test
    void shouldAnswerPing() {
        ResponseEntity<JsonNode> response = post("{\"type\":1}");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(1, response.getBody().get("type").asInt());
        assertTrue(dispatched.isEmpty());
    }

    @Test
    void shouldRejectInvalidSignature() {
        properties.getDiscord().setVerifySignatures(true);
        properties.getDiscord().setPublicKey(null);
        controller = new DiscordInteractionController(new DiscordSignatureVerifier(properties),
                new DiscordInteractionMapper(properties, MutableClock.startingAt("2026-01-01T00:00:00Z")),
                request -> dispatched.add(request), pendingAcknowledgments,
                new DiscordResponseRenderer(new ObjectMapper()), new PersonaService(properties), featureRegistry,
                new IntrospectionService(), usageStatsTracker,
                llmPort, properties, new ObjectMapper());

        ResponseEntity<JsonNode> response = post(COMMAND);

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
        assertTrue(dispatched.isEmpty());
    }

    @Test
    void shouldRejectMalformedPayload() {
        assertEquals(HttpStatus.BAD_REQUEST, post("{not json").getStatusCode());
    }

    @Test
    void shouldReturnAcknowledgmentOfferedByOrchestrator() {
        ResponseEntity<JsonNode> response = post(COMMAND);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(DiscordResponseRenderer.CALLBACK_MESSAGE, response.getBody().get("type").asInt());
        assertEquals("Pong", response.getBody().path("data").path("content").asText());
        assertEquals("ping", dispatched.get(0).getName());
    }

    @Test
    void shouldDeferWhenAcknowledgmentIsLate() {
        properties.getInteraction().setAckDeadline(Duration.ofMillis(200));
        onEvent = request -> {
        };

        ResponseEntity<JsonNode> response = post(COMMAND);

        assertEquals(DiscordResponseRenderer.CALLBACK_DEFERRED_MESSAGE, response.getBody().get("type").asInt());
        assertFalse(pendingAcknowledgments.offer("i-1", Acknowledgment.message("too late")));
        assertTrue(pendingAcknowledgments.consumeAutoDeferred("i-1"));
    }

    // ===== Autocomplete =====

    @Test
    void shouldSuggestPersonasByPrefix() {
        ResponseEntity<JsonNode> response = post("""
                {"type":4,"data":{"name":"set_persona","options":[
                  {"name":"persona","value":"ch","focused":true}]}}
                """);

        JsonNode body = response.getBody();
        assertEquals(DiscordResponseRenderer.CALLBACK_AUTOCOMPLETE, body.get("type").asInt());
        JsonNode choices = body.path("data").path("choices");
        assertEquals(1, choices.size());
        assertEquals("chef", choices.get(0).get("value").asText());
    }

    @Test
    void shouldSuggestVerbosityLevels() {
        ResponseEntity<JsonNode> response = post("""
                {"type":4,"data":{"name":"set_channel_verbosity","options":[
                  {"name":"level","value":"","focused":true}]}}
                """);

        assertEquals(3, response.getBody().path("data").path("choices").size());
    }

    @Test
    void shouldSuggestOnlyToggleableFeatures() {
        ResponseEntity<JsonNode> response = post("""
                {"type":4,"data":{"name":"toggle_feature","options":[
                  {"name":"feature","value":"","focused":true}]}}
                """);

        JsonNode choices = response.getBody().path("data").path("choices");
        assertEquals(3, choices.size());
        assertEquals("reminders", choices.get(0).get("value").asText());
        assertEquals("image_generation", choices.get(1).get("value").asText());
        assertEquals("mention_responses", choices.get(2).get("value").asText());
    }

    @Test
    void shouldSuggestToggleValuesForChosenSetting() {
        ResponseEntity<JsonNode> response = post("""
                {"type":4,"data":{"name":"set_guild_setting","options":[
                  {"name":"setting","value":"mention_responses"},
                  {"name":"value","value":"","focused":true}]}}
                """);

        JsonNode choices = response.getBody().path("data").path("choices");
        assertEquals(2, choices.size());
        assertEquals("enabled", choices.get(0).get("value").asText());
        assertEquals("disabled", choices.get(1).get("value").asText());
    }

    @Test
    void shouldSuggestVerbosityForDefaultVerbosityAlias() {
        ResponseEntity<JsonNode> response = post("""
                {"type":4,"data":{"name":"set_guild_setting","options":[
                  {"name":"setting","value":"default_verbosity"},
                  {"name":"value","value":"d","focused":true}]}}
                """);

        JsonNode choices = response.getBody().path("data").path("choices");
        assertEquals(1, choices.size());
        assertEquals("detailed", choices.get(0).get("value").asText());
    }

    @Test
    void shouldSuggestImageSizes() {
        ResponseEntity<JsonNode> response = post("""
                {"type":4,"data":{"name":"imagine","options":[
                  {"name":"prompt","value":"a cat"},
                  {"name":"size","value":"l","focused":true}]}}
                """);

        JsonNode choices = response.getBody().path("data").path("choices");
        assertEquals(1, choices.size());
        assertEquals("landscape", choices.get(0).get("value").asText());
    }

    // ===== Health =====

    @Test
    void shouldReportHealth() {
        when(usageStatsTracker.summarize(any())).thenReturn(UsageSummary.empty());
        when(llmPort.isAvailable()).thenReturn(true);

        Map<String, Object> body = controller.health().block().getBody();

        assertEquals("ok", body.get("status"));
        assertEquals("bot-1", body.get("bot"));
        assertEquals(true, body.get("llmAvailable"));
        assertEquals(0L, body.get("interactions24h"));
    }

    private ResponseEntity<JsonNode> post(String json) {
        return controller.interactions(json.getBytes(StandardCharsets.UTF_8), "sig", "ts").block(Duration.ofSeconds(5));
    }
}
