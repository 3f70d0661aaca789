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

import me.personabot.adapter.outbound.discord.DiscordResponseRenderer;
import me.personabot.adapter.outbound.discord.PendingAcknowledgments;
import me.personabot.domain.model.Acknowledgment;
import me.personabot.domain.model.Feature;
import me.personabot.domain.model.ImageSize;
import me.personabot.domain.model.ImageStyle;
import me.personabot.domain.model.InteractionRequest;
import me.personabot.domain.model.Persona;
import me.personabot.domain.model.SettingKey;
import me.personabot.domain.service.FeatureRegistry;
import me.personabot.domain.service.IntrospectionService;
import me.personabot.domain.service.PersonaService;
import me.personabot.infrastructure.config.BotProperties;
import me.personabot.port.inbound.InteractionPort;
import me.personabot.port.outbound.LlmPort;
import me.personabot.usage.UsageStatsTracker;
import me.personabot.usage.UsageSummary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Discord HTTP interactions endpoint.
 *
 * <p>
 * Every request is signature-checked. Pings are answered inline, autocomplete
 * requests get setting, persona, feature and option choices, and everything else is handed to
 * the {@link InteractionPort}. The HTTP response carries the orchestrator's
 * acknowledgment when it arrives in time; otherwise a deferred response is
 * returned and the acknowledgment is applied later through the REST API.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class DiscordInteractionController {

    private static final Duration ACK_SAFETY_MARGIN = Duration.ofMillis(500);
    private static final Duration MIN_ACK_WAIT = Duration.ofMillis(100);
    private static final int MAX_CHOICES = 25;

    private final DiscordSignatureVerifier signatureVerifier;
    private final DiscordInteractionMapper mapper;
    private final InteractionPort interactionPort;
    private final PendingAcknowledgments pendingAcknowledgments;
    private final DiscordResponseRenderer renderer;
    private final PersonaService personaService;
    private final FeatureRegistry featureRegistry;
    private final IntrospectionService introspectionService;
    private final UsageStatsTracker usageStatsTracker;
    private final LlmPort llmPort;
    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    @GetMapping("/")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
            UsageSummary summary = usageStatsTracker.summarize(Duration.ofDays(1));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "ok");
            body.put("bot", properties.getBotId());
            body.put("llmAvailable", llmPort.isAvailable());
            body.put("interactions24h", summary.getTotalInteractions());
            body.put("outcomes24h", summary.getByOutcome());
            return ResponseEntity.ok(body);
        });
    }

    @PostMapping(value = "/interactions", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<JsonNode>> interactions(
            @RequestBody byte[] body,
            @RequestHeader(value = "X-Signature-Ed25519", required = false) String signature,
            @RequestHeader(value = "X-Signature-Timestamp", required = false) String timestamp) {

        return Mono.defer(() -> {
            if (!signatureVerifier.verify(signature, timestamp, body)) {
                log.warn("[Discord] Rejected interaction with invalid signature");
                return Mono.just(error(HttpStatus.UNAUTHORIZED, "invalid request signature"));
            }

            JsonNode payload;
            try {
                payload = objectMapper.readTree(body);
            } catch (IOException e) {
                return Mono.just(error(HttpStatus.BAD_REQUEST, "malformed payload"));
            }

            int type = mapper.type(payload);
            if (type == DiscordInteractionMapper.TYPE_PING) {
                return Mono.just(ok(objectMapper.createObjectNode()
                        .put("type", DiscordResponseRenderer.CALLBACK_PONG)));
            }
            if (type == DiscordInteractionMapper.TYPE_AUTOCOMPLETE) {
                return Mono.just(ok(autocomplete(payload.path("data"))));
            }

            Optional<InteractionRequest> mapped = mapper.map(payload);
            if (mapped.isEmpty()) {
                return Mono.just(error(HttpStatus.BAD_REQUEST, "unsupported interaction type " + type));
            }
            return dispatch(mapped.get());
        });
    }

    private Mono<ResponseEntity<JsonNode>> dispatch(InteractionRequest request) {
        CompletableFuture<Acknowledgment> acknowledgment = pendingAcknowledgments.register(request.getId());
        interactionPort.onEvent(request);

        return Mono.fromFuture(acknowledgment, true)
                .timeout(ackWait())
                .map(ack -> ok(renderer.callback(ack)))
                .onErrorResume(TimeoutException.class, e -> Mono.just(ok(late(request, acknowledgment))));
    }

    private JsonNode late(InteractionRequest request, CompletableFuture<Acknowledgment> acknowledgment) {
        if (pendingAcknowledgments.abandon(request.getId(), acknowledgment)) {
            log.warn("[Discord] No acknowledgment for {} within {}ms, deferring", request.getId(),
                    ackWait().toMillis());
            return renderer.callback(Acknowledgment.deferred());
        }
        return renderer.callback(acknowledgment.getNow(Acknowledgment.deferred()));
    }

    private Duration ackWait() {
        Duration wait = properties.getInteraction().getAckDeadline().minus(ACK_SAFETY_MARGIN);
        return wait.compareTo(MIN_ACK_WAIT) < 0 ? MIN_ACK_WAIT : wait;
    }

    private ObjectNode autocomplete(JsonNode data) {
        JsonNode focused = null;
        for (JsonNode option : data.path("options")) {
            if (option.path("focused").asBoolean(false)) {
                focused = option;
            }
        }

        List<String> candidates = new ArrayList<>();
        if (focused != null) {
            String optionName = focused.path("name").asText();
            switch (optionName) {
            case "level" -> candidates.addAll(SettingKey.VERBOSITY_LEVELS.stream().sorted().toList());
            case "setting" -> candidates.addAll(Arrays.stream(SettingKey.values()).map(SettingKey::getKey).toList());
            case "persona" -> candidates.addAll(personaService.listPersonas().stream().map(Persona::getId).toList());
            case "feature" -> candidates.addAll(featureRegistry.toggleableFeatures().stream().map(Feature::id).toList());
            case "component" -> candidates.addAll(introspectionService.components());
            case "size" -> candidates.addAll(Arrays.stream(ImageSize.values()).map(ImageSize::getId).toList());
            case "style" -> candidates.addAll(Arrays.stream(ImageStyle.values()).map(ImageStyle::getId).toList());
            case "action" -> candidates.addAll(List.of("list", "cancel"));
            case "value" -> candidates.addAll(settingValues(data));
            default -> log.debug("[Discord] No autocomplete for option {}", optionName);
            }
        }

        String typed = focused != null ? focused.path("value").asText("").toLowerCase(Locale.ROOT) : "";
        ObjectNode response = objectMapper.createObjectNode().put("type", DiscordResponseRenderer.CALLBACK_AUTOCOMPLETE);
        ArrayNode choices = response.putObject("data").putArray("choices");
        candidates.stream()
                .filter(candidate -> candidate.startsWith(typed))
                .limit(MAX_CHOICES)
                .forEach(candidate -> choices.addObject().put("name", candidate).put("value", candidate));
        return response;
    }

    /**
     * Values for {@code set_guild_setting}, based on the setting already
     * chosen in the same command.
     */
    private List<String> settingValues(JsonNode data) {
        String settingName = null;
        for (JsonNode option : data.path("options")) {
            if ("setting".equals(option.path("name").asText())) {
                settingName = option.path("value").asText(null);
            }
        }
        SettingKey key = SettingKey.fromName(settingName).orElse(null);
        if (key == null) {
            return List.of();
        }
        if (key.isToggle()) {
            return List.of(SettingKey.ENABLED, SettingKey.DISABLED);
        }
        return switch (key) {
        case VERBOSITY -> SettingKey.VERBOSITY_LEVELS.stream().sorted().toList();
        case PERSONA -> personaService.listPersonas().stream().map(Persona::getId).toList();
        default -> List.of();
        };
    }

    private static ResponseEntity<JsonNode> ok(JsonNode body) {
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<JsonNode> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(objectMapper.createObjectNode().put("error", message));
    }
}
