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

import me.personabot.domain.model.Identity;
import me.personabot.domain.model.InteractionKind;
import me.personabot.domain.model.InteractionRequest;
import me.personabot.infrastructure.config.BotProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

/**
 * Maps Discord interaction payloads to {@link InteractionRequest}s.
 */
@Component
@RequiredArgsConstructor
public class DiscordInteractionMapper {

    static final int TYPE_PING = 1;
    static final int TYPE_APPLICATION_COMMAND = 2;
    static final int TYPE_MESSAGE_COMPONENT = 3;
    static final int TYPE_AUTOCOMPLETE = 4;
    static final int TYPE_MODAL_SUBMIT = 5;

    private static final int COMMAND_CHAT_INPUT = 1;
    private static final int COMMAND_USER = 2;
    private static final int COMMAND_MESSAGE = 3;

    private static final BigInteger ADMINISTRATOR = BigInteger.valueOf(0x8);
    private static final BigInteger MANAGE_GUILD = BigInteger.valueOf(0x20);

    private final BotProperties properties;
    private final Clock clock;

    /**
     * @return the request, or empty for interaction types that are not routed
     *         (ping, autocomplete, unknown)
     */
    public Optional<InteractionRequest> map(JsonNode payload) {
        int type = payload.path("type").asInt();
        JsonNode data = payload.path("data");

        InteractionRequest.InteractionRequestBuilder builder = InteractionRequest.builder()
                .id(payload.path("id").asText())
                .identity(new Identity(properties.getBotId(), userId(payload), channelId(payload)))
                .guildId(textOrNull(payload.path("guild_id")))
                .token(payload.path("token").asText(null))
                .applicationId(payload.path("application_id").asText(properties.getDiscord().getApplicationId()))
                .receivedAt(clock.instant())
                .manageGuild(canManageGuild(payload.path("member").path("permissions").asText("")));

        switch (type) {
        case TYPE_APPLICATION_COMMAND -> mapCommand(builder, data);
        case TYPE_MESSAGE_COMPONENT -> builder.kind(InteractionKind.BUTTON).name(data.path("custom_id").asText());
        case TYPE_MODAL_SUBMIT -> mapModal(builder, data);
        default -> {
            return Optional.empty();
        }
        }
        return Optional.of(builder.build());
    }

    public int type(JsonNode payload) {
        return payload.path("type").asInt();
    }

    private void mapCommand(InteractionRequest.InteractionRequestBuilder builder, JsonNode data) {
        String name = data.path("name").asText();
        int commandType = data.path("type").asInt(COMMAND_CHAT_INPUT);
        builder.name(name);

        if (commandType == COMMAND_CHAT_INPUT) {
            builder.kind(InteractionKind.COMMAND);
            for (JsonNode option : data.path("options")) {
                if (option.has("value")) {
                    builder.option(option.path("name").asText(), option.path("value").asText());
                }
            }
            return;
        }

        builder.kind(InteractionKind.CONTEXT_MENU);
        String targetId = data.path("target_id").asText();
        JsonNode resolved = data.path("resolved");
        if (commandType == COMMAND_MESSAGE) {
            builder.text(resolved.path("messages").path(targetId).path("content").asText(""));
        } else if (commandType == COMMAND_USER) {
            JsonNode user = resolved.path("users").path(targetId);
            builder.text(user.path("username").asText(targetId));
        }
    }

    private void mapModal(InteractionRequest.InteractionRequestBuilder builder, JsonNode data) {
        builder.kind(InteractionKind.MODAL).name(data.path("custom_id").asText());
        for (JsonNode row : data.path("components")) {
            for (JsonNode input : row.path("components")) {
                if (input.has("custom_id")) {
                    builder.option(input.path("custom_id").asText(), input.path("value").asText(""));
                }
            }
        }
    }

    private static String userId(JsonNode payload) {
        JsonNode member = payload.path("member").path("user");
        if (member.has("id")) {
            return member.path("id").asText();
        }
        return payload.path("user").path("id").asText();
    }

    private static String channelId(JsonNode payload) {
        String channelId = textOrNull(payload.path("channel_id"));
        return channelId != null ? channelId : payload.path("channel").path("id").asText();
    }

    static boolean canManageGuild(String permissions) {
        if (permissions == null || permissions.isBlank()) {
            return false;
        }
        try {
            BigInteger bits = new BigInteger(permissions);
            return bits.and(ADMINISTRATOR).signum() != 0 || bits.and(MANAGE_GUILD).signum() != 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
