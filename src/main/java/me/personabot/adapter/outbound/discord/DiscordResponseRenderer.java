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
import me.personabot.domain.model.ModalForm;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders acknowledgments and messages into Discord JSON payloads.
 */
@Component
public class DiscordResponseRenderer {

    public static final int CALLBACK_PONG = 1;
    public static final int CALLBACK_MESSAGE = 4;
    public static final int CALLBACK_DEFERRED_MESSAGE = 5;
    public static final int CALLBACK_UPDATE_MESSAGE = 7;
    public static final int CALLBACK_AUTOCOMPLETE = 8;
    public static final int CALLBACK_MODAL = 9;

    static final int FLAG_EPHEMERAL = 1 << 6;

    private static final int COMPONENT_ACTION_ROW = 1;
    private static final int COMPONENT_BUTTON = 2;
    private static final int COMPONENT_TEXT_INPUT = 4;
    private static final int BUTTON_STYLE_SECONDARY = 2;
    private static final int TEXT_INPUT_SHORT = 1;
    private static final int TEXT_INPUT_PARAGRAPH = 2;
    private static final int BUTTONS_PER_ROW = 5;
    private static final int MAX_ROWS = 5;

    private final ObjectMapper objectMapper;

    public DiscordResponseRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Interaction callback body ({@code type} + {@code data}).
     */
    public ObjectNode callback(Acknowledgment acknowledgment) {
        ObjectNode root = objectMapper.createObjectNode();
        switch (acknowledgment.getType()) {
        case DEFERRED -> {
            root.put("type", CALLBACK_DEFERRED_MESSAGE);
            if (acknowledgment.isEphemeral()) {
                root.putObject("data").put("flags", FLAG_EPHEMERAL);
            }
        }
        case MESSAGE -> {
            root.put("type", CALLBACK_MESSAGE);
            root.set("data", message(acknowledgment.getContent(), acknowledgment.getButtons(),
                    acknowledgment.isEphemeral()));
        }
        case UPDATE -> {
            root.put("type", CALLBACK_UPDATE_MESSAGE);
            root.set("data", message(acknowledgment.getContent(), acknowledgment.getButtons(), false));
        }
        case MODAL -> {
            root.put("type", CALLBACK_MODAL);
            root.set("data", modal(acknowledgment.getModal()));
        }
        }
        return root;
    }

    /**
     * Message body with optional buttons. An empty button list clears the
     * components of an updated message.
     */
    public ObjectNode message(String content, List<Acknowledgment.Button> buttons, boolean ephemeral) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("content", content != null ? content : "");
        if (ephemeral) {
            data.put("flags", FLAG_EPHEMERAL);
        }
        ArrayNode rows = data.putArray("components");
        ObjectNode row = null;
        for (int i = 0; i < buttons.size() && i < BUTTONS_PER_ROW * MAX_ROWS; i++) {
            if (i % BUTTONS_PER_ROW == 0) {
                row = rows.addObject();
                row.put("type", COMPONENT_ACTION_ROW);
                row.putArray("components");
            }
            Acknowledgment.Button button = buttons.get(i);
            ((ArrayNode) row.get("components")).addObject()
                    .put("type", COMPONENT_BUTTON)
                    .put("style", BUTTON_STYLE_SECONDARY)
                    .put("label", button.label())
                    .put("custom_id", button.customId());
        }
        return data;
    }

    public ObjectNode content(String content) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("content", content);
        return data;
    }

    private ObjectNode modal(ModalForm form) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("custom_id", form.getCustomId());
        data.put("title", form.getTitle());
        ArrayNode rows = data.putArray("components");
        for (ModalForm.Field field : form.getFields()) {
            ObjectNode input = rows.addObject()
                    .put("type", COMPONENT_ACTION_ROW)
                    .putArray("components")
                    .addObject();
            input.put("type", COMPONENT_TEXT_INPUT)
                    .put("custom_id", field.customId())
                    .put("label", field.label())
                    .put("style", field.paragraph() ? TEXT_INPUT_PARAGRAPH : TEXT_INPUT_SHORT)
                    .put("required", field.required());
            if (field.placeholder() != null) {
                input.put("placeholder", field.placeholder());
            }
        }
        return data;
    }
}
