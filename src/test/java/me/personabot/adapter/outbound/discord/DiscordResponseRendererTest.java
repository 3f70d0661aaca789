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
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.personabot.domain.model.Acknowledgment;
import me.personabot.domain.model.ModalForm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiscordResponseRendererTest {

    private DiscordResponseRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new DiscordResponseRenderer(new ObjectMapper());
    }

    @Test
    void shouldRenderDeferredCallbackWithoutData() {
        ObjectNode callback = renderer.callback(Acknowledgment.deferred());

        assertEquals(DiscordResponseRenderer.CALLBACK_DEFERRED_MESSAGE, callback.get("type").asInt());
        assertFalse(callback.has("data"));
    }

    @Test
    void shouldRenderEphemeralMessage() {
        ObjectNode callback = renderer.callback(Acknowledgment.ephemeral("only you"));

        assertEquals(DiscordResponseRenderer.CALLBACK_MESSAGE, callback.get("type").asInt());
        assertEquals("only you", callback.path("data").path("content").asText());
        assertEquals(64, callback.path("data").path("flags").asInt());
    }

    @Test
    void shouldRenderUpdateWithoutEphemeralFlag() {
        ObjectNode callback = renderer.callback(Acknowledgment.update("done"));

        assertEquals(DiscordResponseRenderer.CALLBACK_UPDATE_MESSAGE, callback.get("type").asInt());
        assertFalse(callback.path("data").has("flags"));
        assertEquals(0, callback.path("data").path("components").size());
    }

    @Test
    void shouldPackButtonsIntoRowsOfFive() {
        List<Acknowledgment.Button> buttons = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            buttons.add(new Acknowledgment.Button("persona_" + i, "P" + i));
        }

        JsonNode rows = renderer.message("pick", buttons, false).get("components");

        assertEquals(2, rows.size());
        assertEquals(5, rows.get(0).get("components").size());
        assertEquals(2, rows.get(1).get("components").size());
        assertEquals("persona_5", rows.get(1).get("components").get(0).get("custom_id").asText());
    }

    @Test
    void shouldRenderModalFields() {
        ModalForm form = ModalForm.builder()
                .customId("help_feedback_modal")
                .title("Help")
                .field(new ModalForm.Field("help_topic", "Topic", false, true, "Ask..."))
                .field(new ModalForm.Field("help_details", "Details", true, false, null))
                .build();

        ObjectNode callback = renderer.callback(Acknowledgment.modal(form));

        assertEquals(DiscordResponseRenderer.CALLBACK_MODAL, callback.get("type").asInt());
        JsonNode rows = callback.path("data").path("components");
        assertEquals(2, rows.size());
        JsonNode topic = rows.get(0).get("components").get(0);
        assertEquals(1, topic.get("style").asInt());
        assertTrue(topic.get("required").asBoolean());
        assertEquals("Ask...", topic.get("placeholder").asText());
        JsonNode details = rows.get(1).get("components").get(0);
        assertEquals(2, details.get("style").asInt());
        assertFalse(details.has("placeholder"));
    }
}
