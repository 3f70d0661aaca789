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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * First response to an interaction, sent before the acknowledgment deadline.
 *
 * <p>
 * A {@link Type#DEFERRED} acknowledgment is a placeholder that is later
 * replaced by the content. The other types already carry the final reply.
 */
@Value
@Builder
public class Acknowledgment {

    public enum Type {
        /** "Processing" placeholder, replaced later by exactly one edit. */
        DEFERRED,
        /** New message carrying the final content. */
        MESSAGE,
        /** Update of the message the clicked component belongs to. */
        UPDATE,
        /** Opens a modal dialog. */
        MODAL
    }

    Type type;

    String content;

    /** Visible only to the invoking user. */
    boolean ephemeral;

    ModalForm modal;

    /** Buttons attached to the message, one row. */
    @Singular
    List<Button> buttons;

    public boolean isFinal() {
        return type != Type.DEFERRED;
    }

    public static Acknowledgment deferred() {
        return Acknowledgment.builder().type(Type.DEFERRED).build();
    }

    /**
     * Placeholder with visible text, for events that cannot show a native
     * "thinking" state (plain channel messages).
     */
    public static Acknowledgment deferred(String placeholder) {
        return Acknowledgment.builder().type(Type.DEFERRED).content(placeholder).build();
    }

    public static Acknowledgment message(String content) {
        return Acknowledgment.builder().type(Type.MESSAGE).content(content).build();
    }

    public static Acknowledgment ephemeral(String content) {
        return Acknowledgment.builder().type(Type.MESSAGE).content(content).ephemeral(true).build();
    }

    public static Acknowledgment update(String content) {
        return Acknowledgment.builder().type(Type.UPDATE).content(content).build();
    }

    public static Acknowledgment modal(ModalForm modal) {
        return Acknowledgment.builder().type(Type.MODAL).modal(modal).build();
    }

    public record Button(String customId, String label) {
    }
}
