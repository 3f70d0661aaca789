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

/**
 * Kind of inbound platform event.
 */
public enum InteractionKind {

    /** Plain channel message addressed to the bot (mention or DM). */
    MESSAGE,

    /** Slash-style application command. */
    COMMAND,

    /** Button or other message component click. */
    BUTTON,

    /** Modal form submission. */
    MODAL,

    /** Context-menu command invoked on a message or a user. */
    CONTEXT_MENU
}
