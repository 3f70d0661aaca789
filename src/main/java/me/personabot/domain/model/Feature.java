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
 * Capability of the bot as listed by {@code /features}.
 *
 * @param id
 *            stable identifier used by {@code /toggle_feature}
 * @param toggle
 *            guild setting that switches the feature on and off, {@code null}
 *            when the feature is always on
 */
public record Feature(String id, String name, String description, SettingKey toggle) {

    public boolean isToggleable() {
        return toggle != null;
    }
}
