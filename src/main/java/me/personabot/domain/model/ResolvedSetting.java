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
 * Effective value of a setting together with the scope it came from.
 * {@code unavailable} marks a system default reported because the stored
 * overrides could not be read.
 */
public record ResolvedSetting(SettingKey key, String value, SettingScope scope, boolean unavailable) {

    public ResolvedSetting(SettingKey key, String value, SettingScope scope) {
        this(key, value, scope, false);
    }
}
