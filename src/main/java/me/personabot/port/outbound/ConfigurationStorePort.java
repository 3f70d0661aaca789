package me.personabot.port.outbound;

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

import me.personabot.domain.model.SettingKey;
import me.personabot.domain.model.SettingScope;

import java.util.Map;
import java.util.Optional;

/**
 * Port for scoped setting overrides (channel and guild), namespaced per bot.
 * The system default scope is not stored.
 */
public interface ConfigurationStorePort {

    /**
     * Read the value defined directly in a scope.
     *
     * @throws RuntimeException
     *             if the store cannot be read
     */
    Optional<String> get(String botId, SettingScope scope, String scopeId, SettingKey key);

    void put(String botId, SettingScope scope, String scopeId, SettingKey key, String value);

    Map<SettingKey, String> getAll(String botId, SettingScope scope, String scopeId);
}
