package me.personabot.infrastructure.i18n;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * User-facing bot texts.
 *
 * <p>
 * Messages are loaded from the {@code messages.properties} resource bundle and
 * are always rendered through {@link MessageFormat}, so literal apostrophes are
 * written as {@code ''}. A missing key
 * is logged and the key itself is returned, so a typo never breaks a reply.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    private static final String BUNDLE_NAME = "messages";

    private final ResourceBundle bundle;

    public MessageService() {
        this.bundle = ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT);
        log.info("Loaded message bundle: {} ({} keys)", BUNDLE_NAME, bundle.keySet().size());
    }

    /**
     * Get message, formatting {@code args} into its placeholders.
     */
    public String getMessage(String key, Object... args) {
        try {
            return MessageFormat.format(bundle.getString(key), args);
        } catch (MissingResourceException e) {
            log.warn("Missing message key: {}", key);
            return key;
        }
    }

    public boolean hasMessage(String key) {
        return bundle.containsKey(key);
    }
}
