package me.personabot.domain.orchestrator;

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
import me.personabot.domain.model.Feature;
import me.personabot.domain.model.Identity;
import me.personabot.domain.model.ImageRequest;
import me.personabot.domain.model.ImageSize;
import me.personabot.domain.model.ImageStyle;
import me.personabot.domain.model.InteractionRequest;
import me.personabot.domain.model.ModalForm;
import me.personabot.domain.model.Persona;
import me.personabot.domain.model.PromptModifier;
import me.personabot.domain.model.Reminder;
import me.personabot.domain.model.ResolvedSetting;
import me.personabot.domain.model.SettingKey;
import me.personabot.domain.model.SettingScope;
import me.personabot.domain.orchestrator.InteractionPlan.Completion;
import me.personabot.domain.service.ConversationContextService;
import me.personabot.domain.service.FeatureRegistry;
import me.personabot.domain.service.IntrospectionService;
import me.personabot.domain.service.PersonaService;
import me.personabot.domain.service.ReminderService;
import me.personabot.domain.service.SettingsResolver;
import me.personabot.domain.service.UserPreferencesService;
import me.personabot.infrastructure.i18n.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Decides how each interaction is answered.
 *
 * <p>
 * Commands that only touch local state (ping, help, persona list, settings,
 * reminders, feature toggles, button toggles) are answered immediately with a
 * final acknowledgment. {@code /imagine} becomes an image plan; every other
 * interaction becomes a {@link Completion} run by the orchestrator after a
 * deferred acknowledgment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InteractionRouter {

    public static final String CMD_PING = "ping";
    public static final String CMD_HELP = "help";
    public static final String CMD_PERSONAS = "personas";
    public static final String CMD_SET_PERSONA = "set_persona";
    public static final String CMD_HEY = "hey";
    public static final String CMD_FORGET = "forget";
    public static final String CMD_SETTINGS = "settings";
    public static final String CMD_SET_CHANNEL_VERBOSITY = "set_channel_verbosity";
    public static final String CMD_SET_GUILD_SETTING = "set_guild_setting";
    public static final String CMD_REMIND = "remind";
    public static final String CMD_REMINDERS = "reminders";
    public static final String CMD_IMAGINE = "imagine";
    public static final String CMD_FEATURES = "features";
    public static final String CMD_TOGGLE_FEATURE = "toggle_feature";
    public static final String CMD_INTROSPECT = "introspect";

    public static final String MENU_ANALYZE_MESSAGE = "Analyze Message";
    public static final String MENU_EXPLAIN_MESSAGE = "Explain Message";
    public static final String MENU_ANALYZE_USER = "Analyze User";

    public static final String PERSONA_BUTTON_PREFIX = "persona_";
    public static final String CONFIRM_PREFIX = "confirm_";
    public static final String CANCEL_PREFIX = "cancel_";
    public static final String SHOW_HELP_MODAL = "show_help_modal";
    public static final String SHOW_PROMPT_MODAL = "show_persona_modal";

    public static final String HELP_MODAL = "help_feedback_modal";
    public static final String PROMPT_MODAL = "ai_prompt_modal";
    public static final String FIELD_HELP_TOPIC = "help_topic";
    public static final String FIELD_HELP_DETAILS = "help_details";
    public static final String FIELD_PROMPT_TEXT = "prompt_text";

    /** Option carrying the free text of each task command. */
    private static final Map<String, String> TEXT_OPTIONS = Map.of(
            CMD_HEY, "message",
            "explain", "topic",
            "simple", "topic",
            "steps", "task",
            "recipe", "food");

    private final PersonaService personaService;
    private final SettingsResolver settingsResolver;
    private final UserPreferencesService userPreferencesService;
    private final ConversationContextService conversationContext;
    private final FeatureRegistry featureRegistry;
    private final ReminderService reminderService;
    private final IntrospectionService introspectionService;
    private final MessageService messages;

    public InteractionPlan route(InteractionRequest request, InteractionContext context) {
        return switch (request.getKind()) {
        case MESSAGE -> InteractionPlan.complete("message", Completion.chat(request.getText()));
        case COMMAND -> routeCommand(request, context);
        case CONTEXT_MENU -> routeContextMenu(request);
        case BUTTON -> routeButton(request);
        case MODAL -> routeModal(request);
        };
    }

    // ==================== COMMANDS ====================

    private InteractionPlan routeCommand(InteractionRequest request, InteractionContext context) {
        String name = request.getName() != null ? request.getName().toLowerCase(Locale.ROOT) : "";
        return switch (name) {
        case CMD_PING -> InteractionPlan.reply(name, Acknowledgment.message(messages.getMessage("command.pong")));
        case CMD_HELP -> InteractionPlan.reply(name, help());
        case CMD_PERSONAS -> InteractionPlan.reply(name, personas(context.persona()));
        case CMD_SET_PERSONA -> InteractionPlan.reply(name, setPersona(request));
        case CMD_FORGET -> InteractionPlan.reply(name, forget(request.getIdentity()));
        case CMD_SETTINGS -> InteractionPlan.reply(name, settings(request));
        case CMD_SET_CHANNEL_VERBOSITY -> InteractionPlan.reply(name, setChannelVerbosity(request));
        case CMD_SET_GUILD_SETTING -> InteractionPlan.reply(name, setGuildSetting(request));
        case CMD_REMIND -> InteractionPlan.reply(name, remind(request));
        case CMD_REMINDERS -> InteractionPlan.reply(name, reminders(request));
        case CMD_FEATURES -> InteractionPlan.reply(name, features(request));
        case CMD_TOGGLE_FEATURE -> InteractionPlan.reply(name, toggleFeature(request));
        case CMD_IMAGINE -> imagine(request);
        case CMD_INTROSPECT -> introspect(request);
        default -> routeTaskCommand(name, request);
        };
    }

    private InteractionPlan routeTaskCommand(String name, InteractionRequest request) {
        String optionName = TEXT_OPTIONS.get(name);
        if (optionName == null) {
            log.debug("[Router] Unknown command: {}", name);
            return InteractionPlan.reply(name,
                    Acknowledgment.ephemeral(messages.getMessage("command.unknown", name)));
        }

        String text = request.option(optionName);
        if (text == null || text.isBlank()) {
            text = request.getText();
        }
        if (text == null || text.isBlank()) {
            return InteractionPlan.reply(name,
                    Acknowledgment.ephemeral(messages.getMessage("reply.missing_input", name)));
        }

        if (CMD_HEY.equals(name)) {
            return InteractionPlan.complete(name, Completion.chat(text));
        }
        PromptModifier modifier = PromptModifier.fromId(name).orElse(null);
        return InteractionPlan.complete(name, Completion.task(text, modifier, ""));
    }

    private Acknowledgment help() {
        return Acknowledgment.builder()
                .type(Acknowledgment.Type.MESSAGE)
                .content(messages.getMessage("command.help"))
                .button(new Acknowledgment.Button(SHOW_HELP_MODAL, messages.getMessage("button.help_modal")))
                .button(new Acknowledgment.Button(SHOW_PROMPT_MODAL, messages.getMessage("button.prompt_modal")))
                .build();
    }

    private Acknowledgment personas(String currentPersona) {
        if (personaService.listPersonas().isEmpty()) {
            return Acknowledgment.ephemeral(messages.getMessage("command.personas.none"));
        }

        StringBuilder content = new StringBuilder(messages.getMessage("command.personas.header")).append("\n\n");
        Acknowledgment.AcknowledgmentBuilder builder = Acknowledgment.builder().type(Acknowledgment.Type.MESSAGE);
        for (Persona persona : personaService.listPersonas()) {
            content.append(messages.getMessage("command.personas.entry", persona.getId(), persona.getDescription()))
                    .append('\n');
            builder.button(new Acknowledgment.Button(PERSONA_BUTTON_PREFIX + persona.getId(), persona.getName()));
        }
        content.append('\n').append(messages.getMessage("command.personas.current", currentPersona))
                .append("\n\n").append(messages.getMessage("command.personas.switch"));
        return builder.content(content.toString()).build();
    }

    private Acknowledgment setPersona(InteractionRequest request) {
        String persona = request.option("persona");
        if (persona == null || persona.isBlank()) {
            return Acknowledgment.ephemeral(messages.getMessage("command.set_persona.missing"));
        }
        String normalized = persona.trim().toLowerCase(Locale.ROOT);
        if (!personaService.exists(normalized)) {
            return Acknowledgment.ephemeral(messages.getMessage("command.set_persona.unknown", normalized));
        }
        Identity identity = request.getIdentity();
        try {
            userPreferencesService.setPersona(identity.botId(), identity.userId(), normalized);
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to store persona for {}: {}", identity, e.getMessage());
            return Acknowledgment.ephemeral(messages.getMessage("reply.storage_unavailable"));
        }
        return Acknowledgment.message(messages.getMessage("command.set_persona.done",
                personaService.displayName(normalized)));
    }

    private Acknowledgment forget(Identity identity) {
        try {
            conversationContext.clear(identity);
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to clear history for {}: {}", identity, e.getMessage());
            return Acknowledgment.ephemeral(messages.getMessage("reply.storage_unavailable"));
        }
        return Acknowledgment.ephemeral(messages.getMessage("command.forget"));
    }

    private Acknowledgment settings(InteractionRequest request) {
        Identity identity = request.getIdentity();
        Map<SettingKey, ResolvedSetting> resolved = settingsResolver.describe(identity.botId(),
                identity.channelId(), request.getGuildId());
        StringBuilder content = new StringBuilder(messages.getMessage("command.settings.header"));
        for (ResolvedSetting setting : resolved.values()) {
            String entry = setting.unavailable() ? "command.settings.entry_unavailable" : "command.settings.entry";
            content.append('\n').append(messages.getMessage(entry,
                    setting.key().getKey(), setting.value(), setting.scope().getLabel()));
        }
        return Acknowledgment.ephemeral(content.toString());
    }

    private Acknowledgment setChannelVerbosity(InteractionRequest request) {
        Acknowledgment denied = checkAdmin(request);
        if (denied != null) {
            return denied;
        }
        String channel = request.option("channel");
        String channelId = channel != null && !channel.isBlank() ? channel : request.getIdentity().channelId();
        return applySetting(request, SettingScope.CHANNEL, channelId, SettingKey.VERBOSITY, request.option("level"));
    }

    private Acknowledgment setGuildSetting(InteractionRequest request) {
        Acknowledgment denied = checkAdmin(request);
        if (denied != null) {
            return denied;
        }
        String settingName = request.option("setting");
        SettingKey key = SettingKey.fromName(settingName).orElse(null);
        if (key == null) {
            return Acknowledgment.ephemeral(messages.getMessage("command.settings.invalid",
                    "Unknown setting: " + settingName));
        }
        return applySetting(request, SettingScope.GUILD, request.getGuildId(), key, request.option("value"));
    }

    private Acknowledgment applySetting(InteractionRequest request, SettingScope scope, String scopeId,
            SettingKey key, String value) {
        try {
            String stored = settingsResolver.set(request.getIdentity().botId(), scope, scopeId, key, value);
            return Acknowledgment.ephemeral(messages.getMessage("command.settings.updated",
                    key.getKey(), stored, scope.getLabel()));
        } catch (IllegalArgumentException e) {
            return Acknowledgment.ephemeral(messages.getMessage("command.settings.invalid", e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to store {} for {} {}: {}", key.getKey(), scope.getLabel(), scopeId,
                    e.getMessage());
            return Acknowledgment.ephemeral(messages.getMessage("reply.storage_unavailable"));
        }
    }

    private Acknowledgment checkAdmin(InteractionRequest request) {
        if (request.isDirectMessage()) {
            return Acknowledgment.ephemeral(messages.getMessage("command.guild_only"));
        }
        if (!request.isManageGuild()) {
            return Acknowledgment.ephemeral(messages.getMessage("command.admin_only"));
        }
        return null;
    }

    // ==================== REMINDERS ====================

    private Acknowledgment remind(InteractionRequest request) {
        Acknowledgment disabled = checkFeature(request, "reminders");
        if (disabled != null) {
            return disabled;
        }
        String time = request.option("time");
        String message = request.option("message");
        if (time == null || time.isBlank() || message == null || message.isBlank()) {
            return Acknowledgment.ephemeral(messages.getMessage("command.remind.missing"));
        }
        Duration delay = ReminderService.parseDelay(time).orElse(null);
        if (delay == null) {
            return Acknowledgment.ephemeral(messages.getMessage("command.remind.invalid_time"));
        }

        Identity identity = request.getIdentity();
        try {
            Reminder reminder = reminderService.create(identity.botId(), identity.userId(), identity.channelId(),
                    request.getGuildId(), message, delay);
            return Acknowledgment.message(messages.getMessage("command.remind.created",
                    String.valueOf(reminder.getId()), String.valueOf(reminder.getDueAt().getEpochSecond()),
                    reminder.getMessage()));
        } catch (IllegalArgumentException e) {
            return Acknowledgment.ephemeral(messages.getMessage("command.remind.invalid", e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to store reminder for {}: {}", identity, e.getMessage());
            return Acknowledgment.ephemeral(messages.getMessage("reply.storage_unavailable"));
        }
    }

    private Acknowledgment reminders(InteractionRequest request) {
        String action = request.option("action");
        action = action != null && !action.isBlank() ? action.trim().toLowerCase(Locale.ROOT) : "list";
        Identity identity = request.getIdentity();
        try {
            return switch (action) {
            case "list" -> listReminders(identity);
            case "cancel" -> cancelReminder(identity, request.option("id"));
            default -> Acknowledgment.ephemeral(messages.getMessage("command.reminders.unknown_action", action));
            };
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to read reminders for {}: {}", identity, e.getMessage());
            return Acknowledgment.ephemeral(messages.getMessage("reply.storage_unavailable"));
        }
    }

    private Acknowledgment listReminders(Identity identity) {
        List<Reminder> pending = reminderService.listPending(identity.botId(), identity.userId());
        if (pending.isEmpty()) {
            return Acknowledgment.ephemeral(messages.getMessage("command.reminders.none"));
        }
        StringBuilder content = new StringBuilder(messages.getMessage("command.reminders.header"));
        for (Reminder reminder : pending) {
            content.append('\n').append(messages.getMessage("command.reminders.entry",
                    String.valueOf(reminder.getId()), String.valueOf(reminder.getDueAt().getEpochSecond()),
                    reminder.getMessage()));
        }
        content.append("\n\n").append(messages.getMessage("command.reminders.footer"));
        return Acknowledgment.ephemeral(content.toString());
    }

    private Acknowledgment cancelReminder(Identity identity, String idOption) {
        long id;
        try {
            id = Long.parseLong(idOption != null ? idOption.trim().replace("#", "") : "");
        } catch (NumberFormatException e) {
            return Acknowledgment.ephemeral(messages.getMessage("command.reminders.missing_id"));
        }
        if (!reminderService.cancel(identity.botId(), identity.userId(), id)) {
            return Acknowledgment.ephemeral(messages.getMessage("command.reminders.not_found", String.valueOf(id)));
        }
        return Acknowledgment.ephemeral(messages.getMessage("command.reminders.cancelled", String.valueOf(id)));
    }

    // ==================== FEATURES ====================

    private Acknowledgment features(InteractionRequest request) {
        Identity identity = request.getIdentity();
        StringBuilder content = new StringBuilder(
                messages.getMessage("command.features.header", featureRegistry.getVersion())).append('\n');
        for (Feature feature : featureRegistry.listFeatures()) {
            boolean enabled = featureRegistry.isEnabled(identity.botId(), feature, identity.channelId(),
                    request.getGuildId());
            content.append('\n').append(messages.getMessage("command.features.entry",
                    enabled ? "✅" : "❌", feature.name(), feature.id(), feature.description()));
            if (feature.isToggleable()) {
                content.append(messages.getMessage("command.features.toggleable"));
            }
        }
        return Acknowledgment.ephemeral(content.toString());
    }

    private Acknowledgment toggleFeature(InteractionRequest request) {
        Acknowledgment denied = checkAdmin(request);
        if (denied != null) {
            return denied;
        }
        String featureId = request.option("feature");
        Feature feature = featureRegistry.find(featureId).orElse(null);
        if (feature == null) {
            String toggleable = featureRegistry.toggleableFeatures().stream()
                    .map(f -> "`" + f.id() + "`")
                    .collect(Collectors.joining(", "));
            return Acknowledgment.ephemeral(messages.getMessage("command.toggle.unknown",
                    featureId != null ? featureId : "", toggleable));
        }
        if (!feature.isToggleable()) {
            return Acknowledgment.ephemeral(messages.getMessage("command.toggle.not_toggleable", feature.name()));
        }
        try {
            boolean enabled = featureRegistry.toggle(request.getIdentity().botId(), feature, request.getGuildId());
            return Acknowledgment.ephemeral(messages.getMessage("command.toggle.done", feature.name(),
                    enabled ? SettingKey.ENABLED : SettingKey.DISABLED));
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to toggle {} for guild {}: {}", feature.id(), request.getGuildId(),
                    e.getMessage());
            return Acknowledgment.ephemeral(messages.getMessage("reply.storage_unavailable"));
        }
    }

    private Acknowledgment checkFeature(InteractionRequest request, String featureId) {
        Identity identity = request.getIdentity();
        Feature feature = featureRegistry.find(featureId).orElseThrow();
        if (featureRegistry.isEnabled(identity.botId(), feature, identity.channelId(), request.getGuildId())) {
            return null;
        }
        return Acknowledgment.ephemeral(messages.getMessage("command.feature_disabled", feature.name()));
    }

    // ==================== IMAGES AND INTROSPECTION ====================

    private InteractionPlan imagine(InteractionRequest request) {
        Acknowledgment disabled = checkFeature(request, "image_generation");
        if (disabled != null) {
            return InteractionPlan.reply(CMD_IMAGINE, disabled);
        }
        String prompt = request.option("prompt");
        if (prompt == null || prompt.isBlank()) {
            return InteractionPlan.reply(CMD_IMAGINE,
                    Acknowledgment.ephemeral(messages.getMessage("command.imagine.missing")));
        }
        String sizeOption = request.option("size");
        ImageSize size = ImageSize.fromName(sizeOption).orElse(null);
        if (sizeOption != null && !sizeOption.isBlank() && size == null) {
            return InteractionPlan.reply(CMD_IMAGINE,
                    Acknowledgment.ephemeral(messages.getMessage("command.imagine.invalid_size", sizeOption)));
        }
        String styleOption = request.option("style");
        ImageStyle style = ImageStyle.fromName(styleOption).orElse(null);
        if (styleOption != null && !styleOption.isBlank() && style == null) {
            return InteractionPlan.reply(CMD_IMAGINE,
                    Acknowledgment.ephemeral(messages.getMessage("command.imagine.invalid_style", styleOption)));
        }
        return InteractionPlan.image(CMD_IMAGINE, new ImageRequest(prompt.trim(), size, style));
    }

    private InteractionPlan introspect(InteractionRequest request) {
        Acknowledgment denied = checkAdmin(request);
        if (denied != null) {
            return InteractionPlan.reply(CMD_INTROSPECT, denied);
        }
        String component = request.option("component");
        IntrospectionService.Snippet snippet = introspectionService.snippet(component).orElse(null);
        if (snippet == null) {
            return InteractionPlan.reply(CMD_INTROSPECT, Acknowledgment.ephemeral(messages.getMessage(
                    "command.introspect.unknown", component != null ? component : "",
                    String.join(", ", introspectionService.components()))));
        }
        return InteractionPlan.complete(CMD_INTROSPECT, Completion.task(
                messages.getMessage("prompt.introspect", snippet.code()),
                PromptModifier.EXPLAIN,
                messages.getMessage("prefix.introspect", snippet.title())));
    }

    // ==================== CONTEXT MENUS ====================

    private InteractionPlan routeContextMenu(InteractionRequest request) {
        String name = request.getName();
        String target = request.getText() != null ? request.getText() : "";
        if (MENU_ANALYZE_USER.equals(name)) {
            return InteractionPlan.complete(name, Completion.task(
                    messages.getMessage("prompt.analyze_user", target),
                    PromptModifier.EXPLAIN,
                    messages.getMessage("prefix.user_analysis")));
        }

        PromptModifier modifier;
        if (MENU_ANALYZE_MESSAGE.equals(name)) {
            modifier = PromptModifier.STEPS;
        } else if (MENU_EXPLAIN_MESSAGE.equals(name)) {
            modifier = PromptModifier.EXPLAIN;
        } else {
            return InteractionPlan.reply(name,
                    Acknowledgment.ephemeral(messages.getMessage("command.unknown", name)));
        }
        return InteractionPlan.complete(name, Completion.task(
                messages.getMessage("prompt.analyze_message", target),
                modifier,
                messages.getMessage("prefix.context_menu", name)));
    }

    // ==================== COMPONENTS ====================

    private InteractionPlan routeButton(InteractionRequest request) {
        String customId = request.getName() != null ? request.getName() : "";

        if (customId.startsWith(PERSONA_BUTTON_PREFIX)) {
            String persona = customId.substring(PERSONA_BUTTON_PREFIX.length());
            if (!personaService.exists(persona)) {
                return InteractionPlan.reply(customId,
                        Acknowledgment.message(messages.getMessage("component.persona.invalid")));
            }
            Identity identity = request.getIdentity();
            try {
                userPreferencesService.setPersona(identity.botId(), identity.userId(), persona);
            } catch (RuntimeException e) {
                log.warn("[Router] Failed to store persona for {}: {}", identity, e.getMessage());
                return InteractionPlan.reply(customId,
                        Acknowledgment.ephemeral(messages.getMessage("reply.storage_unavailable")));
            }
            return InteractionPlan.reply(customId,
                    Acknowledgment.update(messages.getMessage("component.persona.done", persona)));
        }
        if (customId.startsWith(CONFIRM_PREFIX)) {
            String action = customId.substring(CONFIRM_PREFIX.length());
            return InteractionPlan.reply(customId,
                    Acknowledgment.update(messages.getMessage("component.confirmed", action)));
        }
        if (customId.startsWith(CANCEL_PREFIX)) {
            return InteractionPlan.reply(customId,
                    Acknowledgment.update(messages.getMessage("component.cancelled")));
        }
        if (SHOW_HELP_MODAL.equals(customId)) {
            return InteractionPlan.reply(customId, Acknowledgment.modal(helpModal()));
        }
        if (SHOW_PROMPT_MODAL.equals(customId)) {
            return InteractionPlan.reply(customId, Acknowledgment.modal(promptModal()));
        }
        return InteractionPlan.reply(customId, Acknowledgment.message(messages.getMessage("component.unknown")));
    }

    private ModalForm helpModal() {
        return ModalForm.builder()
                .customId(HELP_MODAL)
                .title(messages.getMessage("modal.help.title"))
                .field(new ModalForm.Field(FIELD_HELP_TOPIC, messages.getMessage("modal.help.topic"), false, true,
                        messages.getMessage("modal.help.topic.placeholder")))
                .field(new ModalForm.Field(FIELD_HELP_DETAILS, messages.getMessage("modal.help.details"), true,
                        false, messages.getMessage("modal.help.details.placeholder")))
                .build();
    }

    private ModalForm promptModal() {
        return ModalForm.builder()
                .customId(PROMPT_MODAL)
                .title(messages.getMessage("modal.prompt.title"))
                .field(new ModalForm.Field(FIELD_PROMPT_TEXT, messages.getMessage("modal.prompt.text"), true, true,
                        messages.getMessage("modal.prompt.text.placeholder")))
                .build();
    }

    // ==================== MODALS ====================

    private InteractionPlan routeModal(InteractionRequest request) {
        String customId = request.getName() != null ? request.getName() : "";

        if (HELP_MODAL.equals(customId)) {
            String topic = valueOrEmpty(request.option(FIELD_HELP_TOPIC));
            String details = valueOrEmpty(request.option(FIELD_HELP_DETAILS));
            String message = details.isBlank() ? topic
                    : messages.getMessage("prompt.help_with_details", topic, details);
            return InteractionPlan.complete(customId, Completion.task(message, PromptModifier.EXPLAIN,
                    messages.getMessage("prefix.help")));
        }
        if (PROMPT_MODAL.equals(customId)) {
            String prompt = valueOrEmpty(request.option(FIELD_PROMPT_TEXT));
            if (prompt.isBlank()) {
                return InteractionPlan.reply(customId,
                        Acknowledgment.ephemeral(messages.getMessage("reply.missing_input", customId)));
            }
            return InteractionPlan.complete(customId, new Completion(
                    messages.getMessage("prompt.custom_instruction"), null, prompt,
                    messages.getMessage("prefix.custom_prompt"), false));
        }
        return InteractionPlan.reply(customId, Acknowledgment.message(messages.getMessage("modal.unknown")));
    }

    private static String valueOrEmpty(String value) {
        return value != null ? value : "";
    }
}
