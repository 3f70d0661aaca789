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

import me.personabot.domain.exception.TransportException;
import me.personabot.domain.exception.UpstreamException;
import me.personabot.domain.model.Acknowledgment;
import me.personabot.domain.model.CancellationToken;
import me.personabot.domain.model.ConversationTurn;
import me.personabot.domain.model.GeneratedImage;
import me.personabot.domain.model.Identity;
import me.personabot.domain.model.ImageRequest;
import me.personabot.domain.model.InteractionKind;
import me.personabot.domain.model.InteractionOutcome;
import me.personabot.domain.model.InteractionRequest;
import me.personabot.domain.model.InteractionState;
import me.personabot.domain.model.LlmRequest;
import me.personabot.domain.model.LlmResponse;
import me.personabot.domain.model.RateLimitResult;
import me.personabot.domain.model.ReplyHandle;
import me.personabot.domain.model.SettingKey;
import me.personabot.domain.model.TurnRole;
import me.personabot.domain.model.UsageRecord;
import me.personabot.domain.orchestrator.InteractionPlan.Completion;
import me.personabot.domain.service.ConversationContextService;
import me.personabot.domain.service.PersonaService;
import me.personabot.domain.service.SettingsResolver;
import me.personabot.domain.service.UpstreamErrorClassifier;
import me.personabot.domain.service.UserPreferencesService;
import me.personabot.domain.text.ResponseSplitter;
import me.personabot.infrastructure.config.BotProperties;
import me.personabot.infrastructure.i18n.MessageService;
import me.personabot.port.inbound.InteractionPort;
import me.personabot.port.outbound.ImageGenerationPort;
import me.personabot.port.outbound.LlmPort;
import me.personabot.port.outbound.ReplyTransportPort;
import me.personabot.port.outbound.UsageStatsPort;
import me.personabot.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Drives every interaction from arrival to a terminal reply.
 *
 * <p>
 * Each event runs as one task on the interaction executor:
 * <ol>
 * <li>rate check against the per-user quota</li>
 * <li>settings and history lookup, bounded by the configuration budget</li>
 * <li>routing to a local reply, a language model completion or an image</li>
 * <li>acknowledgment before the platform deadline</li>
 * <li>completion under the completion deadline, then split delivery</li>
 * </ol>
 *
 * <p>
 * The placeholder acknowledgment is edited at most once and nothing is sent
 * after a terminal state. Every failure is converted into a single user-facing
 * reply when one can still be sent; nothing escapes the task.
 *
 * <p>
 * Channel messages that mention the bot are dropped without any reply when the
 * {@code mention_responses} setting is disabled for the channel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InteractionOrchestrator implements InteractionPort {

    private static final int MAX_SEND_ATTEMPTS = 2;

    private final RateLimiter rateLimiter;
    private final SettingsResolver settingsResolver;
    private final UserPreferencesService userPreferencesService;
    private final ConversationContextService conversationContext;
    private final PersonaService personaService;
    private final InteractionRouter router;
    private final LlmPort llmPort;
    private final ImageGenerationPort imagePort;
    private final ReplyTransportPort replyTransport;
    private final UsageStatsPort usageStats;
    private final MessageService messages;
    private final BotProperties properties;
    private final Clock clock;
    private final ExecutorService interactionExecutor;
    private final ExecutorService configurationExecutor;

    @Override
    public void onEvent(InteractionRequest request) {
        try {
            interactionExecutor.execute(() -> process(request));
        } catch (RejectedExecutionException e) {
            log.error("[Orchestrator] Interaction {} rejected: worker pool unavailable", request.getId(), e);
        }
    }

    /**
     * Run one interaction to completion on the calling thread.
     *
     * @return the finished interaction, or {@code null} if the event was
     *         ignored
     */
    DeferredInteraction process(InteractionRequest request) {
        if (!mentionResponsesEnabled(request)) {
            log.debug("[Orchestrator] Mention responses disabled in channel {}, ignoring message {}",
                    request.getIdentity().channelId(), request.getId());
            return null;
        }
        BotProperties.InteractionProperties config = properties.getInteraction();
        DeferredInteraction interaction = new DeferredInteraction(request, config.getAckDeadline(),
                config.getCompletionDeadline());
        Instant started = clock.instant();
        try {
            run(interaction);
        } catch (TransportException e) {
            log.error("[Orchestrator] Reply transport failed for interaction {} (status={}): {}",
                    request.getId(), e.getStatus(), e.getMessage());
            markFailed(interaction, InteractionOutcome.TRANSPORT_ERROR);
        } catch (Exception e) { // NOSONAR - must not kill executor thread
            log.error("[Orchestrator] Interaction {} failed in state {}", request.getId(),
                    interaction.getState(), e);
            sendFailureNotice(interaction);
            markFailed(interaction, InteractionOutcome.INTERNAL_ERROR);
        } finally {
            recordUsage(interaction, started);
        }
        return interaction;
    }

    private boolean mentionResponsesEnabled(InteractionRequest request) {
        if (request.getKind() != InteractionKind.MESSAGE || request.isDirectMessage()) {
            return true;
        }
        Identity identity = request.getIdentity();
        return !SettingKey.DISABLED.equals(settingsResolver.resolveOrDefault(identity.botId(),
                SettingKey.MENTION_RESPONSES, identity.channelId(), request.getGuildId()));
    }

    private void run(DeferredInteraction interaction) {
        InteractionRequest request = interaction.getRequest();
        Identity identity = request.getIdentity();

        RateLimitResult rate = rateLimiter.check(identity.botId(), identity.userId());
        if (!rate.isAllowed()) {
            long seconds = Math.max(1, (rate.getRetryAfter().toMillis() + 999) / 1000);
            log.info("[Orchestrator] Rate limited: bot={}, user={}, retryAfter={}s",
                    identity.botId(), identity.userId(), seconds);
            interaction.setLabel("rate_limited");
            acknowledge(interaction, Acknowledgment.ephemeral(messages.getMessage("reply.rate_limited", seconds)));
            interaction.transition(InteractionState.DELIVERED);
            interaction.setOutcome(InteractionOutcome.RATE_LIMITED);
            return;
        }
        interaction.transition(InteractionState.RATE_CHECKED);

        InteractionContext context = configure(request);
        interaction.setPersona(context.persona());
        interaction.transition(InteractionState.CONFIGURED);

        InteractionPlan plan = router.route(request, context);
        interaction.setLabel(plan.getLabel());

        if (plan.isLocal()) {
            acknowledge(interaction, plan.getLocalReply());
            interaction.transition(InteractionState.ACKNOWLEDGED);
            interaction.transition(InteractionState.DELIVERED);
            interaction.setOutcome(InteractionOutcome.DELIVERED);
            log.debug("[Orchestrator] Answered {} locally: {}", request.getId(), plan.getLabel());
            return;
        }

        Acknowledgment placeholder = request.getKind() == InteractionKind.MESSAGE
                ? Acknowledgment.deferred(messages.getMessage("reply.processing"))
                : Acknowledgment.deferred();
        acknowledge(interaction, placeholder);
        interaction.transition(InteractionState.ACKNOWLEDGED);

        if (plan.isImage()) {
            generateImage(interaction, plan.getImage());
        } else {
            complete(interaction, context, plan.getCompletion());
        }
    }

    // ==================== CONFIGURATION ====================

    private InteractionContext configure(InteractionRequest request) {
        Duration budget = properties.getInteraction().getConfigBudget();
        CompletableFuture<InteractionContext> lookup = CompletableFuture.supplyAsync(() -> loadContext(request),
                configurationExecutor);
        try {
            return lookup.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            log.warn("[Orchestrator] Configuration lookup exceeded {}ms for interaction {}, using defaults",
                    budget.toMillis(), request.getId());
        } catch (ExecutionException e) {
            log.warn("[Orchestrator] Configuration lookup failed for interaction {}, using defaults: {}",
                    request.getId(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during configuration lookup", e);
        }
        return InteractionContext.defaults(
                settingsResolver.systemDefault(SettingKey.PERSONA),
                settingsResolver.systemDefault(SettingKey.VERBOSITY),
                InteractionContext.parseMaxContext(settingsResolver.systemDefault(SettingKey.MAX_CONTEXT_MESSAGES)));
    }

    private InteractionContext loadContext(InteractionRequest request) {
        Identity identity = request.getIdentity();
        String botId = identity.botId();
        String channelId = identity.channelId();
        String guildId = request.getGuildId();

        String persona = userPreferencesService.getPersona(botId, identity.userId())
                .filter(personaService::exists)
                .orElseGet(() -> settingsResolver.resolveOrDefault(botId, SettingKey.PERSONA, channelId, guildId));
        String verbosity = settingsResolver.resolveOrDefault(botId, SettingKey.VERBOSITY, channelId, guildId);
        int maxContext = InteractionContext.parseMaxContext(
                settingsResolver.resolveOrDefault(botId, SettingKey.MAX_CONTEXT_MESSAGES, channelId, guildId));

        List<ConversationTurn> history;
        boolean degraded = false;
        try {
            history = conversationContext.window(identity, maxContext);
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] History unavailable for {}: {}", identity, e.getMessage());
            history = List.of();
            degraded = true;
        }
        return new InteractionContext(persona, verbosity, maxContext, history, degraded);
    }

    // ==================== COMPLETION ====================

    private void complete(DeferredInteraction interaction, InteractionContext context, Completion completion) {
        interaction.transition(InteractionState.COMPLETING);
        Identity identity = interaction.getRequest().getIdentity();

        if (completion.conversational()) {
            appendTurn(identity, TurnRole.USER, completion.userMessage());
        }

        String systemPrompt = completion.systemPrompt() != null
                ? completion.systemPrompt()
                : personaService.buildSystemPrompt(context.persona(), completion.modifier(), context.verbosity());
        LlmRequest llmRequest = LlmRequest.builder()
                .systemPrompt(systemPrompt)
                .history(completion.conversational() ? context.history() : List.of())
                .userMessage(completion.userMessage())
                .build();

        CancellationToken token = new CancellationToken();
        interaction.setCancellationToken(token);
        LlmResponse response = await(interaction, token, llmPort.complete(llmRequest, token));
        if (interaction.getState().isTerminal()) {
            return;
        }
        deliver(interaction, completion, response);
    }

    private void generateImage(DeferredInteraction interaction, ImageRequest request) {
        interaction.transition(InteractionState.COMPLETING);
        CancellationToken token = new CancellationToken();
        interaction.setCancellationToken(token);
        GeneratedImage image = await(interaction, token, imagePort.generate(request, token));
        if (interaction.getState().isTerminal()) {
            return;
        }

        String revised = image.revisedPrompt();
        String content = revised != null && !revised.isBlank() && !revised.equals(request.prompt())
                ? messages.getMessage("reply.image_revised", request.prompt(), revised, image.url())
                : messages.getMessage("reply.image", request.prompt(), image.url());
        int chunks = sendChunks(interaction, content);
        interaction.transition(InteractionState.DELIVERED);
        interaction.setOutcome(InteractionOutcome.DELIVERED);
        log.debug("[Orchestrator] Delivered image for interaction {} in {} chunk(s)",
                interaction.getRequest().getId(), chunks);
    }

    /**
     * Wait for upstream work within the completion deadline. On timeout or
     * failure the interaction is moved to its terminal state and {@code null}
     * is returned.
     */
    private <T> T await(DeferredInteraction interaction, CancellationToken token, CompletableFuture<T> future) {
        Duration remaining = interaction.remainingCompletion(clock.instant());
        try {
            return future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            expire(interaction, token, future);
        } catch (ExecutionException e) {
            onUpstreamFailure(interaction, UpstreamErrorClassifier.classify(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            future.cancel(true);
            throw new IllegalStateException("Interrupted while awaiting completion", e);
        }
        return null;
    }

    private void expire(DeferredInteraction interaction, CancellationToken token, CompletableFuture<?> future) {
        token.cancel();
        future.cancel(true);
        log.warn("[Orchestrator] Completion deadline exceeded for interaction {}, late results are discarded",
                interaction.getRequest().getId());
        editAcknowledgment(interaction, messages.getMessage("reply.timeout"));
        interaction.transition(InteractionState.EXPIRED);
        interaction.setOutcome(InteractionOutcome.EXPIRED);
    }

    private void onUpstreamFailure(DeferredInteraction interaction, UpstreamException failure) {
        String requestId = interaction.getRequest().getId();
        if (failure.getFailure() == UpstreamException.Failure.TIMEOUT) {
            log.warn("[Orchestrator] Upstream timed out for interaction {}: {}", requestId, failure.getMessage());
            editAcknowledgment(interaction, messages.getMessage("reply.timeout"));
            interaction.transition(InteractionState.EXPIRED);
            interaction.setOutcome(InteractionOutcome.EXPIRED);
            return;
        }

        String messageKey = switch (failure.getFailure()) {
        case AUTH, QUOTA -> "reply.upstream_auth";
        case INVALID_INPUT -> "reply.invalid_input";
        default -> "reply.upstream_unavailable";
        };
        if (failure.getFailure() == UpstreamException.Failure.AUTH) {
            log.error("[Orchestrator] Upstream rejected credentials for interaction {}: {} ({})",
                    requestId, failure.getMessage(), failure.getCode());
        } else {
            log.warn("[Orchestrator] Upstream failure {} for interaction {}: {} ({})",
                    failure.getFailure(), requestId, failure.getMessage(), failure.getCode());
        }
        editAcknowledgment(interaction, messages.getMessage(messageKey));
        interaction.transition(InteractionState.FAILED);
        interaction.setOutcome(InteractionOutcome.UPSTREAM_ERROR);
    }

    private void deliver(DeferredInteraction interaction, Completion completion, LlmResponse response) {
        String content = response != null ? response.getContent() : null;
        if (content == null || content.isBlank()) {
            log.warn("[Orchestrator] Empty completion for interaction {}", interaction.getRequest().getId());
            content = messages.getMessage("reply.empty");
        }

        int chunks = sendChunks(interaction, completion.replyPrefix() + content);
        interaction.transition(InteractionState.DELIVERED);
        interaction.setOutcome(InteractionOutcome.DELIVERED);
        log.debug("[Orchestrator] Delivered interaction {} in {} chunk(s)", interaction.getRequest().getId(),
                chunks);

        if (completion.conversational()) {
            appendTurn(interaction.getRequest().getIdentity(), TurnRole.ASSISTANT, content);
        }
    }

    /**
     * Edit the placeholder with the first chunk and send the rest as
     * followups.
     *
     * @return number of messages sent
     */
    private int sendChunks(DeferredInteraction interaction, String text) {
        List<String> chunks = mergeBlankChunks(
                ResponseSplitter.segment(text, properties.getInteraction().getMaxChunkSize()));
        if (chunks.isEmpty()) {
            chunks = List.of(messages.getMessage("reply.empty"));
        }
        editAcknowledgment(interaction, chunks.get(0));
        for (String chunk : chunks.subList(1, chunks.size())) {
            sendFollowup(interaction, chunk);
        }
        return chunks.size();
    }

    /**
     * Attach whitespace-only chunks to the preceding chunk, or to the
     * following one at the start, so no message is blank and the chunks still
     * join to the original text. Empty if the text has no visible content.
     */
    static List<String> mergeBlankChunks(List<String> chunks) {
        List<String> merged = new ArrayList<>();
        StringBuilder leading = new StringBuilder();
        for (String chunk : chunks) {
            if (!chunk.isBlank()) {
                merged.add(leading + chunk);
                leading.setLength(0);
            } else if (merged.isEmpty()) {
                leading.append(chunk);
            } else {
                int last = merged.size() - 1;
                merged.set(last, merged.get(last) + chunk);
            }
        }
        return merged;
    }

    private void appendTurn(Identity identity, TurnRole role, String content) {
        try {
            conversationContext.append(identity, role, content);
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Failed to record {} turn for {}: {}", role, identity,
                    e.getMessage());
        }
    }

    // ==================== SENDING ====================

    private void acknowledge(DeferredInteraction interaction, Acknowledgment acknowledgment) {
        InteractionRequest request = interaction.getRequest();
        interaction.checkSendAllowed("acknowledge");
        Instant now = clock.instant();
        if (now.isAfter(interaction.getAckDeadline())) {
            log.warn("[Orchestrator] Acknowledgment deadline missed for interaction {} by {}ms",
                    request.getId(), Duration.between(interaction.getAckDeadline(), now).toMillis());
        }
        ReplyHandle handle = send("acknowledge", () -> replyTransport.acknowledge(request, acknowledgment));
        interaction.acknowledged(handle != null ? handle : ReplyHandle.forInteraction(request), clock.instant());
    }

    private void editAcknowledgment(DeferredInteraction interaction, String content) {
        interaction.checkSendAllowed("edit");
        interaction.claimAcknowledgmentEdit();
        send("edit", () -> replyTransport.editAcknowledgment(interaction.getHandle(), content));
    }

    private void sendFollowup(DeferredInteraction interaction, String content) {
        interaction.checkSendAllowed("followup");
        send("followup", () -> replyTransport.sendFollowup(interaction.getHandle(), content));
    }

    private <T> T send(String operation, Supplier<CompletableFuture<T>> call) {
        long timeoutMillis = properties.getInteraction().getSendTimeout().toMillis();
        TransportException last = null;
        for (int attempt = 1; attempt <= MAX_SEND_ATTEMPTS; attempt++) {
            try {
                return call.get().get(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                last = new TransportException(operation + " timed out after " + timeoutMillis + "ms", e);
            } catch (ExecutionException e) {
                last = asTransportException(operation, e.getCause());
            } catch (TransportException e) {
                last = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(operation + " interrupted", e);
            }

            if (!last.isRetryable()) {
                throw last;
            }
            if (attempt < MAX_SEND_ATTEMPTS) {
                log.warn("[Orchestrator] Retrying {} after transient failure: {}", operation, last.getMessage());
            }
        }
        throw last;
    }

    private static TransportException asTransportException(String operation, Throwable cause) {
        if (cause instanceof TransportException transport) {
            return transport;
        }
        return new TransportException(operation + " failed", cause);
    }

    // ==================== FAILURE HANDLING ====================

    private void sendFailureNotice(DeferredInteraction interaction) {
        if (interaction.getState().isTerminal()) {
            return;
        }
        String notice = messages.getMessage("reply.internal_error");
        try {
            if (!interaction.isAcknowledged()) {
                acknowledge(interaction, Acknowledgment.ephemeral(notice));
            } else if (!interaction.isAcknowledgmentEdited()) {
                editAcknowledgment(interaction, notice);
            } else {
                sendFollowup(interaction, notice);
            }
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Could not deliver failure notice for interaction {}: {}",
                    interaction.getRequest().getId(), e.getMessage());
        }
    }

    private void markFailed(DeferredInteraction interaction, InteractionOutcome outcome) {
        if (!interaction.getState().isTerminal()) {
            interaction.transition(InteractionState.FAILED);
            interaction.setOutcome(outcome);
        } else if (interaction.getOutcome() == null) {
            interaction.setOutcome(outcome);
        }
    }

    private void recordUsage(DeferredInteraction interaction, Instant started) {
        InteractionRequest request = interaction.getRequest();
        Identity identity = request.getIdentity();
        Instant finished = clock.instant();
        try {
            usageStats.record(UsageRecord.builder()
                    .botId(identity.botId())
                    .userId(identity.userId())
                    .channelId(identity.channelId())
                    .kind(request.getKind())
                    .command(interaction.getLabel())
                    .persona(interaction.getPersona())
                    .outcome(interaction.getOutcome() != null ? interaction.getOutcome()
                            : InteractionOutcome.INTERNAL_ERROR)
                    .latency(Duration.between(started, finished))
                    .timestamp(finished)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Failed to record usage for interaction {}: {}", request.getId(),
                    e.getMessage());
        }
    }
}
