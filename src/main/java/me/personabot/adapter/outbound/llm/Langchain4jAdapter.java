package me.personabot.adapter.outbound.llm;

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

import me.personabot.domain.exception.UpstreamException;
import me.personabot.domain.model.CancellationToken;
import me.personabot.domain.model.ConversationTurn;
import me.personabot.domain.model.LlmRequest;
import me.personabot.domain.model.LlmResponse;
import me.personabot.domain.model.TurnRole;
import me.personabot.domain.service.UpstreamErrorClassifier;
import me.personabot.infrastructure.config.BotProperties;
import me.personabot.port.outbound.LlmPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Language model adapter using the langchain4j library.
 *
 * <p>
 * Supports OpenAI (and OpenAI-compatible endpoints via
 * {@code bot.llm.base-url}) and Anthropic, selected by
 * {@code bot.llm.provider}. Calls run on a dedicated pool; cancelling the
 * {@link CancellationToken} interrupts the running call and fails the returned
 * future. A result arriving after cancellation is discarded.
 *
 * <p>
 * Failures are classified into {@link UpstreamException}. No retry is
 * attempted here; the caller decides what the user sees.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String NOT_CONFIGURED = "llm.not_configured";

    private final BotProperties properties;
    private final ExecutorService executor;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public Langchain4jAdapter(BotProperties properties) {
        this.properties = properties;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getLlm().getThreads()), r -> {
            Thread t = new Thread(r, "llm-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<LlmResponse> complete(LlmRequest request, CancellationToken token) {
        CompletableFuture<LlmResponse> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> run(request, token, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new UpstreamException(UpstreamException.Failure.UNAVAILABLE,
                    UpstreamErrorClassifier.UNKNOWN, "LLM pool unavailable", e));
            return result;
        }
        token.onCancel(() -> {
            task.cancel(true);
            result.cancel(false);
        });
        return result;
    }

    private void run(LlmRequest request, CancellationToken token, CompletableFuture<LlmResponse> result) {
        if (token.isCancelled()) {
            return;
        }
        try {
            LlmResponse response = call(request);
            if (!result.complete(response)) {
                log.info("[LLM] Discarding late result ({} chars)",
                        response.getContent() != null ? response.getContent().length() : 0);
            }
        } catch (Exception e) { // NOSONAR - every failure is reported through the future
            UpstreamException failure = UpstreamErrorClassifier.classify(e);
            if (!result.completeExceptionally(failure)) {
                log.debug("[LLM] Ignoring failure after cancellation: {}", failure.getMessage());
            }
        }
    }

    private LlmResponse call(LlmRequest request) {
        ChatModel model = getChatModel();
        ChatResponse response = model.chat(convertMessages(request));
        return convertResponse(response);
    }

    private synchronized ChatModel getChatModel() {
        if (!initialized) {
            if (!isAvailable()) {
                throw new UpstreamException(UpstreamException.Failure.AUTH, NOT_CONFIGURED,
                        "LLM api key is not configured (bot.llm.api-key)", null);
            }
            chatModel = createModel();
            initialized = true;
            log.info("[LLM] Langchain4j adapter initialized: provider={}, model={}",
                    properties.getLlm().getProvider(), properties.getLlm().getModel());
        }
        return chatModel;
    }

    /**
     * Create a model instance based on configuration.
     */
    protected ChatModel createModel() {
        BotProperties.LlmProperties config = properties.getLlm();
        if (PROVIDER_ANTHROPIC.equalsIgnoreCase(config.getProvider())) {
            return createAnthropicModel(config);
        }
        // All non-Anthropic providers use OpenAI-compatible API
        return createOpenAiModel(config);
    }

    private ChatModel createAnthropicModel(BotProperties.LlmProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .timeout(config.getTimeout());

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(BotProperties.LlmProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .timeout(config.getTimeout());

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        if (request.getHistory() != null) {
            for (ConversationTurn turn : request.getHistory()) {
                if (turn.getContent() == null || turn.getContent().isBlank()) {
                    continue;
                }
                if (turn.getRole() == TurnRole.ASSISTANT) {
                    messages.add(AiMessage.from(turn.getContent()));
                } else {
                    messages.add(UserMessage.from(turn.getContent()));
                }
            }
        }
        messages.add(UserMessage.from(request.getUserMessage()));
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        LlmResponse.LlmResponseBuilder builder = LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(properties.getLlm().getModel());
        if (response.tokenUsage() != null) {
            builder.inputTokens(valueOrZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(valueOrZero(response.tokenUsage().outputTokenCount()));
        }
        return builder.build();
    }

    private static int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
