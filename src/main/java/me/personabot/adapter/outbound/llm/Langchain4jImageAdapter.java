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
import me.personabot.domain.model.GeneratedImage;
import me.personabot.domain.model.ImageRequest;
import me.personabot.domain.model.ImageSize;
import me.personabot.domain.model.ImageStyle;
import me.personabot.domain.service.UpstreamErrorClassifier;
import me.personabot.infrastructure.config.BotProperties;
import me.personabot.port.outbound.ImageGenerationPort;
import dev.langchain4j.data.image.Image;
import dev.langchain4j.model.image.ImageModel;
import dev.langchain4j.model.openai.OpenAiImageModel;
import dev.langchain4j.model.output.Response;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Image generation through the langchain4j OpenAI image model.
 *
 * <p>
 * Size and style are fixed per model instance, so one instance is built and
 * kept per combination. Calls run on a dedicated pool with the same
 * cancellation and failure classification as {@link Langchain4jAdapter}.
 */
@Component
@Slf4j
public class Langchain4jImageAdapter implements ImageGenerationPort {

    private static final String NOT_CONFIGURED = "image.not_configured";

    private final BotProperties properties;
    private final ExecutorService executor;
    private final Map<String, ImageModel> models = new ConcurrentHashMap<>();

    public Langchain4jImageAdapter(BotProperties properties) {
        this.properties = properties;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getImage().getThreads()), r -> {
            Thread t = new Thread(r, "image-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getImage().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<GeneratedImage> generate(ImageRequest request, CancellationToken token) {
        CompletableFuture<GeneratedImage> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> run(request, token, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new UpstreamException(UpstreamException.Failure.UNAVAILABLE,
                    UpstreamErrorClassifier.UNKNOWN, "Image pool unavailable", e));
            return result;
        }
        token.onCancel(() -> {
            task.cancel(true);
            result.cancel(false);
        });
        return result;
    }

    private void run(ImageRequest request, CancellationToken token, CompletableFuture<GeneratedImage> result) {
        if (token.isCancelled()) {
            return;
        }
        try {
            GeneratedImage image = call(request);
            if (!result.complete(image)) {
                log.info("[Image] Discarding late result for prompt of {} chars", request.prompt().length());
            }
        } catch (Exception e) { // NOSONAR - every failure is reported through the future
            UpstreamException failure = UpstreamErrorClassifier.classify(e);
            if (!result.completeExceptionally(failure)) {
                log.debug("[Image] Ignoring failure after cancellation: {}", failure.getMessage());
            }
        }
    }

    private GeneratedImage call(ImageRequest request) {
        if (!isAvailable()) {
            throw new UpstreamException(UpstreamException.Failure.AUTH, NOT_CONFIGURED,
                    "Image api key is not configured (bot.image.api-key)", null);
        }
        ImageModel model = models.computeIfAbsent(request.size().getId() + "/" + request.style().getId(),
                key -> createModel(request.size(), request.style()));
        Response<Image> response = model.generate(request.prompt());
        Image image = response != null ? response.content() : null;
        if (image == null || image.url() == null) {
            throw new UpstreamException(UpstreamException.Failure.UNAVAILABLE, UpstreamErrorClassifier.UNKNOWN,
                    "Image model returned no image", null);
        }
        log.debug("[Image] Generated {} {} image", request.size().getId(), request.style().getId());
        return new GeneratedImage(image.url().toString(), image.revisedPrompt());
    }

    protected ImageModel createModel(ImageSize size, ImageStyle style) {
        BotProperties.ImageProperties config = properties.getImage();
        var builder = OpenAiImageModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .size(size.getDimensions())
                .style(style.getId())
                .responseFormat("url")
                .maxRetries(0)
                .timeout(config.getTimeout());
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        log.info("[Image] Model initialized: model={}, size={}, style={}", config.getModel(), size.getDimensions(),
                style.getId());
        return builder.build();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
