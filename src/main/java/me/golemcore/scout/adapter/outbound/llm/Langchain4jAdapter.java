package me.golemcore.scout.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.domain.model.LlmRequest;
import me.golemcore.scout.domain.model.LlmResponse;
import me.golemcore.scout.domain.model.LlmUsage;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports two vendors, chosen by {@code scout.llm.langchain4j.vendor}:
 * <ul>
 * <li>openai - OpenAI or any OpenAI-compatible endpoint
 * ({@code base-url})
 * <li>anthropic - Claude models
 * </ul>
 *
 * <p>
 * Rate-limited calls are retried with exponential backoff. Any other failure
 * completes the future exceptionally and the calling stage falls back to its
 * deterministic variant.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final int MAX_RETRIES = 2;
    private static final long INITIAL_BACKOFF_MS = 1_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String VENDOR_ANTHROPIC = "anthropic";

    private final ScoutProperties properties;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    private synchronized void initialize() {
        if (initialized) {
            return;
        }
        ScoutProperties.Langchain4jProperties config = properties.getLlm().getLangchain4j();
        try {
            this.chatModel = createModel(config.getModel(), config);
            initialized = true;
            log.info("Langchain4j adapter initialized with vendor: {}, model: {}", config.getVendor(),
                    config.getModel());
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private ChatModel createModel(String modelName, ScoutProperties.Langchain4jProperties config) {
        Duration timeout = properties.getLlm().getTimeout();
        if (VENDOR_ANTHROPIC.equalsIgnoreCase(config.getVendor())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(config.getMaxTokens())
                    .temperature(config.getTemperature())
                    .timeout(timeout);
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey() != null ? config.getApiKey() : "")
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(config.getMaxTokens())
                .temperature(config.getTemperature())
                .timeout(timeout);
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j adapter not available");
            }

            ChatModel modelToUse = modelForRequest(request);
            List<ChatMessage> messages = convertMessages(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    return convertResponse(modelToUse.chat(messages), modelName(request));
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleepBeforeRetry(backoffMs);
                    } else {
                        log.warn("[LLM] Chat failed: {}", e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    private ChatModel modelForRequest(LlmRequest request) {
        ScoutProperties.Langchain4jProperties config = properties.getLlm().getLangchain4j();
        String requestModel = request.getModel();
        if (requestModel != null && !requestModel.equals(config.getModel())) {
            log.trace("Creating one-off model for request: {}", requestModel);
            return createModel(requestModel, config);
        }
        return chatModel;
    }

    private String modelName(LlmRequest request) {
        return request.getModel() != null ? request.getModel() : getCurrentModel();
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getLangchain4j().getModel();
    }

    @Override
    public boolean isAvailable() {
        ScoutProperties.Langchain4jProperties config = properties.getLlm().getLangchain4j();
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            return true;
        }
        // Self-hosted OpenAI-compatible endpoints often run without a key
        return !VENDOR_ANTHROPIC.equalsIgnoreCase(config.getVendor())
                && config.getBaseUrl() != null && !config.getBaseUrl().isBlank();
    }

    static List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        messages.add(UserMessage.from(request.getUserPrompt() != null ? request.getUserPrompt() : ""));
        return messages;
    }

    private static LlmResponse convertResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(count(response.tokenUsage().inputTokenCount()))
                    .outputTokens(count(response.tokenUsage().outputTokenCount()))
                    .totalTokens(count(response.tokenUsage().totalTokenCount()))
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .usage(usage)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private static int count(Integer tokens) {
        return tokens != null ? tokens : 0;
    }
}
