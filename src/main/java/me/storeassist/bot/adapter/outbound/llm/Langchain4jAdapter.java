package me.storeassist.bot.adapter.outbound.llm;

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
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.storeassist.bot.domain.model.ConversationEntry;
import me.storeassist.bot.domain.model.LlmRequest;
import me.storeassist.bot.domain.model.LlmResponse;
import me.storeassist.bot.domain.model.LlmUsage;
import me.storeassist.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible endpoint ({@code base-url})
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * The conversation history is replayed as user/assistant messages after the
 * system prompt, followed by the new user message. Retries are disabled in the
 * client: the router bounds the wait and falls back on its own.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * <p>
 * Configuration via {@code bot.llm.langchain4j.*}.
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final String PROVIDER_ANTHROPIC = "anthropic";

    private final BotProperties properties;

    private ChatModel chatModel;
    private String currentModel;
    private volatile boolean initialized = false;

    /**
     * Package-private setter for testing - allows injecting a mock ChatModel.
     */
    void setChatModel(ChatModel model, String modelName) {
        this.chatModel = model;
        this.currentModel = modelName;
        this.initialized = true;
    }

    @Override
    public synchronized void initialize() {
        if (initialized)
            return;

        BotProperties.Langchain4jProperties config = properties.getLlm().getLangchain4j();
        this.currentModel = config.getModel();

        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("Langchain4j adapter has no API key configured (bot.llm.langchain4j.api-key)");
            return;
        }

        try {
            this.chatModel = createModel(config);
            initialized = true;
            log.info("Langchain4j adapter initialized with provider: {}, model: {}", config.getProvider(),
                    config.getModel());
        } catch (Exception e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private ChatModel createModel(BotProperties.Langchain4jProperties config) {
        Duration timeout = Duration.ofMillis(config.getTimeoutMs());

        if (PROVIDER_ANTHROPIC.equals(config.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .temperature(config.getTemperature())
                    .maxTokens(config.getMaxTokens())
                    .maxRetries(0)
                    .timeout(timeout);
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        // All non-Anthropic providers use OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens())
                .maxRetries(0)
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

            List<ChatMessage> messages = convertMessages(request);
            log.trace("[LLM] Sending {} messages to {} for user {}", messages.size(), currentModel,
                    request.getUserId());
            try {
                return convertResponse(chatModel.chat(messages));
            } catch (RuntimeException e) {
                if (isRateLimitError(e)) {
                    log.warn("[LLM] Rate limit hit: {}", e.getMessage());
                } else {
                    log.error("LLM chat failed", e);
                }
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
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

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        if (request.getHistory() != null) {
            for (ConversationEntry entry : request.getHistory()) {
                if (entry.text() == null || entry.text().isBlank()) {
                    continue;
                }
                switch (entry.role()) {
                case USER -> messages.add(UserMessage.from(entry.text()));
                case ASSISTANT -> messages.add(AiMessage.from(entry.text()));
                default -> log.warn("Unknown conversation role: {}, skipping", entry.role());
                }
            }
        }

        if (request.getUserMessage() != null && !request.getUserMessage().isBlank()) {
            messages.add(UserMessage.from(request.getUserMessage()));
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(orZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(orZero(response.tokenUsage().outputTokenCount()))
                    .totalTokens(orZero(response.tokenUsage().totalTokenCount()))
                    .build();
        }

        String text = aiMessage != null && aiMessage.text() != null ? aiMessage.text().strip() : null;
        return LlmResponse.builder()
                .content(text)
                .usage(usage)
                .model(currentModel)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    @Override
    public String getCurrentModel() {
        return currentModel;
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getLangchain4j().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }
}
