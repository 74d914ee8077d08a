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

import lombok.extern.slf4j.Slf4j;
import me.storeassist.bot.domain.model.LlmRequest;
import me.storeassist.bot.domain.model.LlmResponse;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no LLM provider is configured.
 *
 * <p>
 * Never calls any external API. Every chat request completes exceptionally,
 * so callers treat it as an unavailable LLM and answer with their own
 * fallback text.
 *
 * <p>
 * Provider ID: {@code "none"}
 *
 * @see LlmProviderAdapter
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public void initialize() {
        // No-op, nothing to connect to
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.failedFuture(new IllegalStateException("No LLM provider configured"));
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
