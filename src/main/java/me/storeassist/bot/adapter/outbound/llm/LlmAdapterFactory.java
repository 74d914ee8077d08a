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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.storeassist.bot.domain.model.LlmRequest;
import me.storeassist.bot.domain.model.LlmResponse;
import me.storeassist.bot.infrastructure.config.BotProperties;
import me.storeassist.bot.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for selecting LLM adapters based on configuration.
 *
 * <p>
 * Selects the active adapter from {@code bot.llm.provider}:
 * <ul>
 * <li>langchain4j - OpenAI, Anthropic via langchain4j library
 * <li>none - No-op adapter
 * </ul>
 *
 * <p>
 * If the configured provider is unknown the factory falls back to the no-op
 * adapter. The factory itself is the primary {@link LlmPort} bean and
 * delegates every call to the active adapter.
 *
 * @see Langchain4jAdapter
 * @see NoOpLlmAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final BotProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        activeAdapter = adaptersByProvider.get(provider);

        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("Provider '{}' not found, using: {}",
                    provider, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            log.info("Active LLM provider: {}", provider);
        }

        if (activeAdapter != null) {
            activeAdapter.initialize();
        }
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM adapter registered"));
        }
        return activeAdapter.chat(request);
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
