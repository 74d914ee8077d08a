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

import me.storeassist.bot.port.outbound.LlmPort;

/**
 * Marker interface for concrete LLM provider adapters. All implementations are
 * collected by {@link LlmAdapterFactory}, which selects the active one from
 * {@code bot.llm.provider}.
 */
public interface LlmProviderAdapter extends LlmPort {

    /**
     * Prepares the underlying client. Called once by the factory; must not throw
     * for a missing configuration.
     */
    void initialize();
}
