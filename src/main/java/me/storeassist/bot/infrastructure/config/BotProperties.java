package me.storeassist.bot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link CatalogProperties} - location of the static store dataset</li>
 * <li>{@link ResolverProperties} - store matching thresholds</li>
 * <li>{@link ConversationProperties} - per-user history bounds</li>
 * <li>{@link RoutingProperties} - lookup-intent cues and reply shaping</li>
 * <li>{@link LlmProperties} - LLM provider settings</li>
 * <li>{@link ChannelProperties} - input channels (Telegram)</li>
 * </ul>
 *
 * <p>
 * All values are read once at startup.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String language = "en";
    private CatalogProperties catalog = new CatalogProperties();
    private ResolverProperties resolver = new ResolverProperties();
    private ConversationProperties conversation = new ConversationProperties();
    private RoutingProperties routing = new RoutingProperties();
    private LlmProperties llm = new LlmProperties();
    private Map<String, ChannelProperties> channels = new HashMap<>();
    private DispatchProperties dispatch = new DispatchProperties();

    @Data
    public static class CatalogProperties {
        private String location = "classpath:stores.json";
    }

    // ==================== STORE RESOLUTION ====================

    @Data
    public static class ResolverProperties {
        /** Minimum similarity for a fuzzy match to be kept. */
        private double similarityThreshold = 0.75;

        /** Fuzzy stage runs only while fewer records than this have matched. */
        private int minMatches = 1;

        private int maxResults = 10;

        /** Longest word n-gram taken from a query as a candidate phrase. */
        private int maxPhraseWords = 4;

        /** Shorter query tokens never take part in fuzzy matching. */
        private int minFuzzyTokenLength = 3;
    }

    // ==================== CONVERSATION ====================

    @Data
    public static class ConversationProperties {
        private int maxHistory = 30;

        /** Number of most recent entries sent to the LLM with a new message. */
        private int contextWindow = 10;

        /**
         * If true, a user turn whose LLM call failed is still appended to history
         * (without an assistant turn).
         */
        private boolean retainFailedUserTurn = false;
    }

    // ==================== ROUTING ====================

    @Data
    public static class RoutingProperties {
        private List<String> lookupKeywords = new ArrayList<>(List.of(
                "where", "store", "stores", "shop", "shops", "find", "city",
                "address", "nearest",
                "где", "магазин", "магазины", "найди", "найти", "город", "адрес"));

        private int maxListedMatches = 5;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";

        private String systemPrompt = "You are a friendly assistant. Answer briefly and to the point.";

        /** Upper bound the router waits for an LLM answer before falling back. */
        private Duration replyTimeout = Duration.ofSeconds(8);

        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /** openai (or any OpenAI-compatible endpoint) or anthropic. */
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4.1-mini";
        private double temperature = 0.4;
        private int maxTokens = 250;
        private long timeoutMs = 20000;
    }

    // ==================== CHANNELS ====================

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
        private String token;
        private List<String> allowFrom = new ArrayList<>();
    }

    @Data
    public static class DispatchProperties {
        private int workerThreads = 4;
    }
}
