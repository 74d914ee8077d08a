package me.storeassist.bot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Store Assistant Bot.
 *
 * <p>
 * A Telegram assistant that answers "where is the store" questions from a
 * static catalog and carries ordinary conversation through an LLM, remembering
 * a bounded history per user.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → TelegramAdapter, CommandRouter, InboundMessageListener
 * Domain Layer       → MessageRouter, StoreResolver, ConversationContextService
 * Infrastructure     → StoreCatalogLoader, LLM adapters (langchain4j)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BotApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotApplication.class, args);
    }

}
