package me.storeassist.bot.domain.model;

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

/**
 * Result of classifying an inbound message. {@code cue} is the keyword that
 * triggered a lookup, or null for chat messages.
 */
public record IntentClassification(MessageIntent intent, String cue) {

    public static IntentClassification lookup(String cue) {
        return new IntentClassification(MessageIntent.LOOKUP, cue);
    }

    public static IntentClassification chat() {
        return new IntentClassification(MessageIntent.CHAT, null);
    }

    public boolean isLookup() {
        return intent == MessageIntent.LOOKUP;
    }
}
