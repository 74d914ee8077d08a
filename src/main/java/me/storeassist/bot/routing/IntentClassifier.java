package me.storeassist.bot.routing;

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
import me.storeassist.bot.domain.model.IntentClassification;
import me.storeassist.bot.infrastructure.config.BotProperties;
import me.storeassist.bot.matching.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a message is a store lookup or open conversation.
 *
 * <p>
 * A message is a lookup iff its normalized text contains one of
 * {@code bot.routing.lookup-keywords} as a whole word or phrase. Keywords are
 * normalized once at construction, so "Магазин" and "магазин" are the same
 * cue.
 */
@Component
@Slf4j
public class IntentClassifier {

    private final TextNormalizer normalizer;
    private final List<String> keywords;

    public IntentClassifier(BotProperties properties, TextNormalizer normalizer) {
        this.normalizer = normalizer;

        Set<String> normalized = new LinkedHashSet<>();
        for (String keyword : properties.getRouting().getLookupKeywords()) {
            String value = normalizer.normalize(keyword);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        this.keywords = List.copyOf(normalized);
        log.debug("[Router] Lookup cues: {}", keywords);
    }

    public IntentClassification classify(String text) {
        String padded = " " + normalizer.normalize(text) + " ";
        for (String keyword : keywords) {
            if (padded.contains(" " + keyword + " ")) {
                return IntentClassification.lookup(keyword);
            }
        }
        return IntentClassification.chat();
    }
}
