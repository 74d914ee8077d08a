package me.storeassist.bot.matching;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.storeassist.bot.catalog.StoreCatalog;
import me.storeassist.bot.catalog.StoreCatalog.IndexedRecord;
import me.storeassist.bot.domain.model.MatchKind;
import me.storeassist.bot.domain.model.MatchResult;
import me.storeassist.bot.domain.model.StoreRecord;
import me.storeassist.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Matches free-text queries against the store catalog.
 *
 * <p>
 * Three-stage matching process:
 * <ol>
 * <li><b>Exact</b> - a normalized store name or city equals one of the query's
 * candidate tokens (score 1.0)</li>
 * <li><b>Alias</b> - a normalized alias equals a candidate token, for records
 * without an exact match (score 0.9)</li>
 * <li><b>Fuzzy</b> - only while fewer than {@code bot.resolver.min-matches}
 * records matched: best edit-distance similarity between a candidate token and
 * any field, kept at or above {@code bot.resolver.similarity-threshold}</li>
 * </ol>
 *
 * <p>
 * Candidate tokens are the whole normalized query, every separator-delimited
 * segment of the raw query, and every word n-gram up to
 * {@code bot.resolver.max-phrase-words} words, so multi-word fields such as
 * "New York" are compared as single phrases.
 *
 * <p>
 * Results are deduplicated by (store, city), sorted by score descending, then
 * by the number of fields the query hit (a record named together with its
 * city comes first), then by normalized store and city, and truncated to
 * {@code bot.resolver.max-results}. An empty list means "no match"; resolution
 * never throws for lack of matches.
 *
 * @see TextNormalizer
 * @see EditDistanceSimilarity
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreResolver {

    private static final Pattern SEPARATORS = Pattern.compile("[,;/|.?!:\\r\\n]+");

    private final BotProperties properties;
    private final TextNormalizer normalizer;

    public List<MatchResult> resolve(String rawQuery, StoreCatalog catalog) {
        String normalizedQuery = normalizer.normalize(rawQuery);
        if (normalizedQuery.isEmpty() || catalog == null || catalog.isEmpty()) {
            return List.of();
        }

        BotProperties.ResolverProperties config = properties.getResolver();
        Set<String> tokens = candidateTokens(rawQuery, normalizedQuery, config.getMaxPhraseWords());
        log.trace("[Resolver] Candidate tokens for '{}': {}", normalizedQuery, tokens);

        List<IndexedRecord> records = catalog.indexedRecords();
        Map<RecordKey, Candidate> matches = new LinkedHashMap<>();

        // Stage 1: exact store name or city; a record hit on both fields ranks first
        Set<StoreRecord> cityHits = new HashSet<>();
        for (String token : tokens) {
            cityHits.addAll(catalog.lookupByNormalizedCity(token));
        }
        for (IndexedRecord indexed : records) {
            int matchedFields = (tokens.contains(indexed.name()) ? 1 : 0)
                    + (cityHits.contains(indexed.record()) ? 1 : 0);
            if (matchedFields > 0) {
                keepBest(matches, indexed, MatchResult.exact(indexed.record()), matchedFields);
            }
        }

        // Stage 2: aliases
        for (IndexedRecord indexed : records) {
            if (hasExactMatch(matches, indexed)) {
                continue;
            }
            if (indexed.aliases().stream().anyMatch(tokens::contains)) {
                keepBest(matches, indexed, MatchResult.alias(indexed.record()), 1);
            }
        }

        // Stage 3: fuzzy
        if (matches.size() < config.getMinMatches()) {
            log.debug("[Resolver] {} match(es) after exact/alias stages, running fuzzy stage", matches.size());
            fuzzyStage(tokens, records, matches, config);
        }

        List<MatchResult> results = matches.values().stream()
                .sorted(RANKING)
                .limit(Math.max(1, config.getMaxResults()))
                .map(Candidate::result)
                .toList();

        log.debug("[Resolver] Query '{}' -> {} match(es)", normalizedQuery, results.size());
        return results;
    }

    private void fuzzyStage(Set<String> tokens, List<IndexedRecord> records,
            Map<RecordKey, Candidate> matches, BotProperties.ResolverProperties config) {
        List<String> fuzzyTokens = tokens.stream()
                .filter(token -> token.length() >= config.getMinFuzzyTokenLength())
                .toList();
        if (fuzzyTokens.isEmpty()) {
            return;
        }

        for (IndexedRecord indexed : records) {
            double best = 0.0;
            for (String field : indexed.fields()) {
                for (String token : fuzzyTokens) {
                    best = Math.max(best, EditDistanceSimilarity.similarity(token, field));
                }
            }
            if (best >= config.getSimilarityThreshold()) {
                keepBest(matches, indexed, MatchResult.fuzzy(indexed.record(), best), 1);
            }
        }
    }

    Set<String> candidateTokens(String rawQuery, String normalizedQuery, int maxPhraseWords) {
        Set<String> tokens = new LinkedHashSet<>();
        tokens.add(normalizedQuery);

        for (String segment : SEPARATORS.split(rawQuery)) {
            String normalizedSegment = normalizer.normalize(segment);
            if (!normalizedSegment.isEmpty()) {
                tokens.add(normalizedSegment);
            }
        }

        String[] words = normalizedQuery.split(" ");
        int maxWords = Math.max(1, maxPhraseWords);
        for (int start = 0; start < words.length; start++) {
            StringBuilder phrase = new StringBuilder();
            for (int end = start; end < words.length && end - start < maxWords; end++) {
                if (end > start) {
                    phrase.append(' ');
                }
                phrase.append(words[end]);
                tokens.add(phrase.toString());
            }
        }
        return tokens;
    }

    private static boolean hasExactMatch(Map<RecordKey, Candidate> matches, IndexedRecord indexed) {
        Candidate existing = matches.get(key(indexed));
        return existing != null && existing.result().matchKind() == MatchKind.EXACT;
    }

    private static void keepBest(Map<RecordKey, Candidate> matches, IndexedRecord indexed, MatchResult result,
            int matchedFields) {
        RecordKey key = key(indexed);
        matches.merge(key, new Candidate(key, result, matchedFields),
                (current, offered) -> RANKING.compare(offered, current) < 0 ? offered : current);
    }

    private static RecordKey key(IndexedRecord indexed) {
        return new RecordKey(indexed.name(), indexed.city());
    }

    private static final Comparator<Candidate> RANKING = Comparator
            .comparingDouble((Candidate c) -> c.result().score()).reversed()
            .thenComparing(Comparator.comparingInt(Candidate::matchedFields).reversed())
            .thenComparing(c -> c.key().name())
            .thenComparing(c -> c.key().city());

    private record RecordKey(String name, String city) {
    }

    private record Candidate(RecordKey key, MatchResult result, int matchedFields) {
    }
}
