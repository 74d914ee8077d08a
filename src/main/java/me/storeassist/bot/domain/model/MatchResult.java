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
 * A catalog record matched by a store query with its score (0-1).
 */
public record MatchResult(StoreRecord record, double score, MatchKind matchKind) {

    public static final double EXACT_SCORE = 1.0;
    public static final double ALIAS_SCORE = 0.9;

    public static MatchResult exact(StoreRecord record) {
        return new MatchResult(record, EXACT_SCORE, MatchKind.EXACT);
    }

    public static MatchResult alias(StoreRecord record) {
        return new MatchResult(record, ALIAS_SCORE, MatchKind.ALIAS);
    }

    public static MatchResult fuzzy(StoreRecord record, double similarity) {
        return new MatchResult(record, similarity, MatchKind.FUZZY);
    }
}
