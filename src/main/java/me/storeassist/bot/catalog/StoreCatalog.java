package me.storeassist.bot.catalog;

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

import me.storeassist.bot.domain.model.StoreRecord;
import me.storeassist.bot.matching.TextNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory, read-only store catalog built once at startup.
 *
 * <p>
 * Records keep their source order. A city index keyed by the normalized city
 * name backs {@link #lookupByNormalizedCity(String)}, and every record's
 * normalized store name, city and aliases are computed once up front for
 * {@link #indexedRecords()}. Nothing mutates the
 * catalog after construction, so it is safe to query from any number of
 * threads without locking.
 */
public final class StoreCatalog {

    private final List<StoreRecord> records;
    private final List<IndexedRecord> indexedRecords;
    private final Map<String, Set<StoreRecord>> recordsByCity;
    private final TextNormalizer normalizer;

    public StoreCatalog(List<StoreRecord> records, TextNormalizer normalizer) {
        this.normalizer = normalizer;
        this.records = List.copyOf(records);
        this.indexedRecords = this.records.stream()
                .map(this::index)
                .toList();

        Map<String, Set<StoreRecord>> index = new LinkedHashMap<>();
        for (StoreRecord storeRecord : this.records) {
            index.computeIfAbsent(normalizer.normalize(storeRecord.city()), key -> new LinkedHashSet<>())
                    .add(storeRecord);
        }
        Map<String, Set<StoreRecord>> frozen = new LinkedHashMap<>();
        index.forEach((city, cityRecords) -> frozen.put(city, Collections.unmodifiableSet(cityRecords)));
        this.recordsByCity = Collections.unmodifiableMap(frozen);
    }

    /**
     * Returns the records located in the given city. The token is normalized
     * again, so raw spellings work as well.
     */
    public Set<StoreRecord> lookupByNormalizedCity(String token) {
        return recordsByCity.getOrDefault(normalizer.normalize(token), Set.of());
    }

    public List<StoreRecord> allRecords() {
        return records;
    }

    /**
     * Records paired with their normalized fields, in source order.
     */
    public List<IndexedRecord> indexedRecords() {
        return indexedRecords;
    }

    /**
     * Normalized names of all cities present in the catalog.
     */
    public List<String> normalizedCities() {
        return new ArrayList<>(recordsByCity.keySet());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    private IndexedRecord index(StoreRecord storeRecord) {
        List<String> aliases = storeRecord.aliases().stream()
                .map(normalizer::normalize)
                .filter(alias -> !alias.isEmpty())
                .toList();
        return new IndexedRecord(
                storeRecord,
                normalizer.normalize(storeRecord.storeName()),
                normalizer.normalize(storeRecord.city()),
                aliases);
    }

    /**
     * A catalog record with its normalized store name, city and aliases.
     */
    public record IndexedRecord(StoreRecord record, String name, String city, List<String> aliases) {

        public List<String> fields() {
            List<String> fields = new ArrayList<>(aliases.size() + 2);
            fields.add(name);
            fields.add(city);
            fields.addAll(aliases);
            return fields;
        }
    }
}
