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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.storeassist.bot.domain.model.StoreRecord;
import me.storeassist.bot.matching.TextNormalizer;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the static store dataset from JSON.
 *
 * <p>
 * Accepted layouts are a top-level array of entries or an object with a
 * {@code stores} array. Each entry needs non-blank {@code store} and
 * {@code city}; {@code aliases}, {@code address} and {@code region} are
 * optional.
 *
 * <p>
 * Two entries with the same normalized store and city must not share an alias
 * (or both have none), otherwise the identity would be ambiguous.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreCatalogLoader {

    private static final String STORES_FIELD = "stores";
    private static final TypeReference<List<CatalogEntry>> ENTRIES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final TextNormalizer normalizer;

    public StoreCatalog load(Resource source) {
        if (source == null || !source.exists()) {
            throw new CatalogLoadException("Catalog source not found: "
                    + (source != null ? source.getDescription() : "<null>"));
        }
        try (InputStream in = source.getInputStream()) {
            StoreCatalog catalog = load(in);
            log.info("[Catalog] Loaded {} stores in {} cities from {}", catalog.size(),
                    catalog.normalizedCities().size(), source.getDescription());
            return catalog;
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read catalog " + source.getDescription(), e);
        }
    }

    public StoreCatalog load(InputStream in) throws IOException {
        List<CatalogEntry> entries = readEntries(in);

        List<StoreRecord> records = new ArrayList<>(entries.size());
        Set<String> identities = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            StoreRecord storeRecord = toRecord(entries.get(i), i);
            registerIdentity(storeRecord, i, identities);
            records.add(storeRecord);
        }
        return new StoreCatalog(records, normalizer);
    }

    private List<CatalogEntry> readEntries(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new CatalogLoadException("Catalog is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new CatalogLoadException("Catalog source is empty");
        }

        JsonNode entries = root.isArray() ? root : root.get(STORES_FIELD);
        if (entries == null || !entries.isArray()) {
            throw new CatalogLoadException("Catalog must be an array or an object with a '" + STORES_FIELD
                    + "' array");
        }

        try {
            return objectMapper.convertValue(entries, ENTRIES_TYPE);
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException("Catalog entry has an invalid shape: " + e.getMessage(), e);
        }
    }

    private StoreRecord toRecord(CatalogEntry entry, int index) {
        if (entry == null) {
            throw new CatalogLoadException("Catalog entry #" + index + " is null");
        }
        if (isBlank(entry.getStore())) {
            throw new CatalogLoadException("Catalog entry #" + index + " has no store name");
        }
        if (isBlank(entry.getCity())) {
            throw new CatalogLoadException("Catalog entry #" + index + " ('" + entry.getStore() + "') has no city");
        }

        List<String> aliases = new ArrayList<>();
        if (entry.getAliases() != null) {
            for (String alias : entry.getAliases()) {
                if (isBlank(alias)) {
                    throw new CatalogLoadException("Catalog entry #" + index + " has a blank alias");
                }
                aliases.add(alias.strip());
            }
        }

        return new StoreRecord(
                entry.getStore().strip(),
                entry.getCity().strip(),
                aliases,
                blankToNull(entry.getAddress()),
                blankToNull(entry.getRegion()));
    }

    private void registerIdentity(StoreRecord storeRecord, int index, Set<String> identities) {
        String base = normalizer.normalize(storeRecord.storeName()) + '\u0000'
                + normalizer.normalize(storeRecord.city()) + '\u0000';

        Set<String> keys = new LinkedHashSet<>();
        if (storeRecord.aliases().isEmpty()) {
            keys.add(base);
        } else {
            for (String alias : storeRecord.aliases()) {
                keys.add(base + normalizer.normalize(alias));
            }
        }

        for (String key : keys) {
            if (!identities.add(key)) {
                throw new CatalogLoadException(String.format(
                        "Catalog entry #%d duplicates store '%s' in '%s' with the same alias",
                        index, storeRecord.storeName(), storeRecord.city()));
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.strip();
    }
}
