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

import java.util.List;

/**
 * A single store of the static catalog. Identity is the
 * {@code (storeName, city)} pair; aliases are alternate spellings of the store
 * name. Address and region are optional details shown in lookup replies.
 */
public record StoreRecord(
        String storeName,
        String city,
        List<String> aliases,
        String address,
        String region) {

    public StoreRecord {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public StoreRecord(String storeName, String city, List<String> aliases) {
        this(storeName, city, aliases, null, null);
    }

    public boolean hasAddress() {
        return address != null && !address.isBlank();
    }

    public boolean hasRegion() {
        return region != null && !region.isBlank();
    }
}
