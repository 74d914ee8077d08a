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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Raw catalog entry as it appears in the JSON source. The original dataset
 * names the store field {@code brand}; both spellings are accepted.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogEntry {

    @JsonAlias("brand")
    private String store;
    private String city;
    private List<String> aliases;
    private String address;
    private String region;
}
