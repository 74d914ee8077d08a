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

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes user text and catalog fields so they can be compared.
 *
 * <p>
 * Normalization is deterministic and total:
 * <ol>
 * <li>compatibility decomposition with combining marks removed, so accented
 * letters fold to their base letter ({@code é -> e}, {@code ё -> е})</li>
 * <li>lower-casing with {@link Locale#ROOT}</li>
 * <li>punctuation replaced by a space, except apostrophes and hyphens standing
 * between two letters or digits ({@code o'neil}, {@code 7-eleven})</li>
 * <li>whitespace runs collapsed to a single space and the result trimmed</li>
 * </ol>
 *
 * <p>
 * Two strings are the same mention iff their normalized forms are equal.
 */
@Component
public class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String folded = COMBINING_MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFKD)).replaceAll("");
        int[] codePoints = folded.toLowerCase(Locale.ROOT).codePoints().toArray();

        StringBuilder sb = new StringBuilder(codePoints.length);
        for (int i = 0; i < codePoints.length; i++) {
            int cp = codePoints[i];
            if (Character.isLetterOrDigit(cp)) {
                sb.appendCodePoint(cp);
            } else if (isJoiner(cp) && isWordCharAt(codePoints, i - 1) && isWordCharAt(codePoints, i + 1)) {
                sb.append(cp == '-' || cp == '‐' || cp == '‑' ? '-' : '\'');
            } else {
                sb.append(' ');
            }
        }

        return WHITESPACE.matcher(sb).replaceAll(" ").strip();
    }

    /**
     * Normalizes the text and splits it into words.
     */
    public List<String> words(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }

    private static boolean isJoiner(int cp) {
        return cp == '\'' || cp == '’' || cp == '-' || cp == '‐' || cp == '‑';
    }

    private static boolean isWordCharAt(int[] codePoints, int index) {
        return index >= 0 && index < codePoints.length && Character.isLetterOrDigit(codePoints[index]);
    }
}
