package me.golemcore.memory.text;

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

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frequency-based keyword extraction used when no keywords are supplied and
 * no LLM is available.
 *
 * <p>
 * ASCII words of three or more letters and CJK runs of two to four characters
 * are candidates; stop words are skipped.
 */
public final class KeywordExtractor {

    public static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "and", "or", "of", "to", "in",
            "on", "for", "with", "that", "this", "it", "as", "at", "by", "from", "but", "not", "have",
            "has", "had", "you", "your", "our", "their", "its", "can", "will", "would", "should",
            "的", "了", "是", "在", "和", "与", "或", "我", "你", "他", "她", "它", "这", "那");

    private static final Pattern WORD = Pattern.compile("[A-Za-z][A-Za-z0-9_-]{2,}|[\\p{IsHan}]{2,4}");

    private KeywordExtractor() {
    }

    public static Set<String> extract(String text, int limit) {
        if (text == null || text.isBlank() || limit <= 0) {
            return new LinkedHashSet<>();
        }
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            String word = matcher.group().toLowerCase(Locale.ROOT);
            if (!STOP_WORDS.contains(word)) {
                frequencies.merge(word, 1, Integer::sum);
            }
        }
        Set<String> keywords = new LinkedHashSet<>();
        frequencies.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .forEach(e -> keywords.add(e.getKey()));
        return keywords;
    }
}
