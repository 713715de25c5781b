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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lightweight tokenizer shared by lexical indexing and keyword matching.
 *
 * <p>
 * Punctuation is stripped; ASCII words are lower-cased, any other word (CJK
 * text in practice) is split into single-character unigrams.
 */
public final class TextTokenizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextTokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String cleaned = PUNCTUATION.matcher(text).replaceAll(" ");
        List<String> tokens = new ArrayList<>();
        for (String word : WHITESPACE.split(cleaned.trim())) {
            if (word.isEmpty()) {
                continue;
            }
            if (isAscii(word)) {
                tokens.add(word.toLowerCase(Locale.ROOT));
            } else {
                word.codePoints().forEach(cp -> tokens.add(new String(Character.toChars(cp))));
            }
        }
        return tokens;
    }

    /**
     * Distinct tokens of a text, in first-seen order.
     */
    public static Set<String> tokenSet(String text) {
        return new LinkedHashSet<>(tokenize(text));
    }

    private static boolean isAscii(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (word.charAt(i) > 0x7F) {
                return false;
            }
        }
        return true;
    }
}
