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

import java.util.HashSet;
import java.util.Set;

/**
 * Cheap lexical similarity measures.
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    /**
     * Jaccard similarity over the sets of characters of both texts, ignoring
     * whitespace. Two empty texts are identical.
     */
    public static double characterJaccard(String a, String b) {
        Set<Integer> left = characters(a);
        Set<Integer> right = characters(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        return jaccard(left, right);
    }

    /**
     * Jaccard similarity of two sets; 0 when both are empty.
     */
    public static <T> double jaccard(Set<T> left, Set<T> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }
        Set<T> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<T> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private static Set<Integer> characters(String text) {
        Set<Integer> chars = new HashSet<>();
        if (text != null) {
            text.codePoints().filter(cp -> !Character.isWhitespace(cp)).forEach(chars::add);
        }
        return chars;
    }
}
