package me.golemcore.memory.retrieval;

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

import me.golemcore.memory.text.TextTokenizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Okapi BM25 over an immutable corpus snapshot.
 *
 * <p>
 * Scoring walks the posting lists of the query terms only, so documents that
 * share no term with the query are never touched. Negative IDF values (terms
 * in more than half the corpus) are floored at {@code epsilon * averageIdf}.
 */
public class Bm25Index {

    private static final double EPSILON = 0.25;

    private final List<String> ids;
    private final int[] lengths;
    private final Map<String, Map<Integer, Integer>> postings;
    private final Map<String, Double> idf;
    private final double averageLength;
    private final double k1;
    private final double b;

    public Bm25Index(List<Document> documents, double k1, double b) {
        this.k1 = k1;
        this.b = b;
        this.ids = new ArrayList<>(documents.size());
        this.lengths = new int[documents.size()];
        this.postings = new HashMap<>();

        long totalLength = 0;
        for (int i = 0; i < documents.size(); i++) {
            Document document = documents.get(i);
            ids.add(document.id());
            List<String> tokens = TextTokenizer.tokenize(document.text());
            lengths[i] = tokens.size();
            totalLength += tokens.size();
            for (String token : tokens) {
                postings.computeIfAbsent(token, t -> new HashMap<>()).merge(i, 1, Integer::sum);
            }
        }
        this.averageLength = documents.isEmpty() ? 0.0 : (double) totalLength / documents.size();
        this.idf = computeIdf(documents.size());
    }

    private Map<String, Double> computeIdf(int corpusSize) {
        Map<String, Double> raw = new HashMap<>();
        double sum = 0.0;
        List<String> negative = new ArrayList<>();
        for (Map.Entry<String, Map<Integer, Integer>> entry : postings.entrySet()) {
            int df = entry.getValue().size();
            double value = Math.log((corpusSize - df + 0.5) / (df + 0.5));
            raw.put(entry.getKey(), value);
            sum += value;
            if (value < 0) {
                negative.add(entry.getKey());
            }
        }
        double floor = raw.isEmpty() ? 0.0 : EPSILON * (sum / raw.size());
        for (String term : negative) {
            raw.put(term, floor);
        }
        return raw;
    }

    public int size() {
        return ids.size();
    }

    /**
     * Score the corpus against a query and keep the {@code limit} best
     * documents. Documents sharing no term with the query are absent from the
     * result (their score is zero).
     *
     * @return document id to raw BM25 score, best first
     */
    public LinkedHashMap<String, Double> score(String query, int limit) {
        Set<String> terms = new LinkedHashSet<>(TextTokenizer.tokenize(query));
        Map<Integer, Double> scores = new HashMap<>();
        for (String term : terms) {
            Map<Integer, Integer> termPostings = postings.get(term);
            if (termPostings == null) {
                continue;
            }
            double termIdf = idf.getOrDefault(term, 0.0);
            for (Map.Entry<Integer, Integer> posting : termPostings.entrySet()) {
                int doc = posting.getKey();
                int tf = posting.getValue();
                double norm = averageLength > 0 ? lengths[doc] / averageLength : 1.0;
                double value = termIdf * (tf * (k1 + 1)) / (tf + k1 * (1 - b + b * norm));
                scores.merge(doc, value, Double::sum);
            }
        }

        PriorityQueue<Map.Entry<Integer, Double>> top = new PriorityQueue<>(
                (x, y) -> Double.compare(x.getValue(), y.getValue()));
        for (Map.Entry<Integer, Double> entry : scores.entrySet()) {
            top.offer(entry);
            if (top.size() > limit) {
                top.poll();
            }
        }
        List<Map.Entry<Integer, Double>> ordered = new ArrayList<>(top);
        ordered.sort((x, y) -> {
            int byScore = Double.compare(y.getValue(), x.getValue());
            return byScore != 0 ? byScore : Integer.compare(x.getKey(), y.getKey());
        });

        LinkedHashMap<String, Double> result = new LinkedHashMap<>();
        for (Map.Entry<Integer, Double> entry : ordered) {
            result.put(ids.get(entry.getKey()), entry.getValue());
        }
        return result;
    }

    public record Document(String id, String text) {
    }
}
