package com.architecture.memory.traceback.service.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable Okapi BM25 index over chunk payloads. Tokens are the lower-cased,
 * whitespace-separated words of the chunk {@code content}.
 *
 * <p>Terms that occur in more than half of the corpus get a negative IDF under the
 * Okapi formula; those are floored to {@code epsilon * averageIdf}.
 */
public final class Bm25Index {

    public static final double DEFAULT_K1 = 1.5;
    public static final double DEFAULT_B = 0.75;
    public static final double DEFAULT_EPSILON = 0.25;

    private final List<Map<String, Object>> chunks;
    private final List<Map<String, Integer>> termFrequencies;
    private final int[] documentLengths;
    private final Map<String, Double> idf;
    private final double averageLength;
    private final double k1;
    private final double b;

    private Bm25Index(List<Map<String, Object>> chunks, double k1, double b, double epsilon) {
        this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
        this.k1 = k1;
        this.b = b;
        this.termFrequencies = new ArrayList<>(chunks.size());
        this.documentLengths = new int[chunks.size()];

        Map<String, Integer> documentFrequency = new HashMap<>();
        long totalLength = 0;
        for (int i = 0; i < chunks.size(); i++) {
            List<String> tokens = tokenize(String.valueOf(chunks.get(i).getOrDefault("content", "")));
            Map<String, Integer> frequencies = new HashMap<>();
            for (String token : tokens) {
                frequencies.merge(token, 1, Integer::sum);
            }
            termFrequencies.add(frequencies);
            documentLengths[i] = tokens.size();
            totalLength += tokens.size();
            for (String term : frequencies.keySet()) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }
        this.averageLength = chunks.isEmpty() || totalLength == 0 ? 1.0 : (double) totalLength / chunks.size();
        this.idf = computeIdf(documentFrequency, chunks.size(), epsilon);
    }

    public static Bm25Index build(List<Map<String, Object>> chunks) {
        return new Bm25Index(chunks, DEFAULT_K1, DEFAULT_B, DEFAULT_EPSILON);
    }

    public static Bm25Index build(List<Map<String, Object>> chunks, double k1, double b, double epsilon) {
        return new Bm25Index(chunks, k1, b, epsilon);
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : text.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static Map<String, Double> computeIdf(Map<String, Integer> documentFrequency, int corpusSize, double epsilon) {
        Map<String, Double> result = new HashMap<>();
        List<String> negative = new ArrayList<>();
        double idfSum = 0.0;

        for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
            int frequency = entry.getValue();
            double value = Math.log(corpusSize - frequency + 0.5) - Math.log(frequency + 0.5);
            result.put(entry.getKey(), value);
            idfSum += value;
            if (value < 0) {
                negative.add(entry.getKey());
            }
        }

        if (!result.isEmpty()) {
            double floor = epsilon * (idfSum / result.size());
            for (String term : negative) {
                result.put(term, floor);
            }
        }
        return result;
    }

    public int size() {
        return chunks.size();
    }

    /**
     * BM25 score of every chunk for the query, in index order.
     */
    public double[] scores(String query) {
        double[] scores = new double[chunks.size()];
        for (String term : tokenize(query)) {
            Double termIdf = idf.get(term);
            if (termIdf == null) {
                continue;
            }
            for (int i = 0; i < chunks.size(); i++) {
                Integer frequency = termFrequencies.get(i).get(term);
                if (frequency == null) {
                    continue;
                }
                double norm = k1 * (1 - b + b * documentLengths[i] / averageLength);
                scores[i] += termIdf * (frequency * (k1 + 1)) / (frequency + norm);
            }
        }
        return scores;
    }

    /**
     * Top {@code limit} chunks by descending score. Equal scores keep index order.
     */
    public List<ScoredChunk> search(String query, int limit) {
        double[] scores = scores(query);
        List<ScoredChunk> results = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            results.add(new ScoredChunk(chunks.get(i), scores[i], i));
        }
        results.sort(Comparator.comparingDouble(ScoredChunk::score).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, Math.max(0, limit))) : results;
    }

    public static final class ScoredChunk {

        private final Map<String, Object> chunk;
        private final double score;
        private final int position;

        ScoredChunk(Map<String, Object> chunk, double score, int position) {
            this.chunk = chunk;
            this.score = score;
            this.position = position;
        }

        public Map<String, Object> chunk() {
            return chunk;
        }

        public double score() {
            return score;
        }

        public int position() {
            return position;
        }

        /**
         * Chunk id used for fusion, falling back to {@code document_id}.
         */
        public String id() {
            Object id = chunk.get("id");
            if (id == null) {
                id = chunk.get("document_id");
            }
            return id == null ? null : id.toString();
        }
    }
}
