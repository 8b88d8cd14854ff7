package com.recall.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * LexicalRanker - BM25 index over the corpus, built once and read-only afterwards.
 *
 * <p>{@code idf(t) = ln((N - df + 0.5) / (df + 0.5))}. A term found in more than
 * half of the entries would get a negative idf; it is floored to
 * {@code epsilon * mean idf} so a higher term frequency never lowers a score.
 * Ties keep corpus order. Only entries scoring above zero are returned.
 */
public class LexicalRanker {

    private static final Logger log = LoggerFactory.getLogger(LexicalRanker.class);

    private final List<CorpusEntry> entries;
    private final ClinicalAnalyzer analyzer;
    private final Settings settings;
    private final List<Map<String, Integer>> termFrequencies;
    private final int[] docLengths;
    private final double avgDocLength;
    private final Map<String, Integer> docFrequencies;
    private final Map<String, Double> idf;

    private LexicalRanker(List<CorpusEntry> entries, Settings settings) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.settings = settings;
        this.analyzer = new ClinicalAnalyzer(settings.removeStopWords);
        this.termFrequencies = new ArrayList<>(entries.size());
        this.docLengths = new int[entries.size()];
        this.docFrequencies = new HashMap<>();

        long totalLength = 0;
        for (int i = 0; i < entries.size(); i++) {
            List<String> tokens = analyzer.tokenize(entries.get(i).text);
            Map<String, Integer> tf = new HashMap<>();
            for (String token : tokens) {
                tf.merge(token, 1, Integer::sum);
            }
            for (String term : tf.keySet()) {
                docFrequencies.merge(term, 1, Integer::sum);
            }
            termFrequencies.add(tf);
            docLengths[i] = tokens.size();
            totalLength += tokens.size();
        }
        this.avgDocLength = entries.isEmpty() ? 0.0 : (double) totalLength / entries.size();
        this.idf = computeIdf(entries.size(), docFrequencies, settings.epsilon);
    }

    public static LexicalRanker build(List<CorpusEntry> entries, Settings settings) {
        LexicalRanker ranker = new LexicalRanker(entries, settings);
        log.info("🔍 Lexical index built: {} entries, {} terms, avg length {}",
            entries.size(), ranker.docFrequencies.size(), String.format("%.1f", ranker.avgDocLength));
        return ranker;
    }

    private static Map<String, Double> computeIdf(int n, Map<String, Integer> docFrequencies, double epsilon) {
        Map<String, Double> raw = new HashMap<>();
        double sum = 0.0;
        for (Map.Entry<String, Integer> e : docFrequencies.entrySet()) {
            int df = e.getValue();
            double value = Math.log((n - df + 0.5) / (df + 0.5));
            raw.put(e.getKey(), value);
            sum += value;
        }
        double floor = raw.isEmpty() ? 0.0 : Math.max(0.0, epsilon * sum / raw.size());
        Map<String, Double> result = new HashMap<>();
        raw.forEach((term, value) -> result.put(term, value < 0 ? floor : value));
        return result;
    }

    public List<String> tokenize(String text) {
        return analyzer.tokenize(text);
    }

    public List<ScoredEntry> search(String text, int topN) {
        return query(tokenize(text), topN);
    }

    public List<ScoredEntry> query(List<String> tokens, int topN) {
        return query(tokens, topN, Set.of());
    }

    /** Scores only entries in one of {@code categories}; an empty set scopes nothing out. */
    public List<ScoredEntry> query(List<String> tokens, int topN, Set<String> categories) {
        if (tokens == null || tokens.isEmpty() || topN <= 0) {
            return List.of();
        }
        List<ScoredEntry> scored = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            if (!categories.isEmpty() && !categories.contains(entries.get(i).category)) {
                continue;
            }
            double score = score(tokens, i);
            if (score > 0) {
                scored.add(new ScoredEntry(entries.get(i), i, score));
            }
        }
        // List.sort is stable, so equal scores stay in corpus order
        scored.sort(Comparator.comparingDouble((ScoredEntry s) -> s.score).reversed());
        return scored.size() > topN ? List.copyOf(scored.subList(0, topN)) : List.copyOf(scored);
    }

    public double score(List<String> tokens, int docIndex) {
        Map<String, Integer> tf = termFrequencies.get(docIndex);
        double lengthNorm = avgDocLength == 0 ? 1.0 : docLengths[docIndex] / avgDocLength;
        double k1 = settings.k1;
        double b = settings.b;
        double score = 0.0;
        for (String token : tokens) {
            Double termIdf = idf.get(token);
            if (termIdf == null) {
                continue;
            }
            int freq = tf.getOrDefault(token, 0);
            if (freq == 0) {
                continue;
            }
            score += termIdf * (freq * (k1 + 1)) / (freq + k1 * (1 - b + b * lengthNorm));
        }
        return score;
    }

    public double idf(String term) {
        return idf.getOrDefault(term, 0.0);
    }

    public List<CorpusEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /** BM25 parameters. */
    public static class Settings {
        public final double k1;
        public final double b;
        public final double epsilon;
        public final boolean removeStopWords;

        public Settings(double k1, double b, double epsilon, boolean removeStopWords) {
            this.k1 = k1;
            this.b = b;
            this.epsilon = epsilon;
            this.removeStopWords = removeStopWords;
        }

        public static Settings defaults() {
            return new Settings(1.5, 0.75, 0.25, true);
        }

        @Override
        public String toString() {
            return String.format("Settings{k1=%.2f, b=%.2f, epsilon=%.2f, stopWords=%s}",
                k1, b, epsilon, removeStopWords);
        }
    }
}
