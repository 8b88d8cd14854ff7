package com.recall.retrieval;

import com.recall.policy.ClinicalPolicy.KeywordFallback;
import com.recall.policy.ClinicalPolicy.RerankerLexicon;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * RelevanceReranker - Re-scores ranked candidates to favor dosage-bearing,
 * actionable text over headers and boilerplate.
 *
 * <p>{@link #keywordFallback(String, int)} scores plain keyword overlap and is used
 * when the lexical ranker returns nothing.
 */
public class RelevanceReranker {

    private static final Comparator<ScoredEntry> BY_SCORE_DESC =
        Comparator.comparingDouble((ScoredEntry s) -> s.score).reversed();

    private final LexicalRanker ranker;
    private final RerankerLexicon lexicon;
    private final KeywordFallback fallback;

    public RelevanceReranker(LexicalRanker ranker, RerankerLexicon lexicon, KeywordFallback fallback) {
        this.ranker = ranker;
        this.lexicon = lexicon;
        this.fallback = fallback;
    }

    public List<ScoredEntry> rerank(List<ScoredEntry> candidates, String query) {
        List<ScoredEntry> adjusted = new ArrayList<>(candidates.size());
        for (ScoredEntry candidate : candidates) {
            adjusted.add(candidate.withScore(candidate.score + adjustment(candidate.entry.text)));
        }
        adjusted.sort(BY_SCORE_DESC);
        return adjusted;
    }

    double adjustment(String rawText) {
        String text = rawText.toLowerCase();
        double delta = 0.0;
        if (lexicon.dosagePattern.matcher(text).find()) {
            delta += lexicon.dosageWeight;
        }
        for (String medication : lexicon.medications) {
            if (text.contains(medication)) delta += lexicon.medicationWeight;
        }
        for (String verb : lexicon.actionVerbs) {
            if (text.contains(verb)) delta += lexicon.actionVerbWeight;
        }
        for (String indicator : lexicon.boilerplate) {
            if (text.contains(indicator)) delta += lexicon.boilerplateWeight;
        }
        if (rawText.length() < lexicon.shortTextChars) {
            delta += lexicon.shortTextWeight;
        }
        return delta;
    }

    public List<ScoredEntry> keywordFallback(String query, int topN) {
        Set<String> words = new LinkedHashSet<>(ranker.tokenize(query));
        if (words.isEmpty() || topN <= 0) {
            return List.of();
        }
        List<CorpusEntry> entries = ranker.entries();
        List<ScoredEntry> scored = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            CorpusEntry entry = entries.get(i);
            String text = entry.text.toLowerCase();
            String source = entry.source.toLowerCase();
            String section = entry.section.toLowerCase();

            double score = 0.0;
            for (String word : words) {
                if (text.contains(word)) score += fallback.textWeight;
                if (source.contains(word)) score += fallback.sourceWeight;
                if (section.contains(word)) score += fallback.sectionWeight;
            }
            for (Map.Entry<String, List<String>> variation : fallback.variations.entrySet()) {
                if (!words.contains(variation.getKey())) continue;
                for (String term : variation.getValue()) {
                    if (text.contains(term) || source.contains(term)) {
                        score += fallback.variationWeight;
                    }
                }
            }
            if (score > 0) {
                scored.add(new ScoredEntry(entry, i, score));
            }
        }
        scored.sort(BY_SCORE_DESC);
        return scored.size() > topN ? List.copyOf(scored.subList(0, topN)) : List.copyOf(scored);
    }
}
