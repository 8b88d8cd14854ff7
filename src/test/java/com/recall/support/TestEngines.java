package com.recall.support;

import com.recall.decision.ClinicalDecisionResolver;
import com.recall.engine.RecallEngineFactory;
import com.recall.engine.RecallEngineFactory.Components;
import com.recall.policy.ClinicalPolicy;
import com.recall.query.QueryNormalizer;
import com.recall.retrieval.CorpusEntry;
import com.recall.retrieval.CorpusLevel;
import com.recall.retrieval.CorpusStore;
import com.recall.retrieval.LexicalRanker;
import com.recall.retrieval.RelevanceReranker;
import com.recall.vitals.VitalSignsAnalyzer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/** Builds engine pieces over the classpath policy and the fixture corpus. */
public final class TestEngines {

    public static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    public static final ClinicalPolicy POLICY = ClinicalPolicy.load();

    private TestEngines() {
    }

    public static Path corpusDirectory() {
        try {
            return Paths.get(TestEngines.class.getResource("/corpus").toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static List<CorpusEntry> fixtureCorpus() {
        try {
            return CorpusStore.load(corpusDirectory(),
                List.of(new CorpusLevel("focused", "jts_focused_corpus.json"))).entries();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Components components(Clock clock) {
        return RecallEngineFactory.create(POLICY, fixtureCorpus(), LexicalRanker.Settings.defaults(), 5, clock);
    }

    public static QueryNormalizer normalizer() {
        return new QueryNormalizer(POLICY.corrections, POLICY.contextualRewrites, POLICY.expansions);
    }

    public static VitalSignsAnalyzer analyzer() {
        return new VitalSignsAnalyzer(POLICY.vitalRanges, POLICY.vitalCautions, POLICY.phrases);
    }

    public static LexicalRanker ranker() {
        return LexicalRanker.build(fixtureCorpus(), LexicalRanker.Settings.defaults());
    }

    public static RelevanceReranker reranker(LexicalRanker ranker) {
        return new RelevanceReranker(ranker, POLICY.reranker, POLICY.keywordFallback);
    }

    public static ClinicalDecisionResolver resolver(Clock clock) {
        LexicalRanker ranker = ranker();
        return new ClinicalDecisionResolver(POLICY, analyzer(), normalizer(), ranker, reranker(ranker), 5, clock);
    }
}
