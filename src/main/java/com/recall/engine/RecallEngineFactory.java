package com.recall.engine;

import com.recall.config.EngineSettings;
import com.recall.decision.ClinicalDecisionResolver;
import com.recall.patient.PatientContextUpdater;
import com.recall.policy.ClinicalPolicy;
import com.recall.query.QueryNormalizer;
import com.recall.response.ResponseFormatter;
import com.recall.retrieval.CorpusEntry;
import com.recall.retrieval.CorpusStore;
import com.recall.retrieval.LexicalRanker;
import com.recall.retrieval.RelevanceReranker;
import com.recall.safety.ContraindicationChecker;
import com.recall.vitals.VitalSignsAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

/**
 * RecallEngineFactory - Wires policy, corpus and index into an engine. The only
 * place that does I/O.
 */
public final class RecallEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(RecallEngineFactory.class);

    private RecallEngineFactory() {
    }

    public static Components create(EngineSettings settings, Clock clock) throws IOException {
        log.info("🚀 Building recall engine with {}", settings);
        ClinicalPolicy policy = ClinicalPolicy.load(settings.policyFile);
        CorpusStore store = CorpusStore.load(settings.corpusDirectory, settings.corpusLevels);
        return create(policy, store.entries(), settings.ranker, settings.topN, clock);
    }

    public static Components create(ClinicalPolicy policy, List<CorpusEntry> entries,
                                    LexicalRanker.Settings rankerSettings, int topN, Clock clock) {
        LexicalRanker ranker = LexicalRanker.build(entries, rankerSettings);
        QueryNormalizer normalizer = new QueryNormalizer(policy.corrections, policy.contextualRewrites,
            policy.expansions);
        RelevanceReranker reranker = new RelevanceReranker(ranker, policy.reranker, policy.keywordFallback);
        VitalSignsAnalyzer analyzer = new VitalSignsAnalyzer(policy.vitalRanges, policy.vitalCautions,
            policy.phrases);
        ClinicalDecisionResolver resolver = new ClinicalDecisionResolver(policy, analyzer, normalizer, ranker,
            reranker, topN, clock);
        RecallEngine engine = new RecallEngine(
            normalizer,
            new PatientContextUpdater(policy.patient, clock),
            analyzer,
            resolver,
            new ContraindicationChecker(policy.contraindications, policy.phrases.allergyWarning),
            new ResponseFormatter(policy.formatter),
            policy.phrases,
            policy.criticalStalenessMinutes);
        return new Components(engine, analyzer, policy, clock);
    }

    /** Built engine plus the shared pieces sessions need. */
    public static class Components {
        public final RecallEngine engine;
        public final VitalSignsAnalyzer analyzer;
        public final ClinicalPolicy policy;
        public final Clock clock;

        Components(RecallEngine engine, VitalSignsAnalyzer analyzer, ClinicalPolicy policy, Clock clock) {
            this.engine = engine;
            this.analyzer = analyzer;
            this.policy = policy;
            this.clock = clock;
        }

        public ConsultationSession newSession(String sessionId, int historySize) {
            return new ConsultationSession(sessionId, engine, analyzer, historySize, clock);
        }
    }
}
