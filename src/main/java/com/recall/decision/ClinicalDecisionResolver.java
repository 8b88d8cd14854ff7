package com.recall.decision;

import com.recall.patient.PatientContext;
import com.recall.policy.ClinicalPolicy;
import com.recall.query.QueryNormalizer;
import com.recall.query.TermMatcher;
import com.recall.retrieval.LexicalRanker;
import com.recall.retrieval.RelevanceReranker;
import com.recall.retrieval.ScoredEntry;
import com.recall.vitals.VitalAssessment;
import com.recall.vitals.VitalSignsAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ClinicalDecisionResolver - Ordered rule dispatch for one turn.
 *
 * <ol>
 *   <li>vital staleness: stale vitals stop the turn, missing vitals only add a notice</li>
 *   <li>critical vitals short-circuit</li>
 *   <li>direct medication rules, or the rate read from the retrieved guideline when a
 *       guideline answer is asked for and the passage states one</li>
 *   <li>direct procedure rules, or the scenario's decision tree when it is preferred
 *       or a guideline answer is asked for</li>
 *   <li>decision trees for scenarios without a procedure rule</li>
 *   <li>vitals summary, when asked for</li>
 *   <li>retrieval over the corpus</li>
 *   <li>clarifying question</li>
 * </ol>
 *
 * All lookups read the cleaned query; only retrieval sees the expanded one.
 */
public class ClinicalDecisionResolver {

    private static final Logger log = LoggerFactory.getLogger(ClinicalDecisionResolver.class);

    private final ClinicalPolicy policy;
    private final VitalSignsAnalyzer analyzer;
    private final MedicationRules medications;
    private final ProcedureRules procedures;
    private final QueryNormalizer normalizer;
    private final LexicalRanker ranker;
    private final RelevanceReranker reranker;
    private final GuidelineExtractor extractor;
    private final GuidelineDoseExtractor doseExtractor;
    private final int topN;
    private final Clock clock;

    public ClinicalDecisionResolver(ClinicalPolicy policy, VitalSignsAnalyzer analyzer, QueryNormalizer normalizer,
                                    LexicalRanker ranker, RelevanceReranker reranker, int topN, Clock clock) {
        this.policy = policy;
        this.analyzer = analyzer;
        this.medications = new MedicationRules(policy.medications);
        this.procedures = new ProcedureRules(policy.procedures);
        this.normalizer = normalizer;
        this.ranker = ranker;
        this.reranker = reranker;
        this.extractor = new GuidelineExtractor(policy.retrieval);
        this.doseExtractor = new GuidelineDoseExtractor(policy.guidelineDosing);
        this.topN = topN;
        this.clock = clock;
    }

    /**
     * True when the query asks for something: a medication, procedure or tree
     * scenario, a vitals summary, a guideline, or a request word such as "dose".
     */
    public boolean hasClinicalRequest(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        if (medications.mentionsMedication(query) || procedures.match(query).isPresent()) {
            return true;
        }
        if (policy.decisionTrees.stream().anyMatch(t -> t.matches(query))) {
            return true;
        }
        return TermMatcher.containsAny(query, policy.dialogue.vitalsSummaryCues)
            || TermMatcher.containsAny(query, policy.dialogue.requestCues)
            || TermMatcher.containsAny(query, policy.guidelineKeywords);
    }

    public Decision resolve(PatientContext context, String query) {
        Map<String, Object> params = context.snapshot();
        List<String> notices = new ArrayList<>();
        Map<String, Double> vitals = context.vitals();

        Optional<String> stale = checkStaleness(context);
        if (stale.isPresent()) {
            log.debug("Vitals stale, withholding clinical answer");
            return verbatim(DecisionType.STALE_VITALS, params, stale.get(), true, notices);
        }
        if (context.lastVitalCheck().isEmpty()) {
            notices.add(policy.phrases.missingVitals);
        }

        VitalAssessment assessment = analyzer.analyze(vitals);
        if (assessment.critical) {
            log.debug("Critical vitals short-circuit: {}", assessment.criticalConcerns);
            return new Decision(DecisionType.CRITICAL_VITALS, params, List.of(),
                List.of(RecommendedAction.of(analyzer.criticalMessage(assessment), 5)), true, notices);
        }
        analyzer.caution(vitals, query).ifPresent(notices::add);

        boolean guidelineRequested = TermMatcher.containsAny(query, policy.guidelineKeywords);
        Double weightKg = context.weightKg().orElse(null);
        List<RecommendedAction> doses = medications.resolve(query, weightKg);
        if (!doses.isEmpty()) {
            if (guidelineRequested) {
                Optional<Decision> guided = guidelineDose(query, weightKg, params, notices);
                if (guided.isPresent()) {
                    return guided.get();
                }
            }
            return new Decision(DecisionType.MEDICATION, params, List.of(), doses, true, notices);
        }

        Optional<ProcedureRule> procedure = procedures.match(query);
        if (procedure.isPresent()) {
            ProcedureRule rule = procedure.get();
            Optional<DecisionTree> tree = policy.treeFor(rule.scenario);
            if (tree.isPresent() && (rule.preferTree || guidelineRequested) && tree.get().matches(query)) {
                return treeDecision(tree.get(), query, params, notices);
            }
            return new Decision(DecisionType.PROCEDURE, params, List.of(),
                List.of(procedures.action(rule, query)), true, notices);
        }

        for (DecisionTree tree : policy.decisionTrees) {
            if (tree.matches(query)) {
                return treeDecision(tree, query, params, notices);
            }
        }

        if (TermMatcher.containsAny(query, policy.dialogue.vitalsSummaryCues)) {
            return verbatim(DecisionType.VITALS_SUMMARY, params, analyzer.summarize(vitals), true, List.of());
        }

        Optional<Decision> retrieved = retrieve(query, params, notices);
        if (retrieved.isPresent()) {
            return retrieved.get();
        }

        return verbatim(DecisionType.CLARIFYING, params, clarifyingQuestion(query), false, notices);
    }

    Optional<String> checkStaleness(PatientContext context) {
        Optional<Instant> lastCheck = context.lastVitalCheck();
        if (lastCheck.isEmpty()) {
            return Optional.empty();
        }
        Duration elapsed = Duration.between(lastCheck.get(), clock.instant());
        long minutes = elapsed.toMinutes();
        if (context.isCritical()) {
            if (elapsed.compareTo(Duration.ofMinutes(policy.criticalStalenessMinutes)) > 0) {
                return Optional.of(String.format(policy.phrases.staleCritical, minutes));
            }
        } else if (elapsed.compareTo(Duration.ofMinutes(policy.routineStalenessMinutes)) > 0) {
            return Optional.of(String.format(policy.phrases.staleRoutine, minutes));
        }
        return Optional.empty();
    }

    private Decision treeDecision(DecisionTree tree, String query, Map<String, Object> params, List<String> notices) {
        KeywordBranch branch = tree.walk(query);
        RecommendedAction action = new RecommendedAction(branch.text, null, null, branch.priority,
            "tree:" + tree.scenario);
        return new Decision(DecisionType.DECISION_TREE, params, List.of(), List.of(action), true, notices);
    }

    private Optional<Decision> guidelineDose(String query, Double weightKg, Map<String, Object> params,
                                             List<String> notices) {
        String expanded = normalizer.expand(query);
        List<ScoredEntry> ranked = ranker.query(ranker.tokenize(expanded), topN, policy.guidelineDosing.categories);
        if (ranked.isEmpty()) {
            return Optional.empty();
        }
        List<ScoredEntry> candidates = reranker.rerank(ranked, expanded);
        List<RecommendedAction> actions = doseExtractor.extract(candidates, query, weightKg);
        log.debug("Guideline dosing: {} candidates, {} rates read", candidates.size(), actions.size());
        if (actions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Decision(DecisionType.GUIDELINE_DOSE, params, candidates, actions, true, notices));
    }

    private Optional<Decision> retrieve(String query, Map<String, Object> params, List<String> notices) {
        String expanded = normalizer.expand(query);
        List<String> tokens = ranker.tokenize(expanded);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        List<ScoredEntry> ranked = ranker.query(tokens, topN);
        List<ScoredEntry> candidates = ranked.isEmpty()
            ? reranker.keywordFallback(expanded, topN)
            : reranker.rerank(ranked, expanded);
        log.debug("Retrieval: {} ranked, {} candidates", ranked.size(), candidates.size());

        for (ScoredEntry candidate : candidates) {
            String answer = extractor.extract(candidate.entry.text);
            if (!answer.isEmpty()) {
                RecommendedAction action = new RecommendedAction(answer, null, null, 3, candidate.entry.source);
                return Optional.of(new Decision(DecisionType.RETRIEVAL, params, candidates,
                    List.of(action), true, notices));
            }
        }
        return Optional.empty();
    }

    private String clarifyingQuestion(String query) {
        for (KeywordBranch prompt : policy.dialogue.clarifying) {
            if (prompt.matches(query)) {
                return prompt.text;
            }
        }
        return policy.dialogue.genericClarifying;
    }

    private static Decision verbatim(DecisionType type, Map<String, Object> params, String text,
                                     boolean confident, List<String> notices) {
        return new Decision(type, params, List.of(), List.of(RecommendedAction.of(text, 0)), confident, notices);
    }
}
