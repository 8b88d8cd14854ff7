package com.recall.engine;

import com.recall.decision.ClinicalDecisionResolver;
import com.recall.decision.Decision;
import com.recall.patient.ContextUpdate;
import com.recall.patient.PatientContext;
import com.recall.patient.PatientContextUpdater;
import com.recall.patient.VitalReading;
import com.recall.policy.ClinicalPolicy.Phrases;
import com.recall.query.QueryNormalizer;
import com.recall.response.ResponseFormatter;
import com.recall.safety.ContraindicationChecker;
import com.recall.vitals.VitalAssessment;
import com.recall.vitals.VitalSignsAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * RecallEngine - One conversational turn: normalize, update patient context,
 * resolve, check contraindications, format.
 *
 * <p>Stateless apart from the read-only index and policy it was built with, so one
 * engine serves every session. Faults inside a turn become the spoken apology; the
 * context keeps what this turn recorded.
 */
public class RecallEngine {

    private static final Logger log = LoggerFactory.getLogger(RecallEngine.class);

    private final QueryNormalizer normalizer;
    private final PatientContextUpdater updater;
    private final VitalSignsAnalyzer analyzer;
    private final ClinicalDecisionResolver resolver;
    private final ContraindicationChecker checker;
    private final ResponseFormatter formatter;
    private final Phrases phrases;
    private final int criticalStalenessMinutes;

    public RecallEngine(QueryNormalizer normalizer, PatientContextUpdater updater, VitalSignsAnalyzer analyzer,
                        ClinicalDecisionResolver resolver, ContraindicationChecker checker,
                        ResponseFormatter formatter, Phrases phrases, int criticalStalenessMinutes) {
        this.normalizer = normalizer;
        this.updater = updater;
        this.analyzer = analyzer;
        this.resolver = resolver;
        this.checker = checker;
        this.formatter = formatter;
        this.phrases = phrases;
        this.criticalStalenessMinutes = criticalStalenessMinutes;
    }

    public TurnResponse handleTurn(String sessionId, PatientContext context, String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return TurnResponse.of(phrases.emptyUtterance, List.of());
        }
        log.debug("Session {} utterance: '{}'", sessionId, utterance);
        try {
            String query = normalizer.clean(utterance);
            log.debug("Session {} query: '{}'", sessionId, query);

            ContextUpdate update = updater.update(context, query);
            if (update.changed() && !resolver.hasClinicalRequest(query)) {
                return acknowledge(context, update);
            }

            Decision decision = resolver.resolve(context, query);
            String answer = formatter.format(decision);
            List<String> advisories = new ArrayList<>(decision.notices);
            checker.check(query, answer, context.conditions(), context.allergies())
                .ifPresent(advisories::add);
            log.debug("Session {} resolved {}", sessionId, decision);
            return TurnResponse.of(answer, advisories);
        } catch (RuntimeException e) {
            log.error("❌ Turn failed for session {}", sessionId, e);
            return TurnResponse.failure(phrases.apology);
        }
    }

    private TurnResponse acknowledge(PatientContext context, ContextUpdate update) {
        VitalAssessment assessment = analyzer.analyze(context.vitals());
        if (assessment.critical) {
            return TurnResponse.of(analyzer.criticalMessage(assessment) + ".", List.of());
        }
        List<String> parts = new ArrayList<>();
        parts.add("Patient context updated");
        if (update.weightKg != null) {
            parts.add(String.format(Locale.ROOT, "Weight: %.1f kg", update.weightKg));
        }
        if (!update.allergiesAdded.isEmpty()) {
            parts.add("Allergies noted: " + String.join(", ", update.allergiesAdded));
        }
        if (!update.conditionsAdded.isEmpty()) {
            parts.add("Conditions noted: " + String.join(", ", update.conditionsAdded));
        }
        if (!update.vitalsRecorded.isEmpty()) {
            List<String> vitals = new ArrayList<>();
            for (VitalReading reading : update.vitalsRecorded) {
                vitals.add(reading.vital + " " + formatNumber(reading.value));
            }
            parts.add("Vitals recorded: " + String.join(", ", vitals));
        }
        if (update.criticalMarked) {
            String marked = String.format(phrases.criticalMarked, criticalStalenessMinutes);
            parts.add(marked.endsWith(".") ? marked.substring(0, marked.length() - 1) : marked);
        }
        parts.add(phrases.acknowledgmentSuffix);
        return TurnResponse.of(String.join(". ", parts), List.of());
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.format(Locale.ROOT, "%.1f", value);
    }
}
