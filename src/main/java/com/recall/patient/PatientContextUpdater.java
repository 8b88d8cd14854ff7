package com.recall.patient;

import com.recall.policy.ClinicalPolicy.PatientLexicon;
import com.recall.query.TermMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PatientContextUpdater - Pulls weight, allergies, conditions, vitals and the
 * critical flag out of a cleaned query and applies them to the context.
 *
 * <p>Every rule runs on the same query and a rule that finds nothing does nothing.
 * Expects the query after {@code QueryNormalizer.clean}, where unit and vital
 * phrases are already reduced to kg, lb, hr, bp, rr, spo2 and temp.
 */
public class PatientContextUpdater {

    private static final Logger log = LoggerFactory.getLogger(PatientContextUpdater.class);

    public static final String BP_SYSTOLIC = "bp_systolic";
    public static final String BP_DIASTOLIC = "bp_diastolic";

    private static final Pattern WEIGHT = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(kg|lb)(?![a-z])");
    private static final Pattern BLOOD_PRESSURE = Pattern.compile("(?<!\\d)(\\d{2,3})\\s*/\\s*(\\d{2,3})(?!\\d)");
    private static final Map<String, Pattern> SINGLE_VITALS = new LinkedHashMap<>();

    static {
        for (String vital : List.of("hr", "rr", "spo2", "temp")) {
            SINGLE_VITALS.put(vital, Pattern.compile(
                "(?<![a-z])" + vital + "\\s*(?:is|of|at|was)?\\s*(\\d+(?:\\.\\d+)?)"));
        }
    }

    private final PatientLexicon lexicon;
    private final Clock clock;
    private final List<Pattern> criticalPatterns = new ArrayList<>();

    public PatientContextUpdater(PatientLexicon lexicon, Clock clock) {
        this.lexicon = lexicon;
        this.clock = clock;
        for (String cue : lexicon.criticalCues) {
            criticalPatterns.add(Pattern.compile(
                "(?<!not )(?<!no longer )(?<![a-z])" + Pattern.quote(cue) + "(?![a-z])"));
        }
    }

    public ContextUpdate update(PatientContext context, String query) {
        if (query == null || query.isBlank()) {
            return ContextUpdate.none();
        }
        Double weight = extractWeight(query);
        if (weight != null) {
            context.recordWeight(weight);
        }

        List<String> allergies = new ArrayList<>();
        if (TermMatcher.containsAny(query, lexicon.allergyCues)) {
            for (String allergen : lexicon.allergens) {
                if (TermMatcher.contains(query, allergen) && context.addAllergy(allergen)) {
                    allergies.add(allergen);
                }
            }
        }

        List<String> conditions = new ArrayList<>();
        for (Map.Entry<String, List<String>> condition : lexicon.conditions.entrySet()) {
            if (TermMatcher.containsAny(query, condition.getValue()) && context.addCondition(condition.getKey())) {
                conditions.add(condition.getKey());
            }
        }

        List<VitalReading> vitals = extractVitals(context, query, clock.instant());

        boolean critical = false;
        for (Pattern pattern : criticalPatterns) {
            if (pattern.matcher(query).find()) {
                critical = context.markCritical();
                break;
            }
        }

        ContextUpdate update = new ContextUpdate(weight, allergies, conditions, vitals, critical);
        if (update.changed()) {
            log.debug("Patient context updated: {}", update);
        }
        return update;
    }

    Double extractWeight(String query) {
        Matcher m = WEIGHT.matcher(query);
        Double weight = null;
        while (m.find()) {
            double value = Double.parseDouble(m.group(1));
            weight = "lb".equals(m.group(2)) ? value * lexicon.poundsToKg : value;
        }
        return weight;
    }

    private List<VitalReading> extractVitals(PatientContext context, String query, Instant now) {
        List<VitalReading> recorded = new ArrayList<>();
        Matcher bp = BLOOD_PRESSURE.matcher(query);
        if (bp.find()) {
            recorded.add(record(context, BP_SYSTOLIC, Double.parseDouble(bp.group(1)), now));
            recorded.add(record(context, BP_DIASTOLIC, Double.parseDouble(bp.group(2)), now));
        }
        for (Map.Entry<String, Pattern> vital : SINGLE_VITALS.entrySet()) {
            Matcher m = vital.getValue().matcher(query);
            if (m.find()) {
                recorded.add(record(context, vital.getKey(), Double.parseDouble(m.group(1)), now));
            }
        }
        return recorded;
    }

    private static VitalReading record(PatientContext context, String vital, double value, Instant now) {
        context.recordVital(vital, value, now);
        return new VitalReading(now, vital, value);
    }
}
