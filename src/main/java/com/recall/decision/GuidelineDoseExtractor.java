package com.recall.decision;

import com.recall.policy.ClinicalPolicy.GuidelineDosing;
import com.recall.query.TermMatcher;
import com.recall.retrieval.ScoredEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GuidelineDoseExtractor - Reads per-kilogram rates such as "ketamine 0.5 to 1 mg/kg"
 * or "1-2 mg/kg ketamine" out of retrieved passages and scales them by the recorded
 * weight. Rates outside the policy bounds are skipped as misreads.
 */
public class GuidelineDoseExtractor {

    private static final Logger log = LoggerFactory.getLogger(GuidelineDoseExtractor.class);

    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";
    private static final String RANGE = NUMBER + "\\s*(?:to|-)\\s*" + NUMBER;
    // a lone rate must not be the upper end of a range
    private static final String LONE = "(?<![\\d.\\-])(?<!to )(?<!- )" + NUMBER;

    private final GuidelineDosing dosing;
    private final Map<String, List<Pattern>> patterns = new LinkedHashMap<>();

    public GuidelineDoseExtractor(GuidelineDosing dosing) {
        this.dosing = dosing;
        for (String medication : dosing.medications) {
            String name = Pattern.quote(medication);
            patterns.put(medication, List.of(
                Pattern.compile("\\b" + name + "\\s*\\(?\\s*" + RANGE + "\\s*mg/kg"),
                Pattern.compile(RANGE + "\\s*mg/kg\\s*(?:of\\s+)?" + name + "\\b"),
                Pattern.compile("\\b" + name + "\\s*\\(?\\s*" + NUMBER + "\\s*mg/kg"),
                Pattern.compile(LONE + "\\s*mg/kg\\s*(?:of\\s+)?" + name + "\\b")));
        }
    }

    /** One action per passage and named medication, in candidate order. */
    public List<RecommendedAction> extract(List<ScoredEntry> candidates, String query, Double weightKg) {
        List<String> named = new ArrayList<>();
        for (String medication : dosing.medications) {
            if (TermMatcher.contains(query, medication)) {
                named.add(medication);
            }
        }
        if (named.isEmpty()) {
            return List.of();
        }
        List<RecommendedAction> actions = new ArrayList<>();
        for (ScoredEntry candidate : candidates) {
            String text = candidate.entry.text.toLowerCase(Locale.ROOT);
            for (String medication : named) {
                readRate(medication, text).ifPresent(rate ->
                    actions.add(action(medication, rate, weightKg, candidate.entry.source)));
            }
        }
        return actions;
    }

    Optional<RateRange> readRate(String medication, String text) {
        for (Pattern pattern : patterns.getOrDefault(medication, List.of())) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                double low = Double.parseDouble(m.group(1));
                double high = m.groupCount() > 1 ? Double.parseDouble(m.group(2)) : low;
                if (low >= dosing.minRatePerKg && high <= dosing.maxRatePerKg && low <= high) {
                    return Optional.of(new RateRange(low, high));
                }
                log.debug("Skipping implausible {} rate {}-{} mg/kg", medication, low, high);
            }
        }
        return Optional.empty();
    }

    private RecommendedAction action(String medication, RateRange rate, Double weightKg, String source) {
        String rateText = String.format("%s %s mg/kg %s", capitalize(medication), rate, dosing.route);
        if (weightKg == null) {
            return new RecommendedAction(rateText + ". " + dosing.weightNeeded, medication, null, 5, source);
        }
        long low = Math.round(rate.low * weightKg);
        long high = Math.round(rate.high * weightKg);
        String dose = (low == high ? String.valueOf(low) : low + "-" + high) + "mg";
        String text = String.format("%s. For %dkg patient: %s %s.", rateText, Math.round(weightKg), dose, dosing.route);
        return new RecommendedAction(text, medication, dose, 5, source);
    }

    private static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    /** Per-kilogram rate, a single value when low equals high. */
    static class RateRange {
        final double low;
        final double high;

        RateRange(double low, double high) {
            this.low = low;
            this.high = high;
        }

        private static String plain(double value) {
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }

        @Override
        public String toString() {
            return low == high ? plain(low) : plain(low) + "-" + plain(high);
        }
    }
}
