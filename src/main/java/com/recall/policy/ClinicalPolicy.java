package com.recall.policy;

import com.recall.decision.DecisionTree;
import com.recall.decision.DoseRule;
import com.recall.decision.KeywordBranch;
import com.recall.decision.MedicationRule;
import com.recall.decision.ProcedureRule;
import com.recall.query.ContextualRewriteRule;
import com.recall.query.QueryNormalizer.Correction;
import com.recall.query.QueryNormalizer.Expansion;
import com.recall.safety.ContraindicationRule;
import com.recall.vitals.VitalCaution;
import com.recall.vitals.VitalRangeSpec;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * ClinicalPolicy - Every clinical constant the engine uses, parsed once from the
 * HOCON policy table and immutable afterwards.
 *
 * <p>The classpath {@code clinical-policy.conf} is the baseline; an external file,
 * when given, overrides it key by key.
 */
public class ClinicalPolicy {

    private static final Logger log = LoggerFactory.getLogger(ClinicalPolicy.class);

    public static final String RESOURCE = "clinical-policy.conf";
    private static final String ROOT = "clinical-policy";

    public final List<VitalRangeSpec> vitalRanges;
    public final List<VitalCaution> vitalCautions;
    public final int criticalStalenessMinutes;
    public final int routineStalenessMinutes;
    public final PatientLexicon patient;
    public final List<MedicationRule> medications;
    public final List<ProcedureRule> procedures;
    public final List<DecisionTree> decisionTrees;
    public final List<String> guidelineKeywords;
    public final List<ContraindicationRule> contraindications;
    public final List<Correction> corrections;
    public final List<ContextualRewriteRule> contextualRewrites;
    public final List<Expansion> expansions;
    public final RerankerLexicon reranker;
    public final KeywordFallback keywordFallback;
    public final RetrievalRules retrieval;
    public final GuidelineDosing guidelineDosing;
    public final Dialogue dialogue;
    public final FormatterRules formatter;
    public final Phrases phrases;

    private ClinicalPolicy(Config c) {
        this.vitalRanges = parseRanges(c);
        Set<String> knownVitals = vitalRanges.stream().map(r -> r.vital).collect(Collectors.toSet());
        this.vitalCautions = parseCautions(c, knownVitals);
        this.criticalStalenessMinutes = c.getInt("vitals.staleness.critical-minutes");
        this.routineStalenessMinutes = c.getInt("vitals.staleness.routine-minutes");
        this.patient = new PatientLexicon(c.getConfig("patient"));
        this.medications = parseMedications(c);
        this.procedures = parseProcedures(c);
        this.decisionTrees = parseTrees(c);
        this.guidelineKeywords = c.getStringList("decision-trees.guideline-keywords");
        this.contraindications = c.getConfigList("contraindications").stream()
            .map(r -> new ContraindicationRule(r.getString("condition"), r.getStringList("triggers"),
                r.getString("warning")))
            .collect(Collectors.toUnmodifiableList());
        this.corrections = c.getConfigList("normalizer.corrections").stream()
            .map(r -> new Correction(r.getString("from"), r.getString("to")))
            .collect(Collectors.toUnmodifiableList());
        this.contextualRewrites = c.getConfigList("normalizer.contextual-rewrites").stream()
            .map(r -> new ContextualRewriteRule(r.getString("token"), r.getString("replacement"),
                r.getStringList("indicators")))
            .collect(Collectors.toUnmodifiableList());
        this.expansions = c.getConfigList("normalizer.expansions").stream()
            .map(r -> new Expansion(r.getString("trigger"), r.getStringList("terms")))
            .collect(Collectors.toUnmodifiableList());
        this.reranker = new RerankerLexicon(c.getConfig("reranker"));
        this.keywordFallback = new KeywordFallback(c.getConfig("keyword-fallback"));
        this.retrieval = new RetrievalRules(c.getConfig("retrieval"));
        this.guidelineDosing = new GuidelineDosing(c.getConfig("guideline-dosing"));
        this.dialogue = new Dialogue(c.getConfig("dialogue"));
        this.formatter = new FormatterRules(c.getConfig("formatter"));
        this.phrases = new Phrases(c.getConfig("phrases"));
    }

    /** Loads the classpath policy table. */
    public static ClinicalPolicy load() {
        return load(Optional.empty());
    }

    public static ClinicalPolicy load(Optional<Path> externalFile) {
        Config base = ConfigFactory.parseResources(ClinicalPolicy.class.getClassLoader(), RESOURCE);
        Config config = base;
        if (externalFile.isPresent()) {
            Path file = externalFile.get();
            if (!Files.isRegularFile(file)) {
                throw new PolicyException("Clinical policy file not found: " + file);
            }
            log.info("📋 Loading clinical policy overrides from {}", file);
            config = ConfigFactory.parseFile(file.toFile()).withFallback(base);
        }
        return fromConfig(config);
    }

    public static ClinicalPolicy fromConfig(Config config) {
        try {
            Config resolved = config.resolve();
            if (!resolved.hasPath(ROOT)) {
                throw new PolicyException("Clinical policy table has no '" + ROOT + "' block");
            }
            ClinicalPolicy policy = new ClinicalPolicy(resolved.getConfig(ROOT));
            log.info("📋 Clinical policy loaded: {} vitals, {} medications, {} procedures, {} trees",
                policy.vitalRanges.size(), policy.medications.size(),
                policy.procedures.size(), policy.decisionTrees.size());
            return policy;
        } catch (ConfigException e) {
            throw new PolicyException("Malformed clinical policy: " + e.getMessage(), e);
        }
    }

    public Optional<VitalRangeSpec> rangeFor(String vital) {
        return vitalRanges.stream().filter(r -> r.vital.equals(vital)).findFirst();
    }

    public Optional<DecisionTree> treeFor(String scenario) {
        return decisionTrees.stream().filter(t -> t.scenario.equals(scenario)).findFirst();
    }

    // ========== PARSING ==========

    private static List<VitalRangeSpec> parseRanges(Config c) {
        List<VitalRangeSpec> ranges = new ArrayList<>();
        for (Config r : c.getConfigList("vitals.ranges")) {
            String vital = r.getString("vital");
            ranges.add(new VitalRangeSpec(
                vital,
                optString(r, "label", vital.toUpperCase()),
                optString(r, "unit", ""),
                r.getDouble("min"),
                r.getDouble("max"),
                r.getDouble("critical-low"),
                r.getDouble("critical-high"),
                optString(r, "low-action", null),
                optString(r, "high-action", null)));
        }
        if (ranges.isEmpty()) {
            throw new PolicyException("Clinical policy defines no vital ranges");
        }
        return Collections.unmodifiableList(ranges);
    }

    private static List<VitalCaution> parseCautions(Config c, Set<String> knownVitals) {
        List<VitalCaution> cautions = new ArrayList<>();
        for (Config r : c.getConfigList("vitals.cautions")) {
            String vital = r.getString("vital");
            if (!knownVitals.contains(vital)) {
                throw new PolicyException("Vital caution refers to unknown vital: " + vital);
            }
            cautions.add(new VitalCaution(vital,
                r.hasPath("above") ? r.getDouble("above") : null,
                r.hasPath("below") ? r.getDouble("below") : null,
                r.getStringList("triggers"),
                r.getString("message")));
        }
        return Collections.unmodifiableList(cautions);
    }

    private static List<MedicationRule> parseMedications(Config c) {
        List<MedicationRule> medications = new ArrayList<>();
        for (Config m : c.getConfigList("medications")) {
            List<DoseRule> doses = new ArrayList<>();
            for (Config d : m.getConfigList("doses")) {
                doses.add(new DoseRule(
                    d.getString("intent"),
                    d.hasPath("keywords") ? d.getStringList("keywords") : List.of(),
                    d.hasPath("rate-per-kg") ? d.getDouble("rate-per-kg") : null,
                    d.getString("unit"),
                    d.getString("route"),
                    optString(d, "rate-text", null),
                    optString(d, "dose-note", ""),
                    d.getString("population")));
            }
            String name = m.getString("name");
            if (doses.isEmpty()) {
                throw new PolicyException("Medication has no dose rules: " + name);
            }
            medications.add(new MedicationRule(name, m.getStringList("triggers"), doses));
        }
        return Collections.unmodifiableList(medications);
    }

    private static List<ProcedureRule> parseProcedures(Config c) {
        List<ProcedureRule> procedures = new ArrayList<>();
        for (Config p : c.getConfigList("procedures")) {
            int priority = p.getInt("priority");
            List<KeywordBranch> branches = p.getConfigList("branches").stream()
                .map(b -> new KeywordBranch(b.getStringList("keywords"), b.getString("text"),
                    b.hasPath("priority") ? b.getInt("priority") : priority))
                .collect(Collectors.toList());
            procedures.add(new ProcedureRule(
                p.getString("scenario"),
                p.getStringList("triggers"),
                priority,
                p.hasPath("prefer-tree") && p.getBoolean("prefer-tree"),
                branches,
                p.getString("default")));
        }
        return Collections.unmodifiableList(procedures);
    }

    private static List<DecisionTree> parseTrees(Config c) {
        List<DecisionTree> trees = new ArrayList<>();
        for (Config t : c.getConfigList("decision-trees.trees")) {
            List<KeywordBranch> branches = t.getConfigList("branches").stream()
                .map(ClinicalPolicy::branch)
                .collect(Collectors.toList());
            Config def = t.getConfig("default");
            trees.add(new DecisionTree(
                t.getString("scenario"),
                t.getStringList("triggers"),
                branches,
                new KeywordBranch(List.of(), def.getString("text"), def.getInt("priority"))));
        }
        return Collections.unmodifiableList(trees);
    }

    private static KeywordBranch branch(Config b) {
        return new KeywordBranch(b.getStringList("keywords"), b.getString("text"), b.getInt("priority"));
    }

    private static String optString(Config c, String path, String fallback) {
        return c.hasPath(path) ? c.getString(path) : fallback;
    }

    // ========== SECTIONS ==========

    /** Words that carry patient data. */
    public static class PatientLexicon {
        public final double poundsToKg;
        public final List<String> allergyCues;
        public final List<String> allergens;
        public final List<String> criticalCues;
        public final Map<String, List<String>> conditions;

        PatientLexicon(Config c) {
            this.poundsToKg = c.getDouble("pounds-to-kg");
            this.allergyCues = c.getStringList("allergy-cues");
            this.allergens = c.getStringList("allergens");
            this.criticalCues = c.getStringList("critical-cues");
            Map<String, List<String>> table = new LinkedHashMap<>();
            for (Config condition : c.getConfigList("conditions")) {
                table.put(condition.getString("name"), condition.getStringList("keywords"));
            }
            this.conditions = Collections.unmodifiableMap(table);
        }
    }

    /** Score adjustments that favor actionable text over headers. */
    public static class RerankerLexicon {
        public final Pattern dosagePattern;
        public final List<String> medications;
        public final List<String> actionVerbs;
        public final List<String> boilerplate;
        public final int shortTextChars;
        public final double dosageWeight;
        public final double medicationWeight;
        public final double actionVerbWeight;
        public final double boilerplateWeight;
        public final double shortTextWeight;

        RerankerLexicon(Config c) {
            this.dosagePattern = compile(c.getString("dosage-pattern"));
            this.medications = c.getStringList("medications");
            this.actionVerbs = c.getStringList("action-verbs");
            this.boilerplate = c.getStringList("boilerplate");
            this.shortTextChars = c.getInt("short-text-chars");
            this.dosageWeight = c.getDouble("weights.dosage");
            this.medicationWeight = c.getDouble("weights.medication");
            this.actionVerbWeight = c.getDouble("weights.action-verb");
            this.boilerplateWeight = c.getDouble("weights.boilerplate");
            this.shortTextWeight = c.getDouble("weights.short-text");
        }
    }

    /** Keyword-overlap scoring used when the ranker finds nothing. */
    public static class KeywordFallback {
        public final double textWeight;
        public final double sourceWeight;
        public final double sectionWeight;
        public final double variationWeight;
        public final Map<String, List<String>> variations;

        KeywordFallback(Config c) {
            this.textWeight = c.getDouble("weights.text");
            this.sourceWeight = c.getDouble("weights.source");
            this.sectionWeight = c.getDouble("weights.section");
            this.variationWeight = c.getDouble("weights.variation");
            Map<String, List<String>> table = new LinkedHashMap<>();
            for (Config v : c.getConfigList("variations")) {
                table.put(v.getString("term"), v.getStringList("variations"));
            }
            this.variations = Collections.unmodifiableMap(table);
        }
    }

    public static class RetrievalRules {
        public final List<String> actionVerbs;
        public final int maxAnswerChars;
        public final List<Pattern> boilerplatePatterns;

        RetrievalRules(Config c) {
            this.actionVerbs = c.getStringList("action-verbs");
            this.maxAnswerChars = c.getInt("max-answer-chars");
            this.boilerplatePatterns = c.getStringList("boilerplate-patterns").stream()
                .map(ClinicalPolicy::compile)
                .collect(Collectors.toUnmodifiableList());
        }
    }

    /** Bounds for mg/kg ranges read from guideline passages. */
    public static class GuidelineDosing {
        public final List<String> medications;
        public final Set<String> categories;
        public final double minRatePerKg;
        public final double maxRatePerKg;
        public final String route;
        public final String weightNeeded;

        GuidelineDosing(Config c) {
            this.medications = c.getStringList("medications");
            this.categories = Set.copyOf(c.getStringList("categories"));
            this.minRatePerKg = c.getDouble("min-rate-per-kg");
            this.maxRatePerKg = c.getDouble("max-rate-per-kg");
            this.route = c.getString("route");
            this.weightNeeded = c.getString("weight-needed");
            if (minRatePerKg <= 0 || maxRatePerKg < minRatePerKg) {
                throw new PolicyException("Guideline dosing bounds out of range");
            }
        }
    }

    public static class Dialogue {
        public final List<String> requestCues;
        public final List<String> vitalsSummaryCues;
        public final List<KeywordBranch> clarifying;
        public final String genericClarifying;

        Dialogue(Config c) {
            this.requestCues = c.getStringList("request-cues");
            this.vitalsSummaryCues = c.getStringList("vitals-summary-cues");
            this.clarifying = c.getConfigList("clarifying").stream()
                .map(b -> new KeywordBranch(b.getStringList("keywords"), b.getString("text"), 0))
                .collect(Collectors.toUnmodifiableList());
            this.genericClarifying = c.getString("generic-clarifying");
        }
    }

    public static class FormatterRules {
        public final int maxActions;
        public final int maxDescriptionChars;
        public final String emptyText;

        FormatterRules(Config c) {
            this.maxActions = c.getInt("max-actions");
            this.maxDescriptionChars = c.getInt("max-description-chars");
            this.emptyText = c.getString("empty");
            if (maxActions < 1 || maxDescriptionChars < 4) {
                throw new PolicyException("Formatter limits out of range");
            }
        }
    }

    /** Fixed sentences spoken by the engine. Those with %d or %s are format strings. */
    public static class Phrases {
        public final String acknowledgmentSuffix;
        public final String missingVitals;
        public final String staleCritical;
        public final String staleRoutine;
        public final String criticalMarked;
        public final String stabilizeFirst;
        public final String vitalsAcceptable;
        public final String noVitalsSummary;
        public final String allergyWarning;
        public final String apology;
        public final String emptyUtterance;

        Phrases(Config c) {
            this.acknowledgmentSuffix = c.getString("acknowledgment-suffix");
            this.missingVitals = c.getString("missing-vitals");
            this.staleCritical = c.getString("stale-critical");
            this.staleRoutine = c.getString("stale-routine");
            this.criticalMarked = c.getString("critical-marked");
            this.stabilizeFirst = c.getString("stabilize-first");
            this.vitalsAcceptable = c.getString("vitals-acceptable");
            this.noVitalsSummary = c.getString("no-vitals-summary");
            this.allergyWarning = c.getString("allergy-warning");
            this.apology = c.getString("apology");
            this.emptyUtterance = c.getString("empty-utterance");
        }
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new PolicyException("Invalid pattern in clinical policy: " + regex, e);
        }
    }
}
