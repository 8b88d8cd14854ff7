package com.recall.config;

import com.recall.retrieval.CorpusLevel;
import com.recall.retrieval.LexicalRanker;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.cdimascio.dotenv.Dotenv;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * EngineSettings - Runtime settings from application.conf ({@code recall} block),
 * with RECALL_CORPUS_DIR, RECALL_TOP_N and RECALL_POLICY_FILE overrides taken
 * from the environment or a .env file.
 */
public class EngineSettings {

    public final Path corpusDirectory;
    public final List<CorpusLevel> corpusLevels;
    public final LexicalRanker.Settings ranker;
    public final int topN;
    public final Optional<Path> policyFile;
    public final int historySize;
    public final Duration askTimeout;

    public EngineSettings(Path corpusDirectory, List<CorpusLevel> corpusLevels, LexicalRanker.Settings ranker,
                          int topN, Optional<Path> policyFile, int historySize, Duration askTimeout) {
        this.corpusDirectory = corpusDirectory;
        this.corpusLevels = List.copyOf(corpusLevels);
        this.ranker = ranker;
        this.topN = topN;
        this.policyFile = policyFile;
        this.historySize = historySize;
        this.askTimeout = askTimeout;
    }

    public static EngineSettings load() {
        return fromConfig(ConfigFactory.load(), Dotenv.configure().ignoreIfMissing().load());
    }

    public static EngineSettings fromConfig(Config root, Dotenv d) {
        Config c = root.getConfig("recall");
        String corpusDir = d.get("RECALL_CORPUS_DIR", c.getString("corpus.directory"));
        int topN = Integer.parseInt(d.get("RECALL_TOP_N", String.valueOf(c.getInt("ranker.top-n"))));
        String policy = d.get("RECALL_POLICY_FILE", c.getString("policy-file"));

        List<CorpusLevel> levels = c.getConfigList("corpus.levels").stream()
            .map(l -> new CorpusLevel(l.getString("name"), l.getString("file")))
            .collect(Collectors.toList());
        LexicalRanker.Settings ranker = new LexicalRanker.Settings(
            c.getDouble("ranker.k1"),
            c.getDouble("ranker.b"),
            c.getDouble("ranker.epsilon"),
            c.getBoolean("ranker.stop-words"));

        return new EngineSettings(
            Paths.get(corpusDir),
            levels,
            ranker,
            topN,
            policy == null || policy.isBlank() ? Optional.empty() : Optional.of(Paths.get(policy)),
            c.getInt("session.history-size"),
            c.getDuration("ask-timeout"));
    }

    @Override
    public String toString() {
        return String.format("EngineSettings{corpusDir='%s', levels=%s, ranker=%s, topN=%d, policy=%s, history=%d}",
            corpusDirectory, corpusLevels, ranker, topN, policyFile.map(Path::toString).orElse("classpath"),
            historySize);
    }
}
