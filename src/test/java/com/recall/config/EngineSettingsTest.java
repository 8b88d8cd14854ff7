package com.recall.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.ConfigFactory;
import io.github.cdimascio.dotenv.Dotenv;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineSettingsTest {

    @TempDir
    Path dir;

    private Dotenv dotenv() {
        return Dotenv.configure().directory(dir.toString()).ignoreIfMissing().load();
    }

    @Test
    void defaultsComeFromApplicationConf() {
        EngineSettings settings = EngineSettings.fromConfig(ConfigFactory.load(), dotenv());

        assertEquals(Paths.get("data"), settings.corpusDirectory);
        assertEquals(3, settings.corpusLevels.size());
        assertEquals("comprehensive", settings.corpusLevels.get(0).name);
        assertEquals(1.5, settings.ranker.k1);
        assertEquals(0.75, settings.ranker.b);
        assertEquals(5, settings.topN);
        assertTrue(settings.policyFile.isEmpty());
        assertEquals(10, settings.historySize);
        assertEquals(Duration.ofSeconds(5), settings.askTimeout);
    }

    @Test
    void dotenvOverridesCorpusTopNAndPolicy() throws IOException {
        Files.write(dir.resolve(".env"),
            "RECALL_CORPUS_DIR=/srv/corpus\nRECALL_TOP_N=8\nRECALL_POLICY_FILE=/etc/recall/policy.conf\n"
                .getBytes(StandardCharsets.UTF_8));

        EngineSettings settings = EngineSettings.fromConfig(ConfigFactory.load(), dotenv());

        assertEquals(Paths.get("/srv/corpus"), settings.corpusDirectory);
        assertEquals(8, settings.topN);
        assertEquals(Paths.get("/etc/recall/policy.conf"), settings.policyFile.orElseThrow());
    }

    @Test
    void configValuesCanBeReplaced() {
        EngineSettings settings = EngineSettings.fromConfig(
            ConfigFactory.parseString("recall.ranker.k1 = 1.2\nrecall.session.history-size = 4")
                .withFallback(ConfigFactory.load()),
            dotenv());

        assertEquals(1.2, settings.ranker.k1);
        assertEquals(4, settings.historySize);
    }
}
