package com.recall.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusStoreTest {

    private static final List<CorpusLevel> LEVELS = List.of(
        new CorpusLevel("comprehensive", "comprehensive.json"),
        new CorpusLevel("focused", "focused.json"),
        new CorpusLevel("legacy", "legacy.jsonl"));

    @TempDir
    Path dir;

    private void write(String file, String content) throws IOException {
        Files.write(dir.resolve(file), content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void highestPriorityLevelPresentWins() throws IOException {
        write("focused.json", "[{\"text\": \"Apply tourniquet.\", \"source\": \"TCCC\"}]");
        write("legacy.jsonl", "{\"text\": \"Old guidance.\"}\n");

        CorpusStore store = CorpusStore.load(dir, LEVELS);

        assertEquals("focused", store.level().name);
        assertEquals(1, store.size());
        assertEquals("TCCC", store.entries().get(0).source);
    }

    @Test
    void missingFieldsTakeDefaultsAndCategoryFallsBackToList() throws IOException {
        write("comprehensive.json", "[{\"text\": \"Give fluids.\", \"categories\": [\"shock\", \"fluids\"]},"
            + "{\"text\": \"Check pulse.\", \"category\": \"circulation\", \"page\": 7, \"priority_score\": 2.5}]");

        List<CorpusEntry> entries = CorpusStore.load(dir, LEVELS).entries();

        CorpusEntry first = entries.get(0);
        assertEquals("shock", first.category);
        assertEquals("", first.source);
        assertEquals(0, first.page);
        assertEquals(0.0, first.priorityScore);
        CorpusEntry second = entries.get(1);
        assertEquals("circulation", second.category);
        assertEquals(7, second.page);
        assertEquals(2.5, second.priorityScore);
    }

    @Test
    void jsonLinesArtifactSkipsBlankLinesAndEmptyText() throws IOException {
        write("legacy.jsonl", "{\"text\": \"Splint the limb.\"}\n\n{\"text\": \"   \"}\n{\"text\": \"Monitor airway.\"}\n");

        CorpusStore store = CorpusStore.load(dir, LEVELS);

        assertEquals("legacy", store.level().name);
        assertEquals(2, store.size());
        assertEquals("Monitor airway.", store.entries().get(1).text);
    }

    @Test
    void noArtifactFails() {
        CorpusUnavailableException e = assertThrows(CorpusUnavailableException.class,
            () -> CorpusStore.load(dir, LEVELS));

        assertTrue(e.getMessage().contains("No corpus found"));
    }

    @Test
    void artifactWithoutUsableEntriesFails() throws IOException {
        write("comprehensive.json", "[{\"text\": \"\"}, {\"source\": \"x\"}]");

        assertThrows(CorpusUnavailableException.class, () -> CorpusStore.load(dir, LEVELS));
    }

    @Test
    void nonArrayJsonIsRejected() throws IOException {
        write("comprehensive.json", "{\"text\": \"not a list\"}");

        assertThrows(IOException.class, () -> CorpusStore.load(dir, LEVELS));
    }

    @Test
    void entriesAreReadOnly() throws IOException {
        write("focused.json", "[{\"text\": \"Apply tourniquet.\"}]");

        List<CorpusEntry> entries = CorpusStore.load(dir, LEVELS).entries();

        assertThrows(UnsupportedOperationException.class, () -> entries.add(entries.get(0)));
    }
}
