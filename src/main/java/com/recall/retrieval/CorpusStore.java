package com.recall.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CorpusStore - Immutable, ordered guideline corpus loaded once at startup.
 *
 * <p>A {@code .json} artifact holds a JSON array of entries, a {@code .jsonl}
 * artifact one entry per line. Entries without text are skipped.
 */
public class CorpusStore {

    private static final Logger log = LoggerFactory.getLogger(CorpusStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CorpusLevel level;
    private final List<CorpusEntry> entries;

    public CorpusStore(CorpusLevel level, List<CorpusEntry> entries) {
        this.level = level;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * Loads the first level whose file exists under {@code directory}.
     *
     * @throws CorpusUnavailableException if no level exists or the chosen one is empty
     */
    public static CorpusStore load(Path directory, List<CorpusLevel> levels) throws IOException {
        for (CorpusLevel level : levels) {
            Path file = directory.resolve(level.fileName);
            if (!Files.isRegularFile(file)) {
                log.debug("Corpus level {} not present at {}", level.name, file);
                continue;
            }
            log.info("📚 Loading {} corpus from {}", level.name, file);
            List<CorpusEntry> entries = readEntries(file);
            if (entries.isEmpty()) {
                throw new CorpusUnavailableException(
                    "Corpus level " + level.name + " at " + file + " holds no usable entries");
            }
            CorpusStore store = new CorpusStore(level, entries);
            store.logStatistics();
            return store;
        }
        throw new CorpusUnavailableException(
            "No corpus found in " + directory + ". Tried: " + levels);
    }

    static List<CorpusEntry> readEntries(Path file) throws IOException {
        List<CorpusEntry> entries = new ArrayList<>();
        if (file.getFileName().toString().endsWith(".jsonl")) {
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.trim().isEmpty()) continue;
                    addEntry(entries, MAPPER.readTree(line));
                }
            }
        } else {
            JsonNode root = MAPPER.readTree(file.toFile());
            if (root == null || !root.isArray()) {
                throw new IOException("Corpus file is not a JSON array: " + file);
            }
            root.forEach(node -> addEntry(entries, node));
        }
        return entries;
    }

    private static void addEntry(List<CorpusEntry> entries, JsonNode json) {
        String text = json.path("text").asText("").trim();
        if (text.isEmpty()) {
            return;
        }
        String category = json.path("category").asText("");
        if (category.isEmpty() && json.path("categories").isArray() && json.get("categories").size() > 0) {
            category = json.get("categories").get(0).asText("");
        }
        entries.add(new CorpusEntry(
            text,
            json.path("source").asText(""),
            json.path("section").asText(""),
            category,
            json.path("page").asInt(0),
            json.path("priority_score").asDouble(0.0)));
    }

    private void logStatistics() {
        Map<String, Integer> categories = new LinkedHashMap<>();
        for (CorpusEntry entry : entries) {
            String category = entry.category.isEmpty() ? "uncategorized" : entry.category;
            categories.merge(category, 1, Integer::sum);
        }
        log.info("📚 Corpus ready: {} entries from level '{}'", entries.size(), level.name);
        categories.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .forEach(e -> log.info("   {}: {}", e.getKey(), e.getValue()));
    }

    public CorpusLevel level() {
        return level;
    }

    public List<CorpusEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }
}
