package com.recall.retrieval;

/**
 * CorpusEntry - One indexed unit of guideline text with its source metadata.
 * Immutable after load.
 */
public class CorpusEntry {

    public final String text;
    public final String source;
    public final String section;
    public final String category;
    public final int page;
    public final double priorityScore;

    public CorpusEntry(String text, String source, String section, String category,
                       int page, double priorityScore) {
        this.text = text;
        this.source = source;
        this.section = section;
        this.category = category;
        this.page = page;
        this.priorityScore = priorityScore;
    }

    @Override
    public String toString() {
        return String.format("CorpusEntry{source='%s', section='%s', category='%s', page=%d}",
            source, section, category, page);
    }
}
