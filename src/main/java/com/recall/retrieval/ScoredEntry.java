package com.recall.retrieval;

/**
 * ScoredEntry - A corpus entry with its score and its position in corpus order.
 */
public class ScoredEntry {

    public final CorpusEntry entry;
    public final int index;
    public final double score;

    public ScoredEntry(CorpusEntry entry, int index, double score) {
        this.entry = entry;
        this.index = index;
        this.score = score;
    }

    public ScoredEntry withScore(double newScore) {
        return new ScoredEntry(entry, index, newScore);
    }

    @Override
    public String toString() {
        return String.format("ScoredEntry{#%d, score=%.3f, source='%s'}", index, score, entry.source);
    }
}
