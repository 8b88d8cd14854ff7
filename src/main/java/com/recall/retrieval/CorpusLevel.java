package com.recall.retrieval;

/**
 * CorpusLevel - A named corpus artifact, tried in priority order at startup.
 */
public class CorpusLevel {

    public final String name;
    public final String fileName;

    public CorpusLevel(String name, String fileName) {
        this.name = name;
        this.fileName = fileName;
    }

    @Override
    public String toString() {
        return name + " (" + fileName + ")";
    }
}
