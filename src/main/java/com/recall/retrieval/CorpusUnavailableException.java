package com.recall.retrieval;

/**
 * CorpusUnavailableException - No corpus level exists, or the chosen one holds no
 * usable entries. The engine refuses to start.
 */
public class CorpusUnavailableException extends RuntimeException {

    public CorpusUnavailableException(String message) {
        super(message);
    }
}
