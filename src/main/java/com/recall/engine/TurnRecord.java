package com.recall.engine;

import java.time.Instant;

/**
 * TurnRecord - One utterance and what was said back.
 */
public class TurnRecord {

    public final Instant timestamp;
    public final String utterance;
    public final String response;

    public TurnRecord(Instant timestamp, String utterance, String response) {
        this.timestamp = timestamp;
        this.utterance = utterance;
        this.response = response;
    }

    @Override
    public String toString() {
        return String.format("[%s] Input: %s | Response: %s", timestamp, utterance,
            response.length() > 100 ? response.substring(0, 100) + "..." : response);
    }
}
