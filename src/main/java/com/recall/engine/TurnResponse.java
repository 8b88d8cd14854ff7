package com.recall.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * TurnResponse - What the engine says for one utterance: the answer, then any
 * advisories (vital cautions, contraindication or allergy warnings, vitals requests).
 */
public class TurnResponse {

    public final String answer;
    public final List<String> advisories;
    public final String spokenText;
    public final boolean failed;

    public TurnResponse(String answer, List<String> advisories, boolean failed) {
        this.answer = answer;
        this.advisories = List.copyOf(advisories);
        this.spokenText = compose(answer, this.advisories);
        this.failed = failed;
    }

    public static TurnResponse of(String answer, List<String> advisories) {
        return new TurnResponse(answer, advisories, false);
    }

    public static TurnResponse failure(String apology) {
        return new TurnResponse(apology, List.of(), true);
    }

    private static String compose(String answer, List<String> advisories) {
        List<String> parts = new ArrayList<>();
        parts.add(answer);
        for (String advisory : advisories) {
            parts.add(advisory.endsWith(".") ? advisory : advisory + ".");
        }
        return String.join(" ", parts);
    }

    @Override
    public String toString() {
        return spokenText;
    }
}
