package com.recall.safety;

import java.util.List;

/**
 * ContraindicationRule - An active condition paired with the drugs it warns about.
 */
public class ContraindicationRule {

    public final String condition;
    public final List<String> triggers;
    public final String warning;

    public ContraindicationRule(String condition, List<String> triggers, String warning) {
        this.condition = condition;
        this.triggers = List.copyOf(triggers);
        this.warning = warning;
    }
}
