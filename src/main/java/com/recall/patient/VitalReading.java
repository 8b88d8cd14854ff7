package com.recall.patient;

import java.time.Instant;

/**
 * VitalReading - One entry of the append-only vital history.
 */
public class VitalReading {

    public final Instant timestamp;
    public final String vital;
    public final double value;

    public VitalReading(Instant timestamp, String vital, double value) {
        this.timestamp = timestamp;
        this.vital = vital;
        this.value = value;
    }

    @Override
    public String toString() {
        return String.format("%s=%s @ %s", vital, value, timestamp);
    }
}
