package com.recall.vitals;

/**
 * VitalRangeSpec - Normal and critical bounds for one vital sign, with the
 * stabilizing action suggested when a critical bound is crossed.
 */
public class VitalRangeSpec {

    public final String vital;
    public final String label;
    public final String unit;
    public final double min;
    public final double max;
    public final double criticalLow;
    public final double criticalHigh;
    public final String lowAction;     // may be null
    public final String highAction;    // may be null

    public VitalRangeSpec(String vital, String label, String unit, double min, double max,
                          double criticalLow, double criticalHigh, String lowAction, String highAction) {
        this.vital = vital;
        this.label = label;
        this.unit = unit;
        this.min = min;
        this.max = max;
        this.criticalLow = criticalLow;
        this.criticalHigh = criticalHigh;
        this.lowAction = lowAction;
        this.highAction = highAction;
    }

    public boolean isCritical(double value) {
        return value < criticalLow || value > criticalHigh;
    }

    public boolean isAbnormal(double value) {
        return value < min || value > max;
    }

    @Override
    public String toString() {
        return String.format("VitalRangeSpec{%s normal=[%s, %s] critical=[%s, %s]}",
            vital, min, max, criticalLow, criticalHigh);
    }
}
