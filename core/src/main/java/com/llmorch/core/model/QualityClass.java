package com.llmorch.core.model;

import com.llmorch.core.crd.SlaSpec;

/**
 * Service quality tier derived from a workload's SLA.
 */
public enum QualityClass {
    PREMIUM("premium"),
    STANDARD("standard"),
    BASIC("basic");

    private final String label;

    QualityClass(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * premium: availability >= 99.9 and p95 <= 100 ms;
     * standard: availability >= 99.5 and p95 <= 500 ms;
     * basic otherwise. Missing values never qualify for a higher tier.
     */
    public static QualityClass fromSla(SlaSpec sla) {
        if (sla == null || sla.getAvailability() == null || sla.getP95ResponseTimeMs() == null) {
            return BASIC;
        }
        double availability = sla.getAvailability();
        double p95 = sla.getP95ResponseTimeMs();
        if (availability >= 99.9 && p95 <= 100) {
            return PREMIUM;
        }
        if (availability >= 99.5 && p95 <= 500) {
            return STANDARD;
        }
        return BASIC;
    }

    public static QualityClass fromLabel(String label) {
        for (QualityClass qc : values()) {
            if (qc.label.equalsIgnoreCase(label)) {
                return qc;
            }
        }
        throw new IllegalArgumentException("Unknown quality class: " + label);
    }
}
