package com.zerodayguardian.passwordrisk.detection;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discrete risk label derived from the risk score.
 *
 * @author Naveed Gung
 */
public enum RiskLabel {

    LOW, MEDIUM, HIGH;

    static final double MEDIUM_THRESHOLD = 0.34;
    static final double HIGH_THRESHOLD = 0.67;

    /**
     * Map a score in [0, 1] to its label.
     *
     * @param score the clamped risk score
     * @return LOW below 0.34, MEDIUM below 0.67, otherwise HIGH
     */
    public static RiskLabel fromScore(double score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
