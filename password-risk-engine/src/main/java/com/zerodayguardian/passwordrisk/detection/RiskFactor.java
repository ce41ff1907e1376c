package com.zerodayguardian.passwordrisk.detection;

/**
 * One weighted heuristic signal extracted from a password.
 *
 * @param name      stable factor identifier
 * @param weight    fixed weight in [0.0, 1.0]
 * @param triggered whether the detection rule fired
 * @param detail    deterministic human-readable explanation
 * @param polarity  whether firing raises or lowers the risk
 *
 * @author Naveed Gung
 */
public record RiskFactor(
        String name,
        double weight,
        boolean triggered,
        String detail,
        Polarity polarity) {

    public enum Polarity {
        /** Firing adds the weight. */
        RISK,
        /** Firing subtracts the weight; not firing adds it. */
        STRENGTH
    }

    /** Factory for a factor that raises risk when triggered. */
    public static RiskFactor risk(String name, double weight, boolean triggered, String detail) {
        return new RiskFactor(name, weight, triggered, detail, Polarity.RISK);
    }

    /** Factory for a factor that lowers risk when triggered. */
    public static RiskFactor strength(String name, double weight, boolean triggered, String detail) {
        return new RiskFactor(name, weight, triggered, detail, Polarity.STRENGTH);
    }

    /** Signed amount this factor adds to the score accumulator. */
    public double contribution() {
        if (polarity == Polarity.STRENGTH) {
            return triggered ? -weight : weight;
        }
        return triggered ? weight : 0.0;
    }

    /** True when the factor moved the score and so deserves a reason. */
    public boolean affectsScore() {
        return contribution() != 0.0;
    }
}
