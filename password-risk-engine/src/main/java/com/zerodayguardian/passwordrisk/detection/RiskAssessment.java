package com.zerodayguardian.passwordrisk.detection;

import java.util.List;

/**
 * Output of the risk scorer.
 *
 * @param score   risk score in [0.0, 1.0]
 * @param label   label consistent with the score thresholds
 * @param reasons ordered human-readable reasons
 *
 * @author Naveed Gung
 */
public record RiskAssessment(double score, RiskLabel label, List<String> reasons) {

    public RiskAssessment {
        reasons = List.copyOf(reasons);
    }
}
