package com.zerodayguardian.passwordrisk.detection;

import com.zerodayguardian.passwordrisk.breach.BreachResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines extracted factors and breach flags into a score, label and
 * reasons.
 *
 * <p>
 * Factor contributions are summed and the total is clamped to [0, 1] once.
 * A breach hit from either source lifts the score to at least
 * {@value #BREACH_SCORE_FLOOR} and the label to HIGH.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class RiskScorer {

    public static final double BREACH_SCORE_FLOOR = 0.9;

    /**
     * Score a password.
     *
     * @param factors factors in extraction order
     * @param breach  merged breach flags
     * @return the assessment
     */
    public RiskAssessment score(List<RiskFactor> factors, BreachResult breach) {
        double accumulator = 0.0;
        List<String> reasons = new ArrayList<>();

        for (RiskFactor factor : factors) {
            accumulator += factor.contribution();
            if (factor.affectsScore()) {
                reasons.add(factor.detail());
            }
        }

        double score = clamp(accumulator);
        if (breach.anyHit()) {
            score = Math.max(score, BREACH_SCORE_FLOOR);
        }

        if (breach.offlineHit()) {
            reasons.add("Matches a password from the offline breach corpus");
        }
        switch (breach.onlineStatus()) {
            case FOUND -> reasons.add(String.format(
                    "Found in the Have I Been Pwned password corpus (%d occurrences)", breach.onlineCount()));
            case NOT_FOUND -> reasons.add("Not found in the Have I Been Pwned password corpus");
            case UNAVAILABLE -> reasons.add("Have I Been Pwned lookup unavailable");
            default -> {
                // lookup not requested
            }
        }

        RiskLabel label = breach.anyHit() ? RiskLabel.HIGH : RiskLabel.fromScore(score);
        return new RiskAssessment(score, label, reasons);
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
