package com.zerodayguardian.passwordrisk.analysis;

import com.zerodayguardian.passwordrisk.breach.BreachResult;
import com.zerodayguardian.passwordrisk.detection.RiskLabel;

import java.util.List;

/**
 * Immutable outcome of one password analysis.
 *
 * @param password    the analyzed password, echoed back to the caller
 * @param riskScore   risk score in [0.0, 1.0]
 * @param label       LOW, MEDIUM or HIGH
 * @param reasons     ordered reasons: factors, then offline breach, then online lookup
 * @param suggestions replacement passwords
 * @param breach      merged breach flags
 *
 * @author Naveed Gung
 */
public record AnalysisResult(
        String password,
        double riskScore,
        RiskLabel label,
        List<String> reasons,
        List<String> suggestions,
        BreachResult breach) {

    public AnalysisResult {
        reasons = List.copyOf(reasons);
        suggestions = List.copyOf(suggestions);
    }

    @Override
    public String toString() {
        return "AnalysisResult[password=<redacted>, riskScore=" + riskScore
                + ", label=" + label
                + ", reasons=" + reasons
                + ", suggestions=" + suggestions.size()
                + ", breach=" + breach + "]";
    }
}
