package com.zerodayguardian.passwordrisk.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.zerodayguardian.passwordrisk.analysis.AnalysisResult;
import com.zerodayguardian.passwordrisk.breach.BreachResult;
import com.zerodayguardian.passwordrisk.detection.RiskLabel;

import java.util.List;

/**
 * Flat JSON view of an {@link AnalysisResult}.
 *
 * <p>
 * {@code breached_online} is {@code null} when no usable online answer was
 * obtained; {@code hibp_count} is only present on an online hit.
 * </p>
 *
 * @author Naveed Gung
 */
public record AnalysisResponse(
        @JsonProperty("password") String password,
        @JsonProperty("risk_score") double riskScore,
        @JsonProperty("label") RiskLabel label,
        @JsonProperty("reasons") List<String> reasons,
        @JsonProperty("suggestions") List<String> suggestions,
        @JsonProperty("breached_offline") boolean breachedOffline,
        @JsonInclude(JsonInclude.Include.ALWAYS)
        @JsonProperty("breached_online") Boolean breachedOnline,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("hibp_count") Long hibpCount,
        @JsonProperty("online_checked") boolean onlineChecked) {

    public static AnalysisResponse from(AnalysisResult result) {
        BreachResult breach = result.breach();
        return new AnalysisResponse(
                result.password(),
                result.riskScore(),
                result.label(),
                result.reasons(),
                result.suggestions(),
                breach.offlineHit(),
                breach.onlineChecked() ? breach.onlineHit() : null,
                breach.onlineHit() ? breach.onlineCount() : null,
                breach.onlineChecked());
    }

    @Override
    public String toString() {
        return "AnalysisResponse[password=<redacted>, riskScore=" + riskScore + ", label=" + label + "]";
    }
}
