package com.zerodayguardian.passwordrisk.analysis;

import jakarta.validation.constraints.NotNull;

/**
 * Request to analyze one password.
 *
 * @param password     the password; required, may be empty
 * @param enableOnline whether to run the online breach lookup; {@code null}
 *                     uses the configured default
 *
 * @author Naveed Gung
 */
public record AnalysisRequest(
        @NotNull(message = "password is required")
        String password,

        Boolean enableOnline) {

    public static AnalysisRequest offline(String password) {
        return new AnalysisRequest(password, false);
    }

    public static AnalysisRequest withOnlineLookup(String password) {
        return new AnalysisRequest(password, true);
    }

    @Override
    public String toString() {
        return "AnalysisRequest[password=<redacted>, enableOnline=" + enableOnline + "]";
    }
}
