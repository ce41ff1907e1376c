package com.zerodayguardian.passwordrisk.normalize;

/**
 * Comparison forms of a password, computed once per analysis.
 *
 * @param lowercase     locale-neutral lowercase form
 * @param desubstituted lowercase form with common leetspeak substitutions reversed
 *
 * @author Naveed Gung
 */
public record NormalizedForms(String lowercase, String desubstituted) {

    /** True when desubstitution changed at least one character. */
    public boolean hasSubstitutions() {
        return !lowercase.equals(desubstituted);
    }
}
