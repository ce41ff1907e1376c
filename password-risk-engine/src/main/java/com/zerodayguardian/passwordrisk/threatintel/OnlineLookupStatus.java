package com.zerodayguardian.passwordrisk.threatintel;

/**
 * Outcome of the k-anonymity range lookup.
 *
 * @author Naveed Gung
 */
public enum OnlineLookupStatus {

    /** Lookup not requested for this analysis. */
    SKIPPED,
    /** Suffix present in the returned range with a positive count. */
    FOUND,
    /** Range returned, suffix absent. */
    NOT_FOUND,
    /** Network error, timeout, non-success status or malformed body. */
    UNAVAILABLE
}
