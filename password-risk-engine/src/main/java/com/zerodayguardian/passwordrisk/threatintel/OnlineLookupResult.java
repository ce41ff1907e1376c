package com.zerodayguardian.passwordrisk.threatintel;

/**
 * Result of an online breach lookup.
 *
 * <p>
 * {@code checked == false} means the service gave no usable answer; it never
 * implies the password is clean.
 * </p>
 *
 * @param status  lookup outcome
 * @param checked whether the service answered with a parseable range
 * @param hit     whether the password's suffix was in the range
 * @param count   breach occurrence count, {@code null} when not checked
 *
 * @author Naveed Gung
 */
public record OnlineLookupResult(
        OnlineLookupStatus status,
        boolean checked,
        boolean hit,
        Long count) {

    /** Factory for a lookup that was never attempted. */
    public static OnlineLookupResult skipped() {
        return new OnlineLookupResult(OnlineLookupStatus.SKIPPED, false, false, null);
    }

    /** Factory for a suffix match. */
    public static OnlineLookupResult found(long count) {
        return new OnlineLookupResult(OnlineLookupStatus.FOUND, true, true, count);
    }

    /** Factory for a range without the suffix. */
    public static OnlineLookupResult notFound() {
        return new OnlineLookupResult(OnlineLookupStatus.NOT_FOUND, true, false, 0L);
    }

    /** Factory for a failed or unusable lookup. */
    public static OnlineLookupResult unavailable() {
        return new OnlineLookupResult(OnlineLookupStatus.UNAVAILABLE, false, false, null);
    }
}
