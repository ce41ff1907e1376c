package com.zerodayguardian.passwordrisk.breach;

import com.zerodayguardian.passwordrisk.threatintel.OnlineLookupResult;
import com.zerodayguardian.passwordrisk.threatintel.OnlineLookupStatus;

/**
 * Merged offline and online breach flags for one analysis.
 *
 * @param offlineHit    password (or its desubstituted form) is in the offline corpus
 * @param onlineHit     online range lookup found the password
 * @param onlineCount   occurrences reported online, {@code null} unless checked
 * @param onlineChecked online lookup ran and produced a usable answer
 * @param onlineStatus  detailed online outcome
 *
 * @author Naveed Gung
 */
public record BreachResult(
        boolean offlineHit,
        boolean onlineHit,
        Long onlineCount,
        boolean onlineChecked,
        OnlineLookupStatus onlineStatus) {

    public static BreachResult of(boolean offlineHit, OnlineLookupResult online) {
        return new BreachResult(offlineHit, online.hit(), online.count(), online.checked(), online.status());
    }

    /** True when either source reports the password as breached. */
    public boolean anyHit() {
        return offlineHit || onlineHit;
    }
}
