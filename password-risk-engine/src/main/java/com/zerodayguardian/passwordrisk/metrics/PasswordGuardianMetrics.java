package com.zerodayguardian.passwordrisk.metrics;

import com.zerodayguardian.passwordrisk.breach.OfflineBreachMatcher;
import com.zerodayguardian.passwordrisk.wordlist.WordLists;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Exposes reference-data metrics via Micrometer/Prometheus.
 *
 * <p>
 * Registered gauges (in addition to the analyzer's counters and timer):
 * </p>
 * <ul>
 * <li>{@code guardian.password.corpus.size} - offline breach corpus entries
 * (0 until first use)</li>
 * <li>{@code guardian.password.dictionary.size} - dictionary words</li>
 * <li>{@code guardian.password.uptime_seconds} - engine uptime</li>
 * </ul>
 *
 * @author Naveed Gung
 */
@Component
public class PasswordGuardianMetrics {

    private static final Logger log = LoggerFactory.getLogger(PasswordGuardianMetrics.class);

    private final OfflineBreachMatcher breachMatcher;
    private final WordLists wordLists;
    private final MeterRegistry meterRegistry;

    private final long startTime = System.currentTimeMillis();

    public PasswordGuardianMetrics(
            OfflineBreachMatcher breachMatcher,
            WordLists wordLists,
            MeterRegistry meterRegistry) {
        this.breachMatcher = breachMatcher;
        this.wordLists = wordLists;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("guardian.password.corpus.size", breachMatcher, OfflineBreachMatcher::loadedSize)
                .description("Entries in the offline breach corpus")
                .register(meterRegistry);

        Gauge.builder("guardian.password.dictionary.size", wordLists, w -> w.dictionary().size())
                .description("Words in the bundled dictionary")
                .register(meterRegistry);

        Gauge.builder("guardian.password.uptime_seconds", this, g -> (System.currentTimeMillis() - g.startTime) / 1000.0)
                .description("Password engine uptime in seconds")
                .register(meterRegistry);

        log.info("Password guardian metrics registered");
    }
}
