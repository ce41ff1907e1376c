package com.zerodayguardian.passwordrisk.breach;

import com.zerodayguardian.passwordrisk.config.PasswordAnalyzerConfig;
import com.zerodayguardian.passwordrisk.normalize.NormalizedForms;
import com.zerodayguardian.passwordrisk.wordlist.LineResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exact-match lookup against the bundled breach corpus.
 *
 * <p>
 * The corpus is read once (at application startup, or on first use if that
 * comes earlier), merged from every configured location,
 * and frozen into an immutable set shared by all analyses. Entries are
 * stored lowercased. Missing or unreadable sources degrade to fewer (or no)
 * matches; loading never fails an analysis.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class OfflineBreachMatcher {

    private static final Logger log = LoggerFactory.getLogger(OfflineBreachMatcher.class);

    private final List<String> locations;
    private final ResourceLoader resourceLoader;

    private volatile Set<String> corpus;

    @Autowired
    public OfflineBreachMatcher(PasswordAnalyzerConfig config, ResourceLoader resourceLoader) {
        this(config.getCorpus().getLocations(), resourceLoader);
    }

    public OfflineBreachMatcher(List<String> locations, ResourceLoader resourceLoader) {
        this.locations = List.copyOf(locations);
        this.resourceLoader = resourceLoader;
    }

    /**
     * Check the lowercase and desubstituted forms against the corpus.
     *
     * @param normalized the password's normalized forms
     * @return true if either form is a known leaked password
     */
    public boolean isBreachedOffline(NormalizedForms normalized) {
        Set<String> entries = corpus();
        return entries.contains(normalized.lowercase()) || entries.contains(normalized.desubstituted());
    }

    /** True once the corpus has been read. */
    public boolean isLoaded() {
        return corpus != null;
    }

    /**
     * Load the corpus off the startup thread once the application is ready,
     * so the first analysis does not pay for it.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        Mono.fromRunnable(this::corpus)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(null, e -> log.warn("Breach corpus warm-up failed: {}", e.toString()));
    }

    /** Number of loaded entries, 0 until the corpus is first used. */
    public int loadedSize() {
        Set<String> entries = corpus;
        return entries != null ? entries.size() : 0;
    }

    Set<String> corpus() {
        Set<String> entries = corpus;
        if (entries == null) {
            synchronized (this) {
                entries = corpus;
                if (entries == null) {
                    entries = load();
                    corpus = entries;
                }
            }
        }
        return entries;
    }

    private Set<String> load() {
        long start = System.currentTimeMillis();
        Set<String> entries = new HashSet<>();
        for (String location : locations) {
            try {
                int read = LineResources.stream(resourceLoader.getResource(location), entries::add);
                log.debug("Read {} breach corpus entries from {}", read, location);
            } catch (RuntimeException e) {
                log.warn("Skipping breach corpus source {}: {}", location, e.getMessage());
            }
        }
        if (entries.isEmpty()) {
            log.warn("Offline breach corpus is empty; offline matching disabled");
        } else {
            log.info("Offline breach corpus loaded: {} entries from {} sources in {} ms",
                    entries.size(), locations.size(), System.currentTimeMillis() - start);
        }
        return Set.copyOf(entries);
    }
}
