package com.zerodayguardian.passwordrisk.analysis;

import com.zerodayguardian.passwordrisk.breach.BreachResult;
import com.zerodayguardian.passwordrisk.breach.OfflineBreachMatcher;
import com.zerodayguardian.passwordrisk.config.PasswordAnalyzerConfig;
import com.zerodayguardian.passwordrisk.detection.FeatureExtractor;
import com.zerodayguardian.passwordrisk.detection.RiskAssessment;
import com.zerodayguardian.passwordrisk.detection.RiskFactor;
import com.zerodayguardian.passwordrisk.detection.RiskScorer;
import com.zerodayguardian.passwordrisk.normalize.NormalizedForms;
import com.zerodayguardian.passwordrisk.normalize.Normalizer;
import com.zerodayguardian.passwordrisk.suggestion.SuggestionGenerator;
import com.zerodayguardian.passwordrisk.threatintel.OnlineBreachLookup;
import com.zerodayguardian.passwordrisk.threatintel.OnlineLookupResult;
import com.zerodayguardian.passwordrisk.threatintel.OnlineLookupStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Central analysis orchestrator.
 *
 * <p>
 * Runs normalize, extract, offline match, optional online lookup, score and
 * suggest, then assembles the {@link AnalysisResult}. Everything except the
 * online lookup and a not-yet-loaded corpus is synchronous in-process work;
 * cancelling the returned {@link Mono} cancels an in-flight lookup.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class PasswordAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PasswordAnalyzer.class);

    private final Normalizer normalizer;
    private final FeatureExtractor featureExtractor;
    private final RiskScorer riskScorer;
    private final OfflineBreachMatcher breachMatcher;
    private final OnlineBreachLookup onlineLookup;
    private final SuggestionGenerator suggestionGenerator;
    private final MeterRegistry meterRegistry;
    private final boolean onlineByDefault;

    private Counter analyses;
    private Counter offlineHits;
    private Timer analysisLatency;

    public PasswordAnalyzer(
            Normalizer normalizer,
            FeatureExtractor featureExtractor,
            RiskScorer riskScorer,
            OfflineBreachMatcher breachMatcher,
            OnlineBreachLookup onlineLookup,
            SuggestionGenerator suggestionGenerator,
            MeterRegistry meterRegistry,
            PasswordAnalyzerConfig config) {
        this.normalizer = normalizer;
        this.featureExtractor = featureExtractor;
        this.riskScorer = riskScorer;
        this.breachMatcher = breachMatcher;
        this.onlineLookup = onlineLookup;
        this.suggestionGenerator = suggestionGenerator;
        this.meterRegistry = meterRegistry;
        this.onlineByDefault = config.getOnline().isEnabledByDefault();
    }

    @PostConstruct
    public void init() {
        analyses = Counter.builder("guardian.password.analyses")
                .description("Total password analyses")
                .register(meterRegistry);
        offlineHits = Counter.builder("guardian.password.breach.offline.hits")
                .description("Analyses matching the offline breach corpus")
                .register(meterRegistry);
        analysisLatency = Timer.builder("guardian.password.analysis.latency")
                .description("End-to-end time of one completed analysis, including any online lookup")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        log.info("Password analyzer initialized (online lookup by default: {})", onlineByDefault);
    }

    /** Analyze with the configured online lookup timeout. */
    public Mono<AnalysisResult> analyze(AnalysisRequest request) {
        return analyze(request, onlineLookup.defaultTimeout());
    }

    /**
     * Analyze a password.
     *
     * @param request       the request; a missing password is rejected before any work
     * @param onlineTimeout bound for the online lookup, if it runs
     * @return the result, or an {@link InvalidAnalysisRequestException} error
     */
    public Mono<AnalysisResult> analyze(AnalysisRequest request, Duration onlineTimeout) {
        if (request == null || request.password() == null) {
            return Mono.error(new InvalidAnalysisRequestException("password", "password is required"));
        }
        boolean online = request.enableOnline() != null ? request.enableOnline() : onlineByDefault;

        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(meterRegistry);
            analyses.increment();

            String password = request.password();
            NormalizedForms normalized = normalizer.normalize(password);
            List<RiskFactor> factors = featureExtractor.extract(password, normalized);

            return offlineMatch(normalized)
                    .flatMap(offlineHit -> {
                        if (offlineHit) {
                            offlineHits.increment();
                        }
                        Mono<OnlineLookupResult> lookup = online
                                ? onlineLookup.lookup(password, onlineTimeout)
                                : Mono.just(OnlineLookupResult.skipped());
                        return lookup.map(onlineResult -> {
                            AnalysisResult result = assemble(password, factors, BreachResult.of(offlineHit, onlineResult));
                            sample.stop(analysisLatency);
                            return result;
                        });
                    });
        });
    }

    // Until the corpus is in memory, the first match reads files: keep that off the caller's thread.
    private Mono<Boolean> offlineMatch(NormalizedForms normalized) {
        Mono<Boolean> match = Mono.fromCallable(() -> breachMatcher.isBreachedOffline(normalized));
        return breachMatcher.isLoaded() ? match : match.subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Synchronous variant for callers outside a reactive pipeline.
     */
    public AnalysisResult analyzeBlocking(AnalysisRequest request) {
        return analyze(request).block();
    }

    private AnalysisResult assemble(String password, List<RiskFactor> factors, BreachResult breach) {
        if (breach.onlineStatus() != OnlineLookupStatus.SKIPPED) {
            meterRegistry.counter("guardian.password.breach.online.lookups",
                    "outcome", breach.onlineStatus().name().toLowerCase(Locale.ROOT)).increment();
        }

        RiskAssessment assessment = riskScorer.score(factors, breach);
        List<String> suggestions = suggestionGenerator.generate(password);

        log.debug("Analysis complete: label={} score={} offlineHit={} online={}",
                assessment.label(), assessment.score(), breach.offlineHit(), breach.onlineStatus());

        return new AnalysisResult(
                password,
                assessment.score(),
                assessment.label(),
                assessment.reasons(),
                suggestions,
                breach);
    }
}
