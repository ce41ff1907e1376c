package com.zerodayguardian.passwordrisk;

import com.zerodayguardian.passwordrisk.analysis.PasswordAnalyzer;
import com.zerodayguardian.passwordrisk.breach.OfflineBreachMatcher;
import com.zerodayguardian.passwordrisk.config.PasswordAnalyzerConfig;
import com.zerodayguardian.passwordrisk.detection.FeatureExtractor;
import com.zerodayguardian.passwordrisk.detection.RiskScorer;
import com.zerodayguardian.passwordrisk.normalize.Normalizer;
import com.zerodayguardian.passwordrisk.suggestion.SuggestionGenerator;
import com.zerodayguardian.passwordrisk.threatintel.OnlineBreachLookup;
import com.zerodayguardian.passwordrisk.threatintel.PwnedRangeClient;
import com.zerodayguardian.passwordrisk.wordlist.WordLists;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.ResourceLoader;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Random;

/**
 * Shared builders for components that load bundled reference data.
 */
public final class TestFixtures {

    public static final ResourceLoader RESOURCE_LOADER = new DefaultResourceLoader();

    public static final String TEST_CORPUS = "classpath:fixtures/breach-corpus.txt";

    private TestFixtures() {
    }

    /** Word lists loaded from the bundled classpath resources. */
    public static WordLists bundledWordLists() {
        WordLists wordLists = new WordLists(new PasswordAnalyzerConfig(), RESOURCE_LOADER);
        wordLists.load();
        return wordLists;
    }

    /** Matcher over the small test corpus. */
    public static OfflineBreachMatcher testCorpusMatcher() {
        return new OfflineBreachMatcher(List.of(TEST_CORPUS), RESOURCE_LOADER);
    }

    /**
     * Fully wired analyzer over the test corpus and bundled word lists, with
     * the given range client standing in for the remote service.
     */
    public static PasswordAnalyzer analyzer(PwnedRangeClient rangeClient, MeterRegistry meterRegistry) {
        return analyzer(rangeClient, meterRegistry, testCorpusMatcher());
    }

    /** Fully wired analyzer over the given breach matcher. */
    public static PasswordAnalyzer analyzer(
            PwnedRangeClient rangeClient,
            MeterRegistry meterRegistry,
            OfflineBreachMatcher breachMatcher) {
        Normalizer normalizer = new Normalizer();
        WordLists wordLists = bundledWordLists();
        PasswordAnalyzerConfig config = new PasswordAnalyzerConfig();

        PasswordAnalyzer analyzer = new PasswordAnalyzer(
                normalizer,
                new FeatureExtractor(wordLists),
                new RiskScorer(),
                breachMatcher,
                new OnlineBreachLookup(rangeClient, Duration.ofSeconds(2)),
                new SuggestionGenerator(normalizer, wordLists, breachMatcher, new Random(11), 3, 25),
                meterRegistry,
                config);
        analyzer.init();
        return analyzer;
    }

    /** Uppercase SHA-1 hex of a password, as the range service indexes it. */
    public static String sha1Hex(String password) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-1").digest(password.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().withUpperCase().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Range client that reports {@code password} as seen {@code count} times. */
    public static PwnedRangeClient rangeContaining(String password, long count) {
        String suffix = sha1Hex(password).substring(OnlineBreachLookup.PREFIX_LENGTH);
        return prefix -> Mono.just(
                "0018A45C4D1DEF81644B54AB7F969B88D65:0\r\n" + suffix + ":" + count + "\r\n");
    }
}
