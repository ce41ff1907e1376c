package com.zerodayguardian.passwordrisk.threatintel;

import com.zerodayguardian.passwordrisk.config.PasswordAnalyzerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;

/**
 * k-anonymity breach lookup.
 *
 * <p>
 * The password is hashed with SHA-1 locally; only the first
 * {@value #PREFIX_LENGTH} hex characters of the digest are handed to the
 * {@link PwnedRangeClient}. The returned range is scanned locally for the
 * remaining suffix. Every failure (transport error, timeout, non-success
 * status, malformed body) yields {@link OnlineLookupResult#unavailable()}.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class OnlineBreachLookup {

    private static final Logger log = LoggerFactory.getLogger(OnlineBreachLookup.class);

    public static final int PREFIX_LENGTH = 5;
    static final int DIGEST_HEX_LENGTH = 40;

    private final PwnedRangeClient rangeClient;
    private final Duration defaultTimeout;

    @Autowired
    public OnlineBreachLookup(PwnedRangeClient rangeClient, PasswordAnalyzerConfig config) {
        this(rangeClient, Duration.ofMillis(config.getOnline().getTimeoutMs()));
    }

    public OnlineBreachLookup(PwnedRangeClient rangeClient, Duration defaultTimeout) {
        this.rangeClient = rangeClient;
        this.defaultTimeout = defaultTimeout;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    /** Look up with the configured timeout. */
    public Mono<OnlineLookupResult> lookup(String password) {
        return lookup(password, defaultTimeout);
    }

    /**
     * Look up a password in the remote breach corpus.
     *
     * @param password the raw password; never leaves the process
     * @param timeout  upper bound for the whole exchange
     * @return the lookup result; never an error signal
     */
    public Mono<OnlineLookupResult> lookup(String password, Duration timeout) {
        String digest = sha1Hex(password);
        String prefix = digest.substring(0, PREFIX_LENGTH);
        String suffix = digest.substring(PREFIX_LENGTH);

        return Mono.defer(() -> rangeClient.fetchRange(prefix))
                .timeout(timeout)
                .map(body -> matchSuffix(body, suffix))
                .defaultIfEmpty(OnlineLookupResult.unavailable())
                .onErrorResume(e -> {
                    log.warn("Breach range lookup failed for prefix {}: {}", prefix, e.toString());
                    return Mono.just(OnlineLookupResult.unavailable());
                });
    }

    /**
     * Scan a range response for the suffix.
     *
     * @throws IllegalArgumentException if the body has no entries or a line is
     *                                  not {@code SUFFIX:COUNT}
     */
    static OnlineLookupResult matchSuffix(String body, String suffix) {
        OnlineLookupResult result = OnlineLookupResult.notFound();
        int entries = 0;

        for (String rawLine : body.split("\r?\n")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0 || colon != line.lastIndexOf(':')) {
                throw new IllegalArgumentException("Malformed range line at entry " + (entries + 1));
            }
            String candidate = line.substring(0, colon).strip();
            long count;
            try {
                count = Long.parseLong(line.substring(colon + 1).strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Non-numeric count at entry " + (entries + 1), e);
            }
            if (count < 0) {
                throw new IllegalArgumentException("Negative count at entry " + (entries + 1));
            }
            entries++;

            // Padding entries carry a count of 0 and never count as a hit.
            if (count > 0 && candidate.equalsIgnoreCase(suffix)) {
                result = OnlineLookupResult.found(count);
            }
        }

        if (entries == 0) {
            throw new IllegalArgumentException("Empty range response");
        }
        return result;
    }

    static String sha1Hex(String password) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            byte[] hash = sha1.digest(password.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().withUpperCase().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available in this JVM", e);
        }
    }
}
