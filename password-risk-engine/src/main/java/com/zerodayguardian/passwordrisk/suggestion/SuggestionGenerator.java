package com.zerodayguardian.passwordrisk.suggestion;

import com.zerodayguardian.passwordrisk.breach.OfflineBreachMatcher;
import com.zerodayguardian.passwordrisk.config.PasswordAnalyzerConfig;
import com.zerodayguardian.passwordrisk.detection.FeatureExtractor;
import com.zerodayguardian.passwordrisk.detection.PasswordPatterns;
import com.zerodayguardian.passwordrisk.normalize.Normalizer;
import com.zerodayguardian.passwordrisk.wordlist.WordList;
import com.zerodayguardian.passwordrisk.wordlist.WordLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Generates replacement passwords.
 *
 * <p>
 * Each suggestion is at least 12 characters, uses at least 3 character
 * classes, has no sequential or repeated run, is absent from the offline
 * breach corpus, and differs from the input and from the other suggestions.
 * </p>
 *
 * <p>
 * Candidates are built from the dictionary word found in the input (or a
 * word-bank word) with randomized capitalization, a symbol, two digits and a
 * second word-bank word. A rejected candidate is redrawn up to
 * {@code maxAttempts} times; after that a random password that avoids runs
 * by construction is used instead.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class SuggestionGenerator {

    private static final Logger log = LoggerFactory.getLogger(SuggestionGenerator.class);

    static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final String DIGITS = "0123456789";
    static final String SYMBOLS = "!@#$%^&*?-_+=";

    static final int FALLBACK_LENGTH = 16;
    static final int MAX_FALLBACK_ATTEMPTS = 10;

    /** Used when the bundled word bank could not be loaded. */
    static final List<String> DEFAULT_WORD_BANK = List.of(
            "orbit", "cobalt", "harbor", "falcon", "ember", "sage", "vivid");

    private final Normalizer normalizer;
    private final WordLists wordLists;
    private final OfflineBreachMatcher breachMatcher;
    private final Random random;
    private final int defaultCount;
    private final int maxAttempts;

    @Autowired
    public SuggestionGenerator(
            Normalizer normalizer,
            WordLists wordLists,
            OfflineBreachMatcher breachMatcher,
            PasswordAnalyzerConfig config) {
        this(normalizer, wordLists, breachMatcher, new SecureRandom(),
                config.getSuggestions().getCount(), config.getSuggestions().getMaxAttempts());
    }

    public SuggestionGenerator(
            Normalizer normalizer,
            WordLists wordLists,
            OfflineBreachMatcher breachMatcher,
            Random random,
            int defaultCount,
            int maxAttempts) {
        this.normalizer = normalizer;
        this.wordLists = wordLists;
        this.breachMatcher = breachMatcher;
        this.random = random;
        this.defaultCount = defaultCount;
        this.maxAttempts = maxAttempts;
    }

    /** Generate the configured number of suggestions. */
    public List<String> generate(String password) {
        return generate(password, defaultCount);
    }

    /**
     * Generate replacement passwords.
     *
     * @param password the password being replaced
     * @param count    number of suggestions
     * @return distinct suggestions, in generation order
     */
    public List<String> generate(String password, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Suggestion count must not be negative: " + count);
        }

        Optional<String> baseWord = wordLists.dictionary()
                .findContained(normalizer.normalize(password).desubstituted(), FeatureExtractor.MIN_WORD_LENGTH);

        Set<String> suggestions = new LinkedHashSet<>();
        while (suggestions.size() < count) {
            suggestions.add(nextSuggestion(password, baseWord, suggestions));
        }
        return List.copyOf(suggestions);
    }

    /**
     * Strength rules every suggestion must satisfy, the same ones the
     * feature extractor penalizes.
     */
    public static boolean meetsStrengthRules(String candidate) {
        return candidate.length() >= FeatureExtractor.MIN_LENGTH
                && PasswordPatterns.characterClassCount(candidate) >= FeatureExtractor.MIN_CHARACTER_CLASSES
                && !PasswordPatterns.hasSequentialRun(candidate.toLowerCase(Locale.ROOT))
                && !PasswordPatterns.hasRepeatedRun(candidate);
    }

    private String nextSuggestion(String password, Optional<String> baseWord, Set<String> taken) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String candidate = themedCandidate(baseWord);
            if (isAcceptable(candidate, password, taken)) {
                return candidate;
            }
        }

        log.debug("Themed suggestion attempts exhausted after {} tries, using random fallback", maxAttempts);
        for (int attempt = 0; attempt < MAX_FALLBACK_ATTEMPTS; attempt++) {
            String candidate = randomCandidate();
            if (isAcceptable(candidate, password, taken)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Unable to generate a password suggestion");
    }

    private boolean isAcceptable(String candidate, String password, Set<String> taken) {
        return !candidate.equals(password)
                && !taken.contains(candidate)
                && meetsStrengthRules(candidate)
                && !breachMatcher.isBreachedOffline(normalizer.normalize(candidate));
    }

    private String themedCandidate(Optional<String> baseWord) {
        String base = baseWord.orElseGet(this::bankWord);

        StringBuilder candidate = new StringBuilder();
        candidate.append(randomCase(base));
        candidate.append(pick(SYMBOLS));
        candidate.append(pick(DIGITS));
        candidate.append(pick(DIGITS));
        candidate.append(randomCase(bankWord()));

        String all = LOWER + UPPER + DIGITS + SYMBOLS;
        while (candidate.length() < FeatureExtractor.MIN_LENGTH) {
            candidate.append(pick(all));
        }
        return candidate.toString();
    }

    // First letter upper, others upper with probability 1/4.
    private String randomCase(String word) {
        StringBuilder out = new StringBuilder(word.length());
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            boolean upper = i == 0 || random.nextInt(4) == 0;
            out.append(upper ? Character.toUpperCase(c) : c);
        }
        return out.toString();
    }

    private String bankWord() {
        WordList bank = wordLists.wordBank();
        List<String> words = bank.isEmpty() ? DEFAULT_WORD_BANK : bank.words();
        return words.get(random.nextInt(words.size()));
    }

    /**
     * Random password that covers all four classes and never completes a
     * run: each position draws only from characters that are safe after the
     * previous two.
     */
    private String randomCandidate() {
        List<String> pools = new ArrayList<>(List.of(LOWER, UPPER, DIGITS, SYMBOLS));
        Collections.shuffle(pools, random);
        String all = LOWER + UPPER + DIGITS + SYMBOLS;
        while (pools.size() < FALLBACK_LENGTH) {
            pools.add(all);
        }

        StringBuilder out = new StringBuilder(FALLBACK_LENGTH);
        for (String pool : pools) {
            List<Character> allowed = new ArrayList<>(pool.length());
            for (int i = 0; i < pool.length(); i++) {
                char c = pool.charAt(i);
                int n = out.length();
                if (n < 2 || !PasswordPatterns.completesRun(out.charAt(n - 2), out.charAt(n - 1), c)) {
                    allowed.add(c);
                }
            }
            out.append(allowed.get(random.nextInt(allowed.size())));
        }
        return out.toString();
    }

    private char pick(String pool) {
        return pool.charAt(random.nextInt(pool.length()));
    }
}
