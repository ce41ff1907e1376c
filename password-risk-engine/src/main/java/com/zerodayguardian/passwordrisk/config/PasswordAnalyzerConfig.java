package com.zerodayguardian.passwordrisk.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the password analyzer.
 *
 * <p>
 * Resource locations accept any Spring resource prefix ({@code classpath:},
 * {@code file:}). The online breach service needs no credentials; only the
 * hash prefix of a password is ever sent to it.
 * </p>
 *
 * @author Naveed Gung
 */
@Configuration
@ConfigurationProperties(prefix = "guardian.password")
@Validated
public class PasswordAnalyzerConfig {

    @Valid
    private Corpus corpus = new Corpus();
    @Valid
    private Wordlists wordlists = new Wordlists();
    @Valid
    private Online online = new Online();
    @Valid
    private Suggestions suggestions = new Suggestions();

    public Corpus getCorpus() {
        return corpus;
    }

    public void setCorpus(Corpus corpus) {
        this.corpus = corpus;
    }

    public Wordlists getWordlists() {
        return wordlists;
    }

    public void setWordlists(Wordlists wordlists) {
        this.wordlists = wordlists;
    }

    public Online getOnline() {
        return online;
    }

    public void setOnline(Online online) {
        this.online = online;
    }

    public Suggestions getSuggestions() {
        return suggestions;
    }

    public void setSuggestions(Suggestions suggestions) {
        this.suggestions = suggestions;
    }

    public static class Corpus {
        /** Breach corpus sources, merged in order. Missing sources are skipped. */
        @NotNull
        private List<String> locations = new ArrayList<>(List.of(
                "classpath:breach/breached-passwords.txt",
                "file:./data/rockyou.txt"));

        public List<String> getLocations() {
            return locations;
        }

        public void setLocations(List<String> locations) {
            this.locations = locations;
        }
    }

    public static class Wordlists {
        @NotBlank
        private String dictionary = "classpath:wordlists/common-words.txt";
        @NotBlank
        private String wordBank = "classpath:wordlists/word-bank.txt";

        public String getDictionary() {
            return dictionary;
        }

        public void setDictionary(String dictionary) {
            this.dictionary = dictionary;
        }

        public String getWordBank() {
            return wordBank;
        }

        public void setWordBank(String wordBank) {
            this.wordBank = wordBank;
        }
    }

    public static class Online {
        @NotBlank
        private String baseUrl = "https://api.pwnedpasswords.com";
        @Min(100)
        private int timeoutMs = 5000;
        @NotBlank
        private String userAgent = "ZeroDayGuardian-PasswordAnalyzer";
        private boolean addPadding = true;
        private boolean enabledByDefault = false;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public boolean isAddPadding() {
            return addPadding;
        }

        public void setAddPadding(boolean addPadding) {
            this.addPadding = addPadding;
        }

        public boolean isEnabledByDefault() {
            return enabledByDefault;
        }

        public void setEnabledByDefault(boolean enabledByDefault) {
            this.enabledByDefault = enabledByDefault;
        }
    }

    public static class Suggestions {
        @Min(1)
        private int count = 3;
        /** Redraws allowed per suggestion before switching to the random fallback. */
        @Min(1)
        private int maxAttempts = 25;

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }
}
