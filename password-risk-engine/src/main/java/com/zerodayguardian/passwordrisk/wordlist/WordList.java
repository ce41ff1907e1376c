package com.zerodayguardian.passwordrisk.wordlist;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable list of lowercase words.
 *
 * @author Naveed Gung
 */
public final class WordList {

    private final List<String> words;

    /** Words ordered longest first so containment reports the most specific hit. */
    private final List<String> longestFirst;

    public WordList(List<String> words) {
        this.words = List.copyOf(words);
        this.longestFirst = this.words.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    public static WordList empty() {
        return new WordList(List.of());
    }

    public List<String> words() {
        return words;
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    /**
     * Find the longest word of at least {@code minLength} characters that
     * occurs as a substring of {@code text}.
     *
     * @param text      lowercase text to search
     * @param minLength minimum word length considered
     * @return the matched word, if any
     */
    public Optional<String> findContained(String text, int minLength) {
        for (String word : longestFirst) {
            if (word.length() >= minLength && text.contains(word)) {
                return Optional.of(word);
            }
        }
        return Optional.empty();
    }

    /**
     * Find the longest word of at least {@code minLength} characters that
     * occurs in {@code desubstituted} but not in {@code lowercase}, i.e. a
     * word only revealed by reversing character substitutions.
     *
     * @param lowercase     lowercase form of the password
     * @param desubstituted desubstituted form of the password
     * @param minLength     minimum word length considered
     * @return the exposed word, if any
     */
    public Optional<String> findExposedBy(String lowercase, String desubstituted, int minLength) {
        for (String word : longestFirst) {
            if (word.length() >= minLength && desubstituted.contains(word) && !lowercase.contains(word)) {
                return Optional.of(word);
            }
        }
        return Optional.empty();
    }
}
