package com.zerodayguardian.passwordrisk.detection;

import com.zerodayguardian.passwordrisk.normalize.NormalizedForms;
import com.zerodayguardian.passwordrisk.wordlist.WordList;
import com.zerodayguardian.passwordrisk.wordlist.WordLists;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Derives the fixed set of risk factors from a password.
 *
 * <p>
 * Factors are always returned in the same order so that downstream reason
 * strings are deterministic:
 * </p>
 * <ol>
 * <li>{@code length} - fewer than 12 characters</li>
 * <li>{@code character_diversity} - at least 3 of 4 character classes
 * (lowers risk)</li>
 * <li>{@code sequential_run} - ascending/descending or keyboard run of 3</li>
 * <li>{@code repeated_run} - same character 3 times in a row</li>
 * <li>{@code predictable_substitution} - leetspeak hiding a common word</li>
 * <li>{@code dictionary_word} - common word of 4+ letters after
 * desubstitution</li>
 * </ol>
 *
 * @author Naveed Gung
 */
@Component
public class FeatureExtractor {

    public static final String LENGTH = "length";
    public static final String CHARACTER_DIVERSITY = "character_diversity";
    public static final String SEQUENTIAL_RUN = "sequential_run";
    public static final String REPEATED_RUN = "repeated_run";
    public static final String PREDICTABLE_SUBSTITUTION = "predictable_substitution";
    public static final String DICTIONARY_WORD = "dictionary_word";

    public static final int MIN_LENGTH = 12;
    public static final int MIN_CHARACTER_CLASSES = 3;
    public static final int MIN_WORD_LENGTH = 4;

    static final double LENGTH_WEIGHT = 0.45;
    static final double DIVERSITY_WEIGHT = 0.25;
    static final double SEQUENCE_WEIGHT = 0.15;
    static final double REPETITION_WEIGHT = 0.15;
    static final double SUBSTITUTION_WEIGHT = 0.15;
    static final double DICTIONARY_WEIGHT = 0.20;

    private final WordLists wordLists;

    public FeatureExtractor(WordLists wordLists) {
        this.wordLists = wordLists;
    }

    /**
     * Extract all risk factors. Pure function of its inputs.
     *
     * @param password   the raw password
     * @param normalized its normalized forms
     * @return the six factors in fixed order
     */
    public List<RiskFactor> extract(String password, NormalizedForms normalized) {
        WordList dictionary = wordLists.dictionary();
        Optional<String> word = dictionary.findContained(normalized.desubstituted(), MIN_WORD_LENGTH);

        return List.of(
                length(password),
                diversity(password),
                sequentialRun(normalized),
                repeatedRun(password),
                substitution(normalized, dictionary),
                dictionaryWord(word));
    }

    private RiskFactor length(String password) {
        int length = password.codePointCount(0, password.length());
        boolean tooShort = length < MIN_LENGTH;
        String detail = tooShort
                ? String.format("Shorter than the recommended %d characters (%d characters)", MIN_LENGTH, length)
                : String.format("Length meets the recommended minimum (%d characters)", length);
        return RiskFactor.risk(LENGTH, LENGTH_WEIGHT, tooShort, detail);
    }

    private RiskFactor diversity(String password) {
        int classes = PasswordPatterns.characterClassCount(password);
        boolean diverse = classes >= MIN_CHARACTER_CLASSES;
        String detail = diverse
                ? String.format("Uses %d of 4 character categories", classes)
                : String.format("Limited character variety (%d of 4 character categories)", classes);
        return RiskFactor.strength(CHARACTER_DIVERSITY, DIVERSITY_WEIGHT, diverse, detail);
    }

    private RiskFactor sequentialRun(NormalizedForms normalized) {
        boolean found = PasswordPatterns.hasSequentialRun(normalized.lowercase());
        return RiskFactor.risk(SEQUENTIAL_RUN, SEQUENCE_WEIGHT, found,
                found ? "Contains sequential or keyboard patterns" : "No sequential or keyboard patterns");
    }

    private RiskFactor repeatedRun(String password) {
        boolean found = PasswordPatterns.hasRepeatedRun(password);
        return RiskFactor.risk(REPEATED_RUN, REPETITION_WEIGHT, found,
                found ? "Contains a character repeated 3 or more times in a row" : "No repeated character runs");
    }

    // Fires only when desubstitution is what exposed a word.
    private RiskFactor substitution(NormalizedForms normalized, WordList dictionary) {
        Optional<String> exposed = normalized.hasSubstitutions()
                ? dictionary.findExposedBy(normalized.lowercase(), normalized.desubstituted(), MIN_WORD_LENGTH)
                : Optional.empty();
        String detail = exposed
                .map(w -> String.format("Uses predictable substitutions of the common word \"%s\"", w))
                .orElse("No predictable substitutions of common words");
        return RiskFactor.risk(PREDICTABLE_SUBSTITUTION, SUBSTITUTION_WEIGHT, exposed.isPresent(), detail);
    }

    private RiskFactor dictionaryWord(Optional<String> word) {
        String detail = word
                .map(w -> String.format("Contains the common word \"%s\"", w))
                .orElse("No common dictionary words");
        return RiskFactor.risk(DICTIONARY_WORD, DICTIONARY_WEIGHT, word.isPresent(), detail);
    }
}
