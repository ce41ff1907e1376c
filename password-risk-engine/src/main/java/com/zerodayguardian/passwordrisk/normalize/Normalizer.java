package com.zerodayguardian.passwordrisk.normalize;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonicalizes a raw password into the forms used by the feature extractor
 * and the breach matcher.
 *
 * <p>
 * Desubstitution walks the lowercase form left to right and, at each
 * position, replaces the longest matching key of {@link #SUBSTITUTIONS}.
 * Replaced text is never re-scanned.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class Normalizer {

    /** Leetspeak token to the letter it usually stands for. */
    static final Map<String, String> SUBSTITUTIONS = Map.ofEntries(
            Map.entry("|_|", "u"),
            Map.entry("|<", "k"),
            Map.entry("()", "o"),
            Map.entry("@", "a"),
            Map.entry("4", "a"),
            Map.entry("8", "b"),
            Map.entry("3", "e"),
            Map.entry("6", "g"),
            Map.entry("1", "i"),
            Map.entry("!", "i"),
            Map.entry("0", "o"),
            Map.entry("$", "s"),
            Map.entry("5", "s"),
            Map.entry("7", "t"),
            Map.entry("+", "t"));

    private static final List<String> KEYS_LONGEST_FIRST = SUBSTITUTIONS.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .toList();

    /**
     * Compute both comparison forms. Any string, including empty, is accepted.
     *
     * @param password the raw password
     * @return the normalized forms
     */
    public NormalizedForms normalize(String password) {
        String lowercase = password.toLowerCase(Locale.ROOT);
        return new NormalizedForms(lowercase, desubstitute(lowercase));
    }

    private static String desubstitute(String lowercase) {
        StringBuilder out = new StringBuilder(lowercase.length());
        int i = 0;
        while (i < lowercase.length()) {
            String matched = null;
            for (String key : KEYS_LONGEST_FIRST) {
                if (lowercase.startsWith(key, i)) {
                    matched = key;
                    break;
                }
            }
            if (matched != null) {
                out.append(SUBSTITUTIONS.get(matched));
                i += matched.length();
            } else {
                out.append(lowercase.charAt(i));
                i++;
            }
        }
        return out.toString();
    }
}
