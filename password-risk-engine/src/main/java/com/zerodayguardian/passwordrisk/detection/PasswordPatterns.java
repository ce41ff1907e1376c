package com.zerodayguardian.passwordrisk.detection;

import java.util.List;

/**
 * Structural checks shared by the feature extractor and the suggestion
 * generator, so generated passwords are judged by exactly the rules used to
 * score input passwords.
 *
 * @author Naveed Gung
 */
public final class PasswordPatterns {

    /** Minimum run length for sequential and repeated runs. */
    public static final int RUN_LENGTH = 3;

    /** Keyboard rows, checked forwards and backwards. */
    private static final List<String> KEYBOARD_ROWS = List.of(
            "1234567890",
            "qwertyuiop",
            "asdfghjkl",
            "zxcvbnm");

    private PasswordPatterns() {
    }

    /**
     * Count the character classes present among lowercase, uppercase, digit
     * and symbol. Anything that is not a letter or digit counts as a symbol.
     */
    public static int characterClassCount(String password) {
        boolean lower = false;
        boolean upper = false;
        boolean digit = false;
        boolean symbol = false;
        for (int i = 0; i < password.length(); i++) {
            char c = password.charAt(i);
            if (Character.isLowerCase(c)) {
                lower = true;
            } else if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            } else if (!Character.isLetter(c)) {
                symbol = true;
            }
        }
        return (lower ? 1 : 0) + (upper ? 1 : 0) + (digit ? 1 : 0) + (symbol ? 1 : 0);
    }

    /**
     * Detect an ascending or descending run of three character codes
     * ({@code abc}, {@code 321}) or three adjacent keys on a keyboard row
     * ({@code qwe}, {@code lkj}).
     *
     * @param lowercase the lowercase form of the password
     */
    public static boolean hasSequentialRun(String lowercase) {
        for (int i = 0; i + RUN_LENGTH <= lowercase.length(); i++) {
            if (isSequentialTriple(lowercase.charAt(i), lowercase.charAt(i + 1), lowercase.charAt(i + 2))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Detect any character repeated three or more times in a row. Compares
     * code points, so a repeated supplementary character (emoji) counts.
     */
    public static boolean hasRepeatedRun(String password) {
        int[] codePoints = password.codePoints().toArray();
        for (int i = 0; i + RUN_LENGTH <= codePoints.length; i++) {
            int c = codePoints[i];
            if (codePoints[i + 1] == c && codePoints[i + 2] == c) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when appending {@code next} after {@code a, b} would complete a
     * sequential, keyboard or repeated run. Comparison is case-insensitive
     * for the sequential rules, matching {@link #hasSequentialRun}.
     */
    public static boolean completesRun(char a, char b, char next) {
        if (a == b && b == next) {
            return true;
        }
        return isSequentialTriple(Character.toLowerCase(a), Character.toLowerCase(b), Character.toLowerCase(next));
    }

    private static boolean isSequentialTriple(char a, char b, char c) {
        int step = b - a;
        if ((step == 1 || step == -1) && c - b == step) {
            return true;
        }
        for (String row : KEYBOARD_ROWS) {
            int ia = row.indexOf(a);
            if (ia < 0) {
                continue;
            }
            int ib = row.indexOf(b);
            int ic = row.indexOf(c);
            if (ib < 0 || ic < 0) {
                continue;
            }
            int rowStep = ib - ia;
            if ((rowStep == 1 || rowStep == -1) && ic - ib == rowStep) {
                return true;
            }
        }
        return false;
    }
}
