package com.zerodayguardian.passwordrisk.detection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PasswordPatternsTest {

    @Test
    void shouldCountCharacterClasses() {
        assertEquals(0, PasswordPatterns.characterClassCount(""));
        assertEquals(1, PasswordPatterns.characterClassCount("abc"));
        assertEquals(2, PasswordPatterns.characterClassCount("aaaa1111"));
        assertEquals(3, PasswordPatterns.characterClassCount("Abc1"));
        assertEquals(4, PasswordPatterns.characterClassCount("Abc1!"));
    }

    @Test
    void shouldTreatSpaceAsSymbol() {
        assertEquals(2, PasswordPatterns.characterClassCount("correct horse"));
    }

    @Test
    void shouldDetectAscendingAndDescendingRuns() {
        assertTrue(PasswordPatterns.hasSequentialRun("xxabcxx"));
        assertTrue(PasswordPatterns.hasSequentialRun("pass321"));
        assertTrue(PasswordPatterns.hasSequentialRun("xyz"));
        assertFalse(PasswordPatterns.hasSequentialRun("acegik"));
    }

    @Test
    void shouldDetectKeyboardRuns() {
        assertTrue(PasswordPatterns.hasSequentialRun("qwe"));
        assertTrue(PasswordPatterns.hasSequentialRun("mypoi"));
        assertTrue(PasswordPatterns.hasSequentialRun("lkj"));
        assertTrue(PasswordPatterns.hasSequentialRun("890"));
        assertFalse(PasswordPatterns.hasSequentialRun("qaz"));
    }

    @Test
    void shouldNotTreatConstantRunAsSequential() {
        assertFalse(PasswordPatterns.hasSequentialRun("aaaa1111"));
    }

    @Test
    void shouldIgnoreRunsShorterThanThree() {
        assertFalse(PasswordPatterns.hasSequentialRun("ab"));
        assertFalse(PasswordPatterns.hasRepeatedRun("aa"));
        assertFalse(PasswordPatterns.hasRepeatedRun(""));
    }

    @Test
    void shouldDetectRepeatedRuns() {
        assertTrue(PasswordPatterns.hasRepeatedRun("aaaa1111"));
        assertTrue(PasswordPatterns.hasRepeatedRun("x!!!y"));
        assertFalse(PasswordPatterns.hasRepeatedRun("aabbaabb"));
        assertFalse(PasswordPatterns.hasRepeatedRun("aAa"));
    }

    @Test
    void completesRunShouldAgreeWithRunDetection() {
        assertTrue(PasswordPatterns.completesRun('a', 'b', 'c'));
        assertTrue(PasswordPatterns.completesRun('A', 'b', 'C'));
        assertTrue(PasswordPatterns.completesRun('7', '7', '7'));
        assertTrue(PasswordPatterns.completesRun('w', 'e', 'r'));
        assertFalse(PasswordPatterns.completesRun('a', 'c', 'e'));
        assertFalse(PasswordPatterns.completesRun('A', 'a', 'a'));
    }

    @Test
    void repeatedRunShouldCompareWholeCodePoints() {
        assertTrue(PasswordPatterns.hasRepeatedRun("x🔒🔒🔒y"));
        assertFalse(PasswordPatterns.hasRepeatedRun("🔒🔒x🔒"));
        // distinct emoji sharing a high surrogate
        assertFalse(PasswordPatterns.hasRepeatedRun("😀😁😂"));
    }
}
