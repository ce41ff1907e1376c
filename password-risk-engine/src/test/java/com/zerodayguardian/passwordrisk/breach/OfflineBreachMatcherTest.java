package com.zerodayguardian.passwordrisk.breach;

import com.zerodayguardian.passwordrisk.TestFixtures;
import com.zerodayguardian.passwordrisk.normalize.Normalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class OfflineBreachMatcherTest {

    @TempDir
    Path tempDir;

    private Normalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new Normalizer();
    }

    @Test
    void shouldMatchLowercaseForm() {
        OfflineBreachMatcher matcher = TestFixtures.testCorpusMatcher();

        assertTrue(matcher.isBreachedOffline(normalizer.normalize("LetMeIn")));
        assertTrue(matcher.isBreachedOffline(normalizer.normalize("QWERTY")));
    }

    @Test
    void shouldMatchDesubstitutedForm() {
        OfflineBreachMatcher matcher = TestFixtures.testCorpusMatcher();

        assertTrue(matcher.isBreachedOffline(normalizer.normalize("MyP@ssw0rd")));
    }

    @Test
    void shouldRequireExactMatch() {
        OfflineBreachMatcher matcher = TestFixtures.testCorpusMatcher();

        assertFalse(matcher.isBreachedOffline(normalizer.normalize("password-but-longer")));
        assertFalse(matcher.isBreachedOffline(normalizer.normalize("")));
    }

    @Test
    void shouldSkipCommentLines() {
        OfflineBreachMatcher matcher = TestFixtures.testCorpusMatcher();

        assertFalse(matcher.corpus().contains("# test corpus"));
        assertEquals(6, matcher.corpus().size());
    }

    @Test
    void shouldMergeSourcesAndSkipMissingOnes() throws IOException {
        Path extra = tempDir.resolve("extra.txt");
        Files.writeString(extra, "hunter2\nCorrectHorse\n");

        OfflineBreachMatcher matcher = new OfflineBreachMatcher(List.of(
                TestFixtures.TEST_CORPUS,
                "file:" + tempDir.resolve("missing.txt"),
                "file:" + extra), TestFixtures.RESOURCE_LOADER);

        assertTrue(matcher.isBreachedOffline(normalizer.normalize("hunter2")));
        assertTrue(matcher.isBreachedOffline(normalizer.normalize("correcthorse")));
        assertTrue(matcher.isBreachedOffline(normalizer.normalize("123456")));
    }

    @Test
    void missingCorpusShouldDegradeToNoMatches() {
        OfflineBreachMatcher matcher = new OfflineBreachMatcher(
                List.of("file:" + tempDir.resolve("nowhere.txt")), TestFixtures.RESOURCE_LOADER);

        assertFalse(matcher.isBreachedOffline(normalizer.normalize("password")));
        assertEquals(0, matcher.loadedSize());
    }

    @Test
    void shouldLoadLazilyOnFirstUse() {
        OfflineBreachMatcher matcher = TestFixtures.testCorpusMatcher();
        assertEquals(0, matcher.loadedSize());

        matcher.isBreachedOffline(normalizer.normalize("anything"));

        assertEquals(6, matcher.loadedSize());
    }

    @Test
    void corpusShouldBeImmutableAndLoadedOnce() throws Exception {
        OfflineBreachMatcher matcher = TestFixtures.testCorpusMatcher();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Set<String>>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                tasks.add(matcher::corpus);
            }
            List<Future<Set<String>>> futures = pool.invokeAll(tasks);
            Set<String> first = futures.get(0).get();
            for (Future<Set<String>> future : futures) {
                assertSame(first, future.get());
            }
            assertThrows(UnsupportedOperationException.class, () -> first.add("new"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void warmUpShouldLoadCorpusInBackground() throws InterruptedException {
        OfflineBreachMatcher matcher = TestFixtures.testCorpusMatcher();
        assertFalse(matcher.isLoaded());

        matcher.warmUp();

        long deadline = System.currentTimeMillis() + 5000;
        while (!matcher.isLoaded() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(matcher.isLoaded());
        assertEquals(6, matcher.loadedSize());
    }
}
