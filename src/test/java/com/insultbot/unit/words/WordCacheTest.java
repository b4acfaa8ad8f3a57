/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.unit.words;

import com.insultbot.utils.LoggerUtil;
import com.insultbot.words.InsertResult;
import com.insultbot.words.RemoteWordStore;
import com.insultbot.words.WordCache;
import com.insultbot.words.WordCacheException;
import com.insultbot.words.WordCategory;
import com.insultbot.words.WordRecord;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WordCacheTest {

    @BeforeAll
    static void silenceLogs() {
        LoggerUtil.setSilent(true);
    }

    @AfterAll
    static void restoreLogs() {
        LoggerUtil.setSilent(false);
    }

    @Test
    void shouldBuildPhraseFromSingleWords() {
        WordCache cache = new WordCache(List.of("awful"), List.of("jerk"));

        assertEquals(Optional.of("an awful jerk"), cache.pickPhrase());
    }

    @Test
    void shouldUseArticleAForConsonant() {
        WordCache cache = new WordCache(List.of("smelly"), List.of("goat"));

        assertEquals(Optional.of("a smelly goat"), cache.pickPhrase());
    }

    @Test
    void shouldTreatUppercaseVowelAsVowel() {
        assertEquals("an", WordCache.articleFor("Odious"));
        assertEquals("a", WordCache.articleFor("Bitter"));
    }

    @Test
    void shouldUseArticleAForEmptyDescriptor() {
        assertEquals("a", WordCache.articleFor(""));
        assertEquals("a", WordCache.articleFor(null));
    }

    @Test
    void shouldOnlyPickWordsFromCache() {
        List<String> descriptors = List.of("awful", "smelly", "odious");
        List<String> subjects = List.of("jerk", "goat");
        WordCache cache = new WordCache(descriptors, subjects, new Random(42));

        for (int i = 0; i < 50; i++) {
            String phrase = cache.pickPhrase().orElseThrow();
            String[] parts = phrase.split(" ");
            assertEquals(3, parts.length);
            assertTrue(descriptors.contains(parts[1]), phrase);
            assertTrue(subjects.contains(parts[2]), phrase);
            assertEquals(WordCache.articleFor(parts[1]), parts[0]);
        }
    }

    @Test
    void shouldReturnEmptyWhenSubjectsMissing() {
        WordCache cache = new WordCache(List.of("awful"), List.of());

        assertTrue(cache.pickPhrase().isEmpty());
    }

    @Test
    void shouldInsertThenReportDuplicate() {
        WordCache cache = new WordCache(List.of(), List.of());

        assertEquals(InsertResult.INSERTED, cache.insert(WordCategory.SUBJECT, "goat"));
        assertEquals(InsertResult.ALREADY_PRESENT, cache.insert(WordCategory.SUBJECT, "goat"));
        assertEquals(List.of("goat"), cache.subjects());
        assertEquals(1, cache.size(WordCategory.SUBJECT));
    }

    @Test
    void shouldTrimBeforeDuplicateCheck() {
        WordCache cache = new WordCache(List.of("awful"), List.of());

        assertEquals(InsertResult.ALREADY_PRESENT, cache.insert(WordCategory.DESCRIPTOR, "  awful "));
        assertEquals(InsertResult.INSERTED, cache.insert(WordCategory.DESCRIPTOR, " smelly "));
        assertEquals(List.of("awful", "smelly"), cache.descriptors());
    }

    @Test
    void shouldAllowSameWordInBothCategories() {
        WordCache cache = new WordCache(List.of(), List.of());

        assertEquals(InsertResult.INSERTED, cache.insert(WordCategory.DESCRIPTOR, "weasel"));
        assertEquals(InsertResult.INSERTED, cache.insert(WordCategory.SUBJECT, "weasel"));
        assertEquals(Optional.of("a weasel weasel"), cache.pickPhrase());
    }

    @Test
    void shouldRejectBlankWord() {
        WordCache cache = new WordCache(List.of(), List.of());

        assertThrows(IllegalArgumentException.class, () -> cache.insert(WordCategory.SUBJECT, "   "));
        assertThrows(IllegalArgumentException.class, () -> cache.insert(WordCategory.SUBJECT, null));
        assertEquals(0, cache.size(WordCategory.SUBJECT));
    }

    @Test
    void shouldKeepInsertionOrder() {
        WordCache cache = new WordCache(List.of("b", "a"), List.of());
        cache.insert(WordCategory.DESCRIPTOR, "c");

        assertEquals(List.of("b", "a", "c"), cache.descriptors());
    }

    @Test
    void shouldCollapseDuplicatesPassedToConstructor() {
        WordCache cache = new WordCache(List.of("awful", "awful", " awful"), List.of("jerk"));

        assertEquals(List.of("awful"), cache.descriptors());
    }

    @Test
    void shouldAllowExactlyOneConcurrentInsertOfSameWord() throws Exception {
        WordCache cache = new WordCache(List.of(), List.of());
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<InsertResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<InsertResult> task = () -> {
                    start.await();
                    return cache.insert(WordCategory.SUBJECT, "goat");
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            int inserted = 0;
            int present = 0;
            for (Future<InsertResult> future : futures) {
                InsertResult result = future.get(5, TimeUnit.SECONDS);
                if (result == InsertResult.INSERTED) {
                    inserted++;
                } else {
                    present++;
                }
            }
            assertEquals(1, inserted);
            assertEquals(threads - 1, present);
            assertEquals(List.of("goat"), cache.subjects());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldStayConsistentUnderConcurrentInsertsAndReads() throws Exception {
        WordCache cache = new WordCache(List.of("awful"), List.of("jerk"), new Random(7));
        int writers = 8;
        int readers = 8;
        int distinctWords = 50;
        int attemptsPerWriter = 100;
        ExecutorService executor = Executors.newFixedThreadPool(writers + readers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger inserted = new AtomicInteger();
        ConcurrentLinkedQueue<String> failures = new ConcurrentLinkedQueue<>();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int offset = w;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < attemptsPerWriter; i++) {
                        String word = "word" + ((i + offset) % distinctWords);
                        if (cache.insert(WordCategory.SUBJECT, word) == InsertResult.INSERTED) {
                            inserted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            for (int r = 0; r < readers; r++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        Optional<String> phrase = cache.pickPhrase();
                        if (phrase.isEmpty()) {
                            failures.add("empty phrase");
                            continue;
                        }
                        String[] parts = phrase.get().split(" ");
                        if (parts.length != 3 || !parts[0].equals("an") || !parts[1].equals("awful")
                                || !(parts[2].equals("jerk") || parts[2].matches("word\\d+"))) {
                            failures.add("unexpected phrase " + phrase.get());
                        }
                        List<String> subjects = cache.subjects();
                        if (!subjects.get(0).equals("jerk") || subjects.size() > distinctWords + 1) {
                            failures.add("unexpected subjects " + subjects);
                        }
                        if (!cache.descriptors().equals(List.of("awful"))) {
                            failures.add("descriptors changed");
                        }
                    }
                    return null;
                }));
            }
            start.countDown();

            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }

            assertTrue(failures.isEmpty(), () -> String.join(", ", failures));
            assertEquals(distinctWords, inserted.get());
            assertEquals(distinctWords + 1, cache.size(WordCategory.SUBJECT));
            assertEquals(distinctWords + 1, cache.subjects().stream().distinct().count());
            assertFalse(cache.isPoisoned());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldNotBePoisonedWhenHealthy() {
        WordCache cache = new WordCache(List.of("awful"), List.of("jerk"));
        cache.insert(WordCategory.SUBJECT, "goat");

        assertFalse(cache.isPoisoned());
    }

    @Test
    void shouldPoisonCacheWhenInsertFailsHalfway() {
        IllegalStateException injected = new IllegalStateException("list refused kaboom");
        WordCache cache = new WordCache(List.of("awful"), List.of("jerk"), new Random(1), () -> new ArrayList<>() {
            @Override
            public boolean add(String word) {
                if ("kaboom".equals(word)) {
                    throw injected;
                }
                return super.add(word);
            }
        }) {
        };

        assertEquals(InsertResult.INSERTED, cache.insert(WordCategory.SUBJECT, "goat"));
        assertFalse(cache.isPoisoned());

        WordCacheException.PoisonedCacheException first = assertThrows(
                WordCacheException.PoisonedCacheException.class,
                () -> cache.insert(WordCategory.SUBJECT, "kaboom"));
        assertSame(injected, first.getCause());
        assertTrue(cache.isPoisoned());

        WordCacheException.PoisonedCacheException later = assertThrows(
                WordCacheException.PoisonedCacheException.class, cache::pickPhrase);
        assertSame(injected, later.getCause());
        assertThrows(WordCacheException.PoisonedCacheException.class,
                () -> cache.insert(WordCategory.DESCRIPTOR, "smelly"));
        assertThrows(WordCacheException.PoisonedCacheException.class,
                () -> cache.insert(WordCategory.SUBJECT, "goat"));
        assertThrows(WordCacheException.PoisonedCacheException.class, () -> cache.size(WordCategory.SUBJECT));
        assertThrows(WordCacheException.PoisonedCacheException.class, cache::descriptors);
        assertThrows(WordCacheException.PoisonedCacheException.class, cache::subjects);
        assertTrue(cache.isPoisoned());
    }

    @Test
    void shouldInitializeFromStoreAndDiscardMalformedRecords() {
        RemoteWordStore store = new FixedStore(Arrays.asList(
                new WordRecord("awful", "descriptor"),
                new WordRecord("jerk", "subject"),
                new WordRecord("  ", "subject"),
                new WordRecord(null, "descriptor"),
                new WordRecord("goat", "verb"),
                new WordRecord("weasel", null),
                null,
                new WordRecord("odious", " DESCRIPTOR ")));

        WordCache cache = WordCache.initialize(store);

        assertEquals(List.of("awful", "odious"), cache.descriptors());
        assertEquals(List.of("jerk"), cache.subjects());
    }

    @Test
    void shouldInitializeEmptyCacheFromEmptyStore() {
        WordCache cache = WordCache.initialize(new FixedStore(List.of()));

        assertEquals(0, cache.size(WordCategory.DESCRIPTOR));
        assertEquals(0, cache.size(WordCategory.SUBJECT));
        assertTrue(cache.pickPhrase().isEmpty());
    }

    @Test
    void shouldPropagateStoreFailure() {
        RemoteWordStore store = new FixedStore(null) {
            @Override
            public List<WordRecord> scan() {
                throw new WordCacheException.RemoteStoreException("scan", new IllegalStateException("offline"));
            }
        };

        assertThrows(WordCacheException.RemoteStoreException.class, () -> WordCache.initialize(store));
    }

    @Property
    void articleIsAnExactlyForLeadingVowel(@ForAll @AlphaChars @StringLength(min = 1, max = 12) String descriptor) {
        WordCache cache = new WordCache(List.of(descriptor), List.of("jerk"));

        String phrase = cache.pickPhrase().orElseThrow();
        boolean vowel = "aeiou".indexOf(Character.toLowerCase(descriptor.charAt(0))) >= 0;
        assertEquals((vowel ? "an " : "a ") + descriptor + " jerk", phrase);
    }

    @Property
    void phraseIsEmptyExactlyWhenACategoryIsEmpty(@ForAll boolean hasDescriptor, @ForAll boolean hasSubject) {
        WordCache cache = new WordCache(
                hasDescriptor ? List.of("awful") : List.of(),
                hasSubject ? List.of("jerk") : List.of());

        assertEquals(hasDescriptor && hasSubject, cache.pickPhrase().isPresent());
    }

    @Property
    void insertGrowsCategoryByOneForNewWord(@ForAll @AlphaChars @StringLength(min = 1, max = 10) String word) {
        WordCache cache = new WordCache(List.of("awful"), List.of("jerk"));
        int before = cache.size(WordCategory.SUBJECT);

        InsertResult first = cache.insert(WordCategory.SUBJECT, word);
        InsertResult second = cache.insert(WordCategory.SUBJECT, word);

        assertEquals(word.equals("jerk") ? InsertResult.ALREADY_PRESENT : InsertResult.INSERTED, first);
        assertEquals(InsertResult.ALREADY_PRESENT, second);
        assertEquals(word.equals("jerk") ? before : before + 1, cache.size(WordCategory.SUBJECT));
    }

    private static class FixedStore implements RemoteWordStore {
        private final List<WordRecord> records;

        FixedStore(List<WordRecord> records) {
            this.records = records;
        }

        @Override
        public List<WordRecord> scan() {
            return records;
        }

        @Override
        public void put(String word, WordCategory category) {
            throw new UnsupportedOperationException("read-only store");
        }
    }
}
