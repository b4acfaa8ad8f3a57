/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.words;

import com.insultbot.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory word lists used to build insults.
 *
 * <p>Holds one insertion-ordered list per {@link WordCategory}, with no
 * duplicate value inside a category. The same word may appear in both.
 *
 * <p><b>Locking:</b> {@link #pickPhrase()} and the snapshot accessors take the
 * read lock, so any number of readers run in parallel. {@link #insert} holds
 * the write lock across its check-then-append, so a reader never sees a half
 * applied insert and two concurrent inserts of the same word cannot both win.
 *
 * <p>If an insert throws while holding the write lock, the cache is poisoned:
 * every later call fails with {@link WordCacheException.PoisonedCacheException}.
 *
 * @see LazyWordCache
 */
public class WordCache {

    private static final String VOWELS = "aeiouAEIOU";

    private final Map<WordCategory, Bucket> buckets = new EnumMap<>(WordCategory.class);
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Random random;
    private volatile Throwable poisonCause;

    public WordCache(Collection<String> descriptors, Collection<String> subjects) {
        this(descriptors, subjects, new Random());
    }

    public WordCache(Collection<String> descriptors, Collection<String> subjects, Random random) {
        this(descriptors, subjects, random, ArrayList::new);
    }

    /**
     * Builds a cache whose per-category word lists come from {@code listFactory}.
     *
     * @param listFactory creates the backing list of each category
     */
    protected WordCache(Collection<String> descriptors, Collection<String> subjects, Random random,
                        Supplier<List<String>> listFactory) {
        this(random, listFactory);
        descriptors.forEach(word -> buckets.get(WordCategory.DESCRIPTOR).add(word));
        subjects.forEach(word -> buckets.get(WordCategory.SUBJECT).add(word));
    }

    private WordCache(Random random, Supplier<List<String>> listFactory) {
        this.random = random;
        for (WordCategory category : WordCategory.values()) {
            buckets.put(category, new Bucket(listFactory.get()));
        }
    }

    /**
     * Builds a cache from the full contents of a word store.
     *
     * @param store the backing store
     * @return the populated cache (either category may be empty)
     * @throws WordCacheException if the store cannot be read or is not configured
     */
    public static WordCache initialize(RemoteWordStore store) {
        return initialize(store, new Random());
    }

    /**
     * Builds a cache from the full contents of a word store.
     *
     * <p>Records without a usable word or with an unknown category tag are
     * dropped and reported in a single warning. A word repeated within a
     * category is kept once.
     *
     * @param store  the backing store
     * @param random source for phrase selection
     * @return the populated cache (either category may be empty)
     * @throws WordCacheException if the store cannot be read or is not configured
     */
    public static WordCache initialize(RemoteWordStore store, Random random) {
        List<WordRecord> records = store.scan();
        WordCache cache = new WordCache(random, ArrayList::new);
        if (records == null) {
            LoggerUtil.warn("Word store returned no record list, starting with an empty cache");
            return cache;
        }

        int discarded = 0;
        for (WordRecord record : records) {
            if (record == null || record.word() == null || record.word().isBlank()) {
                discarded++;
                continue;
            }
            Optional<WordCategory> category = WordCategory.fromStoredTag(record.category());
            if (category.isEmpty()) {
                discarded++;
                continue;
            }
            cache.buckets.get(category.get()).add(record.word());
        }

        if (discarded > 0) {
            LoggerUtil.warn("Discarding stored insult words: " + discarded + " records were malformed");
        }
        LoggerUtil.info(String.format("Word cache loaded: %d descriptors, %d subjects (from %d records)",
                cache.size(WordCategory.DESCRIPTOR), cache.size(WordCategory.SUBJECT), records.size()));
        return cache;
    }

    /**
     * Builds a random phrase such as "an awful jerk".
     *
     * @return the phrase, or empty if either category has no words
     * @throws WordCacheException.PoisonedCacheException if the cache is poisoned
     */
    public Optional<String> pickPhrase() {
        lock.readLock().lock();
        try {
            ensureUsable();
            List<String> descriptors = buckets.get(WordCategory.DESCRIPTOR).ordered;
            List<String> subjects = buckets.get(WordCategory.SUBJECT).ordered;
            if (descriptors.isEmpty() || subjects.isEmpty()) {
                return Optional.empty();
            }
            String descriptor = descriptors.get(random.nextInt(descriptors.size()));
            String subject = subjects.get(random.nextInt(subjects.size()));
            return Optional.of(formatPhrase(descriptor, subject));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Adds a word to a category unless it is already there.
     *
     * @param category target category
     * @param word     candidate word; surrounding whitespace is trimmed
     * @return {@link InsertResult#INSERTED} or {@link InsertResult#ALREADY_PRESENT}
     * @throws IllegalArgumentException if the word is null or blank
     * @throws WordCacheException.PoisonedCacheException if the cache is poisoned
     */
    public InsertResult insert(WordCategory category, String word) {
        if (category == null) {
            throw new IllegalArgumentException("Category cannot be null");
        }
        if (word == null || word.isBlank()) {
            throw new IllegalArgumentException("Word cannot be null or blank");
        }
        String candidate = word.trim();

        lock.writeLock().lock();
        try {
            ensureUsable();
            Bucket bucket = buckets.get(category);
            if (bucket.members.contains(candidate)) {
                return InsertResult.ALREADY_PRESENT;
            }
            try {
                bucket.add(candidate);
            } catch (RuntimeException | Error e) {
                poisonCause = e;
                LoggerUtil.error("Word cache poisoned while inserting into " + category, e);
                throw new WordCacheException.PoisonedCacheException(e);
            }
            return InsertResult.INSERTED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Snapshot of the descriptors in insertion order. */
    public List<String> descriptors() {
        return snapshot(WordCategory.DESCRIPTOR);
    }

    /** Snapshot of the subjects in insertion order. */
    public List<String> subjects() {
        return snapshot(WordCategory.SUBJECT);
    }

    public int size(WordCategory category) {
        lock.readLock().lock();
        try {
            ensureUsable();
            return buckets.get(category).ordered.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isPoisoned() {
        return poisonCause != null;
    }

    /**
     * Formats {@code "<article> <descriptor> <subject>"}.
     */
    public static String formatPhrase(String descriptor, String subject) {
        return articleFor(descriptor) + " " + descriptor + " " + subject;
    }

    /**
     * Returns "an" when the descriptor starts with a vowel (either case), else "a".
     * An empty or null descriptor gets "a".
     */
    public static String articleFor(String descriptor) {
        if (descriptor == null || descriptor.isEmpty()) {
            return "a";
        }
        return VOWELS.indexOf(descriptor.charAt(0)) >= 0 ? "an" : "a";
    }

    private List<String> snapshot(WordCategory category) {
        lock.readLock().lock();
        try {
            ensureUsable();
            return List.copyOf(buckets.get(category).ordered);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void ensureUsable() {
        Throwable cause = poisonCause;
        if (cause != null) {
            throw new WordCacheException.PoisonedCacheException(cause);
        }
    }

    /**
     * Ordered list plus membership set for one category. Only touched under the cache lock,
     * or during construction before the cache is published.
     */
    private static final class Bucket {
        private final List<String> ordered;
        private final Set<String> members = new HashSet<>();

        Bucket(List<String> ordered) {
            this.ordered = ordered;
        }

        void add(String word) {
            String trimmed = word.trim();
            if (trimmed.isEmpty() || !members.add(trimmed)) {
                return;
            }
            ordered.add(trimmed);
        }
    }
}
