/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.words;

import com.insultbot.utils.LoggerUtil;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Owns the process-wide {@link WordCache} and builds it on first use.
 *
 * <p>The loader runs at most once. Callers that arrive while it is running
 * wait on the same future, and every caller, then and later, gets the same
 * cache or the same failure. A failed load is never retried by this instance.
 *
 * <p><b>Usage:</b>
 * <pre>
 * LazyWordCache words = new LazyWordCache(() -&gt; WordCache.initialize(store));
 * WordCache cache = words.get();   // first call loads, later calls return at once
 * </pre>
 */
public class LazyWordCache {

    private final Supplier<WordCache> loader;
    private final AtomicReference<CompletableFuture<WordCache>> slot = new AtomicReference<>();

    public LazyWordCache(Supplier<WordCache> loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Convenience constructor that loads from a word store.
     *
     * @param store the backing store to scan on first use
     * @return a lazy cache over that store
     */
    public static LazyWordCache over(RemoteWordStore store) {
        Objects.requireNonNull(store, "store");
        return new LazyWordCache(() -> WordCache.initialize(store));
    }

    /**
     * Returns the cache, loading it if this is the first call.
     *
     * @return the shared cache
     * @throws WordCacheException the load failure, identical for every caller
     */
    public WordCache get() {
        CompletableFuture<WordCache> future = slot.get();
        if (future == null) {
            CompletableFuture<WordCache> created = new CompletableFuture<>();
            if (slot.compareAndSet(null, created)) {
                runLoader(created);
                future = created;
            } else {
                future = slot.get();
            }
        }

        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * @return true once a load has finished successfully
     */
    public boolean isLoaded() {
        CompletableFuture<WordCache> future = slot.get();
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    /**
     * @return true once a load has finished with an error
     */
    public boolean isFailed() {
        CompletableFuture<WordCache> future = slot.get();
        return future != null && future.isCompletedExceptionally();
    }

    private void runLoader(CompletableFuture<WordCache> target) {
        long startTime = System.currentTimeMillis();
        try {
            WordCache cache = loader.get();
            if (cache == null) {
                throw new WordCacheException("Word cache loader returned no cache");
            }
            target.complete(cache);
            LoggerUtil.info("Word cache initialized in " + (System.currentTimeMillis() - startTime) + "ms");
        } catch (WordCacheException e) {
            LoggerUtil.error("Word cache initialization failed", e);
            target.completeExceptionally(e);
        } catch (RuntimeException e) {
            LoggerUtil.error("Word cache initialization failed", e);
            target.completeExceptionally(new WordCacheException("Word cache initialization failed: " + e.getMessage(), e));
        } catch (Error e) {
            target.completeExceptionally(e);
            throw e;
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof WordCacheException wordCacheException) {
            return wordCacheException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new WordCacheException("Word cache initialization failed: " + cause.getMessage(), cause);
    }
}
