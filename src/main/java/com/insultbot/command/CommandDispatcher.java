/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.command;

import com.insultbot.utils.LoggerUtil;
import com.insultbot.words.InsertResult;
import com.insultbot.words.LazyWordCache;
import com.insultbot.words.RemoteWordStore;
import com.insultbot.words.WordCache;
import com.insultbot.words.WordCacheException;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the command found in a chat message.
 *
 * <ul>
 *   <li>insult request: pick a phrase and reply {@code "<target> is <phrase>"},
 *       or "Shut up." when a word list is empty</li>
 *   <li>add word: insert into the cache; new words are written to the store in
 *       the background and confirmed with "Added."; known words get
 *       "I already have that word!" and are not written</li>
 *   <li>empty add word: "Nice try wise guy."</li>
 * </ul>
 *
 * <p>Cache failures (configuration, store, poisoned cache) propagate to the
 * caller and nothing is sent to the channel. Reply failures are logged here
 * and never propagate.
 */
public class CommandDispatcher {

    static final String EMPTY_CACHE_REPLY = "Shut up.";
    static final String ADDED_REPLY = "Added.";
    static final String DUPLICATE_REPLY = "I already have that word!";
    static final String REJECTED_REPLY = "Nice try wise guy.";

    private final CommandRouter router;
    private final LazyWordCache wordCache;
    private final RemoteWordStore wordStore;
    private final ReplySink replySink;
    private final Executor persistenceExecutor;

    public CommandDispatcher(CommandRouter router, LazyWordCache wordCache, RemoteWordStore wordStore,
                             ReplySink replySink, Executor persistenceExecutor) {
        this.router = router;
        this.wordCache = wordCache;
        this.wordStore = wordStore;
        this.replySink = replySink;
        this.persistenceExecutor = persistenceExecutor;
    }

    /**
     * Classifies a message and runs the resulting command.
     *
     * @param text        message text
     * @param requesterId sender's user id
     * @param channel     channel to reply in
     * @return the command that was handled
     * @throws WordCacheException if the word cache cannot be loaded or used
     */
    public CommandMatch dispatch(String text, String requesterId, String channel) {
        CommandMatch match = router.classify(text, requesterId);

        if (match instanceof CommandMatch.InsultRequest insult) {
            handleInsult(insult, channel);
        } else if (match instanceof CommandMatch.AddWord addWord) {
            handleAddWord(addWord, requesterId, channel);
        } else if (match instanceof CommandMatch.RejectedAddWord rejected) {
            LoggerUtil.info(String.format("%s tried to add an empty %s",
                    requesterId, rejected.category().getCommandKeyword()));
            reply(channel, REJECTED_REPLY);
        } else {
            LoggerUtil.debug(() -> "No command in message from " + requesterId);
        }
        return match;
    }

    private void handleInsult(CommandMatch.InsultRequest insult, String channel) {
        WordCache cache = wordCache.get();
        Optional<String> phrase = cache.pickPhrase();
        String message = phrase
                .map(p -> insult.target() + " is " + p)
                .orElse(EMPTY_CACHE_REPLY);
        if (phrase.isEmpty()) {
            LoggerUtil.warn("Cannot build an insult: a word list is empty");
        }
        reply(channel, message);
    }

    private void handleAddWord(CommandMatch.AddWord addWord, String requesterId, String channel) {
        WordCache cache = wordCache.get();
        InsertResult result = cache.insert(addWord.category(), addWord.word());

        if (result == InsertResult.ALREADY_PRESENT) {
            LoggerUtil.info(String.format("%s tried to add known %s '%s'",
                    requesterId, addWord.category().getStoredTag(), addWord.word()));
            reply(channel, DUPLICATE_REPLY);
            return;
        }

        LoggerUtil.info(String.format("%s added %s '%s'",
                requesterId, addWord.category().getStoredTag(), addWord.word()));
        persistAsync(addWord);
        reply(channel, ADDED_REPLY);
    }

    /**
     * Writes a new word to the store. The cache already holds it, so a failed
     * write is only logged and the store misses the word.
     */
    private void persistAsync(CommandMatch.AddWord addWord) {
        try {
            CompletableFuture
                    .runAsync(() -> wordStore.put(addWord.word(), addWord.category()), persistenceExecutor)
                    .exceptionally(ex -> {
                        logPersistFailure(addWord, ex.getCause() != null ? ex.getCause() : ex);
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            logPersistFailure(addWord, e);
        }
    }

    private void logPersistFailure(CommandMatch.AddWord addWord, Throwable cause) {
        LoggerUtil.error("Failed to store " + addWord.category().getStoredTag()
                + " '" + addWord.word() + "'", cause);
    }

    private void reply(String channel, String text) {
        try {
            replySink.send(channel, text);
        } catch (RuntimeException e) {
            LoggerUtil.error("Reply to channel " + channel + " failed", e);
        }
    }
}
