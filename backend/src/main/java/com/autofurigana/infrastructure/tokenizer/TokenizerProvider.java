package com.autofurigana.infrastructure.tokenizer;

import com.autofurigana.domain.furigana.service.ReadingTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Owns the single lazily built tokenizer.
 *
 * <p>{@link #initialize()} is single-flight: every caller that arrives while a build is running gets
 * the same future. A failed build is forgotten so a later call can try again. Once built, the
 * tokenizer is shared read-only.</p>
 */
@Slf4j
public class TokenizerProvider {

    private final Supplier<? extends ReadingTokenizer> factory;
    private final Executor executor;
    private final Duration initTimeout;
    private final AtomicReference<CompletableFuture<ReadingTokenizer>> build = new AtomicReference<>();

    public TokenizerProvider(Supplier<? extends ReadingTokenizer> factory, Executor executor, Duration initTimeout) {
        this.factory = factory;
        this.executor = executor;
        this.initTimeout = initTimeout;
    }

    /**
     * Start the build if none is running or done; idempotent.
     */
    public CompletableFuture<ReadingTokenizer> initialize() {
        while (true) {
            CompletableFuture<ReadingTokenizer> existing = build.get();
            if (existing != null && !existing.isCompletedExceptionally()) {
                return existing;
            }
            CompletableFuture<ReadingTokenizer> fresh = new CompletableFuture<>();
            if (build.compareAndSet(existing, fresh)) {
                executor.execute(() -> runBuild(fresh));
                return fresh;
            }
        }
    }

    /**
     * Block until the tokenizer is built, at most the configured timeout.
     *
     * @throws TokenizerInitializationException on build failure, timeout or interruption
     */
    public ReadingTokenizer awaitReady() {
        CompletableFuture<ReadingTokenizer> future = initialize();
        try {
            return future.get(initTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Tokenizer not ready after {} ms", initTimeout.toMillis());
            throw new TokenizerInitializationException("Tokenizer init timeout", e);
        } catch (ExecutionException e) {
            throw new TokenizerInitializationException("Tokenizer build failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenizerInitializationException("Interrupted while waiting for tokenizer", e);
        }
    }

    /**
     * The built tokenizer, or empty while it is missing, building or failed. Never blocks.
     */
    public Optional<ReadingTokenizer> current() {
        CompletableFuture<ReadingTokenizer> future = build.get();
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    /**
     * Like {@link #current()}, but starts the build when none is running or done. Never blocks.
     */
    public Optional<ReadingTokenizer> currentOrStart() {
        initialize();
        return current();
    }

    public boolean isReady() {
        return current().isPresent();
    }

    private void runBuild(CompletableFuture<ReadingTokenizer> target) {
        long start = System.currentTimeMillis();
        log.info("Building tokenizer");
        try {
            ReadingTokenizer tokenizer = factory.get();
            log.info("Tokenizer ready in {} ms", System.currentTimeMillis() - start);
            target.complete(tokenizer);
        } catch (RuntimeException | Error e) {
            log.warn("Tokenizer build failed after {} ms: {}", System.currentTimeMillis() - start, e.getMessage(), e);
            target.completeExceptionally(e);
        }
    }
}
