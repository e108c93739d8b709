/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.routegraph.dag.Metrics;
import io.routegraph.dag.config.BuilderConfiguration;

/**
 * Writes status updates in the background, independently of each other and of the build that produced them.
 * <p>Each update is retried up to a bounded number of attempts. Failures are logged and counted, never
 * propagated. An update that has been superseded by a later submission for the same object is abandoned.</p>
 */
public class AsyncStatusWriter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncStatusWriter.class);

    private final StatusWriter delegate;
    private final int maxAttempts;
    private final Duration backoff;
    private final ScheduledExecutorService executor;
    private final AtomicLong submissions = new AtomicLong();
    private final Map<ObjectKey, Long> latestSubmission = new ConcurrentHashMap<>();

    public AsyncStatusWriter(StatusWriter delegate, BuilderConfiguration.StatusWriter config) {
        this(delegate, config.maxAttempts(), config.backoff(), Executors.newScheduledThreadPool(config.threads(), r -> {
            Thread thread = new Thread(r, "routegraph-status-writer");
            thread.setDaemon(true);
            return thread;
        }));
    }

    AsyncStatusWriter(StatusWriter delegate, int maxAttempts, Duration backoff, ScheduledExecutorService executor) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.executor = executor;
    }

    /**
     * Submits a batch of updates.
     * @param updates the updates from one build
     * @return completes once every update has been written, abandoned or has exhausted its attempts; never completes exceptionally
     */
    public CompletableFuture<Void> submit(Collection<? extends StatusUpdate> updates) {
        List<CompletableFuture<Void>> futures = updates.stream()
                .map(this::submit)
                .toList();
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    }

    CompletableFuture<Void> submit(StatusUpdate update) {
        long submission = submissions.incrementAndGet();
        latestSubmission.put(update.key(), submission);
        CompletableFuture<Void> result = new CompletableFuture<>();
        executor.execute(() -> attempt(update, submission, 1, result));
        return result;
    }

    private void attempt(StatusUpdate update, long submission, int attempt, CompletableFuture<Void> result) {
        if (isSuperseded(update, submission)) {
            LOGGER.atDebug()
                    .setMessage("Abandoning superseded status update for {}")
                    .addArgument(update.key())
                    .log();
            result.complete(null);
            return;
        }
        try {
            delegate.write(update);
            latestSubmission.remove(update.key(), submission);
            result.complete(null);
        }
        catch (RuntimeException e) {
            if (attempt < maxAttempts) {
                LOGGER.atDebug()
                        .setMessage("Attempt {} to write status of {} failed, retrying: {}")
                        .addArgument(attempt)
                        .addArgument(update.key())
                        .addArgument(e.getMessage())
                        .log();
                executor.schedule(() -> attempt(update, submission, attempt + 1, result), backoff.toMillis(), TimeUnit.MILLISECONDS);
            }
            else {
                LOGGER.atWarn()
                        .setMessage("Failed to write status of {} after {} attempts")
                        .addArgument(update.key())
                        .addArgument(attempt)
                        .setCause(e)
                        .log();
                Metrics.statusWriteFailureCounter(update.key().kind()).increment();
                latestSubmission.remove(update.key(), submission);
                result.complete(null);
            }
        }
    }

    private boolean isSuperseded(StatusUpdate update, long submission) {
        Long latest = latestSubmission.get(update.key());
        return latest != null && latest > submission;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
