/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.builder;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.routegraph.dag.cache.ObjectCacheView;
import io.routegraph.dag.config.BuilderConfiguration;
import io.routegraph.dag.status.StatusUpdate;
import io.routegraph.tag.RunsOnThread;
import io.routegraph.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Turns change notifications into rebuilds.
 * <p>Nothing is built until the cache reports its initial sync. After that a change schedules a build once the
 * cluster has been quiet for the holdoff delay, but never later than the holdoff maximum after the first unbuilt
 * change. Builds run one at a time on a dedicated thread; changes arriving during a build cause exactly one
 * follow-up build.</p>
 */
public class RebuildScheduler implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RebuildScheduler.class);

    private static final String REBUILD_THREAD = "routegraph-rebuild";

    private final Supplier<ObjectCacheView> cache;
    private final GraphBuilder builder;
    private final SnapshotPublisher publisher;
    private final Consumer<List<StatusUpdate>> statusSink;
    private final Duration holdoffDelay;
    private final Duration holdoffMaxDelay;
    private final ScheduledExecutorService executor;
    private final LongSupplier nanoTime;

    private boolean synced;
    private boolean dirty;
    private long firstUnbuiltChangeNanos = -1;
    private @Nullable ScheduledFuture<?> pending;

    /**
     * @param cache supplies a consistent view of the cluster for each build
     * @param builder the graph builder
     * @param publisher receives each snapshot
     * @param statusSink receives the status updates of each snapshot; must not block
     * @param configuration holdoff settings
     */
    public RebuildScheduler(Supplier<ObjectCacheView> cache,
                            GraphBuilder builder,
                            SnapshotPublisher publisher,
                            Consumer<List<StatusUpdate>> statusSink,
                            BuilderConfiguration.Rebuild configuration) {
        this(cache, builder, publisher, statusSink, configuration, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, REBUILD_THREAD);
            thread.setDaemon(true);
            return thread;
        }), System::nanoTime);
    }

    @VisibleForTesting
    RebuildScheduler(Supplier<ObjectCacheView> cache,
                     GraphBuilder builder,
                     SnapshotPublisher publisher,
                     Consumer<List<StatusUpdate>> statusSink,
                     BuilderConfiguration.Rebuild configuration,
                     ScheduledExecutorService executor,
                     LongSupplier nanoTime) {
        this.cache = cache;
        this.builder = builder;
        this.publisher = publisher;
        this.statusSink = statusSink;
        this.holdoffDelay = configuration.holdoffDelay();
        this.holdoffMaxDelay = configuration.holdoffMaxDelay();
        this.executor = executor;
        this.nanoTime = nanoTime;
    }

    /**
     * Signals that the initial listing has been delivered to the cache. The first build is scheduled immediately.
     */
    public synchronized void initialSyncComplete() {
        if (synced) {
            return;
        }
        synced = true;
        LOGGER.atDebug()
                .setMessage("Initial sync complete, building the first snapshot")
                .log();
        firstUnbuiltChangeNanos = nanoTime.getAsLong();
        reschedule(0);
    }

    /**
     * Signals that something in the cache changed.
     */
    public synchronized void changed() {
        if (!synced) {
            dirty = true;
            return;
        }
        long now = nanoTime.getAsLong();
        if (firstUnbuiltChangeNanos < 0) {
            firstUnbuiltChangeNanos = now;
        }
        long untilMax = firstUnbuiltChangeNanos + holdoffMaxDelay.toNanos() - now;
        reschedule(Math.max(0, Math.min(holdoffDelay.toNanos(), untilMax)));
    }

    @VisibleForTesting
    synchronized boolean isDirty() {
        return dirty;
    }

    private void reschedule(long delayNanos) {
        if (pending != null) {
            pending.cancel(false);
        }
        pending = executor.schedule(this::rebuild, delayNanos, TimeUnit.NANOSECONDS);
    }

    @RunsOnThread(REBUILD_THREAD)
    private void rebuild() {
        synchronized (this) {
            pending = null;
            dirty = false;
            firstUnbuiltChangeNanos = -1;
        }
        try {
            BuildResult result = builder.build(cache.get());
            publisher.publish(result.dag());
            statusSink.accept(result.statusUpdates());
        }
        catch (DagBuildException e) {
            LOGGER.atError()
                    .setMessage("Rebuild failed, the previous snapshot remains in service")
                    .setCause(e)
                    .log();
        }
        catch (RuntimeException e) {
            LOGGER.atError()
                    .setMessage("Handing on the rebuilt snapshot failed")
                    .setCause(e)
                    .log();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
