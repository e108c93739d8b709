/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.builder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.routegraph.dag.cache.ObjectCacheView;
import io.routegraph.dag.config.BuilderConfiguration;
import io.routegraph.dag.model.Dag;
import io.routegraph.dag.status.StatusUpdate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RebuildSchedulerTest {

    private static final long HOLDOFF = Duration.ofMillis(100).toNanos();
    private static final long HOLDOFF_MAX = Duration.ofMillis(500).toNanos();

    @Mock
    private ObjectCacheView view;

    @Mock
    private GraphBuilder builder;

    @Mock
    private SnapshotPublisher publisher;

    @Mock
    private Consumer<List<StatusUpdate>> statusSink;

    @Mock
    private ScheduledExecutorService executor;

    @Mock
    private ScheduledFuture<Object> future;

    private final AtomicLong nanoTime = new AtomicLong();
    private final List<Runnable> tasks = new ArrayList<>();
    private RebuildScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new RebuildScheduler(() -> view, builder, publisher, statusSink,
                new BuilderConfiguration.Rebuild(Duration.ofNanos(HOLDOFF), Duration.ofNanos(HOLDOFF_MAX)), executor, nanoTime::get);
    }

    @Test
    void changesBeforeInitialSyncOnlyMarkDirty() {
        scheduler.changed();

        assertThat(scheduler.isDirty()).isTrue();
        verifyNoInteractions(executor);
    }

    @Test
    void initialSyncBuildsImmediately() {
        captureTasks();
        scheduler.changed();

        scheduler.initialSyncComplete();
        scheduler.initialSyncComplete();

        verify(executor, times(1)).schedule(any(Runnable.class), eq(0L), eq(TimeUnit.NANOSECONDS));
    }

    @Test
    void changeAfterSyncWaitsForHoldoff() {
        captureTasks();
        buildsEmptySnapshot();
        scheduler.initialSyncComplete();
        runTask();

        nanoTime.set(1_000);
        scheduler.changed();

        verify(executor).schedule(any(Runnable.class), eq(HOLDOFF), eq(TimeUnit.NANOSECONDS));
    }

    @Test
    void burstOfChangesIsCoalescedUpToMaximumDelay() {
        captureTasks();
        buildsEmptySnapshot();
        scheduler.initialSyncComplete();
        runTask();

        nanoTime.set(0);
        scheduler.changed();
        nanoTime.set(Duration.ofMillis(50).toNanos());
        scheduler.changed();
        nanoTime.set(Duration.ofMillis(450).toNanos());
        scheduler.changed();

        verify(future, times(2)).cancel(false);
        verify(executor, times(2)).schedule(any(Runnable.class), eq(HOLDOFF), eq(TimeUnit.NANOSECONDS));
        verify(executor).schedule(any(Runnable.class), eq(Duration.ofMillis(50).toNanos()), eq(TimeUnit.NANOSECONDS));
    }

    @Test
    void overdueChangeIsBuiltWithoutDelay() {
        captureTasks();
        buildsEmptySnapshot();
        scheduler.initialSyncComplete();
        runTask();

        nanoTime.set(0);
        scheduler.changed();
        nanoTime.set(Duration.ofSeconds(1).toNanos());
        scheduler.changed();

        verify(executor, times(2)).schedule(any(Runnable.class), eq(0L), eq(TimeUnit.NANOSECONDS));
    }

    @Test
    void rebuildPublishesSnapshotAndStatus() {
        captureTasks();
        Dag dag = Dag.empty(1);
        when(builder.build(view)).thenReturn(new BuildResult(dag, List.of()));
        scheduler.initialSyncComplete();

        runTask();

        verify(publisher).publish(dag);
        verify(statusSink).accept(List.of());
        assertThat(scheduler.isDirty()).isFalse();
    }

    @Test
    void failedRebuildKeepsPreviousSnapshot() {
        captureTasks();
        when(builder.build(view)).thenThrow(new DagBuildException("boom", null, new IllegalStateException("boom")));
        scheduler.initialSyncComplete();

        runTask();

        verify(publisher, never()).publish(any());
        verifyNoInteractions(statusSink);
    }

    @Test
    void publishFailureDoesNotStopLaterRebuilds() {
        // Given
        captureTasks();
        Dag dag = Dag.empty(1);
        when(builder.build(view)).thenReturn(new BuildResult(dag, List.of()));
        doThrow(new IllegalStateException("subscriber failed")).when(publisher).publish(dag);
        scheduler.initialSyncComplete();

        // When
        assertThatCode(this::runTask).doesNotThrowAnyException();
        nanoTime.set(1_000);
        scheduler.changed();

        // Then
        verifyNoInteractions(statusSink);
        verify(executor).schedule(any(Runnable.class), eq(HOLDOFF), eq(TimeUnit.NANOSECONDS));
    }

    @Test
    void closeStopsExecutor() {
        scheduler.close();

        verify(executor).shutdownNow();
    }

    private void captureTasks() {
        when(executor.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(invocation -> {
            tasks.add(invocation.getArgument(0));
            return future;
        });
    }

    private void buildsEmptySnapshot() {
        when(builder.build(view)).thenReturn(new BuildResult(Dag.empty(1), List.of()));
    }

    private void runTask() {
        assertThat(tasks).isNotEmpty();
        tasks.remove(tasks.size() - 1).run();
    }
}
