/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.v1.HTTPProxy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AsyncStatusWriterTest {

    private static final ObjectKey ROOT = new ObjectKey("HTTPProxy", new NamespacedName("default", "root"));

    @Mock
    private StatusWriter delegate;

    @Mock
    private ScheduledExecutorService executor;

    private final List<Runnable> queued = new ArrayList<>();
    private final List<Runnable> scheduled = new ArrayList<>();
    private SimpleMeterRegistry simpleMeterRegistry;

    @BeforeEach
    void setUp() {
        simpleMeterRegistry = new SimpleMeterRegistry();
        Metrics.globalRegistry.add(simpleMeterRegistry);
    }

    @AfterEach
    void tearDown() {
        if (simpleMeterRegistry != null) {
            simpleMeterRegistry.getMeters().forEach(Metrics.globalRegistry::remove);
            Metrics.globalRegistry.remove(simpleMeterRegistry);
        }
    }

    @Test
    void shouldWriteUpdate() {
        // Given
        queueExecutions();
        AsyncStatusWriter writer = new AsyncStatusWriter(delegate, 3, Duration.ofMillis(500), executor);
        TestUpdate update = new TestUpdate(ROOT, 1);

        // When
        CompletableFuture<Void> result = writer.submit(List.of(update));
        runQueued();

        // Then
        verify(delegate).write(update);
        assertThat(result).isCompleted();
    }

    @Test
    void shouldRetryWithBackoff() {
        // Given
        queueExecutions();
        queueSchedules();
        TestUpdate update = new TestUpdate(ROOT, 1);
        doThrow(new IllegalStateException("conflict")).doThrow(new IllegalStateException("conflict")).doNothing().when(delegate).write(update);
        AsyncStatusWriter writer = new AsyncStatusWriter(delegate, 3, Duration.ofMillis(500), executor);

        // When
        CompletableFuture<Void> result = writer.submit(List.of(update));
        runQueued();
        assertThat(result).isNotDone();
        runScheduled();
        runScheduled();

        // Then
        verify(delegate, times(3)).write(update);
        verify(executor, times(2)).schedule(any(Runnable.class), eq(500L), eq(TimeUnit.MILLISECONDS));
        assertThat(result).isCompleted();
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        // Given
        queueExecutions();
        queueSchedules();
        TestUpdate update = new TestUpdate(ROOT, 1);
        doThrow(new IllegalStateException("forbidden")).when(delegate).write(update);
        AsyncStatusWriter writer = new AsyncStatusWriter(delegate, 2, Duration.ofMillis(10), executor);

        // When
        CompletableFuture<Void> result = writer.submit(List.of(update));
        runQueued();
        runScheduled();

        // Then
        verify(delegate, times(2)).write(update);
        assertThat(result).isCompleted();
        assertThat(Metrics.globalRegistry.get("routegraph_status_write_failures").tag("kind", "HTTPProxy").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldAbandonSupersededUpdate() {
        // Given
        queueExecutions();
        TestUpdate first = new TestUpdate(ROOT, 1);
        TestUpdate second = new TestUpdate(ROOT, 2);
        doNothing().when(delegate).write(second);
        AsyncStatusWriter writer = new AsyncStatusWriter(delegate, 3, Duration.ofMillis(500), executor);

        // When
        CompletableFuture<Void> firstResult = writer.submit(List.of(first));
        CompletableFuture<Void> secondResult = writer.submit(List.of(second));
        runQueued();

        // Then
        verify(delegate, never()).write(first);
        verify(delegate).write(second);
        assertThat(firstResult).isCompleted();
        assertThat(secondResult).isCompleted();
    }

    @Test
    void shouldRequireAnAttempt() {
        assertThatThrownBy(() -> new AsyncStatusWriter(delegate, 0, Duration.ZERO, executor)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closeShutsDownExecutor() throws InterruptedException {
        doAnswer(invocation -> true).when(executor).awaitTermination(anyLong(), any());
        AsyncStatusWriter writer = new AsyncStatusWriter(delegate, 3, Duration.ofMillis(500), executor);

        writer.close();

        verify(executor).shutdown();
        verify(executor, never()).shutdownNow();
    }

    private void queueExecutions() {
        doAnswer(invocation -> queued.add(invocation.getArgument(0))).when(executor).execute(any(Runnable.class));
    }

    private void queueSchedules() {
        doAnswer(invocation -> {
            scheduled.add(invocation.getArgument(0));
            return null;
        }).when(executor).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    private void runQueued() {
        List<Runnable> toRun = new ArrayList<>(queued);
        queued.clear();
        toRun.forEach(Runnable::run);
    }

    private void runScheduled() {
        assertThat(scheduled).isNotEmpty();
        scheduled.remove(0).run();
    }

    private record TestUpdate(ObjectKey key, long generation) implements StatusUpdate {

        @Override
        public Class<? extends HasMetadata> resourceType() {
            return HTTPProxy.class;
        }

        @Override
        public boolean applyTo(HasMetadata live) {
            return true;
        }
    }
}
