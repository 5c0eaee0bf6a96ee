package org.ipod.datapipeline.resources.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.ipod.datapipeline.api.refinement.RefinementException;
import org.ipod.datapipeline.api.runtime.WaitResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("integration")
class LocalThreadPoolRuntimeTest {

    private LocalThreadPoolRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
    }

    @Test
    void waitForReturnsTheFirstCompletedTask() throws Exception {
        // Given: one blocked task and one that completes immediately
        runtime = new LocalThreadPoolRuntime(2);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> slow = runtime.submit(() -> {
            release.await(5, TimeUnit.SECONDS);
            return "slow";
        });
        Future<String> fast = runtime.submit(() -> "fast");

        // When
        WaitResult<String> result = runtime.waitFor(List.of(slow, fast), 1);

        // Then
        assertThat(result.ready()).containsExactly(fast);
        assertThat(result.remaining()).containsExactly(slow);
        assertThat(runtime.get(fast)).isEqualTo("fast");

        release.countDown();
        assertThat(runtime.get(slow)).isEqualTo("slow");
    }

    @Test
    void waitForReturnsAllWhenFewerThanRequested() throws Exception {
        runtime = new LocalThreadPoolRuntime(1);
        Future<Integer> only = runtime.submit(() -> 42);

        WaitResult<Integer> result = runtime.waitFor(List.of(only), 3);

        assertThat(result.ready()).containsExactly(only);
        assertThat(result.remaining()).isEmpty();
    }

    @Test
    void failedTaskSurfacesAsRefinementException() throws Exception {
        runtime = new LocalThreadPoolRuntime(1);
        Future<Object> failing = runtime.submit(() -> {
            throw new IllegalStateException("boom");
        });
        runtime.waitFor(List.of(failing), 1);

        assertThatThrownBy(() -> runtime.get(failing))
            .isInstanceOf(RefinementException.class)
            .hasRootCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("boom");
    }

    @Test
    void refinementExceptionFromTaskIsRethrownUnchanged() throws Exception {
        runtime = new LocalThreadPoolRuntime(1);
        RefinementException original = new RefinementException("orbit-7", "Error processing orbit orbit-7: bad", null);
        Future<Object> failing = runtime.submit(() -> {
            throw original;
        });
        runtime.waitFor(List.of(failing), 1);

        assertThatThrownBy(() -> runtime.get(failing)).isSameAs(original);
    }

    @Test
    void tasksRunOnNamedWorkerThreads() throws Exception {
        runtime = new LocalThreadPoolRuntime(1);

        String threadName = runtime.get(runtime.submit(() -> Thread.currentThread().getName()));

        assertThat(threadName).startsWith("ipod-worker-");
    }

    @Test
    void closeLetsInFlightTasksFinish() {
        runtime = new LocalThreadPoolRuntime(1);
        CountDownLatch started = new CountDownLatch(1);
        AtomicReference<String> outcome = new AtomicReference<>();
        runtime.submit(() -> {
            started.countDown();
            Thread.sleep(100);
            outcome.set("finished");
            return null;
        });

        await().atMost(Duration.ofSeconds(5)).until(() -> started.getCount() == 0);
        runtime.close();

        await().atMost(Duration.ofSeconds(5)).until(() -> "finished".equals(outcome.get()));
    }

    @Test
    void parallelismMustBePositive() {
        assertThatThrownBy(() -> new LocalThreadPoolRuntime(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
