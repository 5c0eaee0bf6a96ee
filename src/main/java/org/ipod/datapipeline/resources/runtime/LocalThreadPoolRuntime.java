package org.ipod.datapipeline.resources.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.ipod.datapipeline.api.refinement.RefinementException;
import org.ipod.datapipeline.api.runtime.IDistributedRuntime;
import org.ipod.datapipeline.api.runtime.IObjectStore;
import org.ipod.datapipeline.api.runtime.WaitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A runtime that executes chunk tasks on a fixed pool of local threads.
 * <p>
 * Each pool thread is one single-threaded worker. Every task submitted through
 * {@link #submit(Callable)} signals a shared monitor when it completes, which is what
 * {@link #waitFor(Collection, int)} blocks on. Futures not created by this runtime are
 * still accepted by {@code waitFor}; they are polled at {@link #FOREIGN_POLL_INTERVAL_MS}.
 */
public class LocalThreadPoolRuntime implements IDistributedRuntime {

    private static final Logger log = LoggerFactory.getLogger(LocalThreadPoolRuntime.class);

    static final long FOREIGN_POLL_INTERVAL_MS = 100;

    private final ExecutorService executor;
    private final IObjectStore objectStore;
    private final int parallelism;
    private final Object completionMonitor = new Object();
    private final AtomicLong completionSequence = new AtomicLong();

    /**
     * Creates a runtime with its own in-memory object store.
     *
     * @param parallelism Number of worker threads, at least 1.
     */
    public LocalThreadPoolRuntime(int parallelism) {
        this(parallelism, new InMemoryObjectStore());
    }

    /**
     * Creates a runtime using the given object store.
     *
     * @param parallelism Number of worker threads, at least 1.
     * @param objectStore Store for shared inputs.
     */
    public LocalThreadPoolRuntime(int parallelism, IObjectStore objectStore) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.objectStore = objectStore;
        this.executor = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
        log.debug("Started local runtime with {} worker threads", parallelism);
    }

    @Override
    public IObjectStore objectStore() {
        return objectStore;
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        SignallingTask<T> future = new SignallingTask<>(task);
        executor.execute(future);
        return future;
    }

    @Override
    public <T> WaitResult<T> waitFor(Collection<Future<T>> futures, int numReturns) throws InterruptedException {
        if (numReturns < 1) {
            throw new IllegalArgumentException("numReturns must be at least 1");
        }
        int wanted = Math.min(numReturns, futures.size());
        List<Future<T>> pending = new ArrayList<>(futures);
        List<Future<T>> ready = new ArrayList<>(wanted);

        synchronized (completionMonitor) {
            while (true) {
                collectDone(pending, ready);
                if (ready.size() >= wanted) {
                    break;
                }
                completionMonitor.wait(FOREIGN_POLL_INTERVAL_MS);
            }
        }

        ready.sort(Comparator.comparingLong(LocalThreadPoolRuntime::completionOrder));
        // Hand back surplus completions as remaining so exactly `wanted` are reported ready
        while (ready.size() > wanted) {
            pending.add(ready.remove(ready.size() - 1));
        }
        return new WaitResult<>(ready, pending);
    }

    @Override
    public <T> T get(Future<T> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RefinementException refinementException) {
                throw refinementException;
            }
            throw new RefinementException("Chunk task failed: " + cause, cause);
        } catch (CancellationException e) {
            throw new RefinementException("Chunk task was cancelled", e);
        }
    }

    @Override
    public int parallelism() {
        return parallelism;
    }

    @Override
    public void close() {
        executor.shutdown();
        log.debug("Local runtime shut down; in-flight tasks run to completion");
    }

    private static <T> void collectDone(List<Future<T>> pending, List<Future<T>> ready) {
        Iterator<Future<T>> it = pending.iterator();
        while (it.hasNext()) {
            Future<T> future = it.next();
            if (future.isDone()) {
                ready.add(future);
                it.remove();
            }
        }
    }

    private static long completionOrder(Future<?> future) {
        return future instanceof SignallingTask<?> task ? task.completedAt : Long.MAX_VALUE;
    }

    private final class SignallingTask<T> extends FutureTask<T> {

        private volatile long completedAt = Long.MAX_VALUE;

        SignallingTask(Callable<T> callable) {
            super(callable);
        }

        @Override
        protected void done() {
            completedAt = completionSequence.incrementAndGet();
            synchronized (completionMonitor) {
                completionMonitor.notifyAll();
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private static final AtomicInteger RUNTIME_COUNTER = new AtomicInteger();
        private final int runtimeId = RUNTIME_COUNTER.incrementAndGet();
        private final AtomicInteger threadCounter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "ipod-worker-" + runtimeId + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }
}
