package org.ipod.datapipeline.api.runtime;

import java.util.Collection;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

import org.ipod.datapipeline.api.refinement.RefinementException;

/**
 * The four-operation surface the orchestration core needs from a distributed runtime:
 * a shared object store, task submission, waiting for completions and result retrieval.
 * <p>
 * The orchestration core depends on nothing else, so any runtime that can provide these
 * operations can execute chunk tasks.
 */
public interface IDistributedRuntime extends AutoCloseable {

    /**
     * @return The shared object store of this runtime.
     */
    IObjectStore objectStore();

    /**
     * Submits a task for execution on a worker.
     *
     * @param task The task.
     * @param <T>  Result type.
     * @return A future for the task's result.
     */
    <T> Future<T> submit(Callable<T> task);

    /**
     * Blocks until at least {@code numReturns} of the given futures are done, or all of them
     * if fewer were given.
     *
     * @param futures    Outstanding futures.
     * @param numReturns Number of completed futures to return, at least 1.
     * @param <T>        Result type.
     * @return Exactly {@code min(numReturns, futures.size())} ready futures and the rest.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    <T> WaitResult<T> waitFor(Collection<Future<T>> futures, int numReturns) throws InterruptedException;

    /**
     * Retrieves the result of a task, blocking if it is not done yet.
     *
     * @param future The future returned by {@link #submit(Callable)}.
     * @param <T>    Result type.
     * @return The task's result.
     * @throws RefinementException  if the task failed or was lost.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    <T> T get(Future<T> future) throws InterruptedException;

    /**
     * @return The number of tasks this runtime executes in parallel.
     */
    int parallelism();

    /**
     * Stops accepting tasks. Tasks already submitted are not cancelled.
     */
    @Override
    void close();
}
