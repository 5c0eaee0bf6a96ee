package org.ipod.datapipeline.api.runtime;

import java.util.List;
import java.util.concurrent.Future;

/**
 * Result of {@link IDistributedRuntime#waitFor(java.util.Collection, int)}.
 *
 * @param ready     Completed futures, in the order they completed.
 * @param remaining Futures that were not returned as ready, in their original order.
 * @param <T>       Task result type.
 */
public record WaitResult<T>(List<Future<T>> ready, List<Future<T>> remaining) {

    public WaitResult {
        ready = List.copyOf(ready);
        remaining = List.copyOf(remaining);
    }
}
