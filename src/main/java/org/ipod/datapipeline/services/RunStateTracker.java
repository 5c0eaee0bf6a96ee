package org.ipod.datapipeline.services;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the state of the current run and rejects illegal transitions.
 * <p>
 * Legal transitions:
 * <pre>
 * EMPTY -&gt; PLANNING | DONE
 * PLANNING -&gt; DISPATCHING | DONE
 * DISPATCHING -&gt; DISPATCHING | MERGING | DONE
 * MERGING -&gt; DISPATCHING | MERGING | DONE
 * any non-terminal -&gt; ABORTED
 * </pre>
 * A terminal state is left only through {@link #beginRun()}.
 */
public class RunStateTracker {

    private static final Map<RunState, Set<RunState>> TRANSITIONS = Map.of(
            RunState.EMPTY, EnumSet.of(RunState.PLANNING, RunState.DONE),
            RunState.PLANNING, EnumSet.of(RunState.DISPATCHING, RunState.DONE),
            RunState.DISPATCHING, EnumSet.of(RunState.DISPATCHING, RunState.MERGING, RunState.DONE),
            RunState.MERGING, EnumSet.of(RunState.DISPATCHING, RunState.MERGING, RunState.DONE),
            RunState.DONE, EnumSet.noneOf(RunState.class),
            RunState.ABORTED, EnumSet.noneOf(RunState.class));

    private final AtomicReference<RunState> current = new AtomicReference<>(RunState.EMPTY);

    public RunState getState() {
        return current.get();
    }

    /**
     * Starts a new run, resetting a terminal state to {@link RunState#EMPTY}.
     *
     * @throws IllegalStateException if a run is still in progress.
     */
    public void beginRun() {
        RunState state = current.get();
        if (state == RunState.EMPTY) {
            return;
        }
        if (!state.isTerminal() || !current.compareAndSet(state, RunState.EMPTY)) {
            throw new IllegalStateException("Cannot begin a new run while the current run is in state " + state);
        }
    }

    /**
     * Moves to the target state.
     *
     * @param target The next state.
     * @throws IllegalStateException if the transition is not allowed.
     */
    public void transitionTo(RunState target) {
        RunState state = current.get();
        if (target == RunState.ABORTED) {
            abort();
            return;
        }
        if (!TRANSITIONS.get(state).contains(target) || !current.compareAndSet(state, target)) {
            throw new IllegalStateException(String.format("Illegal run state transition %s -> %s", state, target));
        }
    }

    /**
     * Marks the run as aborted.
     *
     * @throws IllegalStateException if the run already ended.
     */
    public void abort() {
        RunState state = current.get();
        if (state.isTerminal() || !current.compareAndSet(state, RunState.ABORTED)) {
            throw new IllegalStateException("Cannot abort a run in state " + state);
        }
    }
}
