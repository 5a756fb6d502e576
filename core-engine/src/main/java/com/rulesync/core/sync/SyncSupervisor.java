package com.rulesync.core.sync;

import com.rulesync.core.model.SourceSpec;

import java.time.Duration;

/**
 * Control surface of the external mirroring agent.
 *
 * <p>
 * A failed sync never removes mirrored content: the agent keeps the last
 * good tree, so downstream data stays stale but valid.
 * </p>
 *
 * @since 1.0.0
 */
public interface SyncSupervisor {

    /**
     * Start the continuous agent for {@code spec}, or confirm it is already
     * running for it. A running agent for a different spec is restarted.
     *
     * @param spec source to mirror
     */
    void ensureRunning(SourceSpec spec);

    /**
     * Stop the agent and discard the local mirror. Stopping a stopped agent
     * does nothing.
     */
    void stop();

    /**
     * Run one sync cycle now and wait for it, bounded by {@code timeout}.
     * Never throws for sync problems: a timeout or launch failure is returned
     * as a {@link SyncResult.Outcome#FAILED} result.
     *
     * @param spec    source to mirror
     * @param timeout upper bound on the wait
     * @return outcome of the cycle
     */
    SyncResult triggerOneShot(SourceSpec spec, Duration timeout);

    /**
     * @return the latest observed outcome, polled without blocking
     */
    SyncResult lastResult();
}
