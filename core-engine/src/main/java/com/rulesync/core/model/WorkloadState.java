package com.rulesync.core.model;

/**
 * Lifecycle state of a deployed rule-sync workload.
 *
 * <ul>
 * <li>{@code UNINITIALIZED}: no source location was ever configured; nothing
 * has been published</li>
 * <li>{@code IDLE}: the source location was cleared after the workload had
 * been configured; the sync agent is stopped and downstream data is
 * cleared</li>
 * <li>{@code CONFIGURED}: a source location is set, the sync agent runs and
 * downstream data reflects the last successful sync</li>
 * </ul>
 *
 * <p>
 * The only input to a transition is whether a non-empty source location is
 * present. See {@link #next(boolean)}.
 * </p>
 *
 * @since 1.0.0
 */
public enum WorkloadState {

    UNINITIALIZED,
    IDLE,
    CONFIGURED;

    /**
     * Compute the state this workload should converge to.
     *
     * @param sourcePresent whether a non-empty source location is configured
     * @return {@code CONFIGURED} when a source is present; otherwise
     *         {@code UNINITIALIZED} if the workload never left it, {@code IDLE}
     *         in every other case
     */
    public WorkloadState next(boolean sourcePresent) {
        if (sourcePresent) {
            return CONFIGURED;
        }
        return this == UNINITIALIZED ? UNINITIALIZED : IDLE;
    }
}
