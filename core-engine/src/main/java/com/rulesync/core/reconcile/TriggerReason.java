package com.rulesync.core.reconcile;

/**
 * Why a reconcile pass was requested. Only used for logging and status; every
 * reason runs the same convergence algorithm.
 *
 * @since 1.0.0
 */
public enum TriggerReason {
    STARTUP,
    SCHEDULED_TICK,
    SETTINGS_CHANGED,
    CHANNEL_JOINED,
    CHANNEL_LEFT,
    MANUAL_SYNC
}
