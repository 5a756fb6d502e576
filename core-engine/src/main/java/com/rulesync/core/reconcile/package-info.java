/**
 * The reconcile state machine and its reports.
 *
 * <p>
 * {@link com.rulesync.core.reconcile.ReconcileController} is the single entry
 * point: scheduled ticks, settings changes, channel joins and the manual
 * sync-now action all end up in one serialized pass.
 * </p>
 *
 * @since 1.0.0
 */
package com.rulesync.core.reconcile;
