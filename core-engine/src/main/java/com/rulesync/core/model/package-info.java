/**
 * Domain model shared by the reconcile engine and the service layer.
 *
 * <ul>
 * <li>{@link com.rulesync.core.model.WorkloadState}: three-state lifecycle
 * with its transition function</li>
 * <li>{@link com.rulesync.core.model.SourceSpec} and
 * {@link com.rulesync.core.model.ReconcileSettings}: externally supplied
 * configuration</li>
 * <li>{@link com.rulesync.core.model.RuleRecord} and
 * {@link com.rulesync.core.model.DashboardRecord}: validated content</li>
 * <li>{@link com.rulesync.core.model.FileError}: per-file problems</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.rulesync.core.model;
