/**
 * Per-file loading and validation of rule and dashboard files.
 *
 * <p>
 * {@link com.rulesync.core.loader.RuleLoader} serves both rule stores,
 * {@link com.rulesync.core.loader.DashboardLoader} the dashboard store. A
 * rejected file never stops its siblings from loading.
 * </p>
 *
 * @since 1.0.0
 */
package com.rulesync.core.loader;
