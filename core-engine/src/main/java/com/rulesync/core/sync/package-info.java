/**
 * Boundary to the external mirroring agent.
 *
 * @since 1.0.0
 */
package com.rulesync.core.sync;
