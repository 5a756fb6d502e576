/**
 * Idempotent projection of records into downstream channels.
 *
 * @since 1.0.0
 */
package com.rulesync.core.publish;
