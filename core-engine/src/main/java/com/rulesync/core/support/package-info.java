/**
 * Helpers shared across the engine: canonical payload encoding, source-tree
 * enumeration and the content-read failure type.
 *
 * @since 1.0.0
 */
package com.rulesync.core.support;
