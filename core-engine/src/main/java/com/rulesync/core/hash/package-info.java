/**
 * Change detection over the mirrored source tree.
 *
 * @since 1.0.0
 */
package com.rulesync.core.hash;
