/**
 * Baseline statistics over a window of historical samples.
 *
 * @since 1.0.0
 */
package com.spansentinel.core.stats;
