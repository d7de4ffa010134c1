/**
 * Anomaly and alert records, alert message rendering and cooldown gating.
 *
 * @since 1.0.0
 */
package com.spansentinel.core.alerting;
