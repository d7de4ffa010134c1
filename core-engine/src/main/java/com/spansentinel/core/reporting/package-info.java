/**
 * Period summaries of detected anomalies.
 *
 * @since 1.0.0
 */
package com.spansentinel.core.reporting;
