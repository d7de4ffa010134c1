package com.spansentinel.core.alerting;

import com.spansentinel.core.model.Alert;
import com.spansentinel.core.model.Anomaly;

import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders an alert as a short Markdown message for notification channels.
 *
 * <pre>
 * **Latency Anomaly Detected: checkout-latency**
 *
 * Value 250.00 is 4.2 standard deviations above mean (100.00)
 *
 * **Details:**
 * - Severity: critical
 * - Current Value: 250.00
 * - Expected Value: 100.00
 * - Deviation: 150.0%
 * - Trace: checkout
 *
 * Detected at: 2024-05-01T12:00:00Z
 * </pre>
 *
 * The trace line is present only when the anomaly has a trace name.
 *
 * @since 1.0.0
 */
public final class AlertMessageFormatter {

    private AlertMessageFormatter() {
        // utility class, not instantiable
    }

    public static String format(Alert alert, Anomaly anomaly) {
        Objects.requireNonNull(alert, "Alert must not be null");
        Objects.requireNonNull(anomaly, "Anomaly must not be null");

        StringBuilder msg = new StringBuilder();
        msg.append("**").append(alert.getTitle()).append("**\n\n");
        msg.append(alert.getDescription()).append("\n\n");

        msg.append("**Details:**\n");
        msg.append("- Severity: ").append(alert.getSeverity()).append('\n');
        msg.append(String.format(Locale.ROOT, "- Current Value: %.2f\n", alert.getCurrentValue()));
        msg.append(String.format(Locale.ROOT, "- Expected Value: %.2f\n", alert.getExpectedValue()));
        msg.append(String.format(Locale.ROOT, "- Deviation: %.1f%%\n", alert.getDeviation()));

        String traceName = anomaly.getTraceName();
        if (traceName != null && !traceName.isEmpty()) {
            msg.append("- Trace: ").append(traceName).append('\n');
        }

        msg.append("\nDetected at: ");
        if (alert.getTriggeredAt() != null) {
            msg.append(DateTimeFormatter.ISO_INSTANT.format(
                    alert.getTriggeredAt().truncatedTo(ChronoUnit.SECONDS)));
        }
        return msg.toString();
    }
}
