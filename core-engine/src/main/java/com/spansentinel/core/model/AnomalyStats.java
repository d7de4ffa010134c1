package com.spansentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary of the anomalies of one reporting period.
 *
 * <p>
 * {@code bySeverity} and {@code byType} hold an entry for every tier and
 * every type, zero when nothing was observed.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TimeWindow period;
    private final int totalAnomalies;
    private final int activeAlerts;
    private final Map<AnomalySeverity, Integer> bySeverity;
    private final Map<AnomalyType, Integer> byType;
    private final List<TraceAnomalyCount> topAffectedTraces;
    private final List<TimeSeriesPoint> anomaliesOverTime;

    public AnomalyStats(TimeWindow period,
            int totalAnomalies,
            int activeAlerts,
            Map<AnomalySeverity, Integer> bySeverity,
            Map<AnomalyType, Integer> byType,
            List<TraceAnomalyCount> topAffectedTraces,
            List<TimeSeriesPoint> anomaliesOverTime) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        this.totalAnomalies = totalAnomalies;
        this.activeAlerts = activeAlerts;
        this.bySeverity = Collections.unmodifiableMap(Objects.requireNonNull(bySeverity));
        this.byType = Collections.unmodifiableMap(Objects.requireNonNull(byType));
        this.topAffectedTraces = List.copyOf(topAffectedTraces);
        this.anomaliesOverTime = List.copyOf(anomaliesOverTime);
    }

    public TimeWindow getPeriod() {
        return period;
    }

    public int getTotalAnomalies() {
        return totalAnomalies;
    }

    public int getActiveAlerts() {
        return activeAlerts;
    }

    public Map<AnomalySeverity, Integer> getBySeverity() {
        return bySeverity;
    }

    public Map<AnomalyType, Integer> getByType() {
        return byType;
    }

    /** @return at most ten traces, most affected first */
    public List<TraceAnomalyCount> getTopAffectedTraces() {
        return topAffectedTraces;
    }

    public List<TimeSeriesPoint> getAnomaliesOverTime() {
        return anomaliesOverTime;
    }

    @Override
    public String toString() {
        return "AnomalyStats{" +
                "period=" + period +
                ", totalAnomalies=" + totalAnomalies +
                ", activeAlerts=" + activeAlerts +
                ", bySeverity=" + bySeverity +
                ", byType=" + byType +
                ", topAffectedTraces=" + topAffectedTraces +
                ", anomaliesOverTime=" + anomaliesOverTime +
                '}';
    }
}
