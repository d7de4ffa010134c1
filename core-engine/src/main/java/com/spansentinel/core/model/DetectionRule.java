package com.spansentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Describes a single anomaly-detection rule loaded from configuration.
 *
 * <p>
 * A rule names the monitored metric ({@code type}), the statistical model
 * used to judge new values ({@code method}) and that model's parameters
 * ({@code config}). Supported methods:
 * </p>
 * <ul>
 * <li>{@code z_score}: distance from the mean in standard deviations</li>
 * <li>{@code iqr}: outside the interquartile fences</li>
 * <li>{@code mad}: modified Z-score on the median absolute deviation</li>
 * <li>{@code moving_average}: relative deviation from a simple moving
 * average</li>
 * <li>{@code exponential_ema}: relative deviation from an exponential moving
 * average</li>
 * <li>{@code threshold}: static minimum / maximum bounds</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared method are present and valid.
 * Parameters that belong to other methods are never checked.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Optional explicit identifier (UUID); derived from the name if absent. */
    private String id;

    /** Unique rule name used in alerts and metrics. */
    private String name;

    private boolean enabled = true;

    /** Metric type: "latency", "cost", "error_rate", "tokens" or "custom". */
    private String type;

    /** Detection method wire value, e.g. "z_score". */
    private String method;

    private RuleConfig config = new RuleConfig();

    /** Minimum history size below which detection is skipped. */
    private int minSamples = 30;

    /** How far back the caller collects history for this rule. */
    private int lookbackHours = 24;

    /** Minimum minutes between two alerts of this rule. */
    private int cooldownMinutes = 15;

    // --- Filters ---
    /** When set, only observations of this trace name are evaluated. */
    private String traceNameFilter;

    /** Metadata entries an observation must carry to be evaluated. */
    private Map<String, String> metadataFilters = new LinkedHashMap<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared method are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (id != null && !id.isBlank()) {
            try {
                Identifiers.parse("rule", id);
            } catch (IllegalArgumentException e) {
                errors.add("Rule '" + name + "' has " + e.getMessage());
            }
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule '" + name + "' requires 'type'");
        } else {
            try {
                AnomalyType.fromValue(type);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (minSamples < 0) {
            errors.add("Rule '" + name + "' requires 'minSamples' >= 0, got: " + minSamples);
        }
        if (lookbackHours < 1) {
            errors.add("Rule '" + name + "' requires 'lookbackHours' >= 1, got: " + lookbackHours);
        }
        if (cooldownMinutes < 0) {
            errors.add("Rule '" + name + "' requires 'cooldownMinutes' >= 0, got: " + cooldownMinutes);
        }

        if (method == null || method.isBlank()) {
            errors.add("Rule '" + name + "' requires 'method'");
        } else if (config == null) {
            errors.add("Rule '" + name + "' requires 'config'");
        } else {
            validateMethodConfig(errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionRule: " + String.join("; ", errors));
        }
    }

    private void validateMethodConfig(List<String> errors) {
        DetectionMethod detectionMethod;
        try {
            detectionMethod = DetectionMethod.fromValue(method);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
            return;
        }

        switch (detectionMethod) {
            case Z_SCORE -> {
                if (config.getZscoreThreshold() <= 0) {
                    errors.add("Z-score rule '" + name + "' requires 'zscoreThreshold' > 0");
                }
            }
            case IQR -> {
                if (config.getIqrMultiplier() < 0) {
                    errors.add("IQR rule '" + name + "' requires 'iqrMultiplier' >= 0");
                }
            }
            case MAD -> {
                if (config.getMadThreshold() <= 0) {
                    errors.add("MAD rule '" + name + "' requires 'madThreshold' > 0");
                }
            }
            case MOVING_AVERAGE -> {
                if (config.getWindowSize() < 1) {
                    errors.add("Moving-average rule '" + name + "' requires 'windowSize' >= 1");
                }
                if (config.getDeviation() <= 0) {
                    errors.add("Moving-average rule '" + name + "' requires 'deviation' > 0");
                }
            }
            case EXPONENTIAL_EMA -> {
                if (config.getAlpha() <= 0 || config.getAlpha() > 1) {
                    errors.add("EMA rule '" + name + "' requires 'alpha' in (0, 1]");
                }
                if (config.getDeviation() <= 0) {
                    errors.add("EMA rule '" + name + "' requires 'deviation' > 0");
                }
            }
            case THRESHOLD -> {
                Double min = config.getMinThreshold();
                Double max = config.getMaxThreshold();
                if (min == null && max == null) {
                    errors.add("Threshold rule '" + name
                            + "' requires 'minThreshold' and/or 'maxThreshold'");
                } else if (min != null && max != null && min > max) {
                    errors.add("Threshold rule '" + name + "' has minThreshold " + min
                            + " greater than maxThreshold " + max);
                }
            }
        }
    }

    // ---------------------------------------------------------------
    // Resolved views
    // ---------------------------------------------------------------

    /**
     * @return the active detection method
     * @throws IllegalArgumentException if the configured method is unsupported
     */
    public DetectionMethod detectionMethod() {
        return DetectionMethod.fromValue(method);
    }

    /**
     * @return the metric type
     * @throws IllegalArgumentException if the configured type is unknown
     */
    public AnomalyType anomalyType() {
        return AnomalyType.fromValue(type);
    }

    /**
     * Resolve the rule identifier: the explicit {@code id} when present,
     * otherwise a stable UUID derived from the rule name.
     *
     * @return rule identifier
     * @throws IllegalArgumentException if the explicit id is malformed
     */
    public UUID ruleId() {
        if (id != null && !id.isBlank()) {
            return Identifiers.parse("rule", id);
        }
        return Identifiers.fromName(Objects.requireNonNull(name, "Rule name must not be null"));
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the metric type, normalised to lowercase.
     *
     * @param type metric type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Set the detection method, normalised to lowercase.
     *
     * @param method method wire value
     */
    public void setMethod(String method) {
        this.method = method != null ? method.toLowerCase(Locale.ROOT) : null;
    }

    public RuleConfig getConfig() {
        return config;
    }

    public void setConfig(RuleConfig config) {
        this.config = config;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public int getLookbackHours() {
        return lookbackHours;
    }

    public void setLookbackHours(int lookbackHours) {
        this.lookbackHours = lookbackHours;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    public String getTraceNameFilter() {
        return traceNameFilter;
    }

    public void setTraceNameFilter(String traceNameFilter) {
        this.traceNameFilter = traceNameFilter;
    }

    /**
     * @return unmodifiable view of the metadata filters
     */
    public Map<String, String> getMetadataFilters() {
        return Collections.unmodifiableMap(metadataFilters);
    }

    public void setMetadataFilters(Map<String, String> metadataFilters) {
        this.metadataFilters = metadataFilters != null
                ? new LinkedHashMap<>(metadataFilters)
                : new LinkedHashMap<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionRule that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "DetectionRule{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", method='" + method + '\'' +
                ", enabled=" + enabled +
                ", minSamples=" + minSamples +
                ", lookbackHours=" + lookbackHours +
                ", cooldownMinutes=" + cooldownMinutes +
                ", config=" + config +
                '}';
    }
}
