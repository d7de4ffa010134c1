package com.spansentinel.core.alerting;

import com.spansentinel.core.model.DetectionRule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether a rule may alert again.
 *
 * <p>
 * The gate holds no state: the caller remembers when the rule last alerted
 * and passes that timestamp in.
 * </p>
 *
 * @since 1.0.0
 */
public class CooldownGate {

    private final Clock clock;

    public CooldownGate() {
        this(Clock.systemUTC());
    }

    public CooldownGate(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param cooldownMinutes minimum minutes between alerts
     * @param lastAlertAt     when the rule last alerted, or {@code null} if never
     * @return {@code true} if no alert was sent before, or if strictly more than
     *         the cooldown has elapsed since the last one
     */
    public boolean shouldTrigger(int cooldownMinutes, Instant lastAlertAt) {
        if (lastAlertAt == null) {
            return true;
        }
        Duration elapsed = Duration.between(lastAlertAt, clock.instant());
        return elapsed.compareTo(Duration.ofMinutes(cooldownMinutes)) > 0;
    }

    public boolean shouldTrigger(DetectionRule rule, Instant lastAlertAt) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        return shouldTrigger(rule.getCooldownMinutes(), lastAlertAt);
    }
}
